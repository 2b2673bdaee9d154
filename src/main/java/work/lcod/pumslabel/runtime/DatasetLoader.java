package work.lcod.pumslabel.runtime;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads PUMS extracts (CSV with a header row) into a {@link Dataset}.
 */
public final class DatasetLoader {
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setTrim(true)
        .setIgnoreEmptyLines(true)
        .build();

    private DatasetLoader() {}

    public static Dataset readCsv(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readCsv(reader);
        }
    }

    public static Dataset readCsv(Reader reader) throws IOException {
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> headers = parser.getHeaderNames();
            if (headers == null || headers.isEmpty()) {
                throw new IOException("CSV dataset has no header row");
            }
            var rows = new ArrayList<List<String>>();
            for (CSVRecord record : parser) {
                var row = new ArrayList<String>(headers.size());
                for (int i = 0; i < headers.size(); i++) {
                    row.add(i < record.size() ? record.get(i) : "");
                }
                rows.add(row);
            }
            return new Dataset(headers, rows);
        }
    }
}
