package work.lcod.pumslabel.dictionary;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * The cached script artifact: a three-line comment header followed by statement and spacer lines.
 */
public record LabelScript(List<String> header, List<String> lines) {
    public static final String COMMENT_PREFIX = "*";

    public LabelScript {
        header = List.copyOf(header);
        lines = List.copyOf(lines);
    }

    public static LabelScript create(String title, String source, Instant generatedAt, List<String> lines) {
        var header = List.of(
            COMMENT_PREFIX + " " + title,
            COMMENT_PREFIX + " Source: " + source,
            COMMENT_PREFIX + " Generated " + DateTimeFormatter.ISO_INSTANT.format(generatedAt.truncatedTo(ChronoUnit.SECONDS))
        );
        return new LabelScript(header, lines);
    }

    /**
     * Reads a rendered script back. Leading comment lines form the header.
     */
    public static LabelScript parse(String text) {
        var header = new ArrayList<String>();
        var lines = new ArrayList<String>();
        for (String line : text.lines().toList()) {
            if (lines.isEmpty() && line.startsWith(COMMENT_PREFIX)) {
                header.add(line);
            } else {
                lines.add(line);
            }
        }
        return new LabelScript(header, lines);
    }

    public long statementCount() {
        return lines.stream().filter(line -> !line.isBlank() && !line.startsWith(COMMENT_PREFIX)).count();
    }

    public String render() {
        var out = new StringBuilder();
        for (String line : header) {
            out.append(line).append('\n');
        }
        for (String line : lines) {
            out.append(line).append('\n');
        }
        return out.toString();
    }
}
