package work.lcod.pumslabel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.pumslabel.runtime.DatasetLabelApplier;
import work.lcod.pumslabel.runtime.DictionaryFetcher;

class LabelRunnerTest {
    private static final Path DICTIONARY = Path.of("src", "test", "resources", "dictionaries", "PUMS_Data_Dictionary_2016.txt");
    private static final Path DATASET = Path.of("src", "test", "resources", "datasets", "pums_extract_2016.csv");

    @TempDir
    Path tempDir;

    private final AtomicInteger downloads = new AtomicInteger();

    private final DictionaryFetcher fixtureFetcher = target -> {
        downloads.incrementAndGet();
        return Files.readString(DICTIONARY, StandardCharsets.UTF_8);
    };

    private LabelRunner runner(DictionaryFetcher fetcher) {
        return new LabelRunner(fetcher, new DatasetLabelApplier(), Clock.systemUTC());
    }

    private LabelRunConfiguration.Builder configuration() {
        return LabelRunConfiguration.builder()
            .target(new DictionaryTarget(2016, 1))
            .cacheDirectory(tempDir.resolve("cache"))
            .cacheMode(CacheMode.CUSTOM);
    }

    @Test
    void generatesAndCachesScript() throws IOException {
        var result = runner(fixtureFetcher).run(configuration().build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertFalse(result.cacheHit());
        assertEquals(21, result.statementCount());
        var script = Files.readString(result.script().orElseThrow(), StandardCharsets.UTF_8);
        assertTrue(script.startsWith("* Labels for the ACS PUMS 2016 1-year sample\n* Source: PUMS_Data_Dictionary_2016.txt\n"));
        assertTrue(script.contains("label values sex sex_lbl\n"));
        assertTrue(Files.isRegularFile(tempDir.resolve("cache/dictionaries/PUMS_Data_Dictionary_2016.txt")));
    }

    @Test
    void secondRunUsesCachedScript() {
        var runner = runner(fixtureFetcher);
        runner.run(configuration().build());
        var second = runner.run(configuration().build());

        assertTrue(second.cacheHit());
        assertEquals(21, second.statementCount());
        assertEquals(1, downloads.get());
    }

    @Test
    void differentLineWidthIsNotServedFromCache() throws IOException {
        DictionaryFetcher fetcher = target -> "TEN 1\nTenure of the housing unit\n";
        var runner = runner(fetcher);
        runner.run(configuration().build());
        var narrow = runner.run(configuration().lineWidth(8).build());

        assertEquals(RunResult.Status.SUCCESS, narrow.status());
        assertFalse(narrow.cacheHit());
        var script = Files.readString(narrow.script().orElseThrow(), StandardCharsets.UTF_8);
        assertTrue(script.contains("label variable ten \"Tenure o\"\n"), script);

        var wideAgain = runner.run(configuration().build());
        assertTrue(wideAgain.cacheHit());
        var wideScript = Files.readString(wideAgain.script().orElseThrow(), StandardCharsets.UTF_8);
        assertTrue(wideScript.contains("label variable ten \"Tenure of the housing unit\"\n"), wideScript);
    }

    @Test
    void refreshDownloadsAgain() {
        var runner = runner(fixtureFetcher);
        runner.run(configuration().build());
        var refreshed = runner.run(configuration().forceRefresh(true).build());

        assertFalse(refreshed.cacheHit());
        assertEquals(2, downloads.get());
    }

    @Test
    void expiredCacheDownloadsAgain() throws IOException {
        var runner = runner(fixtureFetcher);
        var first = runner.run(configuration().cacheTtl(Duration.ofHours(1)).build());
        var old = FileTime.fromMillis(System.currentTimeMillis() - Duration.ofDays(1).toMillis());
        Files.setLastModifiedTime(first.script().orElseThrow(), old);
        Files.setLastModifiedTime(tempDir.resolve("cache/dictionaries/PUMS_Data_Dictionary_2016.txt"), old);

        var second = runner.run(configuration().cacheTtl(Duration.ofHours(1)).build());
        assertFalse(second.cacheHit());
        assertEquals(2, downloads.get());
    }

    @Test
    void labelsDatasetAndWritesMetadata() throws IOException {
        Path metadata = tempDir.resolve("out/metadata.json");
        Path output = tempDir.resolve("out/labels.do");
        var result = runner(fixtureFetcher).run(configuration()
            .scriptOutput(Optional.of(output))
            .dataset(Optional.of(DATASET))
            .metadataOutput(Optional.of(metadata))
            .build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(Optional.of(output), result.script());
        var report = result.applyReport().orElseThrow();
        assertEquals(15, report.applied());
        assertEquals(6, report.skipped());
        assertTrue(report.failures().stream().anyMatch(failure -> failure.statement().equals("label values rt rt_lbl")));

        var json = new ObjectMapper().readTree(metadata.toFile());
        assertEquals(3, json.get("rows").asInt());
        assertEquals("Sex", json.at("/variables/sex/label").asText());
        assertEquals("Male", json.at("/variables/sex/valueLabels/1").asText());
        assertEquals("Under 1 year", json.at("/variables/agep/valueLabels/0").asText());
    }

    @Test
    void downloadFailureBecomesFailureResult() {
        DictionaryFetcher failing = target -> {
            throw new IOException("Failed to download dictionary: HTTP 404");
        };
        var result = runner(failing).run(configuration().build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals(Optional.of("Failed to download dictionary: HTTP 404"), result.error());
        assertTrue(result.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    @Test
    void unparseableDictionaryBecomesFailureResult() {
        var result = runner(target -> "no headers in here at all\n").run(configuration().build());
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertTrue(result.error().orElseThrow().contains("No variable headers"));
    }
}
