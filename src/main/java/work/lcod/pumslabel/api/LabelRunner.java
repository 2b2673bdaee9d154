package work.lcod.pumslabel.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pumslabel.dictionary.DictionaryParser;
import work.lcod.pumslabel.dictionary.LabelScript;
import work.lcod.pumslabel.dictionary.LineTokenizer;
import work.lcod.pumslabel.runtime.ApplyReport;
import work.lcod.pumslabel.runtime.CacheGateway;
import work.lcod.pumslabel.runtime.Dataset;
import work.lcod.pumslabel.runtime.DatasetLoader;
import work.lcod.pumslabel.runtime.DictionaryFetcher;
import work.lcod.pumslabel.runtime.FileCacheGateway;
import work.lcod.pumslabel.runtime.LabelApplier;

/**
 * Public entry point: cache lookup, download, parse, script generation and optional labelling of a dataset.
 */
public final class LabelRunner {
    private static final Logger logger = LoggerFactory.getLogger(LabelRunner.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private final DictionaryFetcher fetcher;
    private final LabelApplier applier;
    private final Clock clock;

    public LabelRunner(DictionaryFetcher fetcher, LabelApplier applier, Clock clock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.applier = Objects.requireNonNull(applier, "applier");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RunResult run(LabelRunConfiguration configuration) {
        var started = clock.instant();
        var target = configuration.target();
        try {
            Files.createDirectories(configuration.cacheDirectory());
            var cache = new FileCacheGateway(configuration.cacheDirectory(), configuration.cacheTtl(), clock);
            String scriptKey = target.scriptCacheKey(configuration.lineWidth());

            boolean cacheHit = !configuration.forceRefresh() && cache.exists(scriptKey);
            LabelScript script;
            if (cacheHit) {
                logger.info("Using cached label script for {}", target.display());
                script = LabelScript.parse(cache.read(scriptKey));
            } else {
                script = generateScript(configuration, cache);
                cache.write(scriptKey, script.render());
            }

            Path scriptPath = cache.pathOf(scriptKey);
            if (configuration.scriptOutput().isPresent()) {
                scriptPath = writeFile(configuration.scriptOutput().get(), script.render());
            }

            Optional<ApplyReport> report = Optional.empty();
            if (configuration.dataset().isPresent()) {
                report = Optional.of(labelDataset(configuration, script));
            }
            return RunResult.success(target, scriptPath, script.statementCount(), cacheHit, report, started, clock.instant());
        } catch (Exception ex) {
            logger.error("Labelling the {} dictionary failed: {}", target.display(), ex.getMessage());
            logger.debug("Failure detail", ex);
            return RunResult.failure(target, ex, started, clock.instant());
        }
    }

    private LabelScript generateScript(LabelRunConfiguration configuration, CacheGateway cache) throws IOException {
        var target = configuration.target();
        String dictionaryKey = target.dictionaryCacheKey();
        String text;
        if (!configuration.forceRefresh() && cache.exists(dictionaryKey)) {
            logger.info("Using cached dictionary {}", target.dictionaryFileName());
            text = cache.read(dictionaryKey);
        } else {
            text = fetcher.fetch(target);
            cache.write(dictionaryKey, text);
        }
        var parser = new DictionaryParser(new LineTokenizer(configuration.lineWidth()));
        var lines = parser.parseDictionary(text, target.year(), target.samplePeriod());
        return LabelScript.create(
            "Labels for the ACS PUMS " + target.display() + " sample",
            target.dictionaryFileName(),
            clock.instant(),
            lines
        );
    }

    private ApplyReport labelDataset(LabelRunConfiguration configuration, LabelScript script) throws IOException {
        Path datasetPath = configuration.dataset().orElseThrow();
        Dataset dataset = DatasetLoader.readCsv(datasetPath);
        logger.info("Labelling {} ({} rows, {} columns)", datasetPath, dataset.rows().size(), dataset.columns().size());
        var report = applier.apply(script.lines(), dataset);
        if (configuration.metadataOutput().isPresent()) {
            writeFile(configuration.metadataOutput().get(), JSON_WRITER.writeValueAsString(dataset.toMetadata()));
        }
        return report;
    }

    private static Path writeFile(Path target, String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target;
    }
}
