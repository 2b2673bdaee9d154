package work.lcod.pumslabel.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.lcod.pumslabel.dictionary.LineTokenizer;

/**
 * Immutable configuration for labelling one dictionary target.
 */
public record LabelRunConfiguration(
    DictionaryTarget target,
    Path cacheDirectory,
    CacheMode cacheMode,
    Duration cacheTtl,
    boolean forceRefresh,
    int lineWidth,
    Optional<Path> scriptOutput,
    Optional<Path> dataset,
    Optional<Path> metadataOutput,
    LogLevel logLevel
) {
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofDays(30);

    public LabelRunConfiguration {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(cacheDirectory, "cacheDirectory");
        Objects.requireNonNull(cacheMode, "cacheMode");
        Objects.requireNonNull(cacheTtl, "cacheTtl");
        Objects.requireNonNull(scriptOutput, "scriptOutput");
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(metadataOutput, "metadataOutput");
        Objects.requireNonNull(logLevel, "logLevel");
        if (lineWidth <= 0) {
            throw new IllegalArgumentException("lineWidth must be positive: " + lineWidth);
        }
        if (metadataOutput.isPresent() && dataset.isEmpty()) {
            throw new IllegalArgumentException("A metadata output needs a dataset to label.");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .target(target)
            .cacheDirectory(cacheDirectory)
            .cacheMode(cacheMode)
            .cacheTtl(cacheTtl)
            .forceRefresh(forceRefresh)
            .lineWidth(lineWidth)
            .scriptOutput(scriptOutput)
            .dataset(dataset)
            .metadataOutput(metadataOutput)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private DictionaryTarget target;
        private Path cacheDirectory;
        private CacheMode cacheMode = CacheMode.LOCAL;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private boolean forceRefresh;
        private int lineWidth = LineTokenizer.DEFAULT_LINE_WIDTH;
        private Optional<Path> scriptOutput = Optional.empty();
        private Optional<Path> dataset = Optional.empty();
        private Optional<Path> metadataOutput = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder target(DictionaryTarget target) {
            this.target = target;
            return this;
        }

        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public Builder cacheMode(CacheMode cacheMode) {
            this.cacheMode = cacheMode;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder forceRefresh(boolean forceRefresh) {
            this.forceRefresh = forceRefresh;
            return this;
        }

        public Builder lineWidth(int lineWidth) {
            this.lineWidth = lineWidth;
            return this;
        }

        public Builder scriptOutput(Optional<Path> scriptOutput) {
            this.scriptOutput = scriptOutput;
            return this;
        }

        public Builder dataset(Optional<Path> dataset) {
            this.dataset = dataset;
            return this;
        }

        public Builder metadataOutput(Optional<Path> metadataOutput) {
            this.metadataOutput = metadataOutput;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public LabelRunConfiguration build() {
            return new LabelRunConfiguration(
                target,
                cacheDirectory,
                cacheMode,
                cacheTtl,
                forceRefresh,
                lineWidth,
                scriptOutput,
                dataset,
                metadataOutput,
                logLevel
            );
        }
    }
}
