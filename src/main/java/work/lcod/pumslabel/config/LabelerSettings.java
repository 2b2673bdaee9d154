package work.lcod.pumslabel.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Values read from a {@code pumslabel.toml} settings file. Every entry is optional;
 * command-line options take precedence.
 */
public record LabelerSettings(
    Optional<String> urlTemplate,
    Optional<Duration> fetchTimeout,
    OptionalInt lineWidth,
    Optional<Path> cacheDirectory,
    Optional<Duration> cacheTtl
) {
    public static final LabelerSettings EMPTY = new LabelerSettings(
        Optional.empty(),
        Optional.empty(),
        OptionalInt.empty(),
        Optional.empty(),
        Optional.empty()
    );

    public LabelerSettings {
        Objects.requireNonNull(urlTemplate, "urlTemplate");
        Objects.requireNonNull(fetchTimeout, "fetchTimeout");
        Objects.requireNonNull(lineWidth, "lineWidth");
        Objects.requireNonNull(cacheDirectory, "cacheDirectory");
        Objects.requireNonNull(cacheTtl, "cacheTtl");
    }
}
