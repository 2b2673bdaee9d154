package work.lcod.pumslabel.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.pumslabel.shared.DurationParser;

/**
 * Reads {@link LabelerSettings} from TOML.
 *
 * <pre>
 * [dictionary]
 * url_template = "https://example.org/dict/{file}"
 * timeout = "30s"
 * line_width = 244
 *
 * [cache]
 * directory = "~/.pumslabel/cache"
 * ttl = "30d"
 * </pre>
 */
public final class SettingsLoader {
    public static final String DEFAULT_FILE_NAME = "pumslabel.toml";

    private SettingsLoader() {}

    public static LabelerSettings load(Path path) throws IOException {
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        Path base = path.toAbsolutePath().getParent();
        return parse(raw, base != null ? base : Path.of("").toAbsolutePath());
    }

    /**
     * Parses settings text; relative cache directories resolve against {@code baseDirectory}.
     */
    public static LabelerSettings parse(String text, Path baseDirectory) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid settings: " + result.errors().get(0).toString());
        }
        Optional<String> urlTemplate = Optional.ofNullable(result.getString("dictionary.url_template"))
            .filter(value -> !value.isBlank());
        Optional<Duration> timeout = DurationParser.parse(result.getString("dictionary.timeout"));
        OptionalInt lineWidth = OptionalInt.empty();
        Long width = result.getLong("dictionary.line_width");
        if (width != null) {
            if (width <= 0 || width > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("dictionary.line_width must be a positive integer: " + width);
            }
            lineWidth = OptionalInt.of(width.intValue());
        }
        Optional<Path> cacheDirectory = Optional.ofNullable(result.getString("cache.directory"))
            .filter(value -> !value.isBlank())
            .map(value -> resolvePath(value, baseDirectory));
        Optional<Duration> cacheTtl = DurationParser.parse(result.getString("cache.ttl"));
        return new LabelerSettings(urlTemplate, timeout, lineWidth, cacheDirectory, cacheTtl);
    }

    static Path resolvePath(String value, Path baseDirectory) {
        String expanded = value;
        if (value.equals("~") || value.startsWith("~/")) {
            expanded = System.getProperty("user.home") + value.substring(1);
        }
        Path path = Path.of(expanded);
        return (path.isAbsolute() ? path : baseDirectory.resolve(path)).toAbsolutePath().normalize();
    }
}
