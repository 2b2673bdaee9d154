package work.lcod.pumslabel.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses short durations such as {@code 30s}, {@code 2m}, {@code 12h} or {@code 30d}.
 * A bare number counts milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        String digits = trimmed;
        long unitMillis = 1L;
        if (trimmed.endsWith("ms")) {
            digits = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 1_000L;
        } else if (trimmed.endsWith("m")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 60_000L;
        } else if (trimmed.endsWith("h")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 3_600_000L;
        } else if (trimmed.endsWith("d")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 86_400_000L;
        }
        long value;
        try {
            value = Long.parseLong(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(Math.multiplyExact(value, unitMillis)));
    }
}
