package work.lcod.pumslabel.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesDays() {
        assertEquals(Optional.of(Duration.ofDays(30)), DurationParser.parse("30d"));
    }

    @Test
    void parsesHoursCaseInsensitively() {
        assertEquals(Optional.of(Duration.ofHours(12)), DurationParser.parse(" 12H "));
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
    }

    @Test
    void handlesZeroAndBlank() {
        assertEquals(Optional.of(Duration.ZERO), DurationParser.parse("0"));
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsGarbageAndNegatives() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("tomorrow"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5m"));
    }
}
