package work.lcod.pumslabel.dictionary;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class LabelScriptTest {
    private static final List<String> BODY = List.of(
        "label variable sex \"Sex\"",
        "label define sex_lbl 1 \"Male\", add",
        "label values sex sex_lbl",
        ""
    );

    @Test
    void headerNamesTitleSourceAndTime() {
        var script = LabelScript.create("Labels", "PUMS_Data_Dictionary_2016.txt",
            Instant.parse("2024-03-01T10:15:30.456Z"), BODY);
        assertEquals(List.of(
            "* Labels",
            "* Source: PUMS_Data_Dictionary_2016.txt",
            "* Generated 2024-03-01T10:15:30Z"
        ), script.header());
        assertEquals(3, script.statementCount());
    }

    @Test
    void renderedScriptParsesBack() {
        var script = LabelScript.create("Labels", "dict.txt", Instant.EPOCH, BODY);
        var parsed = LabelScript.parse(script.render());
        assertEquals(script.header(), parsed.header());
        assertEquals(BODY, parsed.lines());
    }

    @Test
    void renderEndsEveryLineWithNewline() {
        var script = new LabelScript(List.of("* t"), List.of("notes x: y"));
        assertEquals("* t\nnotes x: y\n", script.render());
    }
}
