package work.lcod.pumslabel.dictionary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HeaderGrammarTest {
    private final LineTokenizer tokenizer = new LineTokenizer();

    @Test
    void selectsLayoutByYear() {
        assertEquals(HeaderGrammar.BEFORE_2017, HeaderGrammar.forYear(2016));
        assertEquals(HeaderGrammar.SINCE_2017, HeaderGrammar.forYear(2017));
        assertEquals(HeaderGrammar.SINCE_2017, HeaderGrammar.forYear(2022));
    }

    @Test
    void startOfTextCountsAsBlank() {
        var line = tokenizer.tokenize("AGEP 2").get(0);
        assertTrue(HeaderGrammar.BEFORE_2017.isHeader(line, null));
    }

    @Test
    void rejectsHeaderShapedLineAfterText() {
        var lines = tokenizer.tokenize("Age\nAGEP Numeric 2");
        assertFalse(HeaderGrammar.SINCE_2017.isHeader(lines.get(1), lines.get(0)));
    }

    @Test
    void requiresExactWordCount() {
        var lines = tokenizer.tokenize("\nAGEP 2");
        assertTrue(HeaderGrammar.BEFORE_2017.isHeader(lines.get(1), lines.get(0)));
        assertFalse(HeaderGrammar.SINCE_2017.isHeader(lines.get(1), lines.get(0)));
    }
}
