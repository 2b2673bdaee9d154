package work.lcod.pumslabel.dictionary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class RowClassifierTest {
    private final LineTokenizer tokenizer = new LineTokenizer();

    private List<LineRole> roles(String text, int year) {
        var classifier = new RowClassifier(HeaderGrammar.forYear(year));
        return classifier.classify(tokenizer.tokenize(text)).stream().map(ClassifiedLine::role).toList();
    }

    @Test
    void twoWordHeaderOnlyBefore2017() {
        String text = "\nAGEP 2\nAge\n";
        assertEquals(List.of(LineRole.BLANK, LineRole.VARIABLE_HEADER, LineRole.VARIABLE_LABEL), roles(text, 2016));
        assertEquals(List.of(LineRole.BLANK, LineRole.OTHER, LineRole.OTHER), roles(text, 2018));
    }

    @Test
    void threeWordHeaderOnlySince2017() {
        String text = "\nAGEP Numeric 2\nAge\n";
        assertEquals(List.of(LineRole.BLANK, LineRole.VARIABLE_HEADER, LineRole.VARIABLE_LABEL), roles(text, 2018));
        assertEquals(List.of(LineRole.BLANK, LineRole.OTHER, LineRole.OTHER), roles(text, 2016));
    }

    @Test
    void headerMustFollowABlankLine() {
        var roles = roles("SEX 1\nSex\nAGEP 2\n", 2016);
        assertEquals(LineRole.VARIABLE_HEADER, roles.get(0));
        assertEquals(LineRole.VARIABLE_LABEL, roles.get(1));
        assertEquals(LineRole.OTHER, roles.get(2));
    }

    @Test
    void lineAfterHeaderIsTheLabelWhateverItLooksLike() {
        var roles = roles("SEX 1\n1 .Male\n2 .Female\n", 2016);
        assertEquals(List.of(LineRole.VARIABLE_HEADER, LineRole.VARIABLE_LABEL, LineRole.VALUE_LABEL), roles);
    }

    @Test
    void noteContinuationFillsDownUntilAValueLine() {
        String text = String.join("\n",
            "ADJINC 7",
            "Adjustment factor",
            "Note: The value of ADJINC",
            "inflates incomes",
            "",
            "to current dollars",
            "1 .Factor"
        );
        assertEquals(List.of(
            LineRole.VARIABLE_HEADER,
            LineRole.VARIABLE_LABEL,
            LineRole.NOTE,
            LineRole.NOTE_CONTINUATION,
            LineRole.BLANK,
            LineRole.NOTE_CONTINUATION,
            LineRole.VALUE_LABEL
        ), roles(text, 2016));
    }

    @Test
    void newHeaderClosesTheNote() {
        String text = String.join("\n",
            "ADJINC 7",
            "Adjustment factor",
            "NOTE: inflation factor",
            "",
            "SEX 1",
            "Sex",
            "follow-up text"
        );
        var roles = roles(text, 2016);
        assertEquals(LineRole.NOTE, roles.get(2));
        assertEquals(LineRole.VARIABLE_HEADER, roles.get(4));
        assertEquals(LineRole.OTHER, roles.get(6));
    }

    @Test
    void tagsExposeTheRole() {
        var classified = new RowClassifier(HeaderGrammar.BEFORE_2017)
            .classify(tokenizer.tokenize("SEX 1\nSex\n1 .Male\nNote: self reported"));
        assertTrue(classified.get(0).isVariableHeader());
        assertTrue(classified.get(2).isValueLabel());
        assertTrue(classified.get(3).isNote());
        assertFalse(classified.get(1).isNote());
    }
}
