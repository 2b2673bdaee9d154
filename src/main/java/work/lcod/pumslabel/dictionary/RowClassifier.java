package work.lcod.pumslabel.dictionary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Tags every dictionary line with its {@link LineRole}.
 *
 * <p>Decisions only look one line back. The single piece of carried state is
 * whether a note is open, which lets untagged lines after a {@code Note:} line
 * fill down as note continuations until a header, label or value line closes it.
 */
public final class RowClassifier {
    static final String NOTE_MARKER = "note:";

    private final HeaderGrammar grammar;

    public RowClassifier(HeaderGrammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
    }

    public HeaderGrammar grammar() {
        return grammar;
    }

    public List<ClassifiedLine> classify(List<DictionaryLine> lines) {
        var classified = new ArrayList<ClassifiedLine>(lines.size());
        DictionaryLine previous = null;
        LineRole previousRole = LineRole.BLANK;
        boolean noteOpen = false;
        for (var line : lines) {
            LineRole role = roleOf(line, previous, previousRole, noteOpen);
            switch (role) {
                case NOTE -> noteOpen = true;
                case VARIABLE_HEADER, VARIABLE_LABEL, VALUE_LABEL -> noteOpen = false;
                default -> {
                    // blank and continuation lines leave the note state alone
                }
            }
            classified.add(new ClassifiedLine(line, role));
            previous = line;
            previousRole = role;
        }
        return classified;
    }

    LineRole roleOf(DictionaryLine line, DictionaryLine previous, LineRole previousRole, boolean noteOpen) {
        if (line.isBlank()) {
            return LineRole.BLANK;
        }
        if (previousRole == LineRole.VARIABLE_HEADER) {
            return LineRole.VARIABLE_LABEL;
        }
        if (grammar.isHeader(line, previous)) {
            return LineRole.VARIABLE_HEADER;
        }
        if (isValueLabel(line)) {
            return LineRole.VALUE_LABEL;
        }
        if (isNote(line)) {
            return LineRole.NOTE;
        }
        return noteOpen ? LineRole.NOTE_CONTINUATION : LineRole.OTHER;
    }

    static boolean isValueLabel(DictionaryLine line) {
        return line.dotToken(1).startsWith(".");
    }

    static boolean isNote(DictionaryLine line) {
        return line.word(0).toLowerCase(Locale.ROOT).equals(NOTE_MARKER);
    }
}
