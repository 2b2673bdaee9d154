package work.lcod.pumslabel.dictionary;

import java.util.Objects;

/**
 * A tokenized line together with the role the classifier gave it.
 */
public record ClassifiedLine(DictionaryLine line, LineRole role) {
    public ClassifiedLine {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(role, "role");
    }

    public boolean isVariableHeader() {
        return role == LineRole.VARIABLE_HEADER;
    }

    public boolean isValueLabel() {
        return role == LineRole.VALUE_LABEL;
    }

    public boolean isNote() {
        return role == LineRole.NOTE || role == LineRole.NOTE_CONTINUATION;
    }

    public String text() {
        return line.text();
    }
}
