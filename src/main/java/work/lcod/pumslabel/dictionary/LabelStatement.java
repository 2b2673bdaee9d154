package work.lcod.pumslabel.dictionary;

import java.util.Objects;

/**
 * One executable label directive.
 */
public record LabelStatement(String variable, StatementKind kind, String text) {
    public LabelStatement {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static LabelStatement variableLabel(Variable variable, String label) {
        return new LabelStatement(
            variable.name(),
            StatementKind.VARIABLE_LABEL,
            "label variable " + variable.name() + " " + quote(label)
        );
    }

    public static LabelStatement define(Variable variable, ValueLabel valueLabel) {
        return new LabelStatement(
            variable.name(),
            StatementKind.VALUE_LABEL_DEFINE,
            "label define " + variable.valueLabelSet() + " " + valueLabel.code() + " " + quote(valueLabel.description()) + ", add"
        );
    }

    public static LabelStatement apply(Variable variable) {
        return new LabelStatement(
            variable.name(),
            StatementKind.VALUE_LABEL_APPLY,
            "label values " + variable.name() + " " + variable.valueLabelSet()
        );
    }

    public static LabelStatement note(Variable variable, String note) {
        return new LabelStatement(variable.name(), StatementKind.NOTE, "notes " + variable.name() + ": " + note);
    }

    /**
     * Quotes {@code text}, switching to compound quotes when it already holds a double quote.
     */
    public static String quote(String text) {
        if (text.indexOf('"') >= 0) {
            return "`\"" + text + "\"'";
        }
        return "\"" + text + "\"";
    }
}
