package work.lcod.pumslabel.dictionary;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns assembled variables into the ordered, de-duplicated script body.
 */
public final class StatementEmitter {
    public static final String SPACER = "";

    /**
     * Statements for one variable: label, value-label definitions, value-label
     * assignment, then the note.
     */
    public List<LabelStatement> statements(Variable variable) {
        var block = new ArrayList<LabelStatement>();
        variable.label()
            .map(String::strip)
            .filter(label -> !label.isEmpty())
            .ifPresent(label -> block.add(LabelStatement.variableLabel(variable, label)));
        for (var valueLabel : variable.valueLabels()) {
            block.add(LabelStatement.define(variable, valueLabel));
        }
        if (variable.hasValueLabels()) {
            block.add(LabelStatement.apply(variable));
        }
        String note = variable.note().strip();
        if (!note.isEmpty()) {
            block.add(LabelStatement.note(variable, note));
        }
        return block;
    }

    /**
     * Emits every variable block sorted by name. Repeated statement text is kept
     * once and each non-empty block is followed by a spacer line.
     */
    public List<String> emit(Collection<Variable> variables) {
        var sorted = new ArrayList<>(variables);
        sorted.sort(Comparator.comparing(Variable::name));
        Set<String> seen = new HashSet<>();
        var lines = new ArrayList<String>();
        for (var variable : sorted) {
            boolean wrote = false;
            for (var statement : statements(variable)) {
                if (seen.add(statement.text())) {
                    lines.add(statement.text());
                    wrote = true;
                }
            }
            if (wrote) {
                lines.add(SPACER);
            }
        }
        return lines;
    }
}
