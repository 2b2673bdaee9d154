package work.lcod.pumslabel.dictionary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Working record for one dictionary variable. Only {@link VariableAssembler} mutates it.
 */
public final class Variable {
    private final String name;
    private String label;
    private final List<ValueLabel> valueLabels = new ArrayList<>();
    private final StringBuilder note = new StringBuilder();

    Variable(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public List<ValueLabel> valueLabels() {
        return Collections.unmodifiableList(valueLabels);
    }

    public String note() {
        return note.toString();
    }

    public boolean hasValueLabels() {
        return !valueLabels.isEmpty();
    }

    public String valueLabelSet() {
        return name + "_lbl";
    }

    boolean labelIfAbsent(String text) {
        if (label != null || text.isEmpty()) {
            return false;
        }
        label = text;
        return true;
    }

    void addValueLabel(ValueLabel valueLabel) {
        valueLabels.add(valueLabel);
    }

    void appendNote(String text) {
        if (text.isEmpty()) {
            return;
        }
        if (note.length() > 0) {
            note.append(' ');
        }
        note.append(text);
    }

    @Override
    public String toString() {
        return "Variable[" + name + ", values=" + valueLabels.size() + "]";
    }
}
