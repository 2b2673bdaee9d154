package work.lcod.pumslabel.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory table plus the label metadata applied to it.
 */
public final class Dataset {
    private final List<String> columns;
    private final List<List<String>> rows;
    private final Map<String, String> variableLabels = new LinkedHashMap<>();
    private final Map<String, TreeMap<Integer, String>> valueLabelSets = new LinkedHashMap<>();
    private final Map<String, String> valueLabelAssignments = new LinkedHashMap<>();
    private final Map<String, List<String>> notes = new LinkedHashMap<>();

    public Dataset(List<String> columns, List<List<String>> rows) {
        var names = new LinkedHashSet<String>();
        for (String column : columns) {
            names.add(normalize(column));
        }
        if (names.size() != columns.size()) {
            throw new IllegalArgumentException("duplicate column names: " + columns);
        }
        this.columns = List.copyOf(names);
        var copied = new ArrayList<List<String>>(rows.size());
        for (var row : rows) {
            copied.add(List.copyOf(row));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public static String normalize(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public boolean hasVariable(String name) {
        return columns.contains(normalize(name));
    }

    public Optional<String> variableLabel(String name) {
        return Optional.ofNullable(variableLabels.get(normalize(name)));
    }

    public Optional<String> valueLabelSet(String variable) {
        return Optional.ofNullable(valueLabelAssignments.get(normalize(variable)));
    }

    public boolean hasValueLabelSet(String set) {
        var labels = valueLabelSets.get(set);
        return labels != null && !labels.isEmpty();
    }

    public Optional<String> valueLabel(String set, int code) {
        var labels = valueLabelSets.get(set);
        return labels == null ? Optional.empty() : Optional.ofNullable(labels.get(code));
    }

    /**
     * Looks up the label of a raw cell value through the variable's assigned label set.
     */
    public Optional<String> decode(String variable, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return Optional.empty();
        }
        try {
            int code = Integer.parseInt(rawValue.strip());
            return valueLabelSet(variable).flatMap(set -> valueLabel(set, code));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public List<String> notes(String variable) {
        return List.copyOf(notes.getOrDefault(normalize(variable), List.of()));
    }

    void labelVariable(String name, String label) {
        variableLabels.put(normalize(name), label);
    }

    void defineValueLabel(String set, int code, String label) {
        valueLabelSets.computeIfAbsent(set, ignored -> new TreeMap<>()).put(code, label);
    }

    void assignValueLabels(String variable, String set) {
        valueLabelAssignments.put(normalize(variable), set);
    }

    void addNote(String variable, String text) {
        notes.computeIfAbsent(normalize(variable), ignored -> new ArrayList<>()).add(text);
    }

    /**
     * Label metadata as plain maps and lists, ready for JSON serialization.
     */
    public Map<String, Object> toMetadata() {
        var variables = new LinkedHashMap<String, Object>();
        for (String column : columns) {
            var entry = new LinkedHashMap<String, Object>();
            variableLabel(column).ifPresent(label -> entry.put("label", label));
            valueLabelSet(column).ifPresent(set -> {
                entry.put("valueLabelSet", set);
                var labels = new LinkedHashMap<String, String>();
                valueLabelSets.getOrDefault(set, new TreeMap<>()).forEach((code, text) -> labels.put(code.toString(), text));
                entry.put("valueLabels", labels);
            });
            var columnNotes = notes(column);
            if (!columnNotes.isEmpty()) {
                entry.put("notes", columnNotes);
            }
            variables.put(column, entry);
        }
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("rows", rows.size());
        metadata.put("variables", variables);
        return metadata;
    }
}
