package work.lcod.pumslabel.dictionary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds classified lines into {@link Variable}s in one forward pass.
 *
 * <p>Value-label and note lines belong to the closest header above them. A header
 * that shows up again (the housing and person sections share a few variables)
 * reopens the variable it named first.
 */
public final class VariableAssembler {
    private static final Logger logger = LoggerFactory.getLogger(VariableAssembler.class);

    static final String RANGE_MARKER = "..";
    static final String MISSING_DATA_MARKER = "b";

    public List<Variable> assemble(List<ClassifiedLine> lines) {
        Map<String, Variable> variables = new LinkedHashMap<>();
        Variable current = null;
        for (var line : lines) {
            switch (line.role()) {
                case VARIABLE_HEADER -> {
                    String name = line.line().word(0).toLowerCase(Locale.ROOT);
                    current = variables.computeIfAbsent(name, Variable::new);
                }
                case VARIABLE_LABEL -> {
                    if (current != null && !current.labelIfAbsent(line.text())) {
                        logger.debug("Label on line {} ignored, {} is already labelled",
                            line.line().number(), current.name());
                    }
                }
                case VALUE_LABEL -> {
                    if (current == null) {
                        logUnattached(line);
                    } else {
                        toValueLabel(current.name(), line.line()).ifPresent(current::addValueLabel);
                    }
                }
                case NOTE, NOTE_CONTINUATION -> {
                    if (current == null) {
                        logUnattached(line);
                    } else {
                        current.appendNote(cleanNote(line));
                    }
                }
                default -> {
                    // blank and unrecognized lines carry nothing
                }
            }
        }
        return new ArrayList<>(variables.values());
    }

    static Optional<ValueLabel> toValueLabel(String variable, DictionaryLine line) {
        if (line.text().contains(RANGE_MARKER)) {
            return Optional.empty();
        }
        String marked = line.dotToken(1);
        if (!marked.startsWith(".")) {
            return Optional.empty();
        }
        String code = line.dotToken(0);
        String description = marked.substring(1).strip();
        if (code.isEmpty() || description.isEmpty() || code.startsWith(MISSING_DATA_MARKER)) {
            return Optional.empty();
        }
        return Optional.of(new ValueLabel(variable, code, description));
    }

    static String cleanNote(ClassifiedLine line) {
        String text = line.text();
        if (line.role() == LineRole.NOTE) {
            text = text.substring(RowClassifier.NOTE_MARKER.length()).strip();
        }
        return text;
    }

    private static void logUnattached(ClassifiedLine line) {
        logger.debug("Dropping {} line {} before any variable header: {}",
            line.role(), line.line().number(), line.text());
    }
}
