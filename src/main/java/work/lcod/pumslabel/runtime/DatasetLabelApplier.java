package work.lcod.pumslabel.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code label variable}, {@code label define}, {@code label values}
 * and {@code notes} statements to a {@link Dataset}.
 *
 * <p>A statement that cannot be applied is reported and skipped; the remaining
 * statements still run.
 */
public final class DatasetLabelApplier implements LabelApplier {
    private static final Logger logger = LoggerFactory.getLogger(DatasetLabelApplier.class);

    private static final Pattern VARIABLE_LABEL = Pattern.compile("^label variable (\\S+) (.+)$");
    private static final Pattern VALUE_LABEL_DEFINE = Pattern.compile("^label define (\\S+) (\\S+) (.+), add$");
    private static final Pattern VALUE_LABEL_APPLY = Pattern.compile("^label values (\\S+) (\\S+)$");
    private static final Pattern NOTE = Pattern.compile("^notes (\\S+): (.*)$");

    @Override
    public ApplyReport apply(List<String> statements, Dataset dataset) {
        int applied = 0;
        var failures = new ArrayList<ApplyReport.Failure>();
        for (int i = 0; i < statements.size(); i++) {
            String statement = statements.get(i).strip();
            if (statement.isEmpty() || statement.startsWith("*")) {
                continue;
            }
            try {
                applyStatement(statement, dataset);
                applied++;
            } catch (LabelApplyException ex) {
                logger.warn("Skipping statement {} '{}': {}", i + 1, statement, ex.getMessage());
                failures.add(new ApplyReport.Failure(i + 1, statement, ex.getMessage()));
            }
        }
        logger.info("Applied {} label statements, skipped {}", applied, failures.size());
        return new ApplyReport(applied, failures);
    }

    void applyStatement(String statement, Dataset dataset) {
        Matcher matcher = VARIABLE_LABEL.matcher(statement);
        if (matcher.matches()) {
            dataset.labelVariable(requireVariable(dataset, matcher.group(1)), unquote(matcher.group(2)));
            return;
        }
        matcher = VALUE_LABEL_DEFINE.matcher(statement);
        if (matcher.matches()) {
            defineValueLabel(dataset, matcher.group(1), matcher.group(2), unquote(matcher.group(3)));
            return;
        }
        matcher = VALUE_LABEL_APPLY.matcher(statement);
        if (matcher.matches()) {
            String variable = requireVariable(dataset, matcher.group(1));
            if (!dataset.hasValueLabelSet(matcher.group(2))) {
                throw new LabelApplyException("label set " + matcher.group(2) + " has no values");
            }
            dataset.assignValueLabels(variable, matcher.group(2));
            return;
        }
        matcher = NOTE.matcher(statement);
        if (matcher.matches()) {
            String text = matcher.group(2).strip();
            if (text.isEmpty()) {
                throw new LabelApplyException("empty note for " + matcher.group(1));
            }
            dataset.addNote(requireVariable(dataset, matcher.group(1)), text);
            return;
        }
        throw new LabelApplyException("unrecognized statement");
    }

    private static void defineValueLabel(Dataset dataset, String set, String rawCode, String label) {
        int code;
        try {
            code = Integer.parseInt(rawCode);
        } catch (NumberFormatException ex) {
            throw new LabelApplyException("value-label code is not an integer: " + rawCode);
        }
        var existing = dataset.valueLabel(set, code);
        if (existing.isPresent() && !existing.get().equals(label)) {
            throw new LabelApplyException(
                "label set " + set + " already maps " + code + " to \"" + existing.get() + "\""
            );
        }
        dataset.defineValueLabel(set, code, label);
    }

    private static String requireVariable(Dataset dataset, String name) {
        if (!dataset.hasVariable(name)) {
            throw new LabelApplyException("variable " + name + " not found");
        }
        return name;
    }

    static String unquote(String quoted) {
        String text = quoted.strip();
        if (text.length() >= 4 && text.startsWith("`\"") && text.endsWith("\"'")) {
            return text.substring(2, text.length() - 2);
        }
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        throw new LabelApplyException("label text is not quoted: " + quoted);
    }
}
