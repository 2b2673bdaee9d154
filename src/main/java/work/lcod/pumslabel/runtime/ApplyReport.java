package work.lcod.pumslabel.runtime;

import java.util.List;

/**
 * Outcome of applying a label script: how many statements took effect and which were skipped.
 */
public record ApplyReport(int applied, List<Failure> failures) {
    public ApplyReport {
        failures = List.copyOf(failures);
    }

    public int skipped() {
        return failures.size();
    }

    public record Failure(int lineNumber, String statement, String reason) {}
}
