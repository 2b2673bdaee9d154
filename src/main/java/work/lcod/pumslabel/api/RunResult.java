package work.lcod.pumslabel.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.pumslabel.runtime.ApplyReport;

/**
 * Outcome of a {@link LabelRunner} execution (usable by the CLI and embedding apps).
 */
public record RunResult(
    Status status,
    DictionaryTarget target,
    Optional<Path> script,
    long statementCount,
    boolean cacheHit,
    Optional<ApplyReport> applyReport,
    Optional<String> error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(applyReport, "applyReport");
        Objects.requireNonNull(error, "error");
    }

    public static RunResult success(
        DictionaryTarget target,
        Path script,
        long statementCount,
        boolean cacheHit,
        Optional<ApplyReport> applyReport,
        Instant startedAt,
        Instant finishedAt
    ) {
        return new RunResult(Status.SUCCESS, target, Optional.of(script), statementCount, cacheHit,
            applyReport, Optional.empty(), startedAt, finishedAt);
    }

    public static RunResult failure(DictionaryTarget target, Exception cause, Instant startedAt, Instant finishedAt) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        return new RunResult(Status.FAILURE, target, Optional.empty(), 0, false,
            Optional.empty(), Optional.of(message), startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("year", target.year());
        serializable.put("sample", target.samplePeriod());
        script.ifPresent(path -> serializable.put("script", path.toString()));
        if (status == Status.SUCCESS) {
            serializable.put("statements", statementCount);
            serializable.put("cacheHit", cacheHit);
        }
        applyReport.ifPresent(report -> {
            Map<String, Object> applied = new LinkedHashMap<>();
            applied.put("applied", report.applied());
            applied.put("skipped", report.skipped());
            List<Map<String, Object>> failures = report.failures().stream()
                .map(failure -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("line", failure.lineNumber());
                    entry.put("statement", failure.statement());
                    entry.put("reason", failure.reason());
                    return entry;
                })
                .toList();
            if (!failures.isEmpty()) {
                applied.put("failures", failures);
            }
            serializable.put("dataset", applied);
        });
        error.ifPresent(message -> serializable.put("error", message));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
