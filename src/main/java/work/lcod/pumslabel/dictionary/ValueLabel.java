package work.lcod.pumslabel.dictionary;

import java.util.Objects;

/**
 * A code/description pair belonging to one variable.
 */
public record ValueLabel(String variable, String code, String description) {
    public ValueLabel {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(description, "description");
    }
}
