package work.lcod.pumslabel.runtime;

/**
 * A single label statement that could not be applied to the dataset.
 */
public final class LabelApplyException extends RuntimeException {
    public LabelApplyException(String message) {
        super(message);
    }
}
