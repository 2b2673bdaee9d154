package work.lcod.pumslabel.runtime;

import java.util.List;

/**
 * Executes label script lines against a dataset.
 */
public interface LabelApplier {
    ApplyReport apply(List<String> statements, Dataset dataset);
}
