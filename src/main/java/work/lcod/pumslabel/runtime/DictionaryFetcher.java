package work.lcod.pumslabel.runtime;

import java.io.IOException;
import work.lcod.pumslabel.api.DictionaryTarget;

/**
 * Supplies the raw data-dictionary text for a year and sample period.
 */
public interface DictionaryFetcher {
    String fetch(DictionaryTarget target) throws IOException;
}
