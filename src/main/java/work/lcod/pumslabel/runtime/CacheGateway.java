package work.lcod.pumslabel.runtime;

import java.io.IOException;

/**
 * Keyed text store for downloaded dictionaries and generated scripts.
 */
public interface CacheGateway {
    /** True when {@code key} holds an entry that is still fresh. */
    boolean exists(String key) throws IOException;

    String read(String key) throws IOException;

    void write(String key, String text) throws IOException;
}
