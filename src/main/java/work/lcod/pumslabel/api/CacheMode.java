package work.lcod.pumslabel.api;

import java.nio.file.Path;

/**
 * Where dictionaries and generated scripts are cached.
 */
public enum CacheMode {
    /** {@code ./.pumslabel/cache} below the working directory. */
    LOCAL,
    /** {@code ~/.pumslabel/cache}, shared by every project of the user. */
    GLOBAL,
    /** A directory given explicitly. */
    CUSTOM;

    public static final String CACHE_PATH = ".pumslabel/cache";

    public Path defaultDirectory(Path workingDirectory) {
        return switch (this) {
            case LOCAL -> workingDirectory.resolve(CACHE_PATH).toAbsolutePath().normalize();
            case GLOBAL -> Path.of(System.getProperty("user.home")).resolve(CACHE_PATH).toAbsolutePath().normalize();
            case CUSTOM -> throw new IllegalStateException("custom cache mode needs an explicit directory");
        };
    }
}
