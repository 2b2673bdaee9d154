package work.lcod.pumslabel.runtime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache entries stored as UTF-8 files below one directory, expired by modification time.
 *
 * <p>Writers of the same entry are serialized and publish through an atomic
 * rename, so readers see either the old or the new file.
 */
public final class FileCacheGateway implements CacheGateway {
    private static final Logger logger = LoggerFactory.getLogger(FileCacheGateway.class);
    private static final ConcurrentMap<Path, Object> WRITE_LOCKS = new ConcurrentHashMap<>();

    private final Path root;
    private final Duration ttl;
    private final Clock clock;

    public FileCacheGateway(Path root, Duration ttl) {
        this(root, ttl, Clock.systemUTC());
    }

    public FileCacheGateway(Path root, Duration ttl, Clock clock) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("cache ttl must not be negative: " + ttl);
        }
    }

    public Path root() {
        return root;
    }

    public Path pathOf(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("cache key must not be blank");
        }
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("cache key escapes the cache directory: " + key);
        }
        return resolved;
    }

    @Override
    public boolean exists(String key) throws IOException {
        Path path = pathOf(key);
        if (!Files.isRegularFile(path)) {
            return false;
        }
        if (ttl.isZero()) {
            return true;
        }
        Instant modified = Files.getLastModifiedTime(path).toInstant();
        Duration age = Duration.between(modified, clock.instant());
        boolean fresh = age.compareTo(ttl) <= 0;
        if (!fresh) {
            logger.debug("Cache entry {} is stale (age {})", key, age);
        }
        return fresh;
    }

    @Override
    public String read(String key) throws IOException {
        return Files.readString(pathOf(key), StandardCharsets.UTF_8);
    }

    @Override
    public void write(String key, String text) throws IOException {
        Path target = pathOf(key);
        synchronized (WRITE_LOCKS.computeIfAbsent(target, ignored -> new Object())) {
            Path parent = target.getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, text, StandardCharsets.UTF_8);
                try {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException ex) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
            logger.debug("Wrote cache entry {} ({} chars)", key, text.length());
        }
    }
}
