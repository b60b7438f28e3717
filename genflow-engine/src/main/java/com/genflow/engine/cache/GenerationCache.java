package com.genflow.engine.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genflow.core.model.CacheEntry;
import com.genflow.engine.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Two-tier key/value cache for expensive generation results.
 *
 * <p>Reads check memory first, then the entry file under the cache directory; a
 * disk hit repopulates memory. Expiry is lazy: an entry found expired on read is
 * removed from both tiers, and nothing sweeps the directory in the background.
 * The memory tier holds at most {@code maxMemoryEntries}; on overflow the oldest
 * tenth is dropped from memory only, so those entries are still served from disk.
 *
 * <p>Disk is the durable tier but writes to it are best-effort: a failed write
 * is logged and the entry stays in memory.
 */
public class GenerationCache {
    
    private static final Logger log = LoggerFactory.getLogger(GenerationCache.class);
    private static final Pattern SAFE_FILE_KEY = Pattern.compile("[A-Za-z0-9._-]{1,100}");
    private static final String SUFFIX = ".json";
    
    private final Path directory;
    private final Duration defaultTtl;
    private final int maxMemoryEntries;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final WorkflowMetrics metrics;
    
    private final Map<String, CacheEntry> memory = new LinkedHashMap<>();
    private final Map<String, Object> computeLocks = new ConcurrentHashMap<>();
    
    /**
     * @param defaultTtl TTL for entries stored without one; null means entries never expire
     */
    public GenerationCache(
            Path directory,
            Duration defaultTtl,
            int maxMemoryEntries,
            ObjectMapper objectMapper,
            Clock clock,
            WorkflowMetrics metrics) {
        if (maxMemoryEntries < 1) {
            throw new IllegalArgumentException("maxMemoryEntries must be >= 1");
        }
        this.directory = directory;
        this.defaultTtl = defaultTtl;
        this.maxMemoryEntries = maxMemoryEntries;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
    }
    
    /**
     * Computes a value on a cache miss.
     */
    @FunctionalInterface
    public interface Loader<T, E extends Exception> {
        T load() throws E;
    }
    
    // ========== Reads ==========
    
    public Optional<JsonNode> get(String key) {
        return getEntry(key).map(CacheEntry::value);
    }
    
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).map(value -> objectMapper.convertValue(value, type));
    }
    
    public boolean has(String key) {
        return getEntry(key).isPresent();
    }
    
    /**
     * Full entry, metadata included. Expired entries are removed and reported absent.
     */
    public Optional<CacheEntry> getEntry(String key) {
        Instant now = clock.instant();
        CacheEntry cached;
        synchronized (memory) {
            cached = memory.get(key);
        }
        if (cached != null) {
            if (!cached.isExpired(now)) {
                metrics.cacheHit("memory");
                return Optional.of(cached);
            }
            log.debug("Cache entry {} expired", key);
            delete(key);
            metrics.cacheMiss();
            return Optional.empty();
        }
        
        Optional<CacheEntry> fromDisk = readFile(key);
        if (fromDisk.isPresent()) {
            CacheEntry entry = fromDisk.get();
            if (entry.isExpired(now)) {
                log.debug("Cache file for {} expired", key);
                delete(key);
            } else {
                putInMemory(entry);
                metrics.cacheHit("disk");
                return fromDisk;
            }
        }
        metrics.cacheMiss();
        return Optional.empty();
    }
    
    // ========== Writes ==========
    
    public void set(String key, Object value) {
        set(key, value, null, null);
    }
    
    /**
     * Store a value in both tiers.
     *
     * @param ttl time to live, null for the default
     * @param metadata free-form JSON stored with the entry, may be null
     */
    public void set(String key, Object value, Duration ttl, JsonNode metadata) {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(
            key,
            objectMapper.valueToTree(value),
            now,
            effectiveTtl == null ? null : now.plus(effectiveTtl),
            metadata);
        putInMemory(entry);
        writeFile(entry);
    }
    
    /**
     * Remove an entry from both tiers.
     *
     * @return true if either tier held it
     */
    public boolean delete(String key) {
        boolean removed;
        synchronized (memory) {
            removed = memory.remove(key) != null;
        }
        try {
            removed |= Files.deleteIfExists(fileFor(key));
        } catch (IOException e) {
            log.warn("Cannot delete cache file for {}: {}", key, e.getMessage());
        }
        return removed;
    }
    
    /**
     * Remove every entry from both tiers, expired files included.
     */
    public void clear() {
        synchronized (memory) {
            memory.clear();
        }
        if (!Files.isDirectory(directory)) {
            return;
        }
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                if (Files.deleteIfExists(file)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot clear cache directory " + directory, e);
        }
        log.info("Cleared {} cache file(s) from {}", deleted, directory);
    }
    
    /**
     * Return the cached value, or compute, store and return it.
     * Within this process the loader runs at most once per key while the entry is absent;
     * concurrent callers for the same key wait for the first one.
     */
    public <T, E extends Exception> T getOrCompute(String key, Class<T> type, Duration ttl, Loader<T, E> loader) throws E {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        Object lock = computeLocks.computeIfAbsent(key, k -> new Object());
        synchronized (lock) {
            try {
                cached = get(key, type);
                if (cached.isPresent()) {
                    return cached.get();
                }
                T value = loader.load();
                set(key, value, ttl, null);
                return value;
            } finally {
                computeLocks.remove(key, lock);
            }
        }
    }
    
    int computeLockCount() {
        return computeLocks.size();
    }
    
    public CacheStats getStats() {
        int memoryEntries;
        synchronized (memory) {
            memoryEntries = memory.size();
        }
        int diskEntries = 0;
        long diskBytes = 0;
        if (Files.isDirectory(directory)) {
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
                for (Path file : files) {
                    diskEntries++;
                    diskBytes += Files.size(file);
                }
            } catch (IOException e) {
                log.warn("Cannot read cache directory {}: {}", directory, e.getMessage());
            }
        }
        return new CacheStats(memoryEntries, diskEntries, diskBytes);
    }
    
    public Path getDirectory() {
        return directory;
    }
    
    // ========== Internals ==========
    
    private void putInMemory(CacheEntry entry) {
        synchronized (memory) {
            memory.remove(entry.key());
            memory.put(entry.key(), entry);
            if (memory.size() > maxMemoryEntries) {
                int toEvict = Math.max(1, maxMemoryEntries / 10);
                Iterator<String> oldest = memory.keySet().iterator();
                for (int i = 0; i < toEvict && oldest.hasNext(); i++) {
                    oldest.next();
                    oldest.remove();
                }
                log.debug("Evicted {} entries from the memory tier", toEvict);
            }
        }
    }
    
    private Optional<CacheEntry> readFile(String key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            CacheEntry entry = objectMapper.readValue(file.toFile(), CacheEntry.class);
            if (!key.equals(entry.key())) {
                log.warn("Cache file {} holds key {}, expected {}", file.getFileName(), entry.key(), key);
                return Optional.empty();
            }
            return Optional.of(entry);
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache file {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
    
    private void writeFile(CacheEntry entry) {
        Path target = fileFor(entry.key());
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, "entry", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), entry);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            log.warn("Cannot write cache file for {}: {}", entry.key(), e.getMessage());
        }
    }
    
    private Path fileFor(String key) {
        String name = SAFE_FILE_KEY.matcher(key).matches() && !key.startsWith(".")
            ? key
            : CacheKeys.sha256Hex(key);
        return directory.resolve(name + SUFFIX);
    }
}
