package mediaflow.ai;

import mediaflow.error.InferenceException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded least-recently-used cache of model handles keyed by {@link ModelConfig}.
 *
 * <p>Reads refresh recency, so a config in steady use is never evicted by a burst of
 * one-off configs. This class is thread-safe; the factory runs under the cache lock.
 *
 * @param <M> the handle type
 */
public final class ModelCache<M> {

    /**
     * Creates a handle for a config that is not cached yet.
     */
    @FunctionalInterface
    public interface Factory<M> {
        M create(ModelConfig config) throws InferenceException;
    }

    private final int maxSize;
    private final LinkedHashMap<ModelConfig, M> entries;
    private long hits;
    private long misses;

    public ModelCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ModelConfig, M> eldest) {
                return size() > ModelCache.this.maxSize;
            }
        };
    }

    public synchronized M getOrCreate(ModelConfig config, Factory<M> factory) throws InferenceException {
        Objects.requireNonNull(config, "config");
        M cached = entries.get(config);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        M created = Objects.requireNonNull(factory.create(config), "factory returned null");
        entries.put(config, created);
        return created;
    }

    public synchronized boolean contains(ModelConfig config) {
        return entries.containsKey(config);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
