package io.synphot.core.engine;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Load-once cache. Thread-safe: concurrent callers asking for the same key run the loader once
 * and share its result. A loader that throws stores nothing, so the next call retries. Entries
 * are never evicted; {@link #clear()} empties the cache.
 *
 * <p>
 * Loaders must not call back into the same cache.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class MemoCache<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(MemoCache.class);

    private final String name;
    private final Map<K, V> entries = new ConcurrentHashMap<>();

    public MemoCache(String name) {
        this.name = name;
    }

    /**
     * Returns the cached value for {@code key}, loading it first if absent.
     *
     * @throws NullPointerException if the loader returns {@code null}
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        V value = entries.get(key);
        if (value != null) {
            return value;
        }
        return entries.computeIfAbsent(key, k -> {
            LOG.debug("Cache {}: loading {}", name, k);
            V loaded = loader.apply(k);
            if (loaded == null) {
                throw new NullPointerException("Loader for cache " + name + " returned null for " + k);
            }
            return loaded;
        });
    }

    public Optional<V> peek(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(K key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        LOG.debug("Cache {} cleared", name);
    }

    public String name() {
        return name;
    }
}
