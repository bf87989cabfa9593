package bouncer.core.cache;

import java.util.function.Function;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * Caffeine-backed {@link PatternCache}.
 *
 * <p>Entries never expire on their own; the cache only evicts the least
 * recently used entries once {@code maxSize} is exceeded. Patterns and rule
 * texts are immutable keys, so a cached value never goes stale.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeinePatternCache<K, V> implements PatternCache<K, V> {

    public static final long DEFAULT_MAX_SIZE = 10_000;

    private final Cache<K, V> cache;

    public CaffeinePatternCache() {
        this(DEFAULT_MAX_SIZE);
    }

    /**
     * @param maxSize the maximum number of entries in the cache
     */
    public CaffeinePatternCache(long maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive, got: " + maxSize);
        }
        this.cache = Caffeine.newBuilder().maximumSize(maxSize).build();
    }

    @Override
    public V get(K key, Function<K, V> loader) {
        return cache.get(key, loader);
    }
}
