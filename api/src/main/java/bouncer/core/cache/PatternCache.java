package bouncer.core.cache;

import java.util.function.Function;

/**
 * Size-bounded cache for values that are expensive to derive from a key,
 * such as compiled patterns and parsed rule expressions.
 *
 * <p>Implementations must be safe for concurrent use.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface PatternCache<K, V> {

    /**
     * Get the cached value for a key, computing and storing it if absent.
     *
     * @param key    the cache key
     * @param loader computes the value on a miss; exceptions propagate to the caller
     * @return the cached or freshly computed value
     */
    V get(K key, Function<K, V> loader);
}
