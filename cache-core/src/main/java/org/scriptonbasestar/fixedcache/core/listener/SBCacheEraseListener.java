package org.scriptonbasestar.fixedcache.core.listener;

/**
 * Callback fired when an entry leaves a fixed-size cache through eviction or
 * explicit removal. Bulk {@code clear()} does not fire it.
 * <p>
 * The listener runs synchronously on the caller's thread, once per removed entry,
 * with the value that was current at removal time. It must not modify the cache
 * that invoked it.
 * </p>
 *
 * <pre>{@code
 * SBFixedSizedCache<String, Connection> pool = new SBFixedSizedCache<>(
 *     16,
 *     new LruEvictionPolicy<>(),
 *     (key, connection) -> connection.close()
 * );
 * }</pre>
 *
 * @param <K> the type of cache keys
 * @param <V> the type of cache values
 * @author archmagece
 * @since 2025-01
 */
@FunctionalInterface
public interface SBCacheEraseListener<K, V> {

	/**
	 * @param key   key of the removed entry
	 * @param value value of the removed entry
	 */
	void onErase(K key, V value);

	/**
	 * @return a listener that does nothing
	 */
	static <K, V> SBCacheEraseListener<K, V> noop() {
		return (key, value) -> {
		};
	}
}
