package org.scriptonbasestar.fixedcache.core.policy;

import org.scriptonbasestar.fixedcache.core.exception.SBCacheEmptyPolicyException;

/**
 * Key bookkeeping for a fixed-size cache.
 * <p>
 * A policy tracks keys only, never values. The owning cache calls it around every
 * mutation so that the set of tracked keys always equals the cache's key set, and
 * asks it which key to discard once the cache is full.
 * </p>
 *
 * <h3>Call sequence used by {@code SBFixedSizedCache}:</h3>
 * <ul>
 *   <li>new key stored - {@link #insert(Object)}</li>
 *   <li>successful lookup or value update - {@link #touch(Object)}</li>
 *   <li>explicit remove, eviction or clear - {@link #erase(Object)}</li>
 *   <li>cache full, new key arriving - {@link #replacementCandidate()}</li>
 * </ul>
 *
 * <p>
 * Implementations are not thread-safe. A policy instance belongs to exactly one cache.
 * </p>
 *
 * @param <K> the type of cache keys
 * @author archmagece
 * @since 2025-01
 */
public interface EvictionPolicy<K> {

	/**
	 * Starts tracking a key.
	 * <p>
	 * Inserting a key that is already tracked must not create a second record of it.
	 * </p>
	 *
	 * @param key the key that was stored
	 */
	void insert(K key);

	/**
	 * Notifies the policy that a key was used.
	 * <p>
	 * Unknown keys are ignored.
	 * </p>
	 *
	 * @param key the key that was read or updated
	 */
	void touch(K key);

	/**
	 * Stops tracking a key. Unknown keys are ignored.
	 *
	 * @param key the key that left the cache
	 */
	void erase(K key);

	/**
	 * Selects the key that should be evicted next. The key stays tracked until
	 * {@link #erase(Object)} is called for it.
	 *
	 * @return the next eviction victim
	 * @throws SBCacheEmptyPolicyException if no key is tracked
	 */
	K replacementCandidate();

	/**
	 * @return number of tracked keys
	 */
	int size();

	/**
	 * @param key key to look up
	 * @return true if the key is tracked
	 */
	boolean contains(K key);

	/**
	 * Drops every tracked key at once.
	 */
	void clear();

	default boolean isEmpty() {
		return size() == 0;
	}
}
