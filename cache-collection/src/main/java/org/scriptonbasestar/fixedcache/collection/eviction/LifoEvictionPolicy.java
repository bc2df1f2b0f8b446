package org.scriptonbasestar.fixedcache.collection.eviction;

import org.scriptonbasestar.fixedcache.core.exception.SBCacheEmptyPolicyException;
import org.scriptonbasestar.fixedcache.core.policy.EvictionPolicy;

/**
 * Last In First Out (LIFO) eviction policy.
 * <p>
 * Evicts the most recently inserted entry, so a full cache keeps its oldest
 * residents and churns only the newest slot. Reads are ignored.
 * </p>
 *
 * @param <K> the type of cache keys
 * @author archmagece
 * @since 2025-01
 */
public class LifoEvictionPolicy<K> implements EvictionPolicy<K> {

	// head = newest, top of the stack
	private final KeyOrderList<K> lifoStack = new KeyOrderList<>();

	@Override
	public void insert(K key) {
		lifoStack.pushFront(key);
	}

	@Override
	public void touch(K key) {
		// LIFO doesn't care about access - do nothing
	}

	@Override
	public void erase(K key) {
		lifoStack.remove(key);
	}

	@Override
	public K replacementCandidate() {
		if (lifoStack.isEmpty()) {
			throw new SBCacheEmptyPolicyException("No keys available for eviction (LIFO)");
		}
		return lifoStack.first();
	}

	@Override
	public int size() {
		return lifoStack.size();
	}

	@Override
	public boolean contains(K key) {
		return lifoStack.contains(key);
	}

	@Override
	public void clear() {
		lifoStack.clear();
	}

	@Override
	public String toString() {
		return "LifoEvictionPolicy" + lifoStack;
	}
}
