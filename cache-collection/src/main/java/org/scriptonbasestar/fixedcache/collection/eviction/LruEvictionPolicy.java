package org.scriptonbasestar.fixedcache.collection.eviction;

import org.scriptonbasestar.fixedcache.core.exception.SBCacheEmptyPolicyException;
import org.scriptonbasestar.fixedcache.core.policy.EvictionPolicy;

/**
 * Least Recently Used (LRU) eviction policy.
 * <p>
 * Evicts the entry that hasn't been inserted, read or updated for the longest time.
 * Every touch moves the key's node to the head of the order list through the key
 * index, so insert, touch, erase and victim selection are all O(1).
 * </p>
 *
 * <pre>
 * insert A, B, C   → [C, B, A]
 * touch A          → [A, C, B]
 * candidate        → B
 * </pre>
 *
 * @param <K> the type of cache keys
 * @author archmagece
 * @since 2025-01
 */
public class LruEvictionPolicy<K> implements EvictionPolicy<K> {

	// head = most recently used, tail = least recently used
	private final KeyOrderList<K> lruQueue = new KeyOrderList<>();

	@Override
	public void insert(K key) {
		lruQueue.pushFront(key);
	}

	@Override
	public void touch(K key) {
		lruQueue.moveToFront(key);
	}

	@Override
	public void erase(K key) {
		lruQueue.remove(key);
	}

	@Override
	public K replacementCandidate() {
		if (lruQueue.isEmpty()) {
			throw new SBCacheEmptyPolicyException("No keys available for eviction (LRU)");
		}
		return lruQueue.last();
	}

	@Override
	public int size() {
		return lruQueue.size();
	}

	@Override
	public boolean contains(K key) {
		return lruQueue.contains(key);
	}

	@Override
	public void clear() {
		lruQueue.clear();
	}

	@Override
	public String toString() {
		return "LruEvictionPolicy" + lruQueue;
	}
}
