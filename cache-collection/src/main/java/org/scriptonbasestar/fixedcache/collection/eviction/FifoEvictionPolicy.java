package org.scriptonbasestar.fixedcache.collection.eviction;

import org.scriptonbasestar.fixedcache.core.exception.SBCacheEmptyPolicyException;
import org.scriptonbasestar.fixedcache.core.policy.EvictionPolicy;

/**
 * First In First Out (FIFO) eviction policy.
 * <p>
 * Evicts the oldest entry by insertion. Access recency is ignored, and updating
 * the value of a cached key does not move it.
 * </p>
 *
 * @param <K> the type of cache keys
 * @author archmagece
 * @since 2025-01
 */
public class FifoEvictionPolicy<K> implements EvictionPolicy<K> {

	// head = newest, tail = oldest
	private final KeyOrderList<K> fifoQueue = new KeyOrderList<>();

	@Override
	public void insert(K key) {
		fifoQueue.pushFront(key);
	}

	@Override
	public void touch(K key) {
		// FIFO doesn't care about access - do nothing
	}

	@Override
	public void erase(K key) {
		fifoQueue.remove(key);
	}

	@Override
	public K replacementCandidate() {
		if (fifoQueue.isEmpty()) {
			throw new SBCacheEmptyPolicyException("No keys available for eviction (FIFO)");
		}
		return fifoQueue.last();
	}

	@Override
	public int size() {
		return fifoQueue.size();
	}

	@Override
	public boolean contains(K key) {
		return fifoQueue.contains(key);
	}

	@Override
	public void clear() {
		fifoQueue.clear();
	}

	@Override
	public String toString() {
		return "FifoEvictionPolicy" + fifoQueue;
	}
}
