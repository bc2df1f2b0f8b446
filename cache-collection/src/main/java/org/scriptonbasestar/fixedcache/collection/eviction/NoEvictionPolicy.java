package org.scriptonbasestar.fixedcache.collection.eviction;

import org.scriptonbasestar.fixedcache.core.exception.SBCacheEmptyPolicyException;
import org.scriptonbasestar.fixedcache.core.policy.EvictionPolicy;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Policy without an eviction rule.
 * <p>
 * Keys are tracked for membership only and reads are ignored. Any tracked key is
 * an acceptable victim; the earliest inserted one is returned so that runs are
 * reproducible.
 * </p>
 *
 * @param <K> the type of cache keys
 * @author archmagece
 * @since 2025-01
 */
public class NoEvictionPolicy<K> implements EvictionPolicy<K> {

	private final Set<K> keys = new LinkedHashSet<>();

	@Override
	public void insert(K key) {
		keys.add(key);
	}

	@Override
	public void touch(K key) {
		// no ordering to update
	}

	@Override
	public void erase(K key) {
		keys.remove(key);
	}

	@Override
	public K replacementCandidate() {
		if (keys.isEmpty()) {
			throw new SBCacheEmptyPolicyException("No keys available for replacement");
		}
		return keys.iterator().next();
	}

	@Override
	public int size() {
		return keys.size();
	}

	@Override
	public boolean contains(K key) {
		return keys.contains(key);
	}

	@Override
	public void clear() {
		keys.clear();
	}

	@Override
	public String toString() {
		return "NoEvictionPolicy" + keys;
	}
}
