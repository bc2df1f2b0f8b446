package org.scriptonbasestar.fixedcache.core.exception;

import java.util.NoSuchElementException;

/**
 * Thrown by {@code get} when the key is not cached.
 * Callers that treat absence as a normal outcome use {@code tryGet} instead.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBCacheKeyNotFoundException extends NoSuchElementException {

	private final transient Object key;

	public SBCacheKeyNotFoundException(Object key) {
		super("Key not found in cache: " + key);
		this.key = key;
	}

	public Object getKey() {
		return key;
	}
}
