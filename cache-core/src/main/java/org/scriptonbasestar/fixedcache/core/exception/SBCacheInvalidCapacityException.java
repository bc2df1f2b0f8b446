package org.scriptonbasestar.fixedcache.core.exception;

/**
 * Thrown when a fixed-size cache is built with a capacity below one.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBCacheInvalidCapacityException extends IllegalArgumentException {

	private final int capacity;

	public SBCacheInvalidCapacityException(int capacity) {
		super("Cache capacity must be greater than zero: " + capacity);
		this.capacity = capacity;
	}

	public int getCapacity() {
		return capacity;
	}
}
