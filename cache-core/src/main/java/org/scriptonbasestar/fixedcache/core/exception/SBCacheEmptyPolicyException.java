package org.scriptonbasestar.fixedcache.core.exception;

/**
 * Thrown when an eviction victim is requested from a policy that tracks no key.
 * <p>
 * A cache only asks for a victim while it is full, so this signals broken
 * bookkeeping rather than a recoverable condition.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBCacheEmptyPolicyException extends IllegalStateException {

	public SBCacheEmptyPolicyException() {
		super("No keys available for eviction");
	}

	public SBCacheEmptyPolicyException(String message) {
		super(message);
	}

	public SBCacheEmptyPolicyException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBCacheEmptyPolicyException(Throwable cause) {
		super(cause);
	}
}
