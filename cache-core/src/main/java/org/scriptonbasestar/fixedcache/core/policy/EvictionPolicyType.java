package org.scriptonbasestar.fixedcache.core.policy;

import java.util.Locale;

/**
 * Built-in eviction policies of a fixed-size cache.
 *
 * <h3>Policy Comparison:</h3>
 * <table border="1">
 * <tr>
 *   <th>Policy</th>
 *   <th>Eviction Criteria</th>
 *   <th>Reacts to reads</th>
 *   <th>Structure</th>
 * </tr>
 * <tr>
 *   <td>NONE</td>
 *   <td>Any tracked key (earliest inserted)</td>
 *   <td>No</td>
 *   <td>Linked hash set</td>
 * </tr>
 * <tr>
 *   <td>FIFO</td>
 *   <td>Oldest inserted</td>
 *   <td>No</td>
 *   <td>Order list + key index</td>
 * </tr>
 * <tr>
 *   <td>LIFO</td>
 *   <td>Newest inserted</td>
 *   <td>No</td>
 *   <td>Order list + key index</td>
 * </tr>
 * <tr>
 *   <td>LRU</td>
 *   <td>Least recently inserted or used</td>
 *   <td>Yes</td>
 *   <td>Order list + key index</td>
 * </tr>
 * </table>
 *
 * <h3>Usage Examples:</h3>
 * <pre>{@code
 * SBFixedSizedCache<String, User> cache = SBFixedSizedCache.<String, User>builder()
 *     .capacity(1000)
 *     .evictionPolicy(EvictionPolicyType.LRU)
 *     .build();
 *
 * // from a property file
 * EvictionPolicyType type = EvictionPolicyType.fromConfig(props.getProperty("cache.eviction"));
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public enum EvictionPolicyType {
	/**
	 * No particular ordering.
	 * <p>
	 * Keys are only tracked for membership. The victim is the earliest inserted key
	 * still present, which keeps runs reproducible.
	 * </p>
	 */
	NONE,

	/**
	 * First In First Out.
	 * <p>
	 * Evicts the oldest entry by insertion. Reads and updates are ignored.
	 * </p>
	 *
	 * <h4>Example:</h4>
	 * <pre>
	 * Insertion order: A, B, C (capacity=3)
	 * → Insert D → Evict A
	 * </pre>
	 */
	FIFO,

	/**
	 * Last In First Out.
	 * <p>
	 * Evicts the most recently inserted entry. Reads and updates are ignored.
	 * </p>
	 *
	 * <h4>Example:</h4>
	 * <pre>
	 * Insertion order: A, B, C (capacity=3)
	 * → Insert D → Evict C
	 * </pre>
	 */
	LIFO,

	/**
	 * Least Recently Used.
	 * <p>
	 * Evicts the entry that was inserted, read or updated longest ago.
	 * </p>
	 *
	 * <h4>Example:</h4>
	 * <pre>
	 * Cache access pattern: put A, B, C, get A, put D (capacity=3)
	 * State: [A, B, C] → [B, C, A] → [C, A, D] (B evicted)
	 * </pre>
	 */
	LRU;

	/**
	 * Parses a policy name taken from configuration.
	 * <p>
	 * Matching ignores case and surrounding blanks, and accepts {@code -} in place of {@code _}.
	 * A null or blank value selects {@link #NONE}.
	 * </p>
	 *
	 * @param value configured policy name
	 * @return the matching policy type
	 * @throws IllegalArgumentException if the name matches no policy
	 */
	public static EvictionPolicyType fromConfig(String value) {
		if (value == null || value.trim().isEmpty()) {
			return NONE;
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		try {
			return EvictionPolicyType.valueOf(normalized);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown eviction policy: " + value, e);
		}
	}
}
