package org.scriptonbasestar.fixedcache.collection.eviction;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.scriptonbasestar.fixedcache.core.exception.SBCacheEmptyPolicyException;
import org.scriptonbasestar.fixedcache.core.policy.EvictionPolicy;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.Assert.*;

/**
 * 모든 EvictionPolicy 구현이 공통으로 지켜야 하는 계약 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
@RunWith(Parameterized.class)
public class EvictionPolicyContractTest {

	@Parameterized.Parameters(name = "{0}")
	public static Collection<Object[]> policies() {
		return Arrays.asList(new Object[][]{
			{"NONE", (Supplier<EvictionPolicy<String>>) NoEvictionPolicy::new},
			{"FIFO", (Supplier<EvictionPolicy<String>>) FifoEvictionPolicy::new},
			{"LIFO", (Supplier<EvictionPolicy<String>>) LifoEvictionPolicy::new},
			{"LRU", (Supplier<EvictionPolicy<String>>) LruEvictionPolicy::new},
		});
	}

	private final Supplier<EvictionPolicy<String>> factory;
	private EvictionPolicy<String> policy;

	public EvictionPolicyContractTest(String name, Supplier<EvictionPolicy<String>> factory) {
		this.factory = factory;
	}

	@Before
	public void setUp() {
		policy = factory.get();
	}

	@Test(expected = SBCacheEmptyPolicyException.class)
	public void emptyPolicyHasNoCandidate() {
		policy.replacementCandidate();
	}

	@Test
	public void candidateDoesNotEraseKey() {
		policy.insert("A");
		assertEquals("A", policy.replacementCandidate());
		assertEquals("A", policy.replacementCandidate());
		assertTrue(policy.contains("A"));
		assertEquals(1, policy.size());
	}

	@Test
	public void redundantInsertDoesNotDuplicate() {
		for (int i = 0; i < 5; i++) {
			policy.insert("A");
		}
		policy.insert("B");
		assertEquals(2, policy.size());

		policy.erase("A");

		assertFalse(policy.contains("A"));
		assertEquals(1, policy.size());
		assertEquals("B", policy.replacementCandidate());
		policy.erase("B");
		assertTrue(policy.isEmpty());
	}

	@Test
	public void eraseAndTouchUnknownKeyAreNoOps() {
		policy.insert("A");
		policy.erase("X");
		policy.touch("X");

		assertEquals(1, policy.size());
		assertFalse(policy.contains("X"));
		assertEquals("A", policy.replacementCandidate());
	}

	@Test
	public void candidateIsAlwaysTracked() {
		Set<String> tracked = new HashSet<>();
		for (int i = 0; i < 20; i++) {
			String key = "K" + i;
			policy.insert(key);
			tracked.add(key);
			if (i % 3 == 0) {
				policy.touch("K" + (i / 2));
			}
			if (i % 4 == 0) {
				String candidate = policy.replacementCandidate();
				assertTrue(tracked.contains(candidate));
				policy.erase(candidate);
				tracked.remove(candidate);
			}
			assertEquals(tracked.size(), policy.size());
		}
		while (!tracked.isEmpty()) {
			String candidate = policy.replacementCandidate();
			assertTrue(tracked.remove(candidate));
			policy.erase(candidate);
		}
		assertTrue(policy.isEmpty());
	}

	@Test
	public void clearDropsEverything() {
		policy.insert("A");
		policy.insert("B");
		policy.clear();

		assertTrue(policy.isEmpty());
		assertFalse(policy.contains("A"));
		policy.insert("C");
		assertEquals("C", policy.replacementCandidate());
	}
}
