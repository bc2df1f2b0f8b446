package org.scriptonbasestar.fixedcache.collection.eviction;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-01
 */
public class KeyOrderListTest {

	private KeyOrderList<String> list;

	@Before
	public void setUp() {
		list = new KeyOrderList<>();
	}

	@Test
	public void pushFrontOrdersNewestFirst() {
		list.pushFront("A");
		list.pushFront("B");
		list.pushFront("C");

		assertEquals(Arrays.asList("C", "B", "A"), list.toList());
		assertEquals("C", list.first());
		assertEquals("A", list.last());
		assertEquals(3, list.size());
	}

	@Test
	public void pushFrontIgnoresDuplicate() {
		assertTrue(list.pushFront("A"));
		list.pushFront("B");
		assertFalse(list.pushFront("A"));

		assertEquals(Arrays.asList("B", "A"), list.toList());
		assertEquals(2, list.size());
	}

	@Test
	public void removeHeadMiddleTail() {
		list.pushFront("A");
		list.pushFront("B");
		list.pushFront("C");
		list.pushFront("D");

		assertTrue(list.remove("B"));  // middle
		assertEquals(Arrays.asList("D", "C", "A"), list.toList());

		assertTrue(list.remove("D"));  // head
		assertEquals("C", list.first());

		assertTrue(list.remove("A"));  // tail
		assertEquals("C", list.last());
		assertEquals(Collections.singletonList("C"), list.toList());

		assertFalse(list.remove("X"));
	}

	@Test
	public void removeLastElementEmptiesList() {
		list.pushFront("A");
		assertTrue(list.remove("A"));

		assertTrue(list.isEmpty());
		assertNull(list.first());
		assertNull(list.last());
		assertTrue(list.toList().isEmpty());

		list.pushFront("B");
		assertEquals("B", list.first());
		assertEquals("B", list.last());
	}

	@Test
	public void moveToFront() {
		list.pushFront("A");
		list.pushFront("B");
		list.pushFront("C");

		assertTrue(list.moveToFront("A"));
		assertEquals(Arrays.asList("A", "C", "B"), list.toList());
		assertEquals("B", list.last());

		assertTrue(list.moveToFront("A"));  // already head
		assertEquals(Arrays.asList("A", "C", "B"), list.toList());

		assertTrue(list.moveToFront("C"));
		assertEquals(Arrays.asList("C", "A", "B"), list.toList());

		assertFalse(list.moveToFront("X"));
		assertEquals(3, list.size());
	}

	@Test
	public void clear() {
		list.pushFront("A");
		list.pushFront("B");
		list.clear();

		assertTrue(list.isEmpty());
		assertFalse(list.contains("A"));
		assertNull(list.first());
		assertNull(list.last());
	}
}
