package org.scriptonbasestar.fixedcache.collection.eviction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Doubly-linked list of keys paired with a key→node index.
 * <p>
 * The index makes lookup, unlink and move-to-front O(1), so policies never scan
 * the list to find a key. Head is the most recently pushed key, tail the oldest.
 * </p>
 *
 * @param <K> the type of keys
 * @author archmagece
 * @since 2025-01
 */
class KeyOrderList<K> {

	private static final class Node<K> {
		private final K key;
		private Node<K> prev;
		private Node<K> next;

		private Node(K key) {
			this.key = key;
		}
	}

	private final Map<K, Node<K>> index = new HashMap<>();
	private Node<K> head;
	private Node<K> tail;

	/**
	 * Pushes a key to the head unless it is already present.
	 *
	 * @return true if the key was added
	 */
	boolean pushFront(K key) {
		if (index.containsKey(key)) {
			return false;
		}
		Node<K> node = new Node<>(key);
		linkFirst(node);
		index.put(key, node);
		return true;
	}

	/**
	 * @return true if the key was present
	 */
	boolean remove(K key) {
		Node<K> node = index.remove(key);
		if (node == null) {
			return false;
		}
		unlink(node);
		return true;
	}

	/**
	 * @return true if the key was present
	 */
	boolean moveToFront(K key) {
		Node<K> node = index.get(key);
		if (node == null) {
			return false;
		}
		if (node != head) {
			unlink(node);
			linkFirst(node);
		}
		return true;
	}

	K first() {
		return head == null ? null : head.key;
	}

	K last() {
		return tail == null ? null : tail.key;
	}

	boolean contains(K key) {
		return index.containsKey(key);
	}

	int size() {
		return index.size();
	}

	boolean isEmpty() {
		return index.isEmpty();
	}

	void clear() {
		// unlink every node so dropped nodes do not keep each other reachable
		Node<K> node = head;
		while (node != null) {
			Node<K> next = node.next;
			node.prev = null;
			node.next = null;
			node = next;
		}
		head = null;
		tail = null;
		index.clear();
	}

	/**
	 * @return keys from head to tail
	 */
	List<K> toList() {
		List<K> keys = new ArrayList<>(index.size());
		for (Node<K> node = head; node != null; node = node.next) {
			keys.add(node.key);
		}
		return keys;
	}

	private void linkFirst(Node<K> node) {
		node.prev = null;
		node.next = head;
		if (head != null) {
			head.prev = node;
		}
		head = node;
		if (tail == null) {
			tail = node;
		}
	}

	private void unlink(Node<K> node) {
		if (node.prev != null) {
			node.prev.next = node.next;
		} else {
			head = node.next;
		}
		if (node.next != null) {
			node.next.prev = node.prev;
		} else {
			tail = node.prev;
		}
		node.prev = null;
		node.next = null;
	}

	@Override
	public String toString() {
		return toList().toString();
	}
}
