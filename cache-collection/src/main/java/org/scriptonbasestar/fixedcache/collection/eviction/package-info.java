/**
 * 기본 제공 축출 정책 구현
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.fixedcache.collection.eviction.NoEvictionPolicy} - 순서 없음 (NONE)</li>
 *   <li>{@link org.scriptonbasestar.fixedcache.collection.eviction.FifoEvictionPolicy} - 먼저 들어온 키부터 축출</li>
 *   <li>{@link org.scriptonbasestar.fixedcache.collection.eviction.LifoEvictionPolicy} - 나중에 들어온 키부터 축출</li>
 *   <li>{@link org.scriptonbasestar.fixedcache.collection.eviction.LruEvictionPolicy} - 가장 오래 사용하지 않은 키부터 축출</li>
 * </ul>
 *
 * <p>FIFO/LIFO/LRU는 이중 연결 리스트와 키→노드 인덱스를 함께 사용하므로 touch/erase가 O(1)입니다.</p>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.fixedcache.collection.eviction;
