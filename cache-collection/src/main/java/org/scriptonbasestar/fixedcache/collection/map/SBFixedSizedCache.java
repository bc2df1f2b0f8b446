package org.scriptonbasestar.fixedcache.collection.map;

import org.scriptonbasestar.fixedcache.collection.eviction.FifoEvictionPolicy;
import org.scriptonbasestar.fixedcache.collection.eviction.LifoEvictionPolicy;
import org.scriptonbasestar.fixedcache.collection.eviction.LruEvictionPolicy;
import org.scriptonbasestar.fixedcache.collection.eviction.NoEvictionPolicy;
import org.scriptonbasestar.fixedcache.collection.metrics.CacheMetrics;
import org.scriptonbasestar.fixedcache.core.exception.SBCacheInvalidCapacityException;
import org.scriptonbasestar.fixedcache.core.exception.SBCacheKeyNotFoundException;
import org.scriptonbasestar.fixedcache.core.listener.SBCacheEraseListener;
import org.scriptonbasestar.fixedcache.core.policy.EvictionPolicy;
import org.scriptonbasestar.fixedcache.core.policy.EvictionPolicyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.function.Supplier;

/**
 * @author archmagece
 * @since 2025-01
 *
 * 		SBFixedSizedCache<Long, String> cache = new SBFixedSizedCache<>(3, new LruEvictionPolicy<>());
 * 		cache.put(1L, "a");
 * 		cache.put(2L, "b");
 * 		cache.put(3L, "c");
 * 		cache.tryGet(1L);        // 1 becomes most recently used
 * 		cache.put(4L, "d");      // 2 is evicted
 *
 * 	Features:
 * 	- Fixed capacity: 생성 시 정한 최대 항목 수를 절대 넘지 않음 (capacity > 0)
 * 	- Pluggable eviction: 가득 찬 상태에서 신규 키가 들어오면 EvictionPolicy가 고른 키를 축출
 * 	- Erase listener: 축출/remove() 시 (key, value)로 한 번씩 호출, clear()에서는 호출하지 않음
 * 	- Storage supplier: 내부 Map 구현 교체 가능 (Builder.storage()로 설정, 기본 HashMap)
 * 	- Metrics: 히트율, 축출 수 등 통계 정보 (Builder.enableMetrics()로 설정)
 *
 * 	Not thread-safe. 여러 스레드에서 사용하려면 외부에서 동기화해야 함.
 */
public class SBFixedSizedCache<K, V> implements Iterable<Map.Entry<K, V>>, AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(SBFixedSizedCache.class);

	private final int capacity;  // 최대 항목 수
	private final Map<K, V> entries;  // 실제 데이터
	private final EvictionPolicy<K> evictionPolicy;  // 키 집합은 항상 entries의 키 집합과 같음
	private final SBCacheEraseListener<K, V> eraseListener;
	private final CacheMetrics metrics;  // 통계 (null이면 비활성화)

	/**
	 * 축출 순서가 없는 정책(NONE)으로 캐시를 생성합니다.
	 *
	 * @param capacity 최대 크기
	 */
	public SBFixedSizedCache(int capacity) {
		this(capacity, new NoEvictionPolicy<>());
	}

	/**
	 * @param capacity 최대 크기
	 * @param evictionPolicy 축출 정책 (비어 있는 새 인스턴스)
	 */
	public SBFixedSizedCache(int capacity, EvictionPolicy<K> evictionPolicy) {
		this(capacity, evictionPolicy, SBCacheEraseListener.noop());
	}

	/**
	 * @param capacity 최대 크기
	 * @param evictionPolicy 축출 정책 (비어 있는 새 인스턴스)
	 * @param eraseListener 축출/삭제 시 호출되는 콜백
	 */
	public SBFixedSizedCache(int capacity, EvictionPolicy<K> evictionPolicy,
							 SBCacheEraseListener<K, V> eraseListener) {
		this(capacity, evictionPolicy, eraseListener, HashMap::new, false);
	}

	/**
	 * 모든 옵션을 설정할 수 있는 생성자 (내부용)
	 *
	 * @param capacity 최대 크기 - 1 이상
	 * @param evictionPolicy 축출 정책 (비어 있는 새 인스턴스)
	 * @param eraseListener 축출/삭제 시 호출되는 콜백 (null이면 no-op)
	 * @param storage 빈 Map을 만들어 주는 공급자
	 * @param enableMetrics 통계 수집 활성화 여부
	 */
	protected SBFixedSizedCache(int capacity, EvictionPolicy<K> evictionPolicy,
								SBCacheEraseListener<K, V> eraseListener,
								Supplier<? extends Map<K, V>> storage, boolean enableMetrics) {
		if (capacity <= 0) {
			throw new SBCacheInvalidCapacityException(capacity);
		}
		if (evictionPolicy == null) {
			throw new IllegalArgumentException("EvictionPolicy must not be null");
		}
		if (!evictionPolicy.isEmpty()) {
			throw new IllegalArgumentException("EvictionPolicy must not track any key yet: " + evictionPolicy);
		}
		if (storage == null) {
			throw new IllegalArgumentException("Storage supplier must not be null");
		}
		Map<K, V> map = storage.get();
		if (map == null || !map.isEmpty()) {
			throw new IllegalArgumentException("Storage supplier must return an empty map");
		}

		this.capacity = capacity;
		this.entries = map;
		this.evictionPolicy = evictionPolicy;
		this.eraseListener = eraseListener != null ? eraseListener : SBCacheEraseListener.noop();
		this.metrics = enableMetrics ? new CacheMetrics() : null;

		log.debug("Fixed sized cache created: capacity={}, policy={}, storage={}",
			capacity, evictionPolicy.getClass().getSimpleName(), map.getClass().getSimpleName());
	}

	/**
	 * Builder 패턴을 사용하여 SBFixedSizedCache를 생성합니다.
	 *
	 * @param <K> 키 타입
	 * @param <V> 값 타입
	 * @return Builder 인스턴스
	 */
	public static <K, V> Builder<K, V> builder() {
		return new Builder<>();
	}

	/**
	 * SBFixedSizedCache Builder 클래스
	 *
	 * @param <K> 키 타입
	 * @param <V> 값 타입
	 */
	public static class Builder<K, V> {
		private int capacity = 0; // 필수 - 반드시 설정해야 함
		private EvictionPolicyType evictionPolicyType = EvictionPolicyType.LRU; // 기본값: LRU
		private EvictionPolicy<K> evictionPolicy = null; // 설정하면 evictionPolicyType보다 우선
		private SBCacheEraseListener<K, V> eraseListener = SBCacheEraseListener.noop();
		private Supplier<? extends Map<K, V>> storage = HashMap::new;
		private boolean enableMetrics = false; // 기본값: 비활성화

		/**
		 * 최대 캐시 크기를 설정합니다.
		 *
		 * @param capacity 최대 크기 (1 이상)
		 * @return Builder 인스턴스
		 */
		public Builder<K, V> capacity(int capacity) {
			this.capacity = capacity;
			return this;
		}

		/**
		 * 기본 제공 축출 정책을 설정합니다.
		 *
		 * @param type 축출 정책 (NONE, FIFO, LIFO, LRU)
		 * @return Builder 인스턴스
		 */
		public Builder<K, V> evictionPolicy(EvictionPolicyType type) {
			this.evictionPolicyType = type;
			this.evictionPolicy = null;
			return this;
		}

		/**
		 * 직접 구현한 축출 정책을 설정합니다.
		 * 인스턴스는 이 캐시 전용이어야 하며 비어 있어야 합니다.
		 *
		 * @param policy 축출 정책 인스턴스
		 * @return Builder 인스턴스
		 */
		public Builder<K, V> evictionPolicy(EvictionPolicy<K> policy) {
			this.evictionPolicy = policy;
			return this;
		}

		/**
		 * 축출/삭제 시 호출될 콜백을 설정합니다.
		 *
		 * @param listener 콜백
		 * @return Builder 인스턴스
		 */
		public Builder<K, V> onErase(SBCacheEraseListener<K, V> listener) {
			this.eraseListener = listener;
			return this;
		}

		/**
		 * 내부 저장소 Map 구현을 설정합니다.
		 * 예: {@code TreeMap::new}, {@code () -> new TreeMap<>(String.CASE_INSENSITIVE_ORDER)},
		 * {@code () -> new LinkedHashMap<>(1024)}
		 * <p>
		 * 비교자로 키를 찾는 SortedMap은 equals와 다른 키로도 같은 항목을 찾을 수 있습니다.
		 * 이 경우 축출 정책에는 항상 저장소에 들어 있는 키 객체가 전달됩니다.
		 *
		 * @param storage 빈 Map 공급자
		 * @return Builder 인스턴스
		 */
		public Builder<K, V> storage(Supplier<? extends Map<K, V>> storage) {
			this.storage = storage;
			return this;
		}

		/**
		 * 캐시 통계 수집을 활성화합니다.
		 *
		 * @param enable true면 통계 수집 활성화
		 * @return Builder 인스턴스
		 */
		public Builder<K, V> enableMetrics(boolean enable) {
			this.enableMetrics = enable;
			return this;
		}

		public SBFixedSizedCache<K, V> build() {
			EvictionPolicy<K> policy = evictionPolicy != null
				? evictionPolicy
				: createEvictionPolicy(evictionPolicyType);
			return new SBFixedSizedCache<>(capacity, policy, eraseListener, storage, enableMetrics);
		}
	}

	/**
	 * 값을 저장합니다. 이미 있는 키면 값을 교체하고 사용(touch)으로 기록합니다.
	 * 새 키인데 캐시가 가득 찼으면 축출 정책이 고른 키를 먼저 제거합니다.
	 *
	 * @param key 키
	 * @param value 값
	 */
	public void put(K key, V value) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(value, "value");
		log.trace("put data - key : {} , value : {}", key, value);

		if (entries.containsKey(key)) {
			update(storedKey(key), value);
			return;
		}
		if (entries.size() >= capacity) {
			evictOne();
		}
		insert(key, value);
	}

	/**
	 * 예외 없이 조회합니다. 히트면 축출 정책에 사용을 알립니다.
	 *
	 * @param key 키
	 * @return 캐시된 값, 없으면 empty
	 */
	public Optional<V> tryGet(K key) {
		Objects.requireNonNull(key, "key");
		log.trace("tryGet data - key : {}", key);

		V value = entries.get(key);
		if (value == null) {
			if (metrics != null) {
				metrics.recordMiss();
			}
			return Optional.empty();
		}
		evictionPolicy.touch(storedKey(key));
		if (metrics != null) {
			metrics.recordHit();
		}
		return Optional.of(value);
	}

	/**
	 * 조회합니다. 없는 키는 예외로 알립니다.
	 *
	 * @param key 키
	 * @return 캐시된 값
	 * @throws SBCacheKeyNotFoundException 키가 없을 때
	 */
	public V get(K key) {
		return tryGet(key).orElseThrow(() -> new SBCacheKeyNotFoundException(key));
	}

	/**
	 * 키 존재 여부만 확인합니다. 축출 순서에는 영향을 주지 않습니다.
	 *
	 * @param key 키
	 * @return 캐시되어 있으면 true
	 */
	public boolean cached(K key) {
		return key != null && entries.containsKey(key);
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/**
	 * 항목을 제거하고 erase listener를 호출합니다.
	 *
	 * @param key 키
	 * @return 제거 전에 존재했으면 true
	 */
	public boolean remove(K key) {
		Objects.requireNonNull(key, "key");
		if (!entries.containsKey(key)) {
			return false;
		}
		log.trace("remove data - key : {}", key);
		erase(storedKey(key));
		if (metrics != null) {
			metrics.recordRemoval();
		}
		return true;
	}

	/**
	 * 모든 캐시 항목을 제거합니다.
	 * 축출 정책에서 키를 하나씩 지운 뒤 저장소를 한 번에 비웁니다. erase listener는 호출하지 않습니다.
	 */
	public void clear() {
		int cleared = entries.size();
		for (K key : entries.keySet()) {
			evictionPolicy.erase(key);
		}
		entries.clear();
		if (cleared > 0) {
			log.debug("Cleared {} entries", cleared);
		}
	}

	/**
	 * 현재 캐시 항목을 순회합니다. 순서는 저장소 Map의 순서이며 축출 순서와 무관합니다.
	 * 순회 중 항목을 수정할 수 없습니다.
	 */
	@Override
	public Iterator<Map.Entry<K, V>> iterator() {
		return Collections.unmodifiableMap(entries).entrySet().iterator();
	}

	/**
	 * 현재 캐시에 저장된 모든 항목을 반환합니다.
	 * 반환된 Map은 수정 불가능한(unmodifiable) 뷰이며, 조회해도 축출 순서가 바뀌지 않습니다.
	 *
	 * @return 캐시에 저장된 모든 키-값 쌍의 수정 불가능한 뷰
	 */
	public Map<K, V> asMap() {
		return Collections.unmodifiableMap(entries);
	}

	public Set<K> keySet() {
		return Collections.unmodifiableSet(entries.keySet());
	}

	public int getCapacity() {
		return capacity;
	}

	/**
	 * 진단용. 반환된 정책을 직접 수정하면 캐시와 정책의 키 집합이 어긋납니다.
	 *
	 * @return 이 캐시의 축출 정책
	 */
	public EvictionPolicy<K> getEvictionPolicy() {
		return evictionPolicy;
	}

	/**
	 * @return 통계, 비활성화 상태면 null
	 */
	public CacheMetrics metrics() {
		return metrics;
	}

	/**
	 * clear()와 같습니다. try-with-resources 블록을 벗어날 때 항목을 모두 비웁니다.
	 */
	@Override
	public void close() {
		clear();
	}

	@Override
	public String toString() {
		return entries.toString();
	}

	private void insert(K key, V value) {
		evictionPolicy.insert(key);
		entries.put(key, value);
		if (metrics != null) {
			metrics.recordPut();
		}
	}

	private void update(K key, V value) {
		evictionPolicy.touch(key);
		entries.put(key, value);
		if (metrics != null) {
			metrics.recordUpdate();
		}
	}

	/**
	 * 가득 찬 상태에서 축출 정책이 고른 키 하나를 제거
	 */
	private void evictOne() {
		K victimKey = evictionPolicy.replacementCandidate();
		if (!entries.containsKey(victimKey)) {
			throw new IllegalStateException("Eviction policy selected a key that is not cached: " + victimKey);
		}
		log.debug("Evicting key due to capacity (capacity={}, policy={}): {}",
			capacity, evictionPolicy.getClass().getSimpleName(), victimKey);
		erase(victimKey);
		if (metrics != null) {
			metrics.recordEviction();
		}
	}

	/**
	 * 정책과 저장소에서 함께 제거한 뒤 listener 호출.
	 * listener가 예외를 던져도 두 쪽의 키 집합은 이미 일치함.
	 */
	private void erase(K key) {
		evictionPolicy.erase(key);
		V value = entries.remove(key);
		eraseListener.onErase(key, value);
	}

	/**
	 * 저장소에 실제로 들어 있는 키 객체. 키가 존재할 때만 호출.
	 * 비교자 기반 SortedMap은 equals가 다른 키로도 항목을 찾으므로 정책에는 저장된 키를 넘겨야 함.
	 */
	private K storedKey(K key) {
		if (entries instanceof SortedMap) {
			return ((SortedMap<K, V>) entries).tailMap(key).firstKey();
		}
		return key;
	}

	private static <K> EvictionPolicy<K> createEvictionPolicy(EvictionPolicyType type) {
		if (type == null) {
			throw new IllegalArgumentException("EvictionPolicyType must not be null");
		}
		switch (type) {
			case NONE:
				return new NoEvictionPolicy<>();
			case FIFO:
				return new FifoEvictionPolicy<>();
			case LIFO:
				return new LifoEvictionPolicy<>();
			case LRU:
				return new LruEvictionPolicy<>();
			default:
				throw new IllegalArgumentException("Unknown eviction policy: " + type);
		}
	}
}
