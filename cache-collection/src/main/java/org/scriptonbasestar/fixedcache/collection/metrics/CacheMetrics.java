package org.scriptonbasestar.fixedcache.collection.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 크기 캐시의 통계 정보를 제공합니다.
 *
 * 조회(히트/미스), 신규 저장, 값 갱신, 용량 초과 축출, 명시적 삭제 횟수를 기록합니다.
 * clear()로 비운 항목은 축출/삭제로 집계하지 않습니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class CacheMetrics {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong missCount = new AtomicLong(0);
	private final AtomicLong putCount = new AtomicLong(0);
	private final AtomicLong updateCount = new AtomicLong(0);
	private final AtomicLong evictionCount = new AtomicLong(0);
	private final AtomicLong removalCount = new AtomicLong(0);

	/**
	 * 캐시 히트 횟수를 증가시킵니다.
	 */
	public void recordHit() {
		hitCount.incrementAndGet();
	}

	/**
	 * 캐시 미스 횟수를 증가시킵니다.
	 */
	public void recordMiss() {
		missCount.incrementAndGet();
	}

	/**
	 * 신규 키 저장을 기록합니다.
	 */
	public void recordPut() {
		putCount.incrementAndGet();
	}

	/**
	 * 기존 키의 값 갱신을 기록합니다.
	 */
	public void recordUpdate() {
		updateCount.incrementAndGet();
	}

	/**
	 * 용량 초과로 인한 축출을 기록합니다.
	 */
	public void recordEviction() {
		evictionCount.incrementAndGet();
	}

	/**
	 * remove()에 의한 명시적 삭제를 기록합니다.
	 */
	public void recordRemoval() {
		removalCount.incrementAndGet();
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long missCount() {
		return missCount.get();
	}

	/**
	 * 총 조회 횟수를 반환합니다 (히트 + 미스).
	 *
	 * @return 총 조회 횟수
	 */
	public long requestCount() {
		return hitCount.get() + missCount.get();
	}

	/**
	 * 캐시 히트율을 계산합니다.
	 *
	 * @return 히트율 (0.0 ~ 1.0), 조회가 없으면 0.0
	 */
	public double hitRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) hitCount.get() / requests;
	}

	/**
	 * 캐시 미스율을 계산합니다.
	 *
	 * @return 미스율 (0.0 ~ 1.0), 조회가 없으면 0.0
	 */
	public double missRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) missCount.get() / requests;
	}

	public long putCount() {
		return putCount.get();
	}

	public long updateCount() {
		return updateCount.get();
	}

	public long evictionCount() {
		return evictionCount.get();
	}

	public long removalCount() {
		return removalCount.get();
	}

	/**
	 * 모든 통계를 초기화합니다.
	 */
	public void reset() {
		hitCount.set(0);
		missCount.set(0);
		putCount.set(0);
		updateCount.set(0);
		evictionCount.set(0);
		removalCount.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"CacheMetrics{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, " +
			"puts=%d, updates=%d, evictions=%d, removals=%d}",
			requestCount(),
			hitCount(),
			missCount(),
			hitRate() * 100,
			putCount(),
			updateCount(),
			evictionCount(),
			removalCount()
		);
	}
}
