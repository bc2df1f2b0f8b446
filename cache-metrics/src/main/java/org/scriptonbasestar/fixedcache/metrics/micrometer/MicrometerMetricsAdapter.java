package org.scriptonbasestar.fixedcache.metrics.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.fixedcache.collection.map.SBFixedSizedCache;
import org.scriptonbasestar.fixedcache.collection.metrics.CacheMetrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Micrometer MeterRegistry와 SBFixedSizedCache를 연동하는 어댑터
 *
 * 캐시의 CacheMetrics 카운터와 현재 크기를 Micrometer 메트릭으로 노출합니다.
 * 모든 메터는 레지스트리가 읽을 때 캐시에서 값을 가져오므로 별도 동기화 호출이 필요 없습니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * SBFixedSizedCache<String, User> cache = SBFixedSizedCache.<String, User>builder()
 *     .capacity(1000)
 *     .enableMetrics(true)
 *     .build();
 *
 * MicrometerMetricsAdapter adapter = MicrometerMetricsAdapter.bind(cache, registry, "user-cache");
 *
 * // 캐시 폐기 시
 * adapter.unbind();
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
@Slf4j
public class MicrometerMetricsAdapter {

	private final SBFixedSizedCache<?, ?> cache;
	private final CacheMetrics cacheMetrics;
	private final MeterRegistry meterRegistry;
	private final String cacheName;
	private final List<Meter> meters = new ArrayList<>();

	/**
	 * Micrometer 어댑터 생성
	 *
	 * @param cache 통계가 활성화된 캐시
	 * @param meterRegistry Micrometer 레지스트리
	 * @param cacheName 캐시 이름 (태그로 사용)
	 */
	public MicrometerMetricsAdapter(
		SBFixedSizedCache<?, ?> cache,
		MeterRegistry meterRegistry,
		String cacheName
	) {
		if (cache == null) {
			throw new IllegalArgumentException("Cache must not be null");
		}
		if (cache.metrics() == null) {
			throw new IllegalArgumentException("Cache metrics are not enabled; build the cache with enableMetrics(true)");
		}
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}

		this.cache = cache;
		this.cacheMetrics = cache.metrics();
		this.meterRegistry = meterRegistry;
		this.cacheName = cacheName;

		Tags tags = Tags.of("cache", cacheName);

		meters.add(FunctionCounter.builder("cache.gets", cacheMetrics, CacheMetrics::hitCount)
			.tags(tags)
			.tag("result", "hit")
			.description("Cache lookups that found a value")
			.register(meterRegistry));

		meters.add(FunctionCounter.builder("cache.gets", cacheMetrics, CacheMetrics::missCount)
			.tags(tags)
			.tag("result", "miss")
			.description("Cache lookups that found nothing")
			.register(meterRegistry));

		meters.add(FunctionCounter.builder("cache.puts", cacheMetrics, CacheMetrics::putCount)
			.tags(tags)
			.description("Entries added to the cache")
			.register(meterRegistry));

		meters.add(FunctionCounter.builder("cache.updates", cacheMetrics, CacheMetrics::updateCount)
			.tags(tags)
			.description("Values replaced for cached keys")
			.register(meterRegistry));

		meters.add(FunctionCounter.builder("cache.evictions", cacheMetrics, CacheMetrics::evictionCount)
			.tags(tags)
			.description("Entries evicted because the cache was full")
			.register(meterRegistry));

		meters.add(FunctionCounter.builder("cache.removals", cacheMetrics, CacheMetrics::removalCount)
			.tags(tags)
			.description("Entries removed explicitly")
			.register(meterRegistry));

		// Gauge 등록 (실시간 값)
		meters.add(Gauge.builder("cache.size", cache, c -> c.size())
			.tags(tags)
			.description("Current number of cached entries")
			.register(meterRegistry));

		meters.add(Gauge.builder("cache.capacity", cache, c -> c.getCapacity())
			.tags(tags)
			.description("Maximum number of cached entries")
			.register(meterRegistry));

		meters.add(Gauge.builder("cache.hit.rate", cacheMetrics, CacheMetrics::hitRate)
			.tags(tags)
			.description("Share of lookups that were hits")
			.register(meterRegistry));

		log.debug("Bound {} meters for cache: {}", meters.size(), cacheName);
	}

	/**
	 * 캐시를 레지스트리에 바인딩합니다.
	 *
	 * @param cache 통계가 활성화된 캐시
	 * @param meterRegistry 메터 레지스트리
	 * @param cacheName 캐시 이름
	 * @return MicrometerMetricsAdapter
	 */
	public static MicrometerMetricsAdapter bind(
		SBFixedSizedCache<?, ?> cache,
		MeterRegistry meterRegistry,
		String cacheName
	) {
		return new MicrometerMetricsAdapter(cache, meterRegistry, cacheName);
	}

	/**
	 * 등록한 메터를 레지스트리에서 제거합니다.
	 */
	public void unbind() {
		for (Meter meter : meters) {
			meterRegistry.remove(meter);
		}
		log.debug("Unbound {} meters for cache: {}", meters.size(), cacheName);
		meters.clear();
	}

	/**
	 * 캐시 이름을 반환합니다.
	 *
	 * @return 캐시 이름
	 */
	public String getCacheName() {
		return cacheName;
	}

	/**
	 * CacheMetrics를 반환합니다.
	 *
	 * @return 캐시 메트릭
	 */
	public CacheMetrics getCacheMetrics() {
		return cacheMetrics;
	}

	public SBFixedSizedCache<?, ?> getCache() {
		return cache;
	}

	public List<Meter> getMeters() {
		return Collections.unmodifiableList(meters);
	}
}
