package org.scriptonbasestar.fixedcache.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.scriptonbasestar.fixedcache.collection.map.SBFixedSizedCache;

import java.util.Map;

/**
 * Prometheus 메트릭 간편 설정 헬퍼
 *
 * Prometheus 레지스트리를 쉽게 생성하고 캐시를 연동합니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
 * PrometheusMetricsHelper.bindCache(userCache, registry, "users");
 *
 * // Prometheus 포맷으로 메트릭 출력
 * String prometheusFormat = PrometheusMetricsHelper.scrapeMetrics(registry);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class PrometheusMetricsHelper {

	/**
	 * 기본 설정으로 Prometheus 레지스트리를 생성합니다.
	 *
	 * @return PrometheusMeterRegistry
	 */
	public static PrometheusMeterRegistry createPrometheusRegistry() {
		return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
	}

	/**
	 * 커스텀 설정으로 Prometheus 레지스트리를 생성합니다.
	 *
	 * @param config Prometheus 설정
	 * @return PrometheusMeterRegistry
	 */
	public static PrometheusMeterRegistry createPrometheusRegistry(PrometheusConfig config) {
		return new PrometheusMeterRegistry(config);
	}

	/**
	 * 캐시를 MeterRegistry에 바인딩합니다.
	 *
	 * @param cache 통계가 활성화된 캐시
	 * @param meterRegistry 메터 레지스트리
	 * @param cacheName 캐시 이름
	 * @return MicrometerMetricsAdapter
	 */
	public static MicrometerMetricsAdapter bindCache(
		SBFixedSizedCache<?, ?> cache,
		MeterRegistry meterRegistry,
		String cacheName
	) {
		return MicrometerMetricsAdapter.bind(cache, meterRegistry, cacheName);
	}

	/**
	 * 여러 캐시를 한번에 바인딩합니다.
	 *
	 * @param caches 캐시 이름과 캐시의 맵
	 * @param meterRegistry 메터 레지스트리
	 * @return 어댑터 배열
	 */
	public static MicrometerMetricsAdapter[] bindCaches(
		Map<String, ? extends SBFixedSizedCache<?, ?>> caches,
		MeterRegistry meterRegistry
	) {
		return caches.entrySet().stream()
			.map(entry -> MicrometerMetricsAdapter.bind(entry.getValue(), meterRegistry, entry.getKey()))
			.toArray(MicrometerMetricsAdapter[]::new);
	}

	/**
	 * Prometheus 스크래핑 포맷으로 메트릭을 출력합니다.
	 *
	 * @param registry Prometheus 레지스트리
	 * @return Prometheus 포맷 문자열
	 */
	public static String scrapeMetrics(PrometheusMeterRegistry registry) {
		return registry.scrape();
	}

	private PrometheusMetricsHelper() {
		// 유틸리티 클래스
	}
}
