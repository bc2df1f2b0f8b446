/**
 * Micrometer 기반 캐시 메트릭 통합
 *
 * <p>Micrometer MeterRegistry와 SBFixedSizedCache의 통계를 연동합니다.</p>
 *
 * <h3>주요 클래스</h3>
 * <ul>
 *   <li>{@link org.scriptonbasestar.fixedcache.metrics.micrometer.MicrometerMetricsAdapter} - Micrometer 어댑터</li>
 *   <li>{@link org.scriptonbasestar.fixedcache.metrics.micrometer.PrometheusMetricsHelper} - Prometheus 편의 클래스</li>
 * </ul>
 *
 * <h3>지원 메트릭</h3>
 * <ul>
 *   <li>cache.gets{result=hit|miss} - 조회 횟수 (FunctionCounter)</li>
 *   <li>cache.puts - 신규 저장 횟수 (FunctionCounter)</li>
 *   <li>cache.updates - 값 갱신 횟수 (FunctionCounter)</li>
 *   <li>cache.evictions - 용량 초과 축출 횟수 (FunctionCounter)</li>
 *   <li>cache.removals - 명시적 삭제 횟수 (FunctionCounter)</li>
 *   <li>cache.size - 현재 항목 수 (Gauge)</li>
 *   <li>cache.capacity - 최대 항목 수 (Gauge)</li>
 *   <li>cache.hit.rate - 히트율 (Gauge)</li>
 * </ul>
 *
 * <h3>Prometheus 메트릭 예시</h3>
 * <pre>
 * # HELP cache_gets_total Cache lookups that found a value
 * # TYPE cache_gets_total counter
 * cache_gets_total{cache="user-cache",result="hit",} 15234.0
 *
 * # HELP cache_evictions_total Entries evicted because the cache was full
 * # TYPE cache_evictions_total counter
 * cache_evictions_total{cache="user-cache",} 892.0
 *
 * # HELP cache_size Current number of cached entries
 * # TYPE cache_size gauge
 * cache_size{cache="user-cache",} 1000.0
 * </pre>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.fixedcache.metrics.micrometer;
