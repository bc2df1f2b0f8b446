package org.scriptonbasestar.fixedcache.metrics.micrometer;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.Test;
import org.scriptonbasestar.fixedcache.collection.map.SBFixedSizedCache;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

/**
 * PrometheusMetricsHelper 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class PrometheusMetricsHelperTest {

	private static SBFixedSizedCache<String, String> newCache(int capacity) {
		return SBFixedSizedCache.<String, String>builder()
			.capacity(capacity)
			.enableMetrics(true)
			.build();
	}

	@Test
	public void testCreatePrometheusRegistry() {
		assertNotNull(PrometheusMetricsHelper.createPrometheusRegistry());
	}

	@Test
	public void testBindCache() {
		// Given
		SBFixedSizedCache<String, String> cache = newCache(10);
		PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();

		// When
		MicrometerMetricsAdapter adapter = PrometheusMetricsHelper.bindCache(cache, registry, "users");

		// Then
		assertEquals("users", adapter.getCacheName());
		assertSame(cache.metrics(), adapter.getCacheMetrics());
	}

	@Test
	public void testScrapeMetrics() {
		// Given
		PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
		SBFixedSizedCache<String, String> cache = newCache(1);
		PrometheusMetricsHelper.bindCache(cache, registry, "test-cache");

		// When
		cache.put("a", "1");
		cache.put("b", "2");
		cache.tryGet("b");
		String prometheusFormat = PrometheusMetricsHelper.scrapeMetrics(registry);

		// Then
		assertTrue(prometheusFormat.contains("cache_gets_total"));
		assertTrue(prometheusFormat.contains("cache_evictions_total"));
		assertTrue(prometheusFormat.contains("cache_size"));
		assertTrue(prometheusFormat.contains("test-cache"));
	}

	@Test
	public void testBindCaches() {
		// Given
		Map<String, SBFixedSizedCache<String, String>> caches = new LinkedHashMap<>();
		caches.put("cache1", newCache(2));
		caches.put("cache2", newCache(3));
		PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();

		// When
		MicrometerMetricsAdapter[] adapters = PrometheusMetricsHelper.bindCaches(caches, registry);

		// Then
		assertEquals(2, adapters.length);
		assertEquals("cache1", adapters[0].getCacheName());
		assertEquals("cache2", adapters[1].getCacheName());
	}
}
