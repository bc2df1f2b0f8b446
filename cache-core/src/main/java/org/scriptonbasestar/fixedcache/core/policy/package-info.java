/**
 * 캐시 축출 정책
 *
 * <p>이 패키지는 고정 크기 캐시의 축출 정책 계약을 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.fixedcache.core.policy.EvictionPolicy} - 키 순서 관리 및 축출 대상 선정</li>
 *   <li>{@link org.scriptonbasestar.fixedcache.core.policy.EvictionPolicyType} - 기본 제공 정책 (NONE, FIFO, LIFO, LRU)</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.fixedcache.core.policy;
