/**
 * HTTP 레지스트리 어댑터.
 *
 * <p>{@link com.ryuqq.packsync.core.spi.RegistryGateway}를 JDK HttpClient와 Jackson으로 구현합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.packsync.adapter.registry.RegistryClient} - 재시도/취소를 지원하는 클라이언트</li>
 *   <li>{@link com.ryuqq.packsync.adapter.registry.RegistryClientConfig} - 클라이언트 설정</li>
 *   <li>{@link com.ryuqq.packsync.adapter.registry.BackoffCalculator} - 선형 백오프</li>
 *   <li>{@link com.ryuqq.packsync.adapter.registry.RegistryException} - 오류 계층</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.packsync.adapter.registry;
