/**
 * Reconciler 계약 및 사이클 결과 타입.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.packsync.application.reconciler.Reconciler} - 단일 폴링 사이클</li>
 *   <li>{@link com.ryuqq.packsync.application.reconciler.PollReport} - 사이클 요약</li>
 *   <li>{@link com.ryuqq.packsync.application.reconciler.PollCycleException} - 사이클 실패 계층</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code Watcher}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.packsync.application.reconciler;
