/**
 * 생성 작업 결과 타입.
 *
 * <p>Watcher는 각 worker의 결과를 {@link com.ryuqq.packsync.core.outcome.TaskOutcome}으로 수집하여
 * 성공/skip/benign/critical 건수를 집계합니다.</p>
 *
 * <h2>분류 기준</h2>
 * <pre>
 * PackAlreadyExistsException  → Failed(BENIGN)
 * 그 외 모든 예외              → Failed(CRITICAL)
 * 시작 전 취소 감지            → Skipped
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.packsync.core.outcome;
