/**
 * 취소 및 종료 관련 타입.
 *
 * <p>{@link com.ryuqq.packsync.core.lifecycle.CancellationToken} 하나가 Watcher의
 * 전체 수명을 관장합니다. 취소는 새 tick 수락 중단, 진행 중인 레지스트리 요청의 빠른 실패,
 * 아직 시작하지 않은 생성 작업의 skip으로 이어집니다. 이미 시작된 생성 호출은 중단하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.packsync.core.lifecycle;
