package com.ryuqq.packsync.core.lifecycle;

/**
 * Watch 루프 종료 사유.
 *
 * <p>호출자는 두 종료를 구분할 수 있어야 합니다 (예: 프로세스 종료 코드).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StopReason {

    /**
     * 명시적 취소 (SIGINT/SIGTERM 등) 에 의한 정상 종료.
     */
    GRACEFUL_SHUTDOWN,

    /**
     * 토큰의 deadline 경과.
     */
    DEADLINE_EXCEEDED
}
