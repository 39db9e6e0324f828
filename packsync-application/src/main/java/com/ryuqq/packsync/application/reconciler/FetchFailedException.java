package com.ryuqq.packsync.application.reconciler;

/**
 * 레지스트리 조회 실패.
 *
 * <p>이 경우 lastPoll은 갱신되지 않으므로 다음 사이클이 같은 구간을 다시 조회합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FetchFailedException extends PollCycleException {

    public FetchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
