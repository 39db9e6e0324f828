package com.ryuqq.packsync.application.reconciler;

/**
 * 폴링 사이클 실패의 공통 상위 타입.
 *
 * <p>Watcher 루프는 이 예외를 기록만 하고 다음 주기로 진행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PollCycleException extends RuntimeException {

    public PollCycleException(String message) {
        super(message);
    }

    public PollCycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
