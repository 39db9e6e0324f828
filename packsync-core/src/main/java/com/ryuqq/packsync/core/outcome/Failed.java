package com.ryuqq.packsync.core.outcome;

import com.ryuqq.packsync.core.model.GenerationTask;

/**
 * 생성 실패.
 *
 * <p>실패한 작업은 형제 작업에 영향을 주지 않습니다 (bulkhead 격리).</p>
 *
 * @param task 실패한 작업
 * @param severity 실패 분류
 * @param cause 원인 예외
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed(GenerationTask task, FailureSeverity severity, Throwable cause) implements TaskOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Failed {
        if (task == null || severity == null || cause == null) {
            throw new IllegalArgumentException("task, severity and cause cannot be null");
        }
    }

    /**
     * 로그/리포트용 실패 설명.
     *
     * @return "failed to generate {task}; {message}"
     */
    public String describe() {
        return "failed to generate " + task + "; " + cause.getMessage();
    }
}
