package com.ryuqq.packsync.core.outcome;

import com.ryuqq.packsync.core.model.GenerationTask;

/**
 * 생성을 시도하지 않은 작업 (예: 시작 전 취소 감지).
 *
 * @param task 대상 작업
 * @param reason skip 사유
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Skipped(GenerationTask task, String reason) implements TaskOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException task가 null이거나 reason이 빈 문자열인 경우
     */
    public Skipped {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
