package com.ryuqq.packsync.core.outcome;

import com.ryuqq.packsync.core.model.GenerationTask;

import java.time.Instant;

/**
 * pack 생성 성공.
 *
 * @param task 완료된 작업
 * @param generatedAt 생성 완료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Generated(GenerationTask task, Instant generatedAt) implements TaskOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException task 또는 generatedAt이 null인 경우
     */
    public Generated {
        if (task == null || generatedAt == null) {
            throw new IllegalArgumentException("task and generatedAt cannot be null");
        }
    }
}
