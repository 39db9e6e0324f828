package com.ryuqq.packsync.core.outcome;

import com.ryuqq.packsync.core.model.GenerationTask;

/**
 * 생성 작업 하나의 실행 결과.
 *
 * <p>TaskOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Generated}: pack 생성 성공, 상태 저장소에 기록됨</li>
 *   <li>{@link Skipped}: 취소로 인해 생성을 시도하지 않음</li>
 *   <li>{@link Failed}: 생성 실패 (benign 또는 critical)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 결과 종류가 컴파일 타임에 고정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface TaskOutcome permits Generated, Skipped, Failed {

    /**
     * 결과가 속한 작업.
     *
     * @return 생성 작업
     */
    GenerationTask task();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isGenerated() {
        return this instanceof Generated;
    }

    /**
     * 결과가 skip인지 확인.
     *
     * @return skip 여부
     */
    default boolean isSkipped() {
        return this instanceof Skipped;
    }

    /**
     * 결과가 critical 실패인지 확인.
     *
     * @return critical 실패 여부
     */
    default boolean isCriticalFailure() {
        return this instanceof Failed failed && failed.severity() == FailureSeverity.CRITICAL;
    }

    /**
     * 결과가 benign 실패인지 확인.
     *
     * @return benign 실패 여부
     */
    default boolean isBenignFailure() {
        return this instanceof Failed failed && failed.severity() == FailureSeverity.BENIGN;
    }
}
