package com.ryuqq.packsync.core.outcome;

/**
 * 생성 실패 분류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureSeverity {

    /**
     * 이미 존재하는 산출물과의 충돌. 이전 상태가 반영되지 않았을 뿐인 no-op 으로 취급.
     */
    BENIGN,

    /**
     * 실제 생성 실패. poll cycle 전체를 실패로 보고합니다.
     */
    CRITICAL
}
