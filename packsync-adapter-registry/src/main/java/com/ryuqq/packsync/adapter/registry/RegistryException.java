package com.ryuqq.packsync.adapter.registry;

/**
 * 레지스트리 통신 실패의 공통 상위 타입.
 *
 * <p>응답 본문을 해석할 수 없는 경우에도 이 타입으로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
