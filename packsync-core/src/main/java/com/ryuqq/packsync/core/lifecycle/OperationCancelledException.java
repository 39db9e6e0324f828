package com.ryuqq.packsync.core.lifecycle;

/**
 * 블로킹 호출 도중 취소가 감지되었음을 나타내는 예외.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationCancelledException extends RuntimeException {

    private final StopReason reason;

    /**
     * 생성자.
     *
     * @param message 메시지
     * @param reason 취소 사유
     */
    public OperationCancelledException(String message, StopReason reason) {
        super(message + " (" + reason + ")");
        this.reason = reason;
    }

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유
     */
    public StopReason reason() {
        return reason;
    }
}
