package com.ryuqq.packsync.adapter.registry;

/**
 * 재시도 횟수를 모두 소진한 경우.
 *
 * <p>마지막 시도가 5xx 응답이었다면 {@link #lastStatusCode()}에, 전송 오류였다면
 * {@link #getCause()}에 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RegistryUnavailableException extends RegistryException {

    /**
     * 마지막 시도가 응답을 받지 못한 경우의 상태 코드 값.
     */
    public static final int NO_STATUS = -1;

    private final int attempts;
    private final int lastStatusCode;

    /**
     * 생성자.
     *
     * @param operation 수행하던 작업 설명
     * @param attempts 시도 횟수
     * @param lastStatusCode 마지막 응답 상태 코드 (응답이 없으면 {@link #NO_STATUS})
     * @param cause 마지막 전송 오류 (응답이 있었으면 null)
     */
    public RegistryUnavailableException(String operation, int attempts, int lastStatusCode, Throwable cause) {
        super(buildMessage(operation, attempts, lastStatusCode, cause), cause);
        this.attempts = attempts;
        this.lastStatusCode = lastStatusCode;
    }

    private static String buildMessage(String operation, int attempts, int lastStatusCode, Throwable cause) {
        String last = lastStatusCode != NO_STATUS
            ? "status code " + lastStatusCode
            : (cause == null ? "unknown error" : cause.toString());
        return operation + " failed after " + attempts + " attempts: " + last;
    }

    public int attempts() {
        return attempts;
    }

    public int lastStatusCode() {
        return lastStatusCode;
    }
}
