package com.ryuqq.packsync.adapter.registry;

/**
 * 4xx 응답. 재시도하지 않습니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RegistryClientErrorException extends RegistryException {

    private final int statusCode;
    private final String body;

    /**
     * 생성자.
     *
     * @param statusCode HTTP 상태 코드
     * @param body 응답 본문 (null이면 빈 문자열)
     */
    public RegistryClientErrorException(int statusCode, String body) {
        this("unexpected status code " + statusCode + ": " + (body == null ? "" : body), statusCode, body);
    }

    protected RegistryClientErrorException(String message, int statusCode, String body) {
        super(message);
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }
}
