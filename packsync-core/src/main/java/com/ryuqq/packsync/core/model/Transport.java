package com.ryuqq.packsync.core.model;

/**
 * 패키지 전송 방식 (레지스트리 표기).
 *
 * @param type 레지스트리 측 전송 타입 (예: stdio, streamable-http, sse)
 * @param url 원격 전송 URL (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Transport(String type, String url) {

    /**
     * Compact Constructor.
     *
     * <p>type이 null이면 빈 문자열로 정규화합니다.</p>
     */
    public Transport {
        type = type == null ? "" : type;
    }

    /**
     * url 없이 Transport 생성.
     *
     * @param type 레지스트리 측 전송 타입
     * @return Transport 인스턴스
     */
    public static Transport of(String type) {
        return new Transport(type, null);
    }
}
