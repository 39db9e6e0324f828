package com.ryuqq.packsync.core.model;

import java.util.Locale;

/**
 * 레지스트리 서버 레코드의 게시 상태.
 *
 * <p>레지스트리가 상태를 제공하지 않으면 {@link #ACTIVE}로 간주합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ServerStatus {

    /**
     * 활성 (생성 대상).
     */
    ACTIVE("active"),

    /**
     * 폐기 예정 (allowDeprecated 설정 시에만 생성).
     */
    DEPRECATED("deprecated"),

    /**
     * 삭제됨 (생성 대상 아님).
     */
    DELETED("deleted");

    private final String wireValue;

    ServerStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 레지스트리 응답의 상태 문자열 조회.
     *
     * @return 상태 문자열 (예: "active")
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 레지스트리 상태 문자열을 ServerStatus로 변환.
     *
     * <p>null 또는 빈 문자열은 ACTIVE로 취급합니다 (대소문자 무시).</p>
     *
     * @param value 상태 문자열
     * @return ServerStatus
     * @throws IllegalArgumentException 알 수 없는 상태인 경우
     */
    public static ServerStatus fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ServerStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown server status: " + value);
    }
}
