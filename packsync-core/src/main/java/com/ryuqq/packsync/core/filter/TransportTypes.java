package com.ryuqq.packsync.core.filter;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 사용자 표기 ↔ 레지스트리 표기 전송 타입 변환.
 *
 * <pre>
 * 사용자      레지스트리
 * stdio   ↔  stdio
 * http    ↔  streamable-http
 * sse     ↔  sse
 * </pre>
 *
 * <p>매핑에 없는 값은 그대로 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransportTypes {

    /**
     * 지원하는 사용자 표기 전송 타입.
     */
    public static final List<String> VALID = List.of("stdio", "http", "sse");

    private static final Map<String, String> USER_TO_REGISTRY = Map.of(
        "stdio", "stdio",
        "http", "streamable-http",
        "sse", "sse"
    );

    private static final Map<String, String> REGISTRY_TO_USER = Map.of(
        "stdio", "stdio",
        "streamable-http", "http",
        "sse", "sse"
    );

    private TransportTypes() {
    }

    /**
     * 사용자 표기를 레지스트리 표기로 변환.
     *
     * @param userTransportType 사용자 표기 (예: http)
     * @return 레지스트리 표기 (예: streamable-http)
     */
    public static String toRegistry(String userTransportType) {
        if (userTransportType == null) {
            return "";
        }
        return USER_TO_REGISTRY.getOrDefault(userTransportType.toLowerCase(Locale.ROOT), userTransportType);
    }

    /**
     * 레지스트리 표기를 사용자 표기로 변환.
     *
     * @param registryTransportType 레지스트리 표기 (예: streamable-http)
     * @return 사용자 표기 (예: http)
     */
    public static String fromRegistry(String registryTransportType) {
        if (registryTransportType == null) {
            return "";
        }
        return REGISTRY_TO_USER.getOrDefault(registryTransportType.toLowerCase(Locale.ROOT), registryTransportType);
    }
}
