package com.ryuqq.packsync.core.model;

/**
 * "namespace/name" 형식의 서버 식별자.
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>"/" 구분자는 정확히 하나</li>
 *   <li>namespace, name 모두 비어 있으면 안 됨 (앞뒤 공백 제거 후)</li>
 * </ul>
 *
 * @param namespace 네임스페이스 (예: io.github.acme)
 * @param name 서버 이름 (예: widget)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerName(String namespace, String name) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException namespace 또는 name이 null이거나 빈 문자열인 경우
     */
    public ServerName {
        if (namespace == null || namespace.isBlank() || name == null || name.isBlank()) {
            throw new IllegalArgumentException("namespace and name cannot be null or blank");
        }
    }

    /**
     * "namespace/name" 문자열 파싱.
     *
     * @param fullName 전체 서버 이름
     * @return ServerName 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static ServerName parse(String fullName) {
        if (fullName == null || fullName.isBlank()) {
            throw new IllegalArgumentException("server name cannot be empty");
        }
        String trimmed = fullName.trim();
        int slash = trimmed.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException(
                "invalid server name format '" + trimmed + "': expected format like 'io.github.example/server'"
            );
        }
        if (trimmed.indexOf('/', slash + 1) >= 0) {
            throw new IllegalArgumentException(
                "invalid server name format '" + trimmed + "': expected exactly one '/' separator"
            );
        }
        String namespace = trimmed.substring(0, slash).trim();
        String name = trimmed.substring(slash + 1).trim();
        if (namespace.isEmpty() || name.isEmpty()) {
            throw new IllegalArgumentException(
                "invalid server name format '" + trimmed + "': namespace and name parts cannot be empty"
            );
        }
        return new ServerName(namespace, name);
    }

    /**
     * "namespace/name" 형식 표기.
     *
     * @return 전체 서버 이름
     */
    public String fullName() {
        return namespace + "/" + name;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
