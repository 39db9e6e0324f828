package com.ryuqq.packsync.core.model;

/**
 * 서버 레코드에 포함된 배포 가능한 패키지.
 *
 * @param registryType 패키지 레지스트리 타입 (예: npm, pypi, oci, nuget)
 * @param identifier 패키지 식별자 (예: @acme/widget)
 * @param version 패키지 버전
 * @param transport 전송 방식
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerPackage(
    String registryType,
    String identifier,
    String version,
    Transport transport
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException registryType이 null이거나 빈 문자열인 경우
     */
    public ServerPackage {
        if (registryType == null || registryType.isBlank()) {
            throw new IllegalArgumentException("registryType cannot be null or blank");
        }
        if (transport == null) {
            transport = Transport.of("");
        }
    }

    /**
     * 레지스트리 측 전송 타입 조회.
     *
     * @return 전송 타입 (없으면 빈 문자열)
     */
    public String transportType() {
        return transport.type();
    }
}
