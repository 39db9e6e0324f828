package com.ryuqq.packsync.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 레지스트리에서 조회한 서버 레코드.
 *
 * <p>한 번 조회된 레코드는 불변이며, 한 poll cycle 동안만 사용됩니다.</p>
 *
 * @param name "namespace/name" 형식의 서버 이름
 * @param version 서버 버전 (semver 형태이나 파싱 가능성은 보장되지 않음)
 * @param status 게시 상태
 * @param packages 패키지 목록 (없으면 빈 리스트, remote-only 서버)
 * @param updatedAt 레지스트리가 보고한 최종 갱신 시각 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerRecord(
    String name,
    String version,
    ServerStatus status,
    List<ServerPackage> packages,
    Instant updatedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null인 경우
     */
    public ServerRecord {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        version = version == null ? "" : version;
        status = status == null ? ServerStatus.ACTIVE : status;
        packages = packages == null ? List.of() : List.copyOf(packages);
    }

    /**
     * updatedAt 없이 ServerRecord 생성.
     *
     * @param name 서버 이름
     * @param version 서버 버전
     * @param status 게시 상태
     * @param packages 패키지 목록
     * @return ServerRecord 인스턴스
     */
    public static ServerRecord of(String name, String version, ServerStatus status, List<ServerPackage> packages) {
        return new ServerRecord(name, version, status, packages, null);
    }

    /**
     * 활성 상태인지 확인.
     *
     * @return ACTIVE인 경우 true
     */
    public boolean isActive() {
        return status == ServerStatus.ACTIVE;
    }

    /**
     * "name@version" 형식 표기.
     *
     * @return 서버 표기 문자열
     */
    public String nameAndVersion() {
        return name + "@" + version;
    }
}
