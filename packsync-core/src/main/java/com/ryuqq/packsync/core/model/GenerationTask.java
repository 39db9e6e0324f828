package com.ryuqq.packsync.core.model;

/**
 * 한 번의 pack 생성 작업 (서버 레코드 + 선택된 패키지).
 *
 * <p>Filter Pipeline이 생성하고 worker가 한 번 소비한 뒤 버려집니다. 영속화되지 않습니다.</p>
 *
 * @param server 원본 서버 레코드
 * @param serverPackage 생성 대상 패키지
 * @param serverName 파싱된 서버 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GenerationTask(ServerRecord server, ServerPackage serverPackage, ServerName serverName) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public GenerationTask {
        if (server == null || serverPackage == null || serverName == null) {
            throw new IllegalArgumentException("All fields are required for GenerationTask");
        }
    }

    /**
     * 이 작업의 상태 저장소 키.
     *
     * @return 복합 키
     */
    public String stateKey() {
        return ServerState.keyOf(
            serverName.namespace(),
            serverName.name(),
            server.version(),
            serverPackage.registryType(),
            serverPackage.transportType()
        );
    }

    @Override
    public String toString() {
        return server.name() + "@" + server.version() + ":" + serverPackage.registryType() + ":" + serverPackage.transportType();
    }
}
