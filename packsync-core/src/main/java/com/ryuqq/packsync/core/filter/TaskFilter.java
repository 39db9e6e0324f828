package com.ryuqq.packsync.core.filter;

import com.ryuqq.packsync.core.model.GenerationTask;
import com.ryuqq.packsync.core.model.ServerName;
import com.ryuqq.packsync.core.model.ServerPackage;
import com.ryuqq.packsync.core.model.ServerRecord;
import com.ryuqq.packsync.core.model.ServerStatus;
import com.ryuqq.packsync.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 레지스트리 레코드를 생성 작업 목록으로 축소하는 필터 파이프라인.
 *
 * <p><strong>레코드별 처리 순서:</strong></p>
 * <pre>
 * 1. "namespace/name" 파싱 → 실패 시 경고 후 건너뜀
 * 2. 이름 필터 → 불일치 시 건너뜀
 * 3. 상태 게이트 → DELETED 항상 제외, DEPRECATED는 allowDeprecated일 때만 포함
 * 4. 패키지 없음 → 원격 전용 서버이므로 건너뜀
 * 5. 패키지별:
 *    - 패키지 타입 필터
 *    - 전송 타입 필터 (레지스트리 → 사용자 표기 변환 후)
 *    - forceOverwrite 또는 StateStore.needsGeneration() → 작업 추가
 * </pre>
 *
 * <p>결과는 발견 순서를 유지합니다. 같은 입력과 같은 StateStore 상태에 대해 항상 같은 목록을 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskFilter {

    private static final Logger log = LoggerFactory.getLogger(TaskFilter.class);

    private final ServerNameFilter nameFilter;
    private final PackageTypeFilter packageTypeFilter;
    private final TransportTypeFilter transportTypeFilter;
    private final boolean allowDeprecated;
    private final boolean forceOverwrite;

    /**
     * 생성자.
     *
     * @param nameFilter 서버 이름 필터
     * @param packageTypeFilter 패키지 타입 필터
     * @param transportTypeFilter 전송 타입 필터
     * @param allowDeprecated DEPRECATED 서버 포함 여부
     * @param forceOverwrite StateStore 확인 없이 모든 일치 패키지를 작업으로 포함할지 여부
     * @throws IllegalArgumentException 필터가 null인 경우
     */
    public TaskFilter(
        ServerNameFilter nameFilter,
        PackageTypeFilter packageTypeFilter,
        TransportTypeFilter transportTypeFilter,
        boolean allowDeprecated,
        boolean forceOverwrite
    ) {
        if (nameFilter == null) {
            throw new IllegalArgumentException("nameFilter cannot be null");
        }
        if (packageTypeFilter == null) {
            throw new IllegalArgumentException("packageTypeFilter cannot be null");
        }
        if (transportTypeFilter == null) {
            throw new IllegalArgumentException("transportTypeFilter cannot be null");
        }
        this.nameFilter = nameFilter;
        this.packageTypeFilter = packageTypeFilter;
        this.transportTypeFilter = transportTypeFilter;
        this.allowDeprecated = allowDeprecated;
        this.forceOverwrite = forceOverwrite;
    }

    /**
     * 생성이 필요한 작업 선택.
     *
     * @param records 레지스트리에서 조회한 레코드 목록
     * @param stateStore 생성 이력 조회용 StateStore
     * @return 발견 순서의 작업 목록 (변경 불가)
     */
    public List<GenerationTask> select(List<ServerRecord> records, StateStore stateStore) {
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        if (records == null || records.isEmpty()) {
            return List.of();
        }

        List<GenerationTask> tasks = new ArrayList<>();
        for (ServerRecord record : records) {
            collect(record, stateStore, tasks);
        }
        return List.copyOf(tasks);
    }

    private void collect(ServerRecord record, StateStore stateStore, List<GenerationTask> tasks) {
        ServerName serverName;
        try {
            serverName = ServerName.parse(record.name());
        } catch (IllegalArgumentException e) {
            log.warn("Skipping server with malformed name: {} ({})", record.name(), e.getMessage());
            return;
        }

        if (!nameFilter.matches(serverName.fullName())) {
            log.debug("Skipping {}: not in name filter", record.nameAndVersion());
            return;
        }

        if (!isStatusAllowed(record.status())) {
            log.debug("Skipping {}: status {}", record.nameAndVersion(), record.status().wireValue());
            return;
        }

        if (record.packages().isEmpty()) {
            log.debug("Skipping {}: no packages (remote-only server)", record.nameAndVersion());
            return;
        }

        Instant observedUpdatedAt = record.updatedAt() != null ? record.updatedAt() : Instant.EPOCH;

        for (ServerPackage pkg : record.packages()) {
            if (!packageTypeFilter.matches(pkg.registryType())) {
                log.debug("Skipping {} package {}: package type filtered", record.nameAndVersion(), pkg.registryType());
                continue;
            }
            if (!transportTypeFilter.matches(pkg.transportType())) {
                log.debug("Skipping {} package {}: transport {} filtered",
                    record.nameAndVersion(), pkg.registryType(), pkg.transportType());
                continue;
            }
            if (forceOverwrite || stateStore.needsGeneration(
                serverName.namespace(),
                serverName.name(),
                record.version(),
                pkg.registryType(),
                pkg.transportType(),
                observedUpdatedAt
            )) {
                tasks.add(new GenerationTask(record, pkg, serverName));
            } else {
                log.debug("Skipping {} package {}: already generated", record.nameAndVersion(), pkg.registryType());
            }
        }
    }

    private boolean isStatusAllowed(ServerStatus status) {
        return switch (status) {
            case ACTIVE -> true;
            case DEPRECATED -> allowDeprecated;
            case DELETED -> false;
        };
    }
}
