package com.ryuqq.packsync.adapter.registry;

import com.ryuqq.packsync.adapter.registry.dto.PackageResponse;
import com.ryuqq.packsync.adapter.registry.dto.ServerListResponse;
import com.ryuqq.packsync.adapter.registry.dto.ServerResponse;
import com.ryuqq.packsync.core.model.ServerPackage;
import com.ryuqq.packsync.core.model.ServerPage;
import com.ryuqq.packsync.core.model.ServerRecord;
import com.ryuqq.packsync.core.model.ServerStatus;
import com.ryuqq.packsync.core.model.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 레지스트리 DTO → 도메인 모델 변환.
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>감싼 형태({@code server} 필드)가 있으면 내부 본문을 사용</li>
 *   <li>상태: {@code _meta} official status → 최상위 status → ACTIVE 순</li>
 *   <li>알 수 없는 상태 값은 DELETED로 취급 (생성 대상에서 제외)</li>
 *   <li>updatedAt: {@code _meta} official updatedAt, 해석 실패 시 없음</li>
 *   <li>registryType이 없는 패키지는 제외</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class RegistryRecordMapper {

    private static final Logger log = LoggerFactory.getLogger(RegistryRecordMapper.class);

    private RegistryRecordMapper() {
    }

    static ServerPage toPage(ServerListResponse response) {
        List<ServerRecord> records = new ArrayList<>();
        if (response.servers() != null) {
            for (ServerResponse server : response.servers()) {
                if (server != null) {
                    records.add(toRecord(server));
                }
            }
        }
        ServerListResponse.Metadata metadata = response.metadata();
        int count = metadata != null && metadata.count() != null ? metadata.count() : records.size();
        String nextCursor = metadata != null ? metadata.cursor() : null;
        return new ServerPage(records, count, nextCursor);
    }

    static ServerRecord toRecord(ServerResponse response) {
        ServerResponse body = response.server() != null ? response.server() : response;
        ServerResponse.Official official = official(response);
        if (official == null && body != response) {
            official = official(body);
        }

        String statusValue = official != null && official.status() != null ? official.status() : body.status();
        if (statusValue == null && body != response) {
            statusValue = response.status();
        }

        String name = body.name() == null ? "" : body.name();
        return new ServerRecord(
            name,
            body.version(),
            toStatus(name, statusValue),
            toPackages(name, body.packages()),
            official != null ? toInstant(name, official.updatedAt()) : null
        );
    }

    private static ServerResponse.Official official(ServerResponse response) {
        return response.meta() != null ? response.meta().official() : null;
    }

    private static ServerStatus toStatus(String name, String value) {
        try {
            return ServerStatus.fromWireValue(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown status '{}' for server {}, treating as deleted", value, name);
            return ServerStatus.DELETED;
        }
    }

    private static List<ServerPackage> toPackages(String name, List<PackageResponse> packages) {
        if (packages == null) {
            return List.of();
        }
        List<ServerPackage> result = new ArrayList<>(packages.size());
        for (PackageResponse pkg : packages) {
            if (pkg == null || pkg.type() == null || pkg.type().isBlank()) {
                log.debug("Ignoring package without registry type for server {}", name);
                continue;
            }
            Transport transport = pkg.transport() == null
                ? Transport.of("")
                : new Transport(pkg.transport().type(), pkg.transport().url());
            result.add(new ServerPackage(pkg.type(), pkg.identifier(), pkg.version(), transport));
        }
        return result;
    }

    private static Instant toInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable updatedAt '{}' for server {}", value, name);
            return null;
        }
    }
}
