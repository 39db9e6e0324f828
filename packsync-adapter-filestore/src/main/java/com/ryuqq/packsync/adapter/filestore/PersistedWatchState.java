package com.ryuqq.packsync.adapter.filestore;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.packsync.core.model.ServerState;

import java.time.Instant;
import java.util.Map;

/**
 * 상태 파일 JSON 바인딩 (snake_case).
 *
 * <pre>
 * {
 *   "last_poll": "2025-01-15T10:00:00Z",
 *   "servers": {
 *     "acme/widget@1.0.0:npm:stdio": {
 *       "namespace": "acme", "name": "widget", "version": "1.0.0",
 *       "package_type": "npm", "transport_type": "stdio",
 *       "updated_at": "...", "generated_at": "...", "checksum": ""
 *     }
 *   }
 * }
 * </pre>
 *
 * @param lastPoll 마지막 폴링 시각 (없으면 null)
 * @param servers 복합 키 → 서버 상태
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record PersistedWatchState(
    @JsonProperty("last_poll") Instant lastPoll,
    @JsonProperty("servers") Map<String, Entry> servers
) {

    /**
     * 서버 상태 항목.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(
        @JsonProperty("namespace") String namespace,
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("package_type") String packageType,
        @JsonProperty("transport_type") String transportType,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("checksum") String checksum
    ) {

        static Entry from(ServerState state) {
            return new Entry(
                state.namespace(),
                state.name(),
                state.version(),
                state.packageType(),
                state.transportType(),
                state.updatedAt(),
                state.generatedAt(),
                state.checksum()
            );
        }

        ServerState toState() {
            return new ServerState(namespace, name, version, packageType, transportType, updatedAt, generatedAt, checksum);
        }
    }
}
