package com.ryuqq.packsync.adapter.registry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body of {@code GET /v0/servers}.
 *
 * @param servers server entries of this page
 * @param metadata pagination metadata (may be absent)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerListResponse(List<ServerResponse> servers, Metadata metadata) {

    /**
     * Pagination metadata. Older registries send {@code next_cursor}.
     *
     * @param count number of servers in this page
     * @param nextCursor cursor of the next page
     * @param legacyNextCursor snake_case cursor of the next page
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(
        Integer count,
        @JsonProperty("nextCursor") String nextCursor,
        @JsonProperty("next_cursor") String legacyNextCursor
    ) {

        /**
         * The next cursor, whichever spelling the registry used.
         *
         * @return cursor or null on the last page
         */
        public String cursor() {
            return nextCursor != null && !nextCursor.isEmpty() ? nextCursor : legacyNextCursor;
        }
    }
}
