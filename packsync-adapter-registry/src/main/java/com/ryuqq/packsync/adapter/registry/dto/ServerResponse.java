package com.ryuqq.packsync.adapter.registry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A server entry as served by the registry.
 *
 * <p>Accepts both the flat shape ({@code {name, version, packages, _meta}}) and the
 * wrapped shape ({@code {server: {...}, _meta: {...}}}).</p>
 *
 * @param name full server name ({@code namespace/name})
 * @param version server version
 * @param status top-level status, if the registry puts it there
 * @param packages installable packages
 * @param server wrapped server body
 * @param meta registry metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerResponse(
    String name,
    String version,
    String status,
    List<PackageResponse> packages,
    ServerResponse server,
    @JsonProperty("_meta") Meta meta
) {

    /**
     * Registry-owned metadata block.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Meta(@JsonProperty("io.modelcontextprotocol.registry/official") Official official) {
    }

    /**
     * Official registry metadata.
     *
     * @param status lifecycle status (active, deprecated, deleted)
     * @param updatedAt RFC 3339 timestamp of the last update
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Official(String status, String updatedAt) {
    }
}
