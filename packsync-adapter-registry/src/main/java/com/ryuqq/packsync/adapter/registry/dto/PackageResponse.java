package com.ryuqq.packsync.adapter.registry.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An installable package of a server.
 *
 * @param registryType package ecosystem (npm, pypi, oci, nuget)
 * @param legacyRegistryType snake_case spelling of the ecosystem
 * @param identifier package identifier within the ecosystem
 * @param version package version
 * @param transport transport declaration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PackageResponse(
    @JsonProperty("registryType") String registryType,
    @JsonProperty("registry_type") String legacyRegistryType,
    String identifier,
    String version,
    Transport transport
) {

    /**
     * The ecosystem, whichever spelling the registry used.
     *
     * @return registry type or null
     */
    public String type() {
        return registryType != null && !registryType.isBlank() ? registryType : legacyRegistryType;
    }

    /**
     * Transport declaration (registry-side naming, e.g. {@code streamable-http}).
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Transport(String type, String url) {
    }
}
