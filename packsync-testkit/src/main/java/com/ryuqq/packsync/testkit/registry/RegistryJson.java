package com.ryuqq.packsync.testkit.registry;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds registry v0 JSON payloads for {@link StubRegistryServer}.
 *
 * <p>Servers are emitted in the wrapped shape ({@code {server, _meta}}) unless built with
 * {@link #flatServer(String, String, String...)}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RegistryJson {

    private static final String OFFICIAL_META = "io.modelcontextprotocol.registry/official";

    private RegistryJson() {
    }

    /**
     * A package entry.
     *
     * @param registryType ecosystem (npm, pypi, ...)
     * @param identifier package identifier
     * @param transportType registry-side transport type (stdio, streamable-http, sse)
     */
    public static String pkg(String registryType, String identifier, String transportType) {
        return "{\"registryType\":" + quote(registryType)
            + ",\"identifier\":" + quote(identifier)
            + ",\"version\":\"1.0.0\""
            + ",\"transport\":{\"type\":" + quote(transportType) + "}}";
    }

    /**
     * An active server with the given packages, no updatedAt.
     */
    public static String server(String name, String version, String... packages) {
        return serverWithMeta(name, version, "active", null, packages);
    }

    /**
     * A server in the wrapped shape with official metadata.
     *
     * @param name full server name
     * @param version version string
     * @param status status (active, deprecated, deleted) or null to omit
     * @param updatedAt RFC 3339 timestamp or null to omit
     * @param packages package JSON fragments from {@link #pkg(String, String, String)}
     */
    public static String serverWithMeta(String name, String version, String status, String updatedAt, String... packages) {
        List<String> official = new ArrayList<>();
        if (status != null) {
            official.add("\"status\":" + quote(status));
        }
        if (updatedAt != null) {
            official.add("\"updatedAt\":" + quote(updatedAt));
        }
        return "{\"server\":{\"name\":" + quote(name)
            + ",\"version\":" + quote(version)
            + ",\"description\":\"test server\""
            + ",\"packages\":[" + String.join(",", packages) + "]}"
            + ",\"_meta\":{" + quote(OFFICIAL_META) + ":{" + String.join(",", official) + "}}}";
    }

    /**
     * A server in the flat shape without metadata.
     */
    public static String flatServer(String name, String version, String... packages) {
        return "{\"name\":" + quote(name)
            + ",\"version\":" + quote(version)
            + ",\"packages\":[" + String.join(",", packages) + "]}";
    }

    /**
     * A list page.
     *
     * @param nextCursor next cursor or null for the last page
     * @param servers server JSON fragments
     */
    public static String page(String nextCursor, String... servers) {
        String metadata = "{\"count\":" + servers.length
            + (nextCursor == null ? "" : ",\"nextCursor\":" + quote(nextCursor)) + "}";
        return "{\"servers\":[" + String.join(",", servers) + "],\"metadata\":" + metadata + "}";
    }

    private static String quote(String value) {
        if (value == null) {
            return "null";
        }
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
