package com.ryuqq.packsync.testkit.fixture;

import com.ryuqq.packsync.core.model.ServerPackage;
import com.ryuqq.packsync.core.model.ServerRecord;
import com.ryuqq.packsync.core.model.ServerStatus;
import com.ryuqq.packsync.core.model.Transport;

import java.util.ArrayList;
import java.util.List;

/**
 * ServerRecord fixtures for tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServerRecordFixtures {

    private ServerRecordFixtures() {
    }

    /**
     * A package with a registry-side transport type.
     */
    public static ServerPackage pkg(String registryType, String transportType) {
        return new ServerPackage(registryType, "pkg-" + registryType, "1.0.0", Transport.of(transportType));
    }

    /**
     * An npm/stdio package.
     */
    public static ServerPackage npmStdio() {
        return pkg("npm", "stdio");
    }

    /**
     * An active server with the given packages.
     */
    public static ServerRecord active(String name, String version, ServerPackage... packages) {
        return ServerRecord.of(name, version, ServerStatus.ACTIVE, List.of(packages));
    }

    /**
     * A server with an explicit status.
     */
    public static ServerRecord withStatus(String name, String version, ServerStatus status, ServerPackage... packages) {
        return ServerRecord.of(name, version, status, List.of(packages));
    }

    /**
     * {@code count} active servers named {@code namespace/server-<i>}, each with one npm/stdio package.
     */
    public static List<ServerRecord> activeServers(String namespace, int count) {
        List<ServerRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(active(namespace + "/server-" + i, "1.0.0", npmStdio()));
        }
        return records;
    }
}
