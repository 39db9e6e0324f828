package com.ryuqq.packsync.adapter.registry;

/**
 * 이름이 일치하는 ACTIVE 상태이면서 semver로 해석 가능한 버전이 없는 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NoActiveVersionException extends RegistryException {

    private final String serverName;

    public NoActiveVersionException(String serverName, String message) {
        super(message);
        this.serverName = serverName;
    }

    public String serverName() {
        return serverName;
    }
}
