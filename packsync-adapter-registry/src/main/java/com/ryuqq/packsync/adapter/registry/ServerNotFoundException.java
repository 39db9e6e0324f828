package com.ryuqq.packsync.adapter.registry;

/**
 * 단건 조회 시 404 응답.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ServerNotFoundException extends RegistryClientErrorException {

    private final String serverId;

    /**
     * 생성자.
     *
     * @param serverId 조회한 서버 식별자
     * @param body 응답 본문
     */
    public ServerNotFoundException(String serverId, String body) {
        super("server not found: " + serverId, 404, body);
        this.serverId = serverId;
    }

    public String serverId() {
        return serverId;
    }
}
