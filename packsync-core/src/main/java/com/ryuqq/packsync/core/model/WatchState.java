package com.ryuqq.packsync.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * 영속화되는 watch 상태의 불변 스냅샷.
 *
 * @param lastPoll 마지막 poll 시작 시각 (최초 실행 전에는 null)
 * @param servers 복합 키 → ServerState
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WatchState(Instant lastPoll, Map<String, ServerState> servers) {

    /**
     * Compact Constructor.
     */
    public WatchState {
        servers = servers == null ? Map.of() : Map.copyOf(servers);
    }

    /**
     * 빈 상태 생성.
     *
     * @return lastPoll 없고 서버가 없는 WatchState
     */
    public static WatchState empty() {
        return new WatchState(null, Map.of());
    }

    /**
     * 마지막 poll 시각 조회.
     *
     * @return 마지막 poll 시각 (없으면 empty)
     */
    public Optional<Instant> lastPollTime() {
        return Optional.ofNullable(lastPoll);
    }
}
