package com.ryuqq.packsync.core.model;

import java.util.List;

/**
 * 서버 목록 조회 결과의 한 페이지.
 *
 * @param servers 서버 레코드 목록
 * @param count 레지스트리가 보고한 레코드 수
 * @param nextCursor 다음 페이지 커서 (마지막 페이지면 null 또는 빈 문자열)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerPage(List<ServerRecord> servers, int count, String nextCursor) {

    /**
     * Compact Constructor.
     */
    public ServerPage {
        servers = servers == null ? List.of() : List.copyOf(servers);
    }

    /**
     * 다음 페이지가 있는지 확인.
     *
     * @return nextCursor가 비어 있지 않으면 true
     */
    public boolean hasNextPage() {
        return nextCursor != null && !nextCursor.isEmpty();
    }
}
