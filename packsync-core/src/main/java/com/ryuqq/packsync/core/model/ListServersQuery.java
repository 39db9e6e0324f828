package com.ryuqq.packsync.core.model;

import java.time.Instant;

/**
 * 서버 목록 조회 조건 (불변 record).
 *
 * <p>limit은 레지스트리 상한(100)으로 제한됩니다. 0 이하이면 레지스트리 기본값을 사용합니다.</p>
 *
 * @param cursor 페이지 커서 (선택, null 가능)
 * @param limit 페이지 크기 (1~100, 0 이하는 미지정)
 * @param updatedSince 이 시각 이후 갱신된 레코드만 조회 (선택, null 가능)
 * @param search 이름 검색어 (선택, null 가능)
 * @param version 버전 조건 (선택, null 가능, 예: "latest")
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ListServersQuery(
    String cursor,
    int limit,
    Instant updatedSince,
    String search,
    String version
) {

    /**
     * 레지스트리가 허용하는 최대 페이지 크기.
     */
    public static final int MAX_LIMIT = 100;

    /**
     * Compact Constructor (limit 상한 적용).
     */
    public ListServersQuery {
        if (limit > MAX_LIMIT) {
            limit = MAX_LIMIT;
        }
    }

    /**
     * 최대 페이지 크기의 기본 조회 조건 생성.
     *
     * @return ListServersQuery 인스턴스
     */
    public static ListServersQuery firstPage() {
        return new ListServersQuery(null, MAX_LIMIT, null, null, null);
    }

    /**
     * cursor만 변경한 새 인스턴스 생성.
     */
    public ListServersQuery withCursor(String cursor) {
        return new ListServersQuery(cursor, limit, updatedSince, search, version);
    }

    /**
     * limit만 변경한 새 인스턴스 생성.
     */
    public ListServersQuery withLimit(int limit) {
        return new ListServersQuery(cursor, limit, updatedSince, search, version);
    }

    /**
     * updatedSince만 변경한 새 인스턴스 생성.
     */
    public ListServersQuery withUpdatedSince(Instant updatedSince) {
        return new ListServersQuery(cursor, limit, updatedSince, search, version);
    }

    /**
     * search만 변경한 새 인스턴스 생성.
     */
    public ListServersQuery withSearch(String search) {
        return new ListServersQuery(cursor, limit, updatedSince, search, version);
    }

    /**
     * version만 변경한 새 인스턴스 생성.
     */
    public ListServersQuery withVersion(String version) {
        return new ListServersQuery(cursor, limit, updatedSince, search, version);
    }
}
