package com.ryuqq.packsync.core.filter;

import com.ryuqq.packsync.core.model.ServerName;

import java.util.List;

/**
 * 서버 이름 필터 ("namespace/name" 정확 일치).
 *
 * <p>비어 있으면 모든 서버와 일치합니다.</p>
 *
 * @param names 허용할 전체 서버 이름 목록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerNameFilter(List<String> names) {

    /**
     * Compact Constructor (정규화 및 중복 제거).
     */
    public ServerNameFilter {
        names = FilterLists.normalize(names, false);
    }

    /**
     * 모든 서버와 일치하는 필터.
     *
     * @return 빈 ServerNameFilter
     */
    public static ServerNameFilter matchAll() {
        return new ServerNameFilter(List.of());
    }

    /**
     * 쉼표 구분 목록 파싱.
     *
     * <p>각 이름은 "namespace/name" 형식이어야 합니다. 빈 입력은 전체 일치 필터입니다.</p>
     *
     * @param csv 쉼표 구분 서버 이름 목록
     * @return ServerNameFilter
     * @throws IllegalArgumentException 이름 형식이 올바르지 않은 경우
     */
    public static ServerNameFilter parse(String csv) {
        List<String> names = FilterLists.split(csv, false);
        for (String name : names) {
            ServerName.parse(name);
        }
        return new ServerNameFilter(names);
    }

    /**
     * 필터가 비어 있는지 확인.
     *
     * @return 이름이 없으면 true
     */
    public boolean isEmpty() {
        return names.isEmpty();
    }

    /**
     * 서버 이름 일치 여부.
     *
     * @param fullName "namespace/name"
     * @return 필터가 비어 있거나 이름이 포함되어 있으면 true
     */
    public boolean matches(String fullName) {
        return names.isEmpty() || names.contains(fullName);
    }
}
