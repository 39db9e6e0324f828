package com.ryuqq.packsync.core.filter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 쉼표 구분 필터 목록 파싱 공통 로직.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class FilterLists {

    private FilterLists() {
    }

    /**
     * 쉼표 구분 문자열을 분리 (앞뒤 공백 제거, 빈 항목 제외, 순서 유지 중복 제거).
     *
     * @param csv 쉼표 구분 문자열 (null 가능)
     * @param lowerCase 소문자 정규화 여부
     * @return 정규화된 항목 목록
     */
    static List<String> split(String csv, boolean lowerCase) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String part : csv.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            seen.add(lowerCase ? item.toLowerCase(Locale.ROOT) : item);
        }
        return new ArrayList<>(seen);
    }

    /**
     * 목록을 정규화 (null 제거, 앞뒤 공백 제거, 순서 유지 중복 제거).
     */
    static List<String> normalize(List<String> values, boolean lowerCase) {
        if (values == null) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String item = value.trim();
            seen.add(lowerCase ? item.toLowerCase(Locale.ROOT) : item);
        }
        return List.copyOf(seen);
    }
}
