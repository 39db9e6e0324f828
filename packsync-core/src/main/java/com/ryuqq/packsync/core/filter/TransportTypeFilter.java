package com.ryuqq.packsync.core.filter;

import java.util.List;
import java.util.Locale;

/**
 * 전송 타입 필터.
 *
 * <p>필터 값은 사용자 표기(stdio, http, sse)이며, 비교 전에 레지스트리 표기를
 * {@link TransportTypes#fromRegistry(String)}로 변환합니다.</p>
 *
 * @param types 허용할 사용자 표기 전송 타입 목록 (소문자로 정규화)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TransportTypeFilter(List<String> types) {

    /**
     * Compact Constructor (소문자 정규화 및 중복 제거).
     */
    public TransportTypeFilter {
        types = FilterLists.normalize(types, true);
    }

    /**
     * 지원하는 모든 전송 타입을 허용하는 필터.
     *
     * @return TransportTypeFilter
     */
    public static TransportTypeFilter all() {
        return new TransportTypeFilter(TransportTypes.VALID);
    }

    /**
     * 쉼표 구분 목록 파싱.
     *
     * @param csv 쉼표 구분 전송 타입 목록 (예: "stdio,http")
     * @return TransportTypeFilter
     * @throws IllegalArgumentException 비어 있거나 지원하지 않는 타입이 포함된 경우
     */
    public static TransportTypeFilter parse(String csv) {
        List<String> types = FilterLists.split(csv, true);
        if (types.isEmpty()) {
            throw new IllegalArgumentException("at least one transport type must be specified");
        }
        for (String type : types) {
            if (!TransportTypes.VALID.contains(type)) {
                throw new IllegalArgumentException(
                    "invalid transport type '" + type + "': must be one of " + TransportTypes.VALID
                );
            }
        }
        return new TransportTypeFilter(types);
    }

    /**
     * 레지스트리 표기 전송 타입 일치 여부.
     *
     * @param registryTransportType 레지스트리 표기 (예: streamable-http)
     * @return 사용자 표기로 변환한 값이 허용 목록에 있으면 true
     */
    public boolean matches(String registryTransportType) {
        String userType = TransportTypes.fromRegistry(registryTransportType);
        return types.contains(userType.toLowerCase(Locale.ROOT));
    }
}
