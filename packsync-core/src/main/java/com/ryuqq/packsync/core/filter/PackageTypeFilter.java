package com.ryuqq.packsync.core.filter;

import java.util.List;
import java.util.Locale;

/**
 * 패키지 레지스트리 타입 필터 (대소문자 무시).
 *
 * @param types 허용할 패키지 타입 목록 (소문자로 정규화)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PackageTypeFilter(List<String> types) {

    /**
     * 지원하는 패키지 타입.
     */
    public static final List<String> VALID = List.of("npm", "pypi", "oci", "nuget");

    /**
     * Compact Constructor (소문자 정규화 및 중복 제거).
     */
    public PackageTypeFilter {
        types = FilterLists.normalize(types, true);
    }

    /**
     * 지원하는 모든 패키지 타입을 허용하는 필터.
     *
     * @return PackageTypeFilter
     */
    public static PackageTypeFilter all() {
        return new PackageTypeFilter(VALID);
    }

    /**
     * 쉼표 구분 목록 파싱.
     *
     * @param csv 쉼표 구분 패키지 타입 목록 (예: "npm,oci")
     * @return PackageTypeFilter
     * @throws IllegalArgumentException 비어 있거나 지원하지 않는 타입이 포함된 경우
     */
    public static PackageTypeFilter parse(String csv) {
        List<String> types = FilterLists.split(csv, true);
        if (types.isEmpty()) {
            throw new IllegalArgumentException("at least one package type must be specified");
        }
        for (String type : types) {
            if (!VALID.contains(type)) {
                throw new IllegalArgumentException(
                    "invalid package type '" + type + "': must be one of " + VALID
                );
            }
        }
        return new PackageTypeFilter(types);
    }

    /**
     * 패키지 타입 일치 여부 (대소문자 무시).
     *
     * @param packageType 패키지 레지스트리 타입
     * @return 허용 목록에 있으면 true
     */
    public boolean matches(String packageType) {
        return packageType != null && types.contains(packageType.toLowerCase(Locale.ROOT));
    }
}
