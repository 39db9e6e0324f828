package com.ryuqq.packsync.core.generator;

import java.util.Locale;

/**
 * pack 산출물 형태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OutputType {

    /**
     * pack 디렉터리.
     */
    PACKDIR,

    /**
     * zip 아카이브.
     */
    ARCHIVE;

    /**
     * 설정 문자열을 OutputType으로 변환 (대소문자 무시).
     *
     * @param value "packdir" 또는 "archive"
     * @return OutputType
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static OutputType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("output type cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "packdir" -> PACKDIR;
            case "archive" -> ARCHIVE;
            default -> throw new IllegalArgumentException(
                "invalid output type '" + value + "': must be one of [packdir, archive]"
            );
        };
    }
}
