package com.ryuqq.packsync.core.generator;

/**
 * pack 생성 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PackGeneratorException extends Exception {

    /**
     * 생성자.
     *
     * @param message 메시지
     */
    public PackGeneratorException(String message) {
        super(message);
    }

    /**
     * 생성자.
     *
     * @param message 메시지
     * @param cause 원인
     */
    public PackGeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
