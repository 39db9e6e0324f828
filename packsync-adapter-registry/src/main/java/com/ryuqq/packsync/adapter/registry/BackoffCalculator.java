package com.ryuqq.packsync.adapter.registry;

import java.time.Duration;

/**
 * 선형 Backoff 계산기.
 *
 * <p>재시도 횟수에 비례해 대기 시간을 늘리고 상한에서 자릅니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * retryCount, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, maxDelay=10000ms):</strong></p>
 * <ul>
 *   <li>retryCount=1: 1000ms</li>
 *   <li>retryCount=2: 2000ms</li>
 *   <li>retryCount=15: 10000ms (capped)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * 설정값으로 생성.
     *
     * @param config RegistryClient 설정
     * @return BackoffCalculator
     */
    public static BackoffCalculator from(RegistryClientConfig config) {
        return new BackoffCalculator(config.retryBaseDelay().toMillis(), config.maxRetryDelay().toMillis());
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retryCount 현재 재시도 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간
     * @throws IllegalArgumentException retryCount가 양수가 아닌 경우
     */
    public Duration calculate(int retryCount) {
        if (retryCount <= 0) {
            throw new IllegalArgumentException(
                "retryCount must be positive (current: " + retryCount + ")"
            );
        }
        // overflow 방지
        long linear = baseDelayMs > maxDelayMs / retryCount ? maxDelayMs : baseDelayMs * retryCount;
        return Duration.ofMillis(Math.min(linear, maxDelayMs));
    }
}
