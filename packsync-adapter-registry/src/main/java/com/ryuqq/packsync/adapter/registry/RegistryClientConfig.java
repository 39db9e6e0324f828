package com.ryuqq.packsync.adapter.registry;

import java.net.URI;
import java.time.Duration;

/**
 * RegistryClient 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseUrl: 레지스트리 주소 (기본 https://registry.modelcontextprotocol.io)</li>
 *   <li>requestTimeout: 요청당 제한 시간 (기본 30초)</li>
 *   <li>maxAttempts: 최대 시도 횟수 (기본 3회, 첫 요청 포함)</li>
 *   <li>retryBaseDelay: 선형 백오프 기본 간격 (기본 1초, n번째 재시도 전 n × baseDelay)</li>
 *   <li>maxRetryDelay: 백오프 상한 (기본 10초)</li>
 *   <li>responsePollInterval: 응답 대기 중 취소 확인 간격 (기본 10ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param baseUrl 레지스트리 주소 (http/https, 끝의 "/"는 제거됨)
 * @param requestTimeout 요청당 제한 시간 (양수여야 함)
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param retryBaseDelay 백오프 기본 간격 (양수여야 함)
 * @param maxRetryDelay 백오프 상한 (retryBaseDelay 이상이어야 함)
 * @param responsePollInterval 취소 확인 간격 (양수여야 함)
 */
public record RegistryClientConfig(
    String baseUrl,
    Duration requestTimeout,
    int maxAttempts,
    Duration retryBaseDelay,
    Duration maxRetryDelay,
    Duration responsePollInterval
) {

    /**
     * 기본 레지스트리 주소.
     */
    public static final String DEFAULT_BASE_URL = "https://registry.modelcontextprotocol.io";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: baseUrl=https://registry.modelcontextprotocol.io, requestTimeout=30s,
     * maxAttempts=3, retryBaseDelay=1s, maxRetryDelay=10s, responsePollInterval=10ms</p>
     */
    public RegistryClientConfig() {
        this(DEFAULT_BASE_URL, Duration.ofSeconds(30), 3, Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofMillis(10));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RegistryClientConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        baseUrl = stripTrailingSlash(baseUrl.trim());
        validateBaseUrl(baseUrl);
        requirePositive("requestTimeout", requestTimeout);
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        requirePositive("retryBaseDelay", retryBaseDelay);
        if (maxRetryDelay == null || maxRetryDelay.compareTo(retryBaseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxRetryDelay must be >= retryBaseDelay (base: " + retryBaseDelay + ", max: " + maxRetryDelay + ")"
            );
        }
        requirePositive("responsePollInterval", responsePollInterval);
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(field + " must be positive (current: " + value + ")");
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static void validateBaseUrl(String baseUrl) {
        URI uri;
        try {
            uri = URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid registry base URL: " + baseUrl, e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme) || uri.getHost() == null) {
            throw new IllegalArgumentException("invalid registry base URL: " + baseUrl);
        }
    }

    /**
     * baseUrl만 변경한 새 인스턴스 생성.
     */
    public RegistryClientConfig withBaseUrl(String baseUrl) {
        return new RegistryClientConfig(baseUrl, requestTimeout, maxAttempts, retryBaseDelay, maxRetryDelay, responsePollInterval);
    }

    /**
     * requestTimeout만 변경한 새 인스턴스 생성.
     */
    public RegistryClientConfig withRequestTimeout(Duration requestTimeout) {
        return new RegistryClientConfig(baseUrl, requestTimeout, maxAttempts, retryBaseDelay, maxRetryDelay, responsePollInterval);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RegistryClientConfig withMaxAttempts(int maxAttempts) {
        return new RegistryClientConfig(baseUrl, requestTimeout, maxAttempts, retryBaseDelay, maxRetryDelay, responsePollInterval);
    }

    /**
     * retryBaseDelay만 변경한 새 인스턴스 생성.
     */
    public RegistryClientConfig withRetryBaseDelay(Duration retryBaseDelay) {
        return new RegistryClientConfig(baseUrl, requestTimeout, maxAttempts, retryBaseDelay, maxRetryDelay, responsePollInterval);
    }

    /**
     * maxRetryDelay만 변경한 새 인스턴스 생성.
     */
    public RegistryClientConfig withMaxRetryDelay(Duration maxRetryDelay) {
        return new RegistryClientConfig(baseUrl, requestTimeout, maxAttempts, retryBaseDelay, maxRetryDelay, responsePollInterval);
    }

    /**
     * responsePollInterval만 변경한 새 인스턴스 생성.
     */
    public RegistryClientConfig withResponsePollInterval(Duration responsePollInterval) {
        return new RegistryClientConfig(baseUrl, requestTimeout, maxAttempts, retryBaseDelay, maxRetryDelay, responsePollInterval);
    }
}
