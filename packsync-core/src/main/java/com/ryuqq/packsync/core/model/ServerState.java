package com.ryuqq.packsync.core.model;

import java.time.Instant;

/**
 * 성공적으로 생성된 (namespace, name, version, packageType, transportType) 튜플의 기록.
 *
 * <p><strong>복합 키:</strong> {@code namespace/name@version:packageType:transportType}</p>
 *
 * <p>각 구성 요소에 구분자(/, @, :) 또는 '%'가 포함된 경우 퍼센트 인코딩하여
 * 서로 다른 튜플이 같은 키를 갖지 않도록 합니다. 일반적인 값은 그대로 유지됩니다.</p>
 *
 * <pre>
 * acme/widget@1.0.0:npm:stdio
 * </pre>
 *
 * @param namespace 네임스페이스
 * @param name 서버 이름
 * @param version 서버 버전
 * @param packageType 패키지 레지스트리 타입
 * @param transportType 레지스트리 측 전송 타입
 * @param updatedAt 갱신 시각
 * @param generatedAt 생성 완료 시각
 * @param checksum 예약 필드 (현재 빈 문자열)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ServerState(
    String namespace,
    String name,
    String version,
    String packageType,
    String transportType,
    Instant updatedAt,
    Instant generatedAt,
    String checksum
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException namespace 또는 name이 null인 경우
     */
    public ServerState {
        if (namespace == null || name == null) {
            throw new IllegalArgumentException("namespace and name cannot be null");
        }
        version = version == null ? "" : version;
        packageType = packageType == null ? "" : packageType;
        transportType = transportType == null ? "" : transportType;
        checksum = checksum == null ? "" : checksum;
    }

    /**
     * 생성 완료된 작업의 ServerState 생성 (updatedAt = generatedAt = now).
     *
     * @param task 완료된 생성 작업
     * @param now 생성 완료 시각
     * @return ServerState 인스턴스
     */
    public static ServerState generated(GenerationTask task, Instant now) {
        return new ServerState(
            task.serverName().namespace(),
            task.serverName().name(),
            task.server().version(),
            task.serverPackage().registryType(),
            task.serverPackage().transportType(),
            now,
            now,
            ""
        );
    }

    /**
     * 이 상태의 복합 키.
     *
     * @return 복합 키
     */
    public String key() {
        return keyOf(namespace, name, version, packageType, transportType);
    }

    /**
     * 복합 키 생성.
     *
     * @param namespace 네임스페이스
     * @param name 서버 이름
     * @param version 서버 버전
     * @param packageType 패키지 타입
     * @param transportType 전송 타입
     * @return {@code namespace/name@version:packageType:transportType}
     */
    public static String keyOf(String namespace, String name, String version, String packageType, String transportType) {
        return escape(namespace) + "/" + escape(name) + "@" + escape(version)
            + ":" + escape(packageType) + ":" + escape(transportType);
    }

    private static String escape(String component) {
        if (component == null) {
            return "";
        }
        StringBuilder sb = null;
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            String replacement = switch (c) {
                case '%' -> "%25";
                case '/' -> "%2F";
                case '@' -> "%40";
                case ':' -> "%3A";
                default -> null;
            };
            if (replacement != null && sb == null) {
                sb = new StringBuilder(component.length() + 8);
                sb.append(component, 0, i);
            }
            if (sb != null) {
                if (replacement != null) {
                    sb.append(replacement);
                } else {
                    sb.append(c);
                }
            }
        }
        return sb == null ? component : sb.toString();
    }
}
