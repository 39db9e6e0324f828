package com.ryuqq.packsync.adapter.runner;

import com.ryuqq.packsync.core.filter.PackageTypeFilter;
import com.ryuqq.packsync.core.filter.ServerNameFilter;
import com.ryuqq.packsync.core.filter.TransportTypeFilter;
import com.ryuqq.packsync.core.generator.GenerateOptions;

import java.time.Duration;

/**
 * Watcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalSeconds: 폴링 간격 (기본 300초, 최소 30초)</li>
 *   <li>stateFile: 상태 파일 경로 (기본 ./watch.json)</li>
 *   <li>maxConcurrent: 동시 생성 작업 수 (기본 5)</li>
 *   <li>nameFilter: 서버 이름 필터 (기본 전체)</li>
 *   <li>packageTypeFilter: 패키지 타입 필터 (기본 npm, pypi, oci, nuget)</li>
 *   <li>transportTypeFilter: 전송 타입 필터 (기본 stdio, http, sse)</li>
 *   <li>allowDeprecated: deprecated 서버 포함 여부 (기본 false)</li>
 *   <li>stateRetention: 상태 보존 기간 (기본 null, 정리 비활성화)</li>
 *   <li>generateOptions: pack 생성 옵션 (forceOverwrite는 필터 단계에도 적용)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollIntervalSeconds 폴링 간격 (초, 30 이상이어야 함)
 * @param stateFile 상태 파일 경로 (비어 있으면 안 됨)
 * @param maxConcurrent 동시 생성 작업 수 (1 이상이어야 함)
 * @param nameFilter 서버 이름 필터
 * @param packageTypeFilter 패키지 타입 필터
 * @param transportTypeFilter 전송 타입 필터
 * @param allowDeprecated deprecated 서버 포함 여부
 * @param stateRetention 상태 보존 기간 (null이면 정리하지 않음)
 * @param generateOptions pack 생성 옵션
 */
public record WatcherConfig(
    long pollIntervalSeconds,
    String stateFile,
    int maxConcurrent,
    ServerNameFilter nameFilter,
    PackageTypeFilter packageTypeFilter,
    TransportTypeFilter transportTypeFilter,
    boolean allowDeprecated,
    Duration stateRetention,
    GenerateOptions generateOptions
) {

    /**
     * 최소 폴링 간격 (초).
     */
    public static final long MIN_POLL_INTERVAL_SECONDS = 30;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalSeconds=300, stateFile=./watch.json, maxConcurrent=5,
     * 필터 전체 허용, allowDeprecated=false, stateRetention=null, 기본 GenerateOptions</p>
     */
    public WatcherConfig() {
        this(
            300,
            "./watch.json",
            5,
            ServerNameFilter.matchAll(),
            PackageTypeFilter.all(),
            TransportTypeFilter.all(),
            false,
            null,
            new GenerateOptions()
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WatcherConfig {
        if (pollIntervalSeconds < MIN_POLL_INTERVAL_SECONDS) {
            throw new IllegalArgumentException(
                "pollIntervalSeconds must be at least " + MIN_POLL_INTERVAL_SECONDS
                    + " (current: " + pollIntervalSeconds + ")"
            );
        }
        if (stateFile == null || stateFile.isBlank()) {
            throw new IllegalArgumentException("stateFile cannot be blank (current: " + stateFile + ")");
        }
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
        if (nameFilter == null) {
            throw new IllegalArgumentException("nameFilter cannot be null");
        }
        if (packageTypeFilter == null) {
            throw new IllegalArgumentException("packageTypeFilter cannot be null");
        }
        if (transportTypeFilter == null) {
            throw new IllegalArgumentException("transportTypeFilter cannot be null");
        }
        if (stateRetention != null && (stateRetention.isNegative() || stateRetention.isZero())) {
            throw new IllegalArgumentException(
                "stateRetention must be positive (current: " + stateRetention + ")"
            );
        }
        if (generateOptions == null) {
            throw new IllegalArgumentException("generateOptions cannot be null");
        }
    }

    /**
     * 폴링 간격.
     *
     * @return Duration
     */
    public Duration pollInterval() {
        return Duration.ofSeconds(pollIntervalSeconds);
    }

    /**
     * pollIntervalSeconds만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withPollIntervalSeconds(long pollIntervalSeconds) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }

    /**
     * stateFile만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withStateFile(String stateFile) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }

    /**
     * maxConcurrent만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withMaxConcurrent(int maxConcurrent) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }

    /**
     * nameFilter만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withNameFilter(ServerNameFilter nameFilter) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }

    /**
     * packageTypeFilter만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withPackageTypeFilter(PackageTypeFilter packageTypeFilter) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }

    /**
     * transportTypeFilter만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withTransportTypeFilter(TransportTypeFilter transportTypeFilter) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }

    /**
     * allowDeprecated만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withAllowDeprecated(boolean allowDeprecated) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }

    /**
     * stateRetention만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withStateRetention(Duration stateRetention) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }

    /**
     * generateOptions만 변경한 새 인스턴스 생성.
     */
    public WatcherConfig withGenerateOptions(GenerateOptions generateOptions) {
        return new WatcherConfig(pollIntervalSeconds, stateFile, maxConcurrent, nameFilter, packageTypeFilter,
            transportTypeFilter, allowDeprecated, stateRetention, generateOptions);
    }
}
