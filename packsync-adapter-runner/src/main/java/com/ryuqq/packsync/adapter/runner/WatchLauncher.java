package com.ryuqq.packsync.adapter.runner;

import com.ryuqq.packsync.application.runtime.WatchRuntime;
import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.lifecycle.StopReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * JVM 종료 신호(SIGINT/SIGTERM)를 취소 토큰으로 변환하여 WatchRuntime을 실행.
 *
 * <p>종료 훅은 토큰을 취소한 뒤 루프가 끝날 때까지 최대 {@code shutdownGrace} 동안 대기합니다.
 * run()이 정상 반환되면 훅을 제거합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WatchLauncher {

    private static final Logger log = LoggerFactory.getLogger(WatchLauncher.class);

    private static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private WatchLauncher() {
    }

    /**
     * 종료 신호가 올 때까지 실행 (기본 대기 30초).
     *
     * @param runtime 실행할 WatchRuntime
     * @param token 수명 토큰
     * @return 종료 사유
     */
    public static StopReason runUntilShutdown(WatchRuntime runtime, CancellationToken token) {
        return runUntilShutdown(runtime, token, DEFAULT_SHUTDOWN_GRACE);
    }

    /**
     * 종료 신호가 올 때까지 실행.
     *
     * @param runtime 실행할 WatchRuntime
     * @param token 수명 토큰
     * @param shutdownGrace 종료 훅이 루프 종료를 기다리는 최대 시간
     * @return 종료 사유
     */
    public static StopReason runUntilShutdown(WatchRuntime runtime, CancellationToken token, Duration shutdownGrace) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (shutdownGrace == null || shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must not be negative (current: " + shutdownGrace + ")");
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.info("Shutdown signal received, stopping watch");
            token.cancel();
            try {
                if (!finished.await(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Watch did not stop within {}", shutdownGrace);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "packsync-shutdown");

        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return runtime.run(token);
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown already in progress, hook not removed: {}", e.getMessage());
        }
    }
}
