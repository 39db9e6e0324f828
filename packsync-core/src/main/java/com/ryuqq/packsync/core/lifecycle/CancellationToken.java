package com.ryuqq.packsync.core.lifecycle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Watcher 전체 수명을 관장하는 협조적 취소 토큰.
 *
 * <p><strong>취소 경로:</strong></p>
 * <ul>
 *   <li>{@link #cancel()}: 명시적 취소 → {@link StopReason#GRACEFUL_SHUTDOWN}</li>
 *   <li>deadline 경과: → {@link StopReason#DEADLINE_EXCEEDED}</li>
 * </ul>
 *
 * <p>먼저 관측된 사유 하나만 기록됩니다. deadline은 {@link #isCancelled()} 또는
 * {@link #await(Duration)} 호출 시점에 판정됩니다.</p>
 *
 * <p><strong>협조적 취소:</strong> 토큰은 실행 중인 작업을 강제로 중단하지 않습니다.
 * 각 작업이 시작 전 또는 대기 지점에서 토큰을 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final AtomicReference<StopReason> reason = new AtomicReference<>();
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * deadline 없는 토큰 생성.
     *
     * @return CancellationToken 인스턴스
     */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    /**
     * deadline이 있는 토큰 생성.
     *
     * @param timeout 현재 시각 기준 제한 시간 (양수)
     * @return CancellationToken 인스턴스
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     */
    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    /**
     * 명시적 취소.
     *
     * <p>이미 취소된 토큰에 대한 호출은 무시됩니다 (멱등).</p>
     */
    public void cancel() {
        complete(StopReason.GRACEFUL_SHUTDOWN);
    }

    /**
     * 취소 여부 확인 (deadline 경과 포함).
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        checkDeadline();
        return reason.get() != null;
    }

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유 (취소되지 않았으면 empty)
     */
    public Optional<StopReason> stopReason() {
        checkDeadline();
        return Optional.ofNullable(reason.get());
    }

    /**
     * 취소되었으면 예외 발생.
     *
     * @param operation 진행 중이던 작업 설명 (예외 메시지용)
     * @throws OperationCancelledException 취소된 경우
     */
    public void throwIfCancelled(String operation) {
        if (isCancelled()) {
            throw new OperationCancelledException(operation + " cancelled", reason.get());
        }
    }

    /**
     * 최대 duration 동안 취소를 기다림.
     *
     * <p>deadline이 duration보다 먼저 오면 deadline까지만 대기합니다.</p>
     *
     * @param duration 최대 대기 시간
     * @return 대기 중 (또는 이미) 취소되었으면 true, 시간이 다 되었으면 false
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (isCancelled()) {
            return true;
        }
        long waitNanos = duration.toNanos();
        if (deadline != null) {
            long untilDeadline = Duration.between(clock.instant(), deadline).toNanos();
            waitNanos = Math.max(0, Math.min(waitNanos, untilDeadline));
        }
        if (cancelled.await(waitNanos, TimeUnit.NANOSECONDS)) {
            return true;
        }
        return isCancelled();
    }

    private void checkDeadline() {
        if (deadline != null && reason.get() == null && !clock.instant().isBefore(deadline)) {
            complete(StopReason.DEADLINE_EXCEEDED);
        }
    }

    private void complete(StopReason stopReason) {
        if (reason.compareAndSet(null, stopReason)) {
            cancelled.countDown();
        }
    }
}
