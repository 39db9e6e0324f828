package com.ryuqq.packsync.application.reconciler;

import com.ryuqq.packsync.core.outcome.Failed;
import com.ryuqq.packsync.core.outcome.TaskOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 폴링 사이클 결과 요약.
 *
 * @param startedAt 사이클 시작 시각 (lastPoll로 기록되는 값)
 * @param duration 사이클 소요 시간
 * @param fetched 레지스트리에서 조회한 레코드 수
 * @param attempted 생성이 필요하다고 선택된 작업 수
 * @param succeeded 생성에 성공한 작업 수
 * @param skipped 취소로 건너뛴 작업 수
 * @param benignFailures 무해한 실패 목록 (이미 존재하는 팩)
 * @param criticalFailures 치명적 실패 목록
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PollReport(
    Instant startedAt,
    Duration duration,
    int fetched,
    int attempted,
    int succeeded,
    int skipped,
    List<Failed> benignFailures,
    List<Failed> criticalFailures
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException startedAt 또는 duration이 null이거나 개수가 음수인 경우
     */
    public PollReport {
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        if (fetched < 0 || attempted < 0 || succeeded < 0 || skipped < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
        benignFailures = benignFailures == null ? List.of() : List.copyOf(benignFailures);
        criticalFailures = criticalFailures == null ? List.of() : List.copyOf(criticalFailures);
    }

    /**
     * 작업이 없었던 사이클.
     *
     * @param startedAt 사이클 시작 시각
     * @param duration 소요 시간
     * @param fetched 조회한 레코드 수
     * @return PollReport
     */
    public static PollReport empty(Instant startedAt, Duration duration, int fetched) {
        return new PollReport(startedAt, duration, fetched, 0, 0, 0, List.of(), List.of());
    }

    /**
     * 작업 결과 목록으로부터 요약 생성.
     *
     * @param startedAt 사이클 시작 시각
     * @param duration 소요 시간
     * @param fetched 조회한 레코드 수
     * @param outcomes 작업별 결과
     * @return PollReport
     */
    public static PollReport from(Instant startedAt, Duration duration, int fetched, List<TaskOutcome> outcomes) {
        int succeeded = 0;
        int skipped = 0;
        List<Failed> benign = new ArrayList<>();
        List<Failed> critical = new ArrayList<>();
        for (TaskOutcome outcome : outcomes) {
            if (outcome.isGenerated()) {
                succeeded++;
            } else if (outcome.isSkipped()) {
                skipped++;
            } else if (outcome instanceof Failed failed) {
                if (outcome.isCriticalFailure()) {
                    critical.add(failed);
                } else {
                    benign.add(failed);
                }
            }
        }
        return new PollReport(startedAt, duration, fetched, outcomes.size(), succeeded, skipped, benign, critical);
    }

    /**
     * 치명적 실패 존재 여부.
     *
     * @return 하나 이상이면 true
     */
    public boolean hasCriticalFailures() {
        return !criticalFailures.isEmpty();
    }

    /**
     * 전체 실패 수 (무해 + 치명).
     *
     * @return 실패 수
     */
    public int failed() {
        return benignFailures.size() + criticalFailures.size();
    }
}
