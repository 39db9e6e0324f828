package com.ryuqq.packsync.application.reconciler;

/**
 * 하나 이상의 작업이 치명적으로 실패한 사이클.
 *
 * <p>상태 저장이 끝난 뒤에 발생하며, 사이클 전체 요약을 함께 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CriticalGenerationException extends PollCycleException {

    private final PollReport report;

    /**
     * 생성자.
     *
     * @param report 사이클 요약 (치명적 실패 포함)
     */
    public CriticalGenerationException(PollReport report) {
        super("pack generation completed with " + report.criticalFailures().size() + " critical errors");
        this.report = report;
    }

    public PollReport report() {
        return report;
    }
}
