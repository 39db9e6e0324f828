package com.ryuqq.packsync.core.generator;

import java.nio.file.Path;

/**
 * pack 생성 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>outputDir: 산출물 디렉터리 (기본 ./packs)</li>
 *   <li>outputType: 디렉터리 또는 아카이브 (기본 PACKDIR)</li>
 *   <li>dryRun: 파일을 쓰지 않고 결과만 보고 (기본 false)</li>
 *   <li>forceOverwrite: 기존 산출물 덮어쓰기, 상태와 무관하게 재생성 (기본 false)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param outputDir 산출물 디렉터리 (null이 아니어야 함)
 * @param outputType 산출물 형태 (null이 아니어야 함)
 * @param dryRun dry-run 여부
 * @param forceOverwrite 강제 덮어쓰기 여부
 */
public record GenerateOptions(
    Path outputDir,
    OutputType outputType,
    boolean dryRun,
    boolean forceOverwrite
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: outputDir=./packs, outputType=PACKDIR, dryRun=false, forceOverwrite=false</p>
     */
    public GenerateOptions() {
        this(Path.of("./packs"), OutputType.PACKDIR, false, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GenerateOptions {
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir cannot be null");
        }
        if (outputType == null) {
            throw new IllegalArgumentException("outputType cannot be null");
        }
    }

    /**
     * outputDir만 변경한 새 인스턴스 생성.
     */
    public GenerateOptions withOutputDir(Path outputDir) {
        return new GenerateOptions(outputDir, outputType, dryRun, forceOverwrite);
    }

    /**
     * outputType만 변경한 새 인스턴스 생성.
     */
    public GenerateOptions withOutputType(OutputType outputType) {
        return new GenerateOptions(outputDir, outputType, dryRun, forceOverwrite);
    }

    /**
     * dryRun만 변경한 새 인스턴스 생성.
     */
    public GenerateOptions withDryRun(boolean dryRun) {
        return new GenerateOptions(outputDir, outputType, dryRun, forceOverwrite);
    }

    /**
     * forceOverwrite만 변경한 새 인스턴스 생성.
     */
    public GenerateOptions withForceOverwrite(boolean forceOverwrite) {
        return new GenerateOptions(outputDir, outputType, dryRun, forceOverwrite);
    }
}
