package com.ryuqq.packsync.core.generator;

import java.nio.file.Path;

/**
 * 산출물이 이미 존재하여 생성하지 않은 경우.
 *
 * <p>Watcher는 이 예외를 benign 실패로 분류합니다. 예외 타입으로 구분하며
 * 메시지 문자열을 비교하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PackAlreadyExistsException extends PackGeneratorException {

    /**
     * 이미 존재하는 산출물 종류.
     */
    public enum Artifact {
        DIRECTORY,
        ARCHIVE
    }

    private final Artifact artifact;
    private final Path path;

    /**
     * 생성자.
     *
     * @param artifact 산출물 종류
     * @param path 이미 존재하는 경로
     */
    public PackAlreadyExistsException(Artifact artifact, Path path) {
        super("pack " + (artifact == Artifact.ARCHIVE ? "archive" : "directory") + " already exists: " + path);
        this.artifact = artifact;
        this.path = path;
    }

    /**
     * 산출물 종류 조회.
     *
     * @return 산출물 종류
     */
    public Artifact artifact() {
        return artifact;
    }

    /**
     * 이미 존재하는 경로 조회.
     *
     * @return 경로
     */
    public Path path() {
        return path;
    }
}
