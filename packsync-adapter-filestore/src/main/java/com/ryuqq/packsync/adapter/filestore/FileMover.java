package com.ryuqq.packsync.adapter.filestore;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 임시 파일을 대상 파일 위치로 옮기는 단계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
interface FileMover {

    /**
     * 원자적 이동, 지원하지 않는 파일 시스템에서는 교체 이동.
     */
    FileMover ATOMIC = (source, target) -> {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    };

    void move(Path source, Path target) throws IOException;
}
