package com.ryuqq.packsync.core.generator;

import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.model.ServerPackage;
import com.ryuqq.packsync.core.model.ServerRecord;

/**
 * pack 생성기 SPI.
 *
 * <p>해석된 서버/패키지/전송 방식으로부터 배포 산출물을 만듭니다. 템플릿 렌더링과
 * 아카이브 패키징은 구현체의 책임이며 이 모듈의 범위 밖입니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>서로 다른 (server, package) 쌍에 대해 동시에 호출해도 안전해야 함</li>
 *   <li>산출물이 이미 존재하면 {@link PackAlreadyExistsException}을 던져야 함
 *       (forceOverwrite가 아닌 경우)</li>
 *   <li>토큰 확인은 선택 사항. 시작된 호출은 Watcher가 중단하지 않음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try {
 *     generator.generate(token, server, pkg, "http", options);
 * } catch (PackAlreadyExistsException e) {
 *     // benign: 이미 생성된 산출물
 * } catch (PackGeneratorException e) {
 *     // critical
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PackGenerator {

    /**
     * pack 생성.
     *
     * @param token 취소 토큰
     * @param server 서버 레코드
     * @param serverPackage 대상 패키지
     * @param transportType 사용자 표기 전송 타입 (stdio, http, sse)
     * @param options 생성 옵션
     * @throws PackAlreadyExistsException 산출물이 이미 존재하는 경우
     * @throws PackGeneratorException 생성 실패 시
     */
    void generate(
        CancellationToken token,
        ServerRecord server,
        ServerPackage serverPackage,
        String transportType,
        GenerateOptions options
    ) throws PackGeneratorException;
}
