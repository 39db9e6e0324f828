/**
 * pack 생성기 경계.
 *
 * <p>{@link com.ryuqq.packsync.core.generator.PackGenerator}는 외부 협력자입니다.
 * Watcher는 이 인터페이스만 호출하며, 산출물의 디스크 구조는 정의하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.packsync.core.generator;
