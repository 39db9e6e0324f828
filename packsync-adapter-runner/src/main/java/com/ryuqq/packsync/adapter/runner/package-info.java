/**
 * Watch 모드 Runner 어댑터.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.packsync.adapter.runner.Watcher} - 폴링 사이클과 제한된 워커 풀 기반 pack 생성</li>
 *   <li>{@link com.ryuqq.packsync.adapter.runner.WatcherConfig} - Watcher 설정</li>
 *   <li>{@link com.ryuqq.packsync.adapter.runner.WatchLauncher} - 종료 신호를 취소 토큰으로 변환</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.packsync.adapter.runner;
