/**
 * WatchRuntime 인터페이스.
 *
 * <p>주기적 폴링 루프의 수명 계약을 정의합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code Watcher}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.packsync.application.runtime;
