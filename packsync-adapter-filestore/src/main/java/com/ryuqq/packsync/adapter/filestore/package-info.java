/**
 * JSON 파일 기반 StateStore 어댑터.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.packsync.adapter.filestore.FileStateStore} - 크래시 안전 저장을 지원하는 StateStore</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.packsync.adapter.filestore;
