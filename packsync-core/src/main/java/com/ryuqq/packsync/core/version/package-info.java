/**
 * 시맨틱 버전 파싱 및 비교.
 *
 * <p>레지스트리 버전 문자열은 semver 형식을 따르지만 항상 파싱 가능한 것은 아닙니다.
 * 파싱 실패는 {@link com.ryuqq.packsync.core.version.SemanticVersion#tryParse(String)}로 안전하게 걸러냅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.packsync.core.version;
