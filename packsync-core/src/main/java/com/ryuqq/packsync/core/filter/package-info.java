/**
 * 필터 파이프라인.
 *
 * <p>레지스트리 레코드를 이름, 상태, 패키지 타입, 전송 타입으로 거르고
 * StateStore의 생성 이력과 비교해 실제 생성이 필요한 작업만 남깁니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.packsync.core.filter.ServerNameFilter} - 서버 이름 정확 일치</li>
 *   <li>{@link com.ryuqq.packsync.core.filter.PackageTypeFilter} - 패키지 타입 (대소문자 무시)</li>
 *   <li>{@link com.ryuqq.packsync.core.filter.TransportTypeFilter} - 사용자 표기 전송 타입</li>
 *   <li>{@link com.ryuqq.packsync.core.filter.TaskFilter} - 작업 선택</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.packsync.core.filter;
