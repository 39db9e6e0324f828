/**
 * 레지스트리 동기화 도메인 모델.
 *
 * <p>레지스트리에서 조회한 레코드({@link com.ryuqq.packsync.core.model.ServerRecord}),
 * 파생된 생성 작업({@link com.ryuqq.packsync.core.model.GenerationTask}),
 * 영속화되는 상태({@link com.ryuqq.packsync.core.model.ServerState},
 * {@link com.ryuqq.packsync.core.model.WatchState})를 정의합니다.</p>
 *
 * <h2>생명주기</h2>
 * <ul>
 *   <li>ServerRecord / GenerationTask: 한 poll cycle 동안만 유지</li>
 *   <li>ServerState: 같은 키로 재생성되거나 보존 기간 초과로 정리될 때까지 유지</li>
 *   <li>WatchState: 프로세스 수명 동안 유지, 상태 파일로 재시작 간 보존</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.packsync.core.model;
