/**
 * 컴포넌트 식별 모델.
 *
 * <p>해석 캐시의 키({@link com.ryuqq.startup.core.model.ComponentId})와
 * 탐색 결과 단위({@link com.ryuqq.startup.core.model.ComponentDescriptor})를 제공합니다.
 * 모든 타입은 불변입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.core.model;
