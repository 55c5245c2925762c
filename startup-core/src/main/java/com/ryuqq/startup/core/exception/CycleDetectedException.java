package com.ryuqq.startup.core.exception;

import com.ryuqq.startup.core.model.ComponentId;

/**
 * 의존성 순환 감지.
 *
 * <p>하나의 최상위 해석 호출 안에서 이미 해석 중인 식별자를 다시 만났을 때 발생합니다.
 * 해당 최상위 호출 전체가 중단되며 자동으로 재시도되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CycleDetectedException extends StartupException {

    private final ComponentId componentId;

    /**
     * 생성자.
     *
     * @param componentId 순환을 닫은 식별자
     */
    public CycleDetectedException(ComponentId componentId) {
        super("Cannot initialize " + componentId.getValue() + ". Cycle detected.");
        this.componentId = componentId;
    }

    /**
     * 순환을 닫은 식별자 조회.
     *
     * @return ComponentId
     */
    public ComponentId getComponentId() {
        return componentId;
    }
}
