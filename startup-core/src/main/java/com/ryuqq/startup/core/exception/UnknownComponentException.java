package com.ryuqq.startup.core.exception;

import com.ryuqq.startup.core.model.ComponentId;

/**
 * 레지스트리에 등록되지 않은 식별자.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnknownComponentException extends StartupException {

    private final ComponentId componentId;

    /**
     * 생성자.
     *
     * @param componentId 조회한 식별자
     */
    public UnknownComponentException(ComponentId componentId) {
        super("No initializer registered for " + componentId.getValue());
        this.componentId = componentId;
    }

    public ComponentId getComponentId() {
        return componentId;
    }
}
