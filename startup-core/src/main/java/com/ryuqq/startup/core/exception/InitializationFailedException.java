package com.ryuqq.startup.core.exception;

import com.ryuqq.startup.core.model.ComponentId;

/**
 * 컴포넌트 조회 또는 생성 실패.
 *
 * <p>실패한 식별자는 캐시되지 않으므로, 이후 해석 요청 시 생성을 처음부터 다시 시도합니다.
 * 실패 전에 이미 캐시된 의존성은 그대로 유지됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InitializationFailedException extends StartupException {

    private final ComponentId componentId;

    /**
     * 생성자.
     *
     * @param componentId 실패한 식별자
     * @param cause 원래 원인
     */
    public InitializationFailedException(ComponentId componentId, Throwable cause) {
        super("Failed to initialize " + componentId.getValue() + ": " + cause, cause);
        this.componentId = componentId;
    }

    /**
     * 실패한 식별자 조회.
     *
     * @return ComponentId
     */
    public ComponentId getComponentId() {
        return componentId;
    }
}
