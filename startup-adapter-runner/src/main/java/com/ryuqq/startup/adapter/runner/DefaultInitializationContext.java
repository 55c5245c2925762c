package com.ryuqq.startup.adapter.runner;

import com.ryuqq.startup.core.initializer.InitializationContext;
import com.ryuqq.startup.core.model.ComponentId;

import java.util.Map;

/**
 * 해석 캐시를 읽는 InitializationContext 구현체.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class DefaultInitializationContext implements InitializationContext {

    private final ComponentId componentId;
    private final Object hostContext;
    private final Map<ComponentId, Object> resolved;

    DefaultInitializationContext(ComponentId componentId, Object hostContext, Map<ComponentId, Object> resolved) {
        this.componentId = componentId;
        this.hostContext = hostContext;
        this.resolved = resolved;
    }

    @Override
    public ComponentId componentId() {
        return componentId;
    }

    @Override
    public Object hostContext() {
        return hostContext;
    }

    @Override
    public <T> T dependency(ComponentId id, Class<T> type) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Object value = resolved.get(id);
        if (value == null) {
            throw new IllegalStateException(
                id.getValue() + " has not been initialized (requested by " + componentId.getValue() + ")");
        }
        return type.cast(value);
    }
}
