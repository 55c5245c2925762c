package com.ryuqq.startup.adapter.runner;

import com.ryuqq.startup.core.model.ComponentId;

import java.util.concurrent.CompletableFuture;

/**
 * 진행 중인 식별자 해석 하나 (single flight).
 *
 * <p>식별자마다 최대 하나만 존재하며, 같은 식별자를 요청한 다른 해석은
 * 새로 생성하지 않고 {@link #result()}에 합류합니다.
 * owner는 이 해석을 소유한 {@link ResolutionScope}로, 교차 해석 간 교착 감지에 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class InFlightResolution {

    private final ComponentId componentId;
    private final ResolutionScope owner;
    private final CompletableFuture<Object> result = new CompletableFuture<>();

    InFlightResolution(ComponentId componentId, ResolutionScope owner) {
        this.componentId = componentId;
        this.owner = owner;
    }

    ComponentId componentId() {
        return componentId;
    }

    ResolutionScope owner() {
        return owner;
    }

    /**
     * 해석 결과 (성공 시 값, 실패 시 원인 예외로 완료).
     */
    CompletableFuture<Object> result() {
        return result;
    }

    boolean isRunning() {
        return !result.isDone();
    }
}
