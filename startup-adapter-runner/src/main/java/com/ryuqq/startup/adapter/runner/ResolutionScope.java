package com.ryuqq.startup.adapter.runner;

import com.ryuqq.startup.core.model.ComponentId;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 최상위 해석 호출 하나의 진행 중(in-progress) 식별자 집합.
 *
 * <p>순환 감지 전용이며, 재귀 호출 사이에 명시적으로 전달됩니다.
 * 독립된 최상위 호출끼리는 공유하지 않습니다.</p>
 *
 * <p>다른 scope가 소유한 {@link InFlightResolution}에 합류할 때는 {@link #awaiting}으로
 * 대기 대상을 기록합니다. 대기 관계를 따라가다 자기 자신에게 돌아오면 교착(순환)입니다.</p>
 *
 * <p>비동기 경로에서는 의존성 체인이 여러 스레드를 거쳐 실행되므로
 * concurrent set과 volatile 필드를 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ResolutionScope {

    private final Set<ComponentId> inProgress = ConcurrentHashMap.newKeySet();
    private volatile InFlightResolution waitingOn;

    /**
     * 식별자 해석 시작.
     *
     * @param id 식별자
     * @return 새로 등록된 경우 true, 이미 진행 중이면 false (순환)
     */
    boolean enter(ComponentId id) {
        return inProgress.add(id);
    }

    /**
     * 식별자 해석 종료.
     *
     * @param id 식별자
     */
    void exit(ComponentId id) {
        inProgress.remove(id);
    }

    /**
     * 이 scope의 해석 체인에 식별자가 있는지 확인.
     *
     * @param id 식별자
     * @return 진행 중이면 true
     */
    boolean contains(ComponentId id) {
        return inProgress.contains(id);
    }

    void awaiting(InFlightResolution resolution) {
        this.waitingOn = resolution;
    }

    void awaitingDone() {
        this.waitingOn = null;
    }

    /**
     * target에 합류하면 교착이 되는지 확인.
     *
     * <p>target의 owner가 기다리는 해석을 차례로 따라가며, 이미 끝난 해석에서 멈춥니다.
     * 호출자는 게이트를 보유한 상태여야 합니다.</p>
     *
     * @param target 합류하려는 해석
     * @return 대기 체인이 이 scope로 돌아오면 true
     */
    boolean wouldDeadlock(InFlightResolution target) {
        InFlightResolution current = target;
        while (current != null && current.isRunning()) {
            ResolutionScope owner = current.owner();
            if (owner == this) {
                return true;
            }
            current = owner.waitingOn;
        }
        return false;
    }
}
