package com.ryuqq.startup.core.model;

/**
 * 초기화 실행 방식.
 *
 * <ul>
 *   <li>SYNC: 호출 스레드에서 완료될 때까지 블로킹 실행</li>
 *   <li>ASYNC: Job Engine을 통해 백그라운드에서 동시 실행</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum InitializerKind {

    /**
     * 동기 초기화 (호출 컨텍스트에서 실행).
     */
    SYNC,

    /**
     * 비동기 초기화 (워커 풀에서 실행, 중단 가능).
     */
    ASYNC;

    /**
     * 비동기 방식인지 확인.
     *
     * @return ASYNC인 경우 true
     */
    public boolean isAsync() {
        return this == ASYNC;
    }
}
