package com.ryuqq.startup.core.initializer;

import com.ryuqq.startup.core.model.ComponentId;
import com.ryuqq.startup.core.model.InitializerKind;

import java.util.List;

/**
 * 컴포넌트 값을 생성하는 초기화기.
 *
 * <p>Initializer는 두 가지 변형을 가집니다:</p>
 * <ul>
 *   <li>{@link SyncInitializer}: 호출 스레드에서 완료될 때까지 실행</li>
 *   <li>{@link AsyncInitializer}: {@link java.util.concurrent.CompletionStage}로 결과를 나중에 전달</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 오케스트레이터가 두 변형만 처리하도록 보장합니다.</p>
 *
 * <p><strong>의존성 순서:</strong> {@link #dependencies()}가 반환한 순서대로
 * 하나씩 해석되며, 모든 의존성이 캐시된 후에 {@code create}가 호출됩니다.</p>
 *
 * @param <T> 생성되는 컴포넌트 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Initializer<T> permits SyncInitializer, AsyncInitializer {

    /**
     * 이 컴포넌트보다 먼저 해석되어야 하는 컴포넌트 목록.
     *
     * @return 의존성 식별자 목록 (선언 순서 유지, 기본값: 빈 목록)
     */
    default List<ComponentId> dependencies() {
        return List.of();
    }

    /**
     * 실행 방식 조회.
     *
     * @return SYNC 또는 ASYNC
     */
    InitializerKind kind();
}
