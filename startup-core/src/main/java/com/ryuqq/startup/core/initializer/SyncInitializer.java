package com.ryuqq.startup.core.initializer;

import com.ryuqq.startup.core.model.InitializerKind;

/**
 * 동기 초기화기.
 *
 * <p>{@link #create(InitializationContext)}는 호출 스레드에서 완료될 때까지 실행됩니다.
 * 특정 실행 컨텍스트(예: UI 스레드)에서 실행되어야 한다는 제약은
 * 호출자가 보장하며, 오케스트레이터는 이를 강제하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SyncInitializer&lt;Database&gt; database = context -&gt; Database.open(context.hostContext());
 * </pre>
 *
 * @param <T> 생성되는 컴포넌트 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface SyncInitializer<T> extends Initializer<T> {

    /**
     * 컴포넌트 값 생성.
     *
     * @param context 초기화 컨텍스트 (의존성 값 조회 가능)
     * @return 생성된 값 (null 불가)
     * @throws Exception 생성 실패 시 (오케스트레이터가 InitializationFailedException으로 래핑)
     */
    T create(InitializationContext context) throws Exception;

    @Override
    default InitializerKind kind() {
        return InitializerKind.SYNC;
    }
}
