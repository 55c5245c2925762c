package com.ryuqq.startup.core.initializer;

import com.ryuqq.startup.core.model.InitializerKind;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 초기화기.
 *
 * <p>{@link #create(InitializationContext)}는 즉시 {@link CompletionStage}를 반환하고,
 * 실제 값은 나중에 전달할 수 있습니다. 대기하는 동안 워커 스레드를 점유하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AsyncInitializer&lt;RemoteConfig&gt; remoteConfig =
 *     context -&gt; httpClient.sendAsync(request, ofString()).thenApply(RemoteConfig::parse);
 * </pre>
 *
 * @param <T> 생성되는 컴포넌트 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface AsyncInitializer<T> extends Initializer<T> {

    /**
     * 컴포넌트 값 생성 시작.
     *
     * <p>예외를 직접 던지거나 실패한 Stage를 반환하는 두 경우 모두
     * 오케스트레이터가 InitializationFailedException으로 래핑합니다.</p>
     *
     * @param context 초기화 컨텍스트 (의존성 값 조회 가능)
     * @return 생성 값을 전달할 Stage (null 불가)
     */
    CompletionStage<T> create(InitializationContext context);

    @Override
    default InitializerKind kind() {
        return InitializerKind.ASYNC;
    }
}
