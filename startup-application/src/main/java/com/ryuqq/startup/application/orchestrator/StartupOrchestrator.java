package com.ryuqq.startup.application.orchestrator;

import com.ryuqq.startup.core.model.ComponentDescriptor;
import com.ryuqq.startup.core.model.ComponentId;
import com.ryuqq.startup.core.spi.ComponentDiscovery;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 컴포넌트 초기화 조정자.
 *
 * <p>각 컴포넌트를 의존성 순서대로 정확히 한 번 생성하고, 결과를 캐시합니다.
 * 동기(블로킹) 해석과 비동기 해석을 모두 지원하며, 백그라운드로 실행된
 * 초기화 작업 전체를 기다리는 barrier를 제공합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StartupOrchestrator orchestrator = new DependencyResolvingOrchestrator(registry, jobEngine);
 * orchestrator.bulkInitialize(discovery);
 *
 * // 동기 해석: 호출 스레드에서 완료
 * Database database = orchestrator.resolveSync(ComponentId.of("database"), Database.class);
 *
 * // 비동기 작업 완료 후 실행
 * orchestrator.afterAllJobs(o -&gt; log.info("startup finished"));
 * </pre>
 *
 * <p><strong>불변식:</strong> 식별자마다 캐시 값은 최대 하나이며, {@code create}는
 * 오케스트레이터 수명 동안 식별자당 최대 한 번 성공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StartupOrchestrator {

    /**
     * 호출 스레드에서 컴포넌트와 그 의존성 전체를 해석.
     *
     * <p>이미 캐시된 경우 즉시 반환합니다. 그렇지 않으면 깊이 우선으로
     * 의존성을 선언 순서대로 먼저 해석한 뒤 {@code create}를 호출합니다.</p>
     *
     * @param id 컴포넌트 식별자
     * @param <T> 값 타입
     * @return 컴포넌트 값
     * @throws IllegalArgumentException id가 null인 경우
     * @throws com.ryuqq.startup.core.exception.CycleDetectedException 의존성 순환 시
     * @throws com.ryuqq.startup.core.exception.InitializationFailedException 조회/생성 실패 시
     */
    <T> T resolveSync(ComponentId id);

    /**
     * 타입을 지정한 동기 해석.
     *
     * @param id 컴포넌트 식별자
     * @param type 기대 타입
     * @param <T> 값 타입
     * @return 컴포넌트 값
     * @throws ClassCastException 값이 type과 호환되지 않는 경우
     * @see #resolveSync(ComponentId)
     */
    <T> T resolveSync(ComponentId id, Class<T> type);

    /**
     * 비동기 해석.
     *
     * <p>동기 해석과 같은 알고리즘이지만, 해석 잠금 대기와 비동기 {@code create} 동안
     * 스레드를 블로킹하지 않습니다.</p>
     *
     * @param id 컴포넌트 식별자
     * @param <T> 값 타입
     * @return 컴포넌트 값 Future (실패 시 CycleDetectedException 또는
     *         InitializationFailedException으로 예외 완료)
     * @throws IllegalArgumentException id가 null인 경우
     */
    <T> CompletableFuture<T> resolveAsync(ComponentId id);

    /**
     * 비동기 해석을 Job Engine에 독립 작업으로 실행 (fire-and-forget).
     *
     * @param id 컴포넌트 식별자
     * @throws IllegalArgumentException id가 null인 경우
     */
    void launchAsync(ComponentId id);

    /**
     * Descriptor 목록 일괄 초기화.
     *
     * <p>모든 항목을 eager 탐색 대상으로 등록한 뒤,
     * SYNC 항목은 순서대로 {@link #resolveSync(ComponentId)},
     * ASYNC 항목은 {@link #launchAsync(ComponentId)}로 실행합니다.</p>
     *
     * @param descriptors 탐색된 Descriptor 목록
     * @throws IllegalArgumentException descriptors가 null인 경우
     */
    void bulkInitialize(List<ComponentDescriptor> descriptors);

    /**
     * 탐색 후 일괄 초기화.
     *
     * @param discovery 탐색 메커니즘
     * @throws com.ryuqq.startup.core.exception.StartupException 탐색 실패 시
     */
    void bulkInitialize(ComponentDiscovery discovery);

    /**
     * 일괄 초기화로 탐색된 컴포넌트인지 확인 (생성 완료 여부와 무관).
     *
     * @param id 컴포넌트 식별자
     * @return 동기 또는 비동기 eager 탐색 대상이면 true
     */
    boolean isEagerlyInitialized(ComponentId id);

    /**
     * 해석 캐시에 값이 있는지 확인.
     *
     * @param id 컴포넌트 식별자
     * @return 캐시된 경우 true
     */
    boolean isInitialized(ComponentId id);

    /**
     * 실행 중인 모든 비동기 작업 완료 대기.
     *
     * @throws com.ryuqq.startup.core.exception.AwaitAllFailedException 작업 실패 시 (첫 번째 실패)
     */
    void awaitAll();

    /**
     * 제한 시간을 둔 전체 작업 대기.
     *
     * @param timeout 최대 대기 시간
     * @throws com.ryuqq.startup.core.exception.AwaitAllFailedException 작업 실패 또는 시간 초과 시
     */
    void awaitAll(Duration timeout);

    /**
     * 비블로킹 전체 작업 대기.
     *
     * @return 모든 작업 완료 시 완료되는 Future
     */
    CompletableFuture<Void> awaitAllAsync();

    /**
     * 모든 추적 작업이 종료 상태인지 확인 (스냅샷).
     *
     * @return 실행 중인 작업이 없으면 true
     */
    boolean isAllDone();

    /**
     * 모든 비동기 작업이 끝난 뒤 콜백 실행.
     *
     * @param callback 실행할 콜백 (오케스트레이터를 인자로 받음)
     * @throws com.ryuqq.startup.core.exception.AwaitAllFailedException 작업 실패 시 (콜백 미실행)
     */
    void afterAllJobs(Consumer<? super StartupOrchestrator> callback);

    /**
     * {@link #afterAllJobs(Consumer)}의 비블로킹 형태.
     *
     * @param callback 실행할 콜백
     * @return 콜백 실행 후 완료되는 Future
     */
    CompletableFuture<Void> afterAllJobsAsync(Consumer<? super StartupOrchestrator> callback);
}
