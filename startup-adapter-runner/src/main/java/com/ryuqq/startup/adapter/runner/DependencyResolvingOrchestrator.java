package com.ryuqq.startup.adapter.runner;

import com.ryuqq.startup.application.engine.JobEngine;
import com.ryuqq.startup.application.orchestrator.StartupOrchestrator;
import com.ryuqq.startup.core.exception.CycleDetectedException;
import com.ryuqq.startup.core.exception.InitializationFailedException;
import com.ryuqq.startup.core.exception.StartupException;
import com.ryuqq.startup.core.initializer.AsyncInitializer;
import com.ryuqq.startup.core.initializer.InitializationContext;
import com.ryuqq.startup.core.initializer.Initializer;
import com.ryuqq.startup.core.initializer.SyncInitializer;
import com.ryuqq.startup.core.model.ComponentDescriptor;
import com.ryuqq.startup.core.model.ComponentId;
import com.ryuqq.startup.core.spi.ComponentDiscovery;
import com.ryuqq.startup.core.spi.InitializerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * 의존성 해석 기반 StartupOrchestrator 구현체.
 *
 * <p>메모이제이션 캐시와 순환 감지를 갖춘 깊이 우선 해석기입니다.
 * 동기 분기는 호출 스레드에서, 비동기 분기는 {@link JobEngine}의 워커 풀에서 실행합니다.</p>
 *
 * <p><strong>해석 알고리즘 (동기/비동기 공통):</strong></p>
 * <pre>
 * resolve(id, scope):
 *   [게이트 보유]
 *   1. 캐시에 있으면 → 캐시 값 반환
 *   2. scope에 이미 있으면 → CycleDetectedException(id)
 *   3. 다른 해석이 진행 중이면 → 대기 체인이 scope로 돌아오면 CycleDetectedException(id),
 *      아니면 그 결과에 합류
 *   4. scope.enter(id), 진행 중 목록에 등록
 *   [게이트 해제]
 *   5. initializer = registry.lookup(id)            (실패 → InitializationFailedException)
 *   6. 선언 순서대로 resolve(dep, scope)
 *   7. value = initializer.create(context)          (실패 → InitializationFailedException)
 *   8. cache[id] = value, 진행 중 목록에서 제거, 대기자에게 결과 전달
 *   실패 시: 진행 중 목록에서 제거, 대기자에게 실패 전달
 *   finally: scope.exit(id)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>{@link ResolutionGate}는 확인-등록 단계(1~4)에서만 보유</li>
 *   <li>식별자별 진행 중 해석은 하나뿐 (single flight) → create는 식별자당 한 번</li>
 *   <li>서로 다른 식별자의 해석은 동시에 진행</li>
 *   <li>create 실행 중에는 현재 scope를 스레드에 기록 → create 안의 중첩
 *       {@code resolveSync}는 같은 scope를 이어서 사용</li>
 *   <li>의존성은 비동기 경로에서도 순차적으로 해석 (병렬 해석 없음)</li>
 * </ul>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>실패한 식별자는 캐시되지 않음 → 다음 요청 시 다시 생성 시도</li>
 *   <li>실패 전에 캐시된 의존성은 롤백하지 않음</li>
 *   <li>하위 의존성에서 발생한 StartupException은 래핑 없이 그대로 전파</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DependencyResolvingOrchestrator implements StartupOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolvingOrchestrator.class);

    private final InitializerRegistry registry;
    private final JobEngine jobEngine;
    private final OrchestratorConfig config;
    private final Executor continuationExecutor;

    private final ResolutionGate gate = new ResolutionGate();
    private final ThreadLocal<ResolutionScope> activeScope = new ThreadLocal<>();
    private final ConcurrentHashMap<ComponentId, Object> initialized = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ComponentId, InFlightResolution> inFlight = new ConcurrentHashMap<>();
    private final Set<ComponentId> syncDiscovered = ConcurrentHashMap.newKeySet();
    private final Set<ComponentId> asyncDiscovered = ConcurrentHashMap.newKeySet();

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param registry Initializer 레지스트리
     * @param jobEngine 비동기 작업 엔진
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DependencyResolvingOrchestrator(InitializerRegistry registry, JobEngine jobEngine) {
        this(registry, jobEngine, new OrchestratorConfig());
    }

    /**
     * 생성자 (설정 주입).
     *
     * <p>비동기 해석은 {@link JobEngine#executor()}에서 실행합니다.</p>
     *
     * @param registry Initializer 레지스트리
     * @param jobEngine 비동기 작업 엔진
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DependencyResolvingOrchestrator(InitializerRegistry registry, JobEngine jobEngine,
                                           OrchestratorConfig config) {
        this(registry, jobEngine, config, executorOf(jobEngine));
    }

    /**
     * 생성자 (비동기 후속 작업 Executor 주입).
     *
     * <p>continuationExecutor는 게이트 Permit을 받은 뒤의 비동기 해석을 실행합니다.</p>
     *
     * @param registry Initializer 레지스트리
     * @param jobEngine 비동기 작업 엔진
     * @param config 설정
     * @param continuationExecutor 비동기 해석 실행 Executor
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DependencyResolvingOrchestrator(InitializerRegistry registry, JobEngine jobEngine,
                                           OrchestratorConfig config, Executor continuationExecutor) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (jobEngine == null) {
            throw new IllegalArgumentException("jobEngine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (continuationExecutor == null) {
            throw new IllegalArgumentException("continuationExecutor cannot be null");
        }
        this.registry = registry;
        this.jobEngine = jobEngine;
        this.config = config;
        this.continuationExecutor = continuationExecutor;
    }

    private static Executor executorOf(JobEngine jobEngine) {
        if (jobEngine == null) {
            throw new IllegalArgumentException("jobEngine cannot be null");
        }
        return jobEngine.executor();
    }

    // ============================================================
    // 동기 해석
    // ============================================================

    @Override
    public <T> T resolveSync(ComponentId id) {
        requireId(id);

        Object cached = initialized.get(id);
        if (cached != null) {
            return cast(cached);
        }

        // create() 안에서 다시 호출한 경우: 진행 중인 scope를 이어서 사용
        ResolutionScope active = activeScope.get();
        return cast(resolveSync(id, active != null ? active : new ResolutionScope()));
    }

    @Override
    public <T> T resolveSync(ComponentId id, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return type.cast(resolveSync(id));
    }

    private Object resolveSync(ComponentId id, ResolutionScope scope) {
        Claim claim = claimBlocking(id, scope);
        if (claim.isCached()) {
            return claim.value();
        }
        if (!claim.owned()) {
            return join(claim.resolution(), scope);
        }

        InFlightResolution resolution = claim.resolution();
        try {
            Initializer<?> initializer = lookup(id);
            for (ComponentId dependency : dependenciesOf(id, initializer)) {
                resolveSync(dependency, scope);
            }

            Object value = createBlocking(id, initializer, scope);
            succeed(resolution, scope, value);
            return value;
        } catch (RuntimeException | Error e) {
            fail(resolution, scope, e);
            throw e;
        }
    }

    /**
     * 다른 scope가 진행 중인 해석의 결과를 호출 스레드에서 대기.
     */
    private Object join(InFlightResolution resolution, ResolutionScope scope) {
        try {
            return resolution.result().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitializationFailedException(resolution.componentId(), e);
        } catch (ExecutionException e) {
            Throwable cause = Futures.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new InitializationFailedException(resolution.componentId(), cause);
        } finally {
            scope.awaitingDone();
        }
    }

    /**
     * 호출 스레드에서 값 생성.
     *
     * <p>비동기 Initializer를 만나면 Stage가 완료될 때까지 호출 스레드에서 대기합니다.</p>
     */
    private Object createBlocking(ComponentId id, Initializer<?> initializer, ResolutionScope scope) {
        InitializationContext context = contextFor(id);
        logInitializing(id);

        Object value;
        ResolutionScope previous = enterCreate(scope);
        try {
            if (initializer instanceof SyncInitializer<?> sync) {
                value = sync.create(context);
            } else {
                CompletionStage<?> stage = ((AsyncInitializer<?>) initializer).create(context);
                value = requireStage(id, stage).toCompletableFuture().get();
            }
        } catch (StartupException e) {
            // create() 안의 중첩 해석이 실패한 경우
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitializationFailedException(id, e);
        } catch (Exception e) {
            throw new InitializationFailedException(id, Futures.unwrap(e));
        } finally {
            exitCreate(previous);
        }

        requireValue(id, value);
        logInitialized(id);
        return value;
    }

    // ============================================================
    // 비동기 해석
    // ============================================================

    @Override
    public <T> CompletableFuture<T> resolveAsync(ComponentId id) {
        requireId(id);

        Object cached = initialized.get(id);
        if (cached != null) {
            return CompletableFuture.completedFuture(cast(cached));
        }

        return resolveAsync(id, new ResolutionScope())
            .thenApply(DependencyResolvingOrchestrator::<T>cast);
    }

    private CompletableFuture<Object> resolveAsync(ComponentId id, ResolutionScope scope) {
        return claimAsync(id, scope).thenCompose(claim -> {
            if (claim.isCached()) {
                return CompletableFuture.completedFuture(claim.value());
            }
            if (!claim.owned()) {
                return claim.resolution().result()
                    .whenComplete((value, failure) -> scope.awaitingDone());
            }
            return resolveOwnedAsync(id, claim.resolution(), scope);
        });
    }

    private CompletableFuture<Object> resolveOwnedAsync(ComponentId id, InFlightResolution resolution,
                                                        ResolutionScope scope) {
        Initializer<?> initializer;
        List<ComponentId> dependencies;
        try {
            initializer = lookup(id);
            dependencies = dependenciesOf(id, initializer);
        } catch (RuntimeException e) {
            fail(resolution, scope, e);
            return resolution.result();
        }

        // 의존성은 선언 순서대로 하나씩 (이전 의존성 완료 후 다음 의존성 해석)
        CompletableFuture<Object> chain = CompletableFuture.completedFuture(null);
        for (ComponentId dependency : dependencies) {
            chain = chain.thenCompose(ignored -> resolveAsync(dependency, scope));
        }

        chain.thenCompose(ignored -> createAsync(id, initializer, scope))
            .whenComplete((value, failure) -> {
                if (failure != null) {
                    fail(resolution, scope, Futures.unwrap(failure));
                } else {
                    succeed(resolution, scope, value);
                }
            });
        return resolution.result();
    }

    /**
     * 값 생성 시작 (비동기 경로).
     *
     * <p>동기 Initializer는 체인 안에서 바로 실행합니다.</p>
     */
    private CompletableFuture<Object> createAsync(ComponentId id, Initializer<?> initializer,
                                                  ResolutionScope scope) {
        InitializationContext context = contextFor(id);
        logInitializing(id);

        CompletionStage<?> stage;
        ResolutionScope previous = enterCreate(scope);
        try {
            if (initializer instanceof SyncInitializer<?> sync) {
                stage = CompletableFuture.completedFuture(sync.create(context));
            } else {
                stage = requireStage(id, ((AsyncInitializer<?>) initializer).create(context));
            }
        } catch (StartupException e) {
            return CompletableFuture.failedFuture(e);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(asyncFailure(id, e));
        } finally {
            exitCreate(previous);
        }

        return stage.toCompletableFuture().handle((value, failure) -> {
            if (failure != null) {
                throw asyncFailure(id, Futures.unwrap(failure));
            }
            requireValue(id, value);
            logInitialized(id);
            return value;
        });
    }

    private InitializationFailedException asyncFailure(ComponentId id, Throwable cause) {
        log.error("Error initializing {}: {}", id.getValue(), cause.getMessage(), cause);
        return new InitializationFailedException(id, cause);
    }

    // ============================================================
    // 진행 중 해석 관리
    // ============================================================

    /**
     * 확인-등록 결과.
     *
     * @param value 캐시된 값 (캐시 적중 시에만)
     * @param resolution 소유하거나 합류한 진행 중 해석
     * @param owned 호출자가 해석을 소유하여 직접 생성해야 하면 true
     */
    private record Claim(Object value, InFlightResolution resolution, boolean owned) {

        static Claim cached(Object value) {
            return new Claim(value, null, false);
        }

        static Claim join(InFlightResolution resolution) {
            return new Claim(null, resolution, false);
        }

        static Claim own(InFlightResolution resolution) {
            return new Claim(null, resolution, true);
        }

        boolean isCached() {
            return resolution == null;
        }
    }

    private Claim claimBlocking(ComponentId id, ResolutionScope scope) {
        ResolutionGate.Permit permit = gate.acquireBlocking();
        try {
            return claim(id, scope);
        } finally {
            permit.release();
        }
    }

    private CompletableFuture<Claim> claimAsync(ComponentId id, ResolutionScope scope) {
        return gate.acquire().thenApplyAsync(permit -> {
            try {
                return claim(id, scope);
            } finally {
                permit.release();
            }
        }, continuationExecutor);
    }

    /**
     * 캐시, 순환, 진행 중 해석을 확인하고 필요하면 새 해석을 등록 (게이트 보유 상태).
     */
    private Claim claim(ComponentId id, ResolutionScope scope) {
        Object cached = initialized.get(id);
        if (cached != null) {
            return Claim.cached(cached);
        }
        if (scope.contains(id)) {
            throw new CycleDetectedException(id);
        }

        InFlightResolution running = inFlight.get(id);
        if (running != null) {
            if (scope.wouldDeadlock(running)) {
                throw new CycleDetectedException(id);
            }
            scope.awaiting(running);
            return Claim.join(running);
        }

        scope.enter(id);
        InFlightResolution resolution = new InFlightResolution(id, scope);
        inFlight.put(id, resolution);
        return Claim.own(resolution);
    }

    private void succeed(InFlightResolution resolution, ResolutionScope scope, Object value) {
        ComponentId id = resolution.componentId();
        initialized.put(id, value);
        inFlight.remove(id, resolution);
        scope.exit(id);
        resolution.result().complete(value);
    }

    private void fail(InFlightResolution resolution, ResolutionScope scope, Throwable failure) {
        ComponentId id = resolution.componentId();
        inFlight.remove(id, resolution);
        scope.exit(id);
        resolution.result().completeExceptionally(failure);
    }

    private ResolutionScope enterCreate(ResolutionScope scope) {
        ResolutionScope previous = activeScope.get();
        activeScope.set(scope);
        return previous;
    }

    private void exitCreate(ResolutionScope previous) {
        if (previous == null) {
            activeScope.remove();
        } else {
            activeScope.set(previous);
        }
    }

    @Override
    public void launchAsync(ComponentId id) {
        requireId(id);
        jobEngine.launch(id.getValue(), () -> resolveAsync(id));
    }

    // ============================================================
    // 일괄 초기화
    // ============================================================

    @Override
    public void bulkInitialize(List<ComponentDescriptor> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }

        for (ComponentDescriptor descriptor : descriptors) {
            if (descriptor.kind().isAsync()) {
                asyncDiscovered.add(descriptor.id());
            } else {
                syncDiscovered.add(descriptor.id());
            }
            log.debug("Discovered {} ({})", descriptor.id().getValue(), descriptor.kind());
        }

        // 1. SYNC: 순서대로 호출 스레드에서 해석
        for (ComponentDescriptor descriptor : descriptors) {
            if (!descriptor.kind().isAsync()) {
                resolveSync(descriptor.id());
            }
        }

        // 2. ASYNC: 독립 작업으로 실행
        for (ComponentDescriptor descriptor : descriptors) {
            if (descriptor.kind().isAsync()) {
                launchAsync(descriptor.id());
            }
        }
    }

    @Override
    public void bulkInitialize(ComponentDiscovery discovery) {
        if (discovery == null) {
            throw new IllegalArgumentException("discovery cannot be null");
        }

        List<ComponentDescriptor> descriptors;
        try {
            descriptors = discovery.discover();
        } catch (StartupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StartupException("Component discovery failed", e);
        }
        if (descriptors == null) {
            throw new StartupException("Component discovery returned no descriptors");
        }

        log.info("Discovered {} components for eager initialization", descriptors.size());
        bulkInitialize(descriptors);
    }

    @Override
    public boolean isEagerlyInitialized(ComponentId id) {
        requireId(id);
        return syncDiscovered.contains(id) || asyncDiscovered.contains(id);
    }

    @Override
    public boolean isInitialized(ComponentId id) {
        requireId(id);
        return initialized.containsKey(id);
    }

    // ============================================================
    // 작업 대기 (Job Engine 위임)
    // ============================================================

    @Override
    public void awaitAll() {
        jobEngine.awaitAll();
    }

    @Override
    public void awaitAll(Duration timeout) {
        jobEngine.awaitAll(timeout);
    }

    @Override
    public CompletableFuture<Void> awaitAllAsync() {
        return jobEngine.awaitAllAsync();
    }

    @Override
    public boolean isAllDone() {
        return jobEngine.isAllDone();
    }

    @Override
    public void afterAllJobs(Consumer<? super StartupOrchestrator> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        awaitAll();
        callback.accept(this);
    }

    @Override
    public CompletableFuture<Void> afterAllJobsAsync(Consumer<? super StartupOrchestrator> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        return awaitAllAsync().thenRun(() -> callback.accept(this));
    }

    // ============================================================
    // 내부 헬퍼
    // ============================================================

    private Initializer<?> lookup(ComponentId id) {
        Initializer<?> initializer;
        try {
            initializer = registry.lookup(id);
        } catch (RuntimeException e) {
            throw new InitializationFailedException(id, e);
        }
        if (initializer == null) {
            throw new InitializationFailedException(id,
                new IllegalStateException("Registry returned no initializer for " + id.getValue()));
        }
        return initializer;
    }

    private static List<ComponentId> dependenciesOf(ComponentId id, Initializer<?> initializer) {
        List<ComponentId> dependencies;
        try {
            dependencies = initializer.dependencies();
        } catch (RuntimeException e) {
            throw new InitializationFailedException(id, e);
        }
        if (dependencies == null) {
            throw new InitializationFailedException(id,
                new IllegalStateException(id.getValue() + " declared no dependency list"));
        }
        for (ComponentId dependency : dependencies) {
            if (dependency == null) {
                throw new InitializationFailedException(id,
                    new IllegalStateException(id.getValue() + " declared a null dependency"));
            }
        }
        return dependencies;
    }

    private InitializationContext contextFor(ComponentId id) {
        return new DefaultInitializationContext(id, config.hostContext(), initialized);
    }

    private static CompletionStage<?> requireStage(ComponentId id, CompletionStage<?> stage) {
        if (stage == null) {
            throw new IllegalStateException(id.getValue() + " returned no completion stage");
        }
        return stage;
    }

    private static void requireValue(ComponentId id, Object value) {
        if (value == null) {
            throw new InitializationFailedException(id,
                new IllegalStateException(id.getValue() + " produced a null value"));
        }
    }

    private static <T> T cast(Object value) {
        return (T) value;
    }

    private static void requireId(ComponentId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    private void logInitializing(ComponentId id) {
        if (config.verboseLogging()) {
            log.info("Initializing {}", id.getValue());
        } else {
            log.debug("Initializing {}", id.getValue());
        }
    }

    private void logInitialized(ComponentId id) {
        if (config.verboseLogging()) {
            log.info("Initialized {}", id.getValue());
        } else {
            log.debug("Initialized {}", id.getValue());
        }
    }
}
