package com.ryuqq.startup.adapter.runner;

import com.ryuqq.startup.application.engine.JobEngine;
import com.ryuqq.startup.application.orchestrator.StartupOrchestrator;
import com.ryuqq.startup.core.exception.InitializationFailedException;
import com.ryuqq.startup.core.exception.StartupException;
import com.ryuqq.startup.core.initializer.AsyncInitializer;
import com.ryuqq.startup.core.initializer.InitializationContext;
import com.ryuqq.startup.core.initializer.SyncInitializer;
import com.ryuqq.startup.core.model.ComponentDescriptor;
import com.ryuqq.startup.core.model.ComponentId;
import com.ryuqq.startup.core.spi.ComponentDiscovery;
import com.ryuqq.startup.core.spi.InitializerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * DependencyResolvingOrchestrator 유닛 테스트.
 *
 * <p>InitializerRegistry와 JobEngine을 Mock으로 대체하여 다음을 검증합니다:</p>
 * <ul>
 *   <li>캐시된 값은 레지스트리를 다시 조회하지 않음</li>
 *   <li>레지스트리 조회 실패는 InitializationFailedException으로 래핑</li>
 *   <li>ASYNC 디스크립터만 Job Engine으로 위임</li>
 *   <li>awaitAll 계열 연산은 Job Engine에 위임</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DependencyResolvingOrchestratorTest {

    private static final ComponentId DATABASE = ComponentId.of("database");
    private static final ComponentId ANALYTICS = ComponentId.of("analytics");

    @Mock
    private InitializerRegistry registry;

    @Mock
    private JobEngine jobEngine;

    @Mock
    private Consumer<StartupOrchestrator> callback;

    @Captor
    private ArgumentCaptor<Supplier<? extends CompletionStage<?>>> task;

    private DependencyResolvingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        // 후속 작업을 호출 스레드에서 바로 실행
        orchestrator = new DependencyResolvingOrchestrator(registry, jobEngine, new OrchestratorConfig(), Runnable::run);
    }

    // ============================================================
    // 1. 동기 해석
    // ============================================================

    @Test
    void resolveSync_캐시된_값은_레지스트리를_다시_조회하지_않음() {
        // given
        doReturn((SyncInitializer<String>) context -> "db-connection").when(registry).lookup(DATABASE);

        // when
        String first = orchestrator.resolveSync(DATABASE);
        String second = orchestrator.resolveSync(DATABASE);

        // then
        assertThat(first).isEqualTo("db-connection");
        assertThat(second).isSameAs(first);
        verify(registry, times(1)).lookup(DATABASE);
        assertThat(orchestrator.isInitialized(DATABASE)).isTrue();
    }

    @Test
    void resolveSync_호스트_컨텍스트를_create에_전달() {
        // given
        Object host = new Object();
        AtomicReference<InitializationContext> seen = new AtomicReference<>();
        orchestrator = new DependencyResolvingOrchestrator(registry, jobEngine,
            new OrchestratorConfig().withHostContext(host).withVerboseLogging(true), Runnable::run);
        doReturn((SyncInitializer<String>) context -> {
            seen.set(context);
            return "db";
        }).when(registry).lookup(DATABASE);

        // when
        orchestrator.resolveSync(DATABASE);

        // then
        assertThat(seen.get().hostContext()).isSameAs(host);
        assertThat(seen.get().componentId()).isEqualTo(DATABASE);
    }

    @Test
    void resolveSync_레지스트리_조회_실패는_래핑() {
        // given
        IllegalStateException lookupFailure = new IllegalStateException("registry unavailable");
        when(registry.lookup(DATABASE)).thenThrow(lookupFailure);

        // when & then
        assertThatThrownBy(() -> orchestrator.resolveSync(DATABASE))
            .isInstanceOf(InitializationFailedException.class)
            .hasCause(lookupFailure);
        assertThat(orchestrator.isInitialized(DATABASE)).isFalse();
    }

    @Test
    void resolveSync_레지스트리가_null을_반환하면_실패() {
        // given
        when(registry.lookup(DATABASE)).thenReturn(null);

        // when & then
        assertThatThrownBy(() -> orchestrator.resolveSync(DATABASE))
            .isInstanceOf(InitializationFailedException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void resolveSync_캐시되지_않은_의존성을_컨텍스트에서_요청하면_실패() {
        // given: 선언하지 않은 의존성을 읽으려는 초기화기
        doReturn((SyncInitializer<String>) context -> context.dependency(ANALYTICS, String.class))
            .when(registry).lookup(DATABASE);

        // when & then
        assertThatThrownBy(() -> orchestrator.resolveSync(DATABASE))
            .isInstanceOf(InitializationFailedException.class)
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("analytics");
    }

    @Test
    void resolveSync_null_인자는_거부() {
        assertThatThrownBy(() -> orchestrator.resolveSync(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.resolveSync(DATABASE, null))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(registry);
    }

    // ============================================================
    // 2. 비동기 해석
    // ============================================================

    @Test
    void resolveAsync_비동기_초기화기_결과를_캐시() {
        // given
        CompletableFuture<String> stage = new CompletableFuture<>();
        doReturn((AsyncInitializer<String>) context -> stage).when(registry).lookup(ANALYTICS);

        // when
        CompletableFuture<String> result = orchestrator.resolveAsync(ANALYTICS);

        // then
        assertThat(result).isNotDone();
        assertThat(orchestrator.isInitialized(ANALYTICS)).isFalse();

        stage.complete("analytics-client");
        assertThat(result).isCompletedWithValue("analytics-client");
        assertThat(orchestrator.isInitialized(ANALYTICS)).isTrue();
    }

    @Test
    void resolveAsync_null_Stage는_실패() {
        // given
        doReturn((AsyncInitializer<String>) context -> null).when(registry).lookup(ANALYTICS);

        // when
        CompletableFuture<Object> result = orchestrator.resolveAsync(ANALYTICS);

        // then
        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join)
            .hasCauseInstanceOf(InitializationFailedException.class);
    }

    @Test
    void launchAsync_Job_Engine에_식별자_라벨로_위임() {
        // given
        doReturn((AsyncInitializer<String>) context -> CompletableFuture.completedFuture("client"))
            .when(registry).lookup(ANALYTICS);

        // when
        orchestrator.launchAsync(ANALYTICS);

        // then
        verify(jobEngine).launch(eq("analytics"), task.capture());
        verifyNoInteractions(registry);

        CompletionStage<?> stage = task.getValue().get();
        assertThat(stage.toCompletableFuture().join()).isEqualTo("client");
        assertThat(orchestrator.isInitialized(ANALYTICS)).isTrue();
    }

    // ============================================================
    // 3. 일괄 초기화
    // ============================================================

    @Test
    void bulkInitialize_SYNC는_즉시_해석하고_ASYNC만_작업으로_실행() {
        // given
        doReturn((SyncInitializer<String>) context -> "db").when(registry).lookup(DATABASE);

        // when
        orchestrator.bulkInitialize(List.of(
            ComponentDescriptor.async(ANALYTICS),
            ComponentDescriptor.sync(DATABASE)));

        // then
        assertThat(orchestrator.isInitialized(DATABASE)).isTrue();
        verify(jobEngine).launch(eq("analytics"), any());
        verify(jobEngine, never()).launch(eq("database"), any());
        assertThat(orchestrator.isEagerlyInitialized(DATABASE)).isTrue();
        assertThat(orchestrator.isEagerlyInitialized(ANALYTICS)).isTrue();
    }

    @Test
    void bulkInitialize_디스커버리_실패는_StartupException() {
        // given
        ComponentDiscovery broken = () -> {
            throw new IllegalStateException("registration file unreadable");
        };

        // when & then
        assertThatThrownBy(() -> orchestrator.bulkInitialize(broken))
            .isInstanceOf(StartupException.class)
            .hasMessageContaining("discovery failed")
            .hasCauseInstanceOf(IllegalStateException.class);
        verifyNoInteractions(registry, jobEngine);
    }

    @Test
    void bulkInitialize_디스커버리가_null을_반환하면_StartupException() {
        // when & then
        assertThatThrownBy(() -> orchestrator.bulkInitialize((ComponentDiscovery) () -> null))
            .isInstanceOf(StartupException.class);
    }

    @Test
    void bulkInitialize_디스커버리_결과를_순서대로_해석() {
        // given
        doReturn((SyncInitializer<String>) context -> "db").when(registry).lookup(DATABASE);
        ComponentDiscovery discovery = () -> List.of(ComponentDescriptor.sync(DATABASE));

        // when
        orchestrator.bulkInitialize(discovery);

        // then
        assertThat(orchestrator.isInitialized(DATABASE)).isTrue();
        assertThat(orchestrator.isEagerlyInitialized(DATABASE)).isTrue();
        verifyNoInteractions(jobEngine);
    }

    // ============================================================
    // 4. Job Engine 위임
    // ============================================================

    @Test
    void awaitAll_계열_연산은_Job_Engine에_위임() {
        // given
        when(jobEngine.isAllDone()).thenReturn(false);
        when(jobEngine.awaitAllAsync()).thenReturn(CompletableFuture.completedFuture(null));

        // when
        orchestrator.awaitAll();
        orchestrator.awaitAll(Duration.ofSeconds(1));
        boolean done = orchestrator.isAllDone();
        CompletableFuture<Void> barrier = orchestrator.awaitAllAsync();

        // then
        assertThat(done).isFalse();
        assertThat(barrier).isDone();
        verify(jobEngine).awaitAll();
        verify(jobEngine).awaitAll(Duration.ofSeconds(1));
    }

    @Test
    void afterAllJobs_대기_후_콜백_실행() {
        // when
        orchestrator.afterAllJobs(callback);

        // then
        InOrder inOrder = inOrder(jobEngine, callback);
        inOrder.verify(jobEngine).awaitAll();
        inOrder.verify(callback).accept(orchestrator);
    }

    @Test
    void afterAllJobsAsync_barrier_완료_후_콜백_실행() {
        // given
        CompletableFuture<Void> barrier = new CompletableFuture<>();
        when(jobEngine.awaitAllAsync()).thenReturn(barrier);
        AtomicReference<StartupOrchestrator> seen = new AtomicReference<>();

        // when
        CompletableFuture<Void> done = orchestrator.afterAllJobsAsync(seen::set);

        // then
        assertThat(seen.get()).isNull();
        barrier.complete(null);
        assertThat(done).isDone();
        assertThat(seen.get()).isSameAs(orchestrator);
    }

    @Test
    void constructor_기본_후속_작업은_Job_Engine_Executor에서_실행() {
        // given
        AtomicInteger dispatched = new AtomicInteger();
        when(jobEngine.executor()).thenReturn(command -> {
            dispatched.incrementAndGet();
            command.run();
        });
        orchestrator = new DependencyResolvingOrchestrator(registry, jobEngine, new OrchestratorConfig());
        doReturn((AsyncInitializer<String>) context -> CompletableFuture.completedFuture("client"))
            .when(registry).lookup(ANALYTICS);

        // when
        CompletableFuture<String> result = orchestrator.resolveAsync(ANALYTICS);

        // then
        assertThat(result.join()).isEqualTo("client");
        assertThat(dispatched.get()).isPositive();
    }

    @Test
    void resolveSync_dependencies가_던지면_InitializationFailedException() {
        // given
        IllegalStateException broken = new IllegalStateException("dependency list unavailable");
        doReturn(new SyncInitializer<String>() {
            @Override
            public String create(InitializationContext context) {
                return "db";
            }

            @Override
            public List<ComponentId> dependencies() {
                throw broken;
            }
        }).when(registry).lookup(DATABASE);

        // when & then
        assertThatThrownBy(() -> orchestrator.resolveSync(DATABASE))
            .isInstanceOf(InitializationFailedException.class)
            .hasCause(broken);
        assertThat(orchestrator.isInitialized(DATABASE)).isFalse();
    }

    @Test
    void resolveAsync_dependencies가_null이면_InitializationFailedException() {
        // given
        doReturn(new AsyncInitializer<String>() {
            @Override
            public CompletionStage<String> create(InitializationContext context) {
                return CompletableFuture.completedFuture("client");
            }

            @Override
            public List<ComponentId> dependencies() {
                return null;
            }
        }).when(registry).lookup(ANALYTICS);

        // when
        CompletableFuture<Object> result = orchestrator.resolveAsync(ANALYTICS);

        // then
        assertThatThrownBy(result::join)
            .hasCauseInstanceOf(InitializationFailedException.class)
            .hasRootCauseInstanceOf(IllegalStateException.class);
        assertThat(orchestrator.isInitialized(ANALYTICS)).isFalse();
    }

    @Test
    void constructor_null_의존성은_거부() {
        assertThatThrownBy(() -> new DependencyResolvingOrchestrator(null, jobEngine))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DependencyResolvingOrchestrator(registry, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DependencyResolvingOrchestrator(registry, jobEngine, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DependencyResolvingOrchestrator(registry, jobEngine, new OrchestratorConfig(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
