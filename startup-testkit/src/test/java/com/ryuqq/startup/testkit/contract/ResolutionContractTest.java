package com.ryuqq.startup.testkit.contract;

import com.ryuqq.startup.core.initializer.InitializationContext;
import com.ryuqq.startup.core.initializer.SyncInitializer;
import com.ryuqq.startup.core.model.ComponentId;
import com.ryuqq.startup.testkit.contract.ComponentGraph.TestComponent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for memoized dependency resolution.
 *
 * <p>This test validates that every reachable component is constructed exactly once,
 * after its dependencies, in declared order, for both sync and async resolution.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>{A:[], B:[A], C:[A]}: resolving C then B constructs A once</li>
 *   <li>Repeated resolveSync returns the identical cached value</li>
 *   <li>Dependencies resolved strictly in declared order (first listed, first resolved)</li>
 *   <li>Shared dependency of two siblings constructed once</li>
 *   <li>Async resolution follows the same rules</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResolutionContractTest extends RunnerContractTest {

    @Test
    void testResolveSync_SharedDependency_ConstructedOnceAndReused() {
        // Given
        graph.sync("A").sync("B", "A").sync("C", "A");

        // When: resolve C
        orchestrator.resolveSync(id("C"));

        // Then: A once, then C
        assertCreationOrder("A", "C");

        // When: resolve B afterwards
        orchestrator.resolveSync(id("B"));

        // Then: cached A reused, only B constructed
        assertCreationOrder("A", "C", "B");
        assertCreatedOnce("A");
        assertCreatedOnce("B");
        assertCreatedOnce("C");
    }

    @Test
    void testResolveSync_CalledTwice_ReturnsIdenticalValue() {
        // Given
        graph.sync("A");

        // When
        TestComponent first = orchestrator.resolveSync(id("A"));
        TestComponent second = orchestrator.resolveSync(id("A"));

        // Then
        assertSame(first, second, "Second call must return the cached instance");
        assertCreatedOnce("A");
    }

    @Test
    void testResolveSync_DependenciesResolvedInDeclaredOrder() {
        // Given: D depends on C, A, B (in that order)
        graph.sync("A").sync("B").sync("C").sync("D", "C", "A", "B");

        // When
        orchestrator.resolveSync(id("D"));

        // Then
        assertCreationOrder("C", "A", "B", "D");
    }

    @Test
    void testResolveSync_DiamondGraph_EachNodeOnce() {
        // Given: D → (B, C), B → A, C → A
        graph.sync("A").sync("B", "A").sync("C", "A").sync("D", "B", "C");

        // When
        orchestrator.resolveSync(id("D"));

        // Then
        assertCreationOrder("A", "B", "C", "D");
        for (String node : List.of("A", "B", "C", "D")) {
            assertCreatedOnce(node);
            assertInitialized(node);
        }
    }

    @Test
    void testResolveSync_TypedOverload_CastsValue() {
        // Given
        graph.sync("A");

        // When
        TestComponent value = orchestrator.resolveSync(id("A"), TestComponent.class);

        // Then
        assertEquals(id("A"), value.id());
        assertEquals(1, value.generation());
    }

    @Test
    void testResolveSync_TypedOverload_WrongType_ThrowsClassCastException() {
        // Given
        graph.sync("A");

        // When & Then
        assertThrows(ClassCastException.class, () -> orchestrator.resolveSync(id("A"), String.class));
        assertInitialized("A");
    }

    @Test
    void testResolveAsync_DependencyChain_ConstructedInOrder() throws Exception {
        // Given: async chain with a sync leaf
        graph.sync("A").async("B", "A").async("C", "B", "A");

        // When
        TestComponent value = orchestrator.<TestComponent>resolveAsync(id("C")).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(id("C"), value.id());
        assertCreationOrder("A", "B", "C");
        assertCreatedOnce("A");
    }

    @Test
    void testResolveAsync_AlreadyCached_CompletesImmediately() {
        // Given
        graph.sync("A");
        TestComponent cached = orchestrator.resolveSync(id("A"));

        // When
        TestComponent value = orchestrator.<TestComponent>resolveAsync(id("A")).getNow(null);

        // Then
        assertSame(cached, value);
        assertCreatedOnce("A");
    }

    @Test
    void testResolveSync_AsyncDependency_WaitsForStage() {
        // Given: sync B depends on async A
        graph.async("A").sync("B", "A");

        // When
        orchestrator.resolveSync(id("B"));

        // Then
        assertCreationOrder("A", "B");
        assertInitialized("A");
        assertInitialized("B");
    }

    @Test
    void testCreate_ReadsDependencyValueFromContext() {
        // Given: B reads A's value through the context
        ComponentId a = id("A");
        graph.sync("A");
        graph.node("B", new SyncInitializer<String>() {
            @Override
            public String create(InitializationContext context) {
                TestComponent dependency = context.dependency(a, TestComponent.class);
                return context.componentId().getValue() + "<-" + dependency.id().getValue();
            }

            @Override
            public List<ComponentId> dependencies() {
                return List.of(a);
            }
        });

        // When
        String value = orchestrator.resolveSync(id("B"));

        // Then
        assertEquals("B<-A", value);
    }

    @Test
    void testResolveSync_NestedCallFromCreate_SharesScope() {
        // Given: B resolves A from inside its own create (same thread)
        graph.sync("A");
        graph.node("B", (SyncInitializer<String>) context -> {
            TestComponent nested = orchestrator.resolveSync(id("A"));
            return "B+" + nested.id().getValue();
        });

        // When
        String value = orchestrator.resolveSync(id("B"));

        // Then
        assertEquals("B+A", value);
        assertCreatedOnce("A");
    }

    @Test
    void testResolveAsync_SyncCreateResolvesNested_Completes() throws Exception {
        // Given: S is reached through the async path and resolves T from inside its create
        graph.sync("T");
        graph.node("S", (SyncInitializer<String>) context -> {
            TestComponent nested = orchestrator.resolveSync(id("T"));
            return "S+" + nested.id().getValue();
        });

        // When
        CompletableFuture<String> result = orchestrator.resolveAsync(id("S"));

        // Then
        assertEquals("S+T", result.get(5, TimeUnit.SECONDS));
        assertCreatedOnce("T");
    }
}
