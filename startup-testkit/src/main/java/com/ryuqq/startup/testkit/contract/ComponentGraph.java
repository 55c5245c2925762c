package com.ryuqq.startup.testkit.contract;

import com.ryuqq.startup.core.exception.UnknownComponentException;
import com.ryuqq.startup.core.initializer.AsyncInitializer;
import com.ryuqq.startup.core.initializer.InitializationContext;
import com.ryuqq.startup.core.initializer.Initializer;
import com.ryuqq.startup.core.initializer.SyncInitializer;
import com.ryuqq.startup.core.model.ComponentId;
import com.ryuqq.startup.core.spi.InitializerRegistry;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Test fixture describing a component dependency graph.
 *
 * <p>Each node is an initializer that records every {@code create} call, so contract
 * tests can assert exactly-once construction and creation order. The graph itself is
 * the {@link InitializerRegistry} handed to the orchestrator under test.</p>
 *
 * <p><strong>Node Types:</strong></p>
 * <ul>
 *   <li>{@link #sync}: synchronous, produces a {@link TestComponent}</li>
 *   <li>{@link #async}: asynchronous, completes on another thread</li>
 *   <li>{@link #asyncAwaiting}: asynchronous, completes when a test-controlled future completes</li>
 *   <li>{@link #failing} / {@link #failingOnce}: synchronous, create throws</li>
 *   <li>{@link #asyncFailing}: asynchronous, returns a failed stage</li>
 *   <li>{@link #slow}: synchronous, sleeps before producing its value</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ComponentGraph graph = new ComponentGraph()
 *     .sync("A")
 *     .sync("B", "A")
 *     .sync("C", "A");
 *
 * orchestrator.resolveSync(ComponentGraph.id("C"));
 * assertEquals(1, graph.createCount("A"));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ComponentGraph implements InitializerRegistry {

    private final ConcurrentHashMap<ComponentId, Initializer<?>> nodes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ComponentId, AtomicInteger> createCounts = new ConcurrentHashMap<>();
    private final List<ComponentId> creationOrder = new CopyOnWriteArrayList<>();
    private final AtomicInteger lookupCount = new AtomicInteger();

    /**
     * Value produced by every graph node.
     *
     * @param id identity of the node that produced it
     * @param generation 1 for the first create call, 2 for the second, ...
     */
    public record TestComponent(ComponentId id, int generation) {
    }

    /**
     * Shorthand for {@link ComponentId#of(String)}.
     *
     * @param value identity value
     * @return ComponentId
     */
    public static ComponentId id(String value) {
        return ComponentId.of(value);
    }

    /**
     * Adds a synchronous node.
     *
     * @param id node identity
     * @param dependencies dependency identities in resolution order
     * @return this graph
     */
    public ComponentGraph sync(String id, String... dependencies) {
        return addSync(id, dependencies, this::record);
    }

    /**
     * Adds an asynchronous node completing on a pool thread.
     *
     * @param id node identity
     * @param dependencies dependency identities in resolution order
     * @return this graph
     */
    public ComponentGraph async(String id, String... dependencies) {
        return addAsync(id, dependencies, componentId -> {
            TestComponent component = record(componentId);
            return CompletableFuture.supplyAsync(() -> component);
        });
    }

    /**
     * Adds an asynchronous node that completes only after {@code release} completes.
     *
     * @param id node identity
     * @param release test-controlled future
     * @param dependencies dependency identities in resolution order
     * @return this graph
     */
    public ComponentGraph asyncAwaiting(String id, CompletableFuture<?> release, String... dependencies) {
        return addAsync(id, dependencies, componentId -> {
            TestComponent component = record(componentId);
            return release.thenApply(ignored -> component);
        });
    }

    /**
     * Adds a synchronous node whose create always throws {@code cause}.
     *
     * @param id node identity
     * @param cause failure to throw
     * @param dependencies dependency identities in resolution order
     * @return this graph
     */
    public ComponentGraph failing(String id, RuntimeException cause, String... dependencies) {
        return addSync(id, dependencies, componentId -> {
            record(componentId);
            throw cause;
        });
    }

    /**
     * Adds a synchronous node whose first create throws {@code cause} and later ones succeed.
     *
     * @param id node identity
     * @param cause failure to throw on the first attempt
     * @param dependencies dependency identities in resolution order
     * @return this graph
     */
    public ComponentGraph failingOnce(String id, RuntimeException cause, String... dependencies) {
        return addSync(id, dependencies, componentId -> {
            TestComponent component = record(componentId);
            if (component.generation() == 1) {
                throw cause;
            }
            return component;
        });
    }

    /**
     * Adds an asynchronous node whose stage fails with {@code cause}.
     *
     * @param id node identity
     * @param cause failure of the returned stage
     * @param dependencies dependency identities in resolution order
     * @return this graph
     */
    public ComponentGraph asyncFailing(String id, RuntimeException cause, String... dependencies) {
        return addAsync(id, dependencies, componentId -> {
            record(componentId);
            return CompletableFuture.failedFuture(cause);
        });
    }

    /**
     * Adds a synchronous node that sleeps before producing its value.
     *
     * @param id node identity
     * @param sleepMillis time spent inside create
     * @param dependencies dependency identities in resolution order
     * @return this graph
     */
    public ComponentGraph slow(String id, long sleepMillis, String... dependencies) {
        return addSync(id, dependencies, componentId -> {
            try {
                Thread.sleep(sleepMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while creating " + componentId.getValue(), e);
            }
            return record(componentId);
        });
    }

    /**
     * Adds a custom initializer.
     *
     * @param id node identity
     * @param initializer initializer to return from lookup
     * @return this graph
     */
    public ComponentGraph node(String id, Initializer<?> initializer) {
        if (nodes.putIfAbsent(id(id), initializer) != null) {
            throw new IllegalStateException("Node already defined: " + id);
        }
        return this;
    }

    @Override
    public Initializer<?> lookup(ComponentId id) {
        lookupCount.incrementAndGet();
        Initializer<?> initializer = nodes.get(id);
        if (initializer == null) {
            throw new UnknownComponentException(id);
        }
        return initializer;
    }

    /**
     * Number of create calls for a node (successful or not).
     *
     * @param id node identity
     * @return create call count
     */
    public int createCount(String id) {
        AtomicInteger count = createCounts.get(id(id));
        return count == null ? 0 : count.get();
    }

    /**
     * Identities in the order their create was invoked.
     *
     * @return creation order snapshot
     */
    public List<ComponentId> creationOrder() {
        return List.copyOf(creationOrder);
    }

    /**
     * Creation order as plain identity values.
     *
     * @return creation order snapshot
     */
    public List<String> creationOrderValues() {
        return creationOrder.stream().map(ComponentId::getValue).collect(Collectors.toList());
    }

    /**
     * Number of registry lookups performed.
     *
     * @return lookup count
     */
    public int lookupCount() {
        return lookupCount.get();
    }

    private TestComponent record(ComponentId id) {
        int generation = createCounts.computeIfAbsent(id, key -> new AtomicInteger()).incrementAndGet();
        creationOrder.add(id);
        return new TestComponent(id, generation);
    }

    private ComponentGraph addSync(String id, String[] dependencies, Function<ComponentId, TestComponent> body) {
        List<ComponentId> declared = toIds(dependencies);
        ComponentId componentId = id(id);
        return node(id, new SyncInitializer<TestComponent>() {
            @Override
            public TestComponent create(InitializationContext context) {
                return body.apply(componentId);
            }

            @Override
            public List<ComponentId> dependencies() {
                return declared;
            }
        });
    }

    private ComponentGraph addAsync(String id, String[] dependencies,
                                    Function<ComponentId, CompletionStage<TestComponent>> body) {
        List<ComponentId> declared = toIds(dependencies);
        ComponentId componentId = id(id);
        return node(id, new AsyncInitializer<TestComponent>() {
            @Override
            public CompletionStage<TestComponent> create(InitializationContext context) {
                return body.apply(componentId);
            }

            @Override
            public List<ComponentId> dependencies() {
                return declared;
            }
        });
    }

    private static List<ComponentId> toIds(String[] dependencies) {
        return Arrays.stream(dependencies).map(ComponentId::of).collect(Collectors.toList());
    }
}
