package com.ryuqq.startup.adapter.inmemory.registry;

import com.ryuqq.startup.core.exception.UnknownComponentException;
import com.ryuqq.startup.core.initializer.AsyncInitializer;
import com.ryuqq.startup.core.initializer.InitializationContext;
import com.ryuqq.startup.core.initializer.Initializer;
import com.ryuqq.startup.core.initializer.SyncInitializer;
import com.ryuqq.startup.core.model.ComponentId;
import com.ryuqq.startup.core.spi.InitializerRegistry;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link InitializerRegistry}.
 *
 * <p>The host application registers one factory per {@link ComponentId} at startup;
 * {@link #lookup(ComponentId)} invokes the factory to obtain an {@link Initializer}.
 * No reflection is involved: every constructible component is listed explicitly.</p>
 *
 * <p><strong>Registration Rules:</strong></p>
 * <ul>
 *   <li>Each identity can be registered once (duplicates are rejected)</li>
 *   <li>Factories may return a new instance per lookup or a shared one</li>
 *   <li>Unknown identities fail with {@link UnknownComponentException}</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ConcurrentHashMap#putIfAbsent} makes registration atomic</li>
 *   <li>Safe to look up from sync and async resolution paths concurrently</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryInitializerRegistry registry = new InMemoryInitializerRegistry()
 *     .register(ComponentId.of("database"), DatabaseInitializer::new)
 *     .registerSync(ComponentId.of("cache"), List.of(ComponentId.of("database")),
 *         context -&gt; new Cache(context.dependency(ComponentId.of("database"), Database.class)))
 *     .registerAsync(ComponentId.of("remote-config"), List.of(),
 *         context -&gt; client.fetchAsync());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryInitializerRegistry implements InitializerRegistry {

    /**
     * ComponentId → Initializer factory.
     */
    private final ConcurrentHashMap<ComponentId, Supplier<? extends Initializer<?>>> factories;

    /**
     * Creates an empty registry.
     */
    public InMemoryInitializerRegistry() {
        this.factories = new ConcurrentHashMap<>();
    }

    /**
     * Registers a factory for the given identity.
     *
     * @param id component identity
     * @param factory initializer factory
     * @return this registry (for chaining)
     * @throws IllegalArgumentException if id or factory is null
     * @throws IllegalStateException if id is already registered
     */
    public InMemoryInitializerRegistry register(ComponentId id, Supplier<? extends Initializer<?>> factory) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (factories.putIfAbsent(id, factory) != null) {
            throw new IllegalStateException("Initializer already registered for " + id.getValue());
        }
        return this;
    }

    /**
     * Registers a factory keyed by the initializer type's fully-qualified name.
     *
     * @param type initializer type (identity = {@code ComponentId.of(type)})
     * @param factory initializer factory
     * @param <I> initializer type
     * @return this registry (for chaining)
     */
    public <I extends Initializer<?>> InMemoryInitializerRegistry register(Class<I> type, Supplier<? extends I> factory) {
        return register(ComponentId.of(type), factory);
    }

    /**
     * Registers a synchronous initializer built from a dependency list and a body.
     *
     * @param id component identity
     * @param dependencies dependencies in resolution order
     * @param body create function
     * @param <T> value type
     * @return this registry (for chaining)
     */
    public <T> InMemoryInitializerRegistry registerSync(ComponentId id, List<ComponentId> dependencies,
                                                        SyncInitializer<T> body) {
        List<ComponentId> declared = copyDependencies(dependencies);
        requireBody(body);
        SyncInitializer<T> initializer = new SyncInitializer<>() {
            @Override
            public T create(InitializationContext context) throws Exception {
                return body.create(context);
            }

            @Override
            public List<ComponentId> dependencies() {
                return declared;
            }
        };
        return register(id, () -> initializer);
    }

    /**
     * Registers an asynchronous initializer built from a dependency list and a body.
     *
     * @param id component identity
     * @param dependencies dependencies in resolution order
     * @param body create function
     * @param <T> value type
     * @return this registry (for chaining)
     */
    public <T> InMemoryInitializerRegistry registerAsync(ComponentId id, List<ComponentId> dependencies,
                                                         AsyncInitializer<T> body) {
        List<ComponentId> declared = copyDependencies(dependencies);
        requireBody(body);
        AsyncInitializer<T> initializer = new AsyncInitializer<>() {
            @Override
            public CompletionStage<T> create(InitializationContext context) {
                return body.create(context);
            }

            @Override
            public List<ComponentId> dependencies() {
                return declared;
            }
        };
        return register(id, () -> initializer);
    }

    /**
     * {@inheritDoc}
     *
     * @throws UnknownComponentException if no factory is registered for id
     * @throws IllegalStateException if the factory returns null
     */
    @Override
    public Initializer<?> lookup(ComponentId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Supplier<? extends Initializer<?>> factory = factories.get(id);
        if (factory == null) {
            throw new UnknownComponentException(id);
        }
        Initializer<?> initializer = factory.get();
        if (initializer == null) {
            throw new IllegalStateException("Factory for " + id.getValue() + " returned null");
        }
        return initializer;
    }

    /**
     * Checks whether an identity is registered.
     *
     * @param id component identity
     * @return true if a factory exists
     */
    public boolean isRegistered(ComponentId id) {
        return id != null && factories.containsKey(id);
    }

    /**
     * Returns all registered identities in natural order.
     *
     * @return sorted snapshot of registered identities
     */
    public Set<ComponentId> registeredIds() {
        return new TreeSet<>(factories.keySet());
    }

    /**
     * Removes a registration.
     *
     * @param id component identity
     * @return true if a registration was removed
     */
    public boolean unregister(ComponentId id) {
        return id != null && factories.remove(id) != null;
    }

    /**
     * Clears all registrations (for test cleanup).
     */
    public void clear() {
        factories.clear();
    }

    private static List<ComponentId> copyDependencies(List<ComponentId> dependencies) {
        if (dependencies == null) {
            throw new IllegalArgumentException("dependencies cannot be null");
        }
        return List.copyOf(dependencies);
    }

    private static void requireBody(Object body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
    }
}
