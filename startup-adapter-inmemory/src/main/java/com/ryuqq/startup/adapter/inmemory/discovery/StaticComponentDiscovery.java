package com.ryuqq.startup.adapter.inmemory.discovery;

import com.ryuqq.startup.core.model.ComponentDescriptor;
import com.ryuqq.startup.core.model.ComponentId;
import com.ryuqq.startup.core.model.InitializerKind;
import com.ryuqq.startup.core.spi.ComponentDiscovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static-registration implementation of {@link ComponentDiscovery}.
 *
 * <p>The host application lists the components to initialize eagerly, in order,
 * through registration calls. {@link #discover()} returns them as an ordered batch.</p>
 *
 * <p><strong>Ordering:</strong> descriptors are returned in registration order.
 * Registering the same identity twice is rejected.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ComponentDiscovery discovery = StaticComponentDiscovery.builder()
 *     .sync(ComponentId.of("database"))
 *     .async(ComponentId.of("remote-config"))
 *     .build();
 *
 * orchestrator.bulkInitialize(discovery);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StaticComponentDiscovery implements ComponentDiscovery {

    private static final Logger log = LoggerFactory.getLogger(StaticComponentDiscovery.class);

    private final List<ComponentDescriptor> descriptors;

    /**
     * Creates a discovery over a fixed descriptor list.
     *
     * @param descriptors descriptors in initialization order
     * @throws IllegalArgumentException if descriptors is null, contains null, or repeats an identity
     */
    public StaticComponentDiscovery(List<ComponentDescriptor> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("descriptors cannot be null");
        }
        Map<ComponentId, ComponentDescriptor> unique = new LinkedHashMap<>();
        for (ComponentDescriptor descriptor : descriptors) {
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptors cannot contain null");
            }
            if (unique.putIfAbsent(descriptor.id(), descriptor) != null) {
                throw new IllegalArgumentException(
                    "Component registered more than once: " + descriptor.id().getValue());
            }
        }
        this.descriptors = List.copyOf(unique.values());
    }

    /**
     * Starts a new builder.
     *
     * @return empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<ComponentDescriptor> discover() {
        for (ComponentDescriptor descriptor : descriptors) {
            log.debug("Discovered {} ({})", descriptor.id().getValue(), descriptor.kind());
        }
        return descriptors;
    }

    /**
     * Registration-call builder.
     */
    public static final class Builder {

        private final List<ComponentDescriptor> descriptors = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a synchronously initialized component.
         *
         * @param id component identity
         * @return this builder
         */
        public Builder sync(ComponentId id) {
            return add(id, InitializerKind.SYNC);
        }

        /**
         * Adds an asynchronously initialized component.
         *
         * @param id component identity
         * @return this builder
         */
        public Builder async(ComponentId id) {
            return add(id, InitializerKind.ASYNC);
        }

        /**
         * Adds a component of the given kind.
         *
         * @param id component identity
         * @param kind initialization kind
         * @return this builder
         */
        public Builder add(ComponentId id, InitializerKind kind) {
            descriptors.add(new ComponentDescriptor(id, kind));
            return this;
        }

        /**
         * Builds the discovery.
         *
         * @return immutable discovery
         * @throws IllegalArgumentException if an identity was added twice
         */
        public StaticComponentDiscovery build() {
            return new StaticComponentDiscovery(descriptors);
        }
    }
}
