package com.ryuqq.startup.core.exception;

import com.ryuqq.startup.core.model.ComponentId;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StartupException 계층 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StartupExceptionTest {

    @Test
    void cycleDetected_MessageNamesComponent() {
        // When
        CycleDetectedException exception = new CycleDetectedException(ComponentId.of("database"));

        // Then
        assertEquals("Cannot initialize database. Cycle detected.", exception.getMessage());
        assertEquals(ComponentId.of("database"), exception.getComponentId());
        assertInstanceOf(StartupException.class, exception);
    }

    @Test
    void initializationFailed_KeepsCause() {
        // Given
        IllegalStateException cause = new IllegalStateException("connection refused");

        // When
        InitializationFailedException exception =
            new InitializationFailedException(ComponentId.of("database"), cause);

        // Then
        assertSame(cause, exception.getCause());
        assertEquals(ComponentId.of("database"), exception.getComponentId());
        assertTrue(exception.getMessage().startsWith("Failed to initialize database"));
        assertTrue(exception.getMessage().contains("connection refused"));
    }

    @Test
    void unknownComponent_MessageNamesComponent() {
        // When
        UnknownComponentException exception = new UnknownComponentException(ComponentId.of("ghost"));

        // Then
        assertEquals("No initializer registered for ghost", exception.getMessage());
        assertInstanceOf(StartupException.class, exception);
    }

    @Test
    void awaitAllFailed_KeepsCause() {
        // Given
        TimeoutException cause = new TimeoutException();

        // When
        AwaitAllFailedException exception = new AwaitAllFailedException("Start jobs timed out", cause);

        // Then
        assertSame(cause, exception.getCause());
        assertInstanceOf(RuntimeException.class, exception);
    }
}
