package com.ryuqq.startup.application.engine;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Background Job Engine.
 *
 * <p>This interface manages a dynamic set of in-flight initialization jobs and
 * exposes an "await all" barrier over them.</p>
 *
 * <p><strong>Job Lifecycle:</strong></p>
 * <pre>
 * launch(label, task)
 *   ↓ appended to the tracked job collection
 * task runs on a worker (may complete later via CompletionStage)
 *   ↓
 * terminal: succeeded | failed
 *   ↓
 * awaitAll() → all terminal → collection cleared (only when none failed)
 * </pre>
 *
 * <p><strong>Failure Isolation:</strong></p>
 * <ul>
 *   <li>One failing job never cancels its siblings</li>
 *   <li>awaitAll() surfaces the failure of the job that failed first in time</li>
 *   <li>Other failures are not aggregated and nothing is retried</li>
 *   <li>After a failed wait the collection is kept, so the failure stays observable</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> implementations must allow launch(), awaitAll()
 * and isAllDone() to be called concurrently from any thread.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface JobEngine {

    /**
     * Schedules a task to run concurrently and starts tracking it.
     *
     * <p>Returns immediately. The stage returned by {@code task} decides when the job
     * reaches its terminal state.</p>
     *
     * @param label human readable job label (used in logs)
     * @param task task producing the completion stage of the job
     * @throws IllegalArgumentException if label is blank or task is null
     * @throws IllegalStateException if the engine has been shut down
     */
    void launch(String label, Supplier<? extends CompletionStage<?>> task);

    /**
     * Blocks until every tracked job is terminal, then clears the collection.
     *
     * <p>Jobs launched while waiting are included in the same wait.</p>
     *
     * @throws com.ryuqq.startup.core.exception.AwaitAllFailedException if any job failed
     *         (carries the first failure) or the waiting thread was interrupted
     */
    void awaitAll();

    /**
     * Same as {@link #awaitAll()} with an overall deadline.
     *
     * @param timeout maximum time to wait
     * @throws com.ryuqq.startup.core.exception.AwaitAllFailedException if any job failed,
     *         or the deadline passed (cause: {@link java.util.concurrent.TimeoutException})
     */
    void awaitAll(Duration timeout);

    /**
     * Non-blocking form of {@link #awaitAll()}.
     *
     * @return future completing when the barrier is passed, or exceptionally with
     *         {@link com.ryuqq.startup.core.exception.AwaitAllFailedException}
     */
    CompletableFuture<Void> awaitAllAsync();

    /**
     * Snapshot check: true iff no tracked job is still running.
     *
     * <p>Does not clear the collection.</p>
     *
     * @return true when every tracked job is terminal (or none is tracked)
     */
    boolean isAllDone();

    /**
     * Number of tracked jobs (running or terminal, not yet cleared).
     *
     * @return tracked job count
     */
    int trackedJobCount();

    /**
     * Executor backing the engine's workers.
     *
     * <p>Orchestrators run asynchronous resolution steps on it by default, so the
     * engine's configured concurrency bounds that work too.</p>
     *
     * @return executor running work on the engine's worker pool
     */
    Executor executor();
}
