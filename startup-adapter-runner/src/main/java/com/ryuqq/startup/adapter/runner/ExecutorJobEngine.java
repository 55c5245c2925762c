package com.ryuqq.startup.adapter.runner;

import com.ryuqq.startup.application.engine.JobEngine;
import com.ryuqq.startup.core.exception.AwaitAllFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * ExecutorService 기반 Job Engine 구현체.
 *
 * <p>비동기 초기화 작업을 워커 풀에서 실행하고, 추적 중인 작업 전체에 대한
 * barrier({@link #awaitAll()})를 제공합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * launch(label, task)
 *   ↓ StartJob 생성 → jobs에 추가
 * workerExecutor에서 task.get() 실행 → CompletionStage
 *   ↓ Stage 완료 시
 * 성공: StartJob 종료
 * 실패: 실패 순번 기록 → StartJob 종료 (형제 작업은 계속 실행)
 *
 * awaitAll()
 *   ↓ 스냅샷의 모든 StartJob 종료 대기 (대기 중 추가된 작업 포함)
 * 실패 없음: 관찰한 작업 제거 (다음 launch부터 새 배치)
 * 실패 있음: 가장 먼저 실패한 작업의 원인으로 AwaitAllFailedException (목록 유지)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>jobs 목록은 자체 모니터로 보호 (추가, 제거, 스냅샷)</li>
 *   <li>각 StartJob의 완료 Future는 항상 정상 완료되며, 실패 정보는 별도로 보관</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutorJobEngine implements JobEngine, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorJobEngine.class);

    private final JobEngineConfig config;
    private final ExecutorService workerExecutor;
    private final List<StartJob> jobs = new ArrayList<>();
    private final AtomicLong failureSequence = new AtomicLong();

    /**
     * 생성자 (기본 설정 사용).
     */
    public ExecutorJobEngine() {
        this(new JobEngineConfig());
    }

    /**
     * 생성자 (설정 기반 고정 크기 워커 풀 생성).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ExecutorJobEngine(JobEngineConfig config) {
        this(config, newWorkerPool(config));
    }

    /**
     * 생성자 (워커 풀 주입).
     *
     * @param config 설정
     * @param workerExecutor 작업 실행 풀
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ExecutorJobEngine(JobEngineConfig config, ExecutorService workerExecutor) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (workerExecutor == null) {
            throw new IllegalArgumentException("workerExecutor cannot be null");
        }
        this.config = config;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public void launch(String label, Supplier<? extends CompletionStage<?>> task) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        StartJob job = new StartJob(label);
        synchronized (jobs) {
            jobs.add(job);
        }

        try {
            workerExecutor.execute(() -> runJob(job, task));
        } catch (RejectedExecutionException e) {
            synchronized (jobs) {
                jobs.remove(job);
            }
            throw new IllegalStateException("Job engine has been shut down, cannot launch " + label, e);
        }
        log.debug("Launched start job {}", label);
    }

    @Override
    public void awaitAll() {
        try {
            awaitAllAsync().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AwaitAllFailedException("Interrupted while awaiting start jobs", e);
        } catch (ExecutionException e) {
            throw asAwaitFailure(e.getCause());
        }
    }

    @Override
    public void awaitAll(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        try {
            awaitAllAsync().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AwaitAllFailedException("Interrupted while awaiting start jobs", e);
        } catch (ExecutionException e) {
            throw asAwaitFailure(e.getCause());
        } catch (TimeoutException e) {
            throw new AwaitAllFailedException(
                "Start jobs did not finish within " + timeout.toMillis() + "ms", e);
        }
    }

    @Override
    public CompletableFuture<Void> awaitAllAsync() {
        log.debug("Awaiting all start jobs ...");
        return awaitRound();
    }

    @Override
    public boolean isAllDone() {
        return snapshot().stream().allMatch(StartJob::isDone);
    }

    @Override
    public int trackedJobCount() {
        synchronized (jobs) {
            return jobs.size();
        }
    }

    /**
     * 워커 풀에서 실행하는 Executor.
     *
     * <p>풀 자체는 노출하지 않으므로 호출자가 종료할 수 없습니다.</p>
     */
    @Override
    public Executor executor() {
        return workerExecutor::execute;
    }

    /**
     * Job Engine 종료 (리소스 정리).
     *
     * <p>ExecutorService를 graceful shutdown하여 진행 중인 작업이
     * 완료되도록 대기합니다. 제한 시간 초과 시 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Start job workers did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    @Override
    public void close() throws InterruptedException {
        shutdown();
    }

    /**
     * 작업 실행 (워커 스레드).
     *
     * <p>task 자체가 던진 예외와 실패한 Stage 모두 작업 실패로 기록합니다.</p>
     *
     * @param job 추적 중인 작업
     * @param task 실행할 작업
     */
    private void runJob(StartJob job, Supplier<? extends CompletionStage<?>> task) {
        CompletionStage<?> stage;
        try {
            stage = task.get();
        } catch (RuntimeException e) {
            job.fail(e);
            return;
        } catch (Error e) {
            job.fail(e);
            throw e;
        }
        if (stage == null) {
            job.fail(new IllegalStateException("Start job " + job.label + " returned no completion stage"));
            return;
        }
        stage.whenComplete((value, failure) -> {
            if (failure != null) {
                job.fail(Futures.unwrap(failure));
            } else {
                job.succeed();
            }
        });
    }

    /**
     * 한 라운드 대기: 스냅샷 전체 종료 후, 그 사이 추가된 미완료 작업이 있으면 다시 대기.
     */
    private CompletableFuture<Void> awaitRound() {
        List<StartJob> observed = snapshot();
        CompletableFuture<?>[] completions = observed.stream()
            .map(job -> job.completion)
            .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(completions).thenCompose(ignored -> {
            List<StartJob> current = snapshot();
            if (!current.stream().allMatch(StartJob::isDone)) {
                return awaitRound();
            }

            Optional<StartJob> firstFailed = current.stream()
                .filter(StartJob::isFailed)
                .min(Comparator.comparingLong(job -> job.failureOrder));
            if (firstFailed.isPresent()) {
                StartJob failed = firstFailed.get();
                return CompletableFuture.failedFuture(new AwaitAllFailedException(
                    "Start job " + failed.label + " failed", failed.failure));
            }

            synchronized (jobs) {
                jobs.removeAll(current);
            }
            log.debug("All {} start jobs finished", current.size());
            return CompletableFuture.completedFuture(null);
        });
    }

    private List<StartJob> snapshot() {
        synchronized (jobs) {
            return new ArrayList<>(jobs);
        }
    }

    private static AwaitAllFailedException asAwaitFailure(Throwable failure) {
        Throwable cause = Futures.unwrap(failure);
        if (cause instanceof AwaitAllFailedException) {
            return (AwaitAllFailedException) cause;
        }
        return new AwaitAllFailedException("Failed to await start jobs", cause);
    }

    private static ExecutorService newWorkerPool(JobEngineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        AtomicInteger threadNumber = new AtomicInteger(1);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "startup-job-" + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(config.concurrency(), threadFactory);
    }

    /**
     * 추적 중인 작업 한 건 (Job Record).
     *
     * <p>completion은 성공/실패와 관계없이 정상 완료되며,
     * 실패 정보(failure, failureOrder)는 completion 완료 전에 기록됩니다.</p>
     */
    private final class StartJob {

        private final String label;
        private final CompletableFuture<Void> completion = new CompletableFuture<>();
        private volatile Throwable failure;
        private volatile long failureOrder = Long.MAX_VALUE;

        private StartJob(String label) {
            this.label = label;
        }

        private void succeed() {
            completion.complete(null);
        }

        private void fail(Throwable cause) {
            failureOrder = failureSequence.incrementAndGet();
            failure = cause;
            log.warn("Start job {} failed: {}", label, cause.toString());
            completion.complete(null);
        }

        private boolean isDone() {
            return completion.isDone();
        }

        private boolean isFailed() {
            return failure != null;
        }
    }
}
