package com.ryuqq.startup.adapter.runner;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 식별자 확인-등록 단계를 직렬화하는 FIFO 상호 배제 게이트.
 *
 * <p>동기 경로와 비동기 경로가 같은 게이트를 사용하므로, 한 시점에는
 * 하나의 해석만 캐시 확인과 진행 중 해석 등록을 수행합니다.
 * 게이트는 이 단계 동안만 보유하며 create 실행 중에는 보유하지 않습니다.</p>
 *
 * <p><strong>획득 방식:</strong></p>
 * <ul>
 *   <li>{@link #acquire()}: Future로 Permit을 전달 (대기 중 스레드를 점유하지 않음)</li>
 *   <li>{@link #acquireBlocking()}: 호출 스레드에서 Permit을 받을 때까지 블로킹</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 재진입을 지원하지 않습니다. Permit을 보유한 채로
 * 사용자 코드를 호출하지 마십시오.</p>
 *
 * <p><strong>공정성:</strong> 대기자는 요청 순서대로 Permit을 받습니다.
 * Permit 전달은 해제한 스레드에서 동기적으로 이루어지므로, 대기자 쪽 후속 작업은
 * 별도 Executor로 넘기는 것이 좋습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResolutionGate {

    private final Object monitor = new Object();
    private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
    private boolean locked;

    /**
     * Permit 비동기 획득.
     *
     * @return Permit을 전달하는 Future (게이트가 비어 있으면 즉시 완료)
     */
    public CompletableFuture<Permit> acquire() {
        synchronized (monitor) {
            if (!locked) {
                locked = true;
                return CompletableFuture.completedFuture(new Permit());
            }
            CompletableFuture<Permit> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    /**
     * Permit 블로킹 획득.
     *
     * <p>대기 중 인터럽트되면 대기열에서 제거하고, 그 사이 Permit이 이미 전달됐다면
     * 즉시 반납한 뒤 인터럽트 플래그를 복원하여 RuntimeException으로 래핑합니다.</p>
     *
     * @return Permit
     * @throws IllegalStateException 대기 중 인터럽트 발생 시
     */
    public Permit acquireBlocking() {
        CompletableFuture<Permit> waiter = acquire();
        try {
            return waiter.get();
        } catch (InterruptedException e) {
            abandon(waiter);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for resolution gate", e);
        } catch (ExecutionException e) {
            // waiter는 정상 완료만 하므로 도달하지 않음
            throw new IllegalStateException("Resolution gate waiter failed", e.getCause());
        }
    }

    /**
     * 현재 게이트 점유 여부 (진단용 스냅샷).
     *
     * @return 점유 중이면 true
     */
    public boolean isLocked() {
        synchronized (monitor) {
            return locked;
        }
    }

    /**
     * 대기 중인 요청 수 (진단용 스냅샷).
     *
     * @return 대기자 수
     */
    public int queueLength() {
        synchronized (monitor) {
            return waiters.size();
        }
    }

    private void abandon(CompletableFuture<Permit> waiter) {
        boolean removed;
        synchronized (monitor) {
            removed = waiters.remove(waiter);
        }
        if (!removed) {
            // 이미 Permit이 전달된 경우: 받은 Permit을 반납
            waiter.thenAccept(Permit::release);
        }
    }

    private void handOff() {
        CompletableFuture<Permit> next;
        synchronized (monitor) {
            next = waiters.pollFirst();
            if (next == null) {
                locked = false;
                return;
            }
        }
        next.complete(new Permit());
    }

    /**
     * 게이트 점유 증표.
     *
     * <p>{@link #release()}는 여러 번 호출해도 한 번만 반영됩니다.</p>
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        /**
         * 게이트 반납 (다음 대기자에게 전달).
         */
        public void release() {
            if (released.compareAndSet(false, true)) {
                handOff();
            }
        }

        @Override
        public void close() {
            release();
        }
    }
}
