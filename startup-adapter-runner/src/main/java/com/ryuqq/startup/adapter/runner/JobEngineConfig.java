package com.ryuqq.startup.adapter.runner;

/**
 * ExecutorJobEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 워커 스레드 수 (기본 4)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중인 작업 대기 시간 (기본 60000ms = 60초)</li>
 * </ul>
 *
 * <p>concurrency는 작업 시작뿐 아니라 오케스트레이터의 비동기 해석 후속 작업 전체를
 * 제한합니다. 비동기 체인 안의 SYNC {@code create}와 그 안의 중첩 {@code resolveSync}는
 * 끝날 때까지 워커 스레드 하나를 점유하므로, 동시에 블로킹될 수 있는 create 수보다
 * 크게 잡아야 합니다. {@code CompletionStage}가 완료되기를 기다리는 동안에는
 * 워커를 점유하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param concurrency 워커 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record JobEngineConfig(
    int concurrency,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, shutdownTimeoutMs=60000ms</p>
     */
    public JobEngineConfig() {
        this(4, 60_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JobEngineConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public JobEngineConfig withConcurrency(int concurrency) {
        return new JobEngineConfig(concurrency, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public JobEngineConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new JobEngineConfig(concurrency, shutdownTimeoutMs);
    }
}
