package com.ryuqq.startup.adapter.runner;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * CompletableFuture 예외 처리 유틸리티.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class Futures {

    private Futures() {
    }

    /**
     * CompletionException / ExecutionException 래퍼를 벗겨 원래 원인을 반환.
     *
     * @param failure Future에서 전달된 예외
     * @return 원래 원인 (래퍼가 아니면 그대로)
     */
    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
