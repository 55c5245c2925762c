package com.ryuqq.startup.core.exception;

/**
 * 백그라운드 작업 대기 실패.
 *
 * <p>가장 먼저 실패한 작업의 원인을 전달합니다.
 * 다른 작업의 실패는 집계되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AwaitAllFailedException extends StartupException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 첫 번째 실패 원인
     */
    public AwaitAllFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
