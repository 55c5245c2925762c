package com.ryuqq.startup.core.exception;

/**
 * 컴포넌트 초기화 오류의 상위 타입.
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link CycleDetectedException}: 의존성 순환 감지</li>
 *   <li>{@link InitializationFailedException}: 조회 또는 생성 실패</li>
 *   <li>{@link AwaitAllFailedException}: 백그라운드 작업 대기 실패</li>
 *   <li>{@link UnknownComponentException}: 레지스트리에 등록되지 않은 식별자</li>
 * </ul>
 *
 * <p>모든 오류는 최상위 호출자에게 전달되며, 내부 재시도는 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StartupException extends RuntimeException {

    /**
     * 메시지로 생성.
     *
     * @param message 오류 메시지
     */
    public StartupException(String message) {
        super(message);
    }

    /**
     * 메시지와 원인으로 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
