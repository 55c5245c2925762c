/**
 * 초기화 오류 분류.
 *
 * <p>모든 예외는 {@link com.ryuqq.startup.core.exception.StartupException}을 상속하는 unchecked 예외입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.startup.core.exception;
