/**
 * Job Engine 인터페이스.
 *
 * <p>비동기 초기화 작업의 추적과 대기(barrier)를 정의합니다.</p>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 startup-adapter-runner 모듈의 {@code ExecutorJobEngine}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.startup.application.engine;
