package com.ryuqq.startup.adapter.runner;

/**
 * DependencyResolvingOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>hostContext: 모든 {@code create} 호출에 전달되는 호스트 컨텍스트 (기본 null)</li>
 *   <li>verboseLogging: 컴포넌트별 생성 시작/완료 로그를 INFO로 남길지 여부 (기본 false → DEBUG)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param hostContext 호스트 컨텍스트 (null 허용)
 * @param verboseLogging 생성 로그 INFO 출력 여부
 */
public record OrchestratorConfig(
    Object hostContext,
    boolean verboseLogging
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: hostContext=null, verboseLogging=false</p>
     */
    public OrchestratorConfig() {
        this(null, false);
    }

    /**
     * hostContext만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withHostContext(Object hostContext) {
        return new OrchestratorConfig(hostContext, verboseLogging);
    }

    /**
     * verboseLogging만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withVerboseLogging(boolean verboseLogging) {
        return new OrchestratorConfig(hostContext, verboseLogging);
    }
}
