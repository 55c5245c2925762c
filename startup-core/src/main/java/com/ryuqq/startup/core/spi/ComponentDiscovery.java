package com.ryuqq.startup.core.spi;

import com.ryuqq.startup.core.model.ComponentDescriptor;

import java.util.List;

/**
 * Component Discovery SPI.
 *
 * <p>일괄 초기화 대상 (식별자, 실행 방식) 목록을 제공합니다.
 * 구체적인 출처(설정 파일, 환경 변수, 정적 등록 등)는 구현체가 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ComponentDiscovery {

    /**
     * 초기화 대상 탐색.
     *
     * @return 탐색된 Descriptor 목록 (순서 유지, 빈 목록 가능)
     * @throws RuntimeException 탐색 실패 시
     */
    List<ComponentDescriptor> discover();
}
