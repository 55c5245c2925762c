package com.ryuqq.startup.core.model;

/**
 * 컴포넌트의 고유 식별자.
 *
 * <p>ComponentId는 초기화 대상 컴포넌트 타입을 식별하며,
 * 해석 캐시(Resolution Cache)와 레지스트리 조회의 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 점(.), 달러($), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ComponentId database = ComponentId.of("database");
 * ComponentId analytics = ComponentId.of(AnalyticsInitializer.class);
 * // → "com.example.AnalyticsInitializer"
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ComponentId implements Comparable<ComponentId> {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private ComponentId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ComponentId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ComponentId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9.$\\-_]+$")) {
            throw new IllegalArgumentException(
                "ComponentId contains invalid characters. Only alphanumeric, dot, dollar, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 문자열 식별자로 ComponentId 생성.
     *
     * @param value 식별자 값
     * @return ComponentId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ComponentId of(String value) {
        return new ComponentId(value);
    }

    /**
     * 타입의 정규 이름(fully-qualified name)으로 ComponentId 생성.
     *
     * @param type 컴포넌트 타입
     * @return ComponentId 인스턴스
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static ComponentId of(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new ComponentId(type.getName());
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ComponentId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComponentId that = (ComponentId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ComponentId{" + value + '}';
    }
}
