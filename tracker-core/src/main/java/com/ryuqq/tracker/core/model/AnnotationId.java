package com.ryuqq.tracker.core.model;

/**
 * Annotation 레코드의 전역 고유 식별자.
 *
 * <p>AnnotationId는 카탈로그, 성공 로그, 결과 로그 전체에서 하나의 작업 항목을 가리키며,
 * Fragment 파일 이름({@code result_<id>.tsv}, {@code log_<id>.tsv})을 만드는 데도 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자, 경로 구분자(/, \) 불가</li>
 *   <li>"." 또는 ".." 단독 사용 불가</li>
 * </ul>
 *
 * <p><strong>정렬:</strong> 문자열 자연 순서. PendingSetResolver의 결정적 정렬이 이 순서에 의존합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AnnotationId implements Comparable<AnnotationId> {

    private final String value;

    private AnnotationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AnnotationId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("AnnotationId length cannot exceed 255 characters");
        }
        if (!value.matches("^[^\\s/\\\\]+$")) {
            throw new IllegalArgumentException(
                "AnnotationId contains invalid characters. Whitespace and path separators are not allowed: " + value
            );
        }
        if (value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException("AnnotationId cannot be a relative path token: " + value);
        }
        this.value = value;
    }

    /**
     * AnnotationId 생성.
     *
     * @param value AnnotationId 값
     * @return AnnotationId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AnnotationId of(String value) {
        return new AnnotationId(value);
    }

    /**
     * 유효한 식별자인지 확인.
     *
     * <p>TSV 파일에서 읽은 원시 값을 걸러낼 때 사용합니다.</p>
     *
     * @param value 검사할 값
     * @return AnnotationId로 생성 가능하면 true
     */
    public static boolean isValid(String value) {
        try {
            new AnnotationId(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * AnnotationId 값 조회.
     *
     * @return AnnotationId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(AnnotationId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AnnotationId that = (AnnotationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AnnotationId{" + value + '}';
    }
}
