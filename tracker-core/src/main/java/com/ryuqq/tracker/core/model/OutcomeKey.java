package com.ryuqq.tracker.core.model;

/**
 * 결과 로그(OutcomeLog)의 중복 제거 키.
 *
 * <p>같은 id에 대한 반복 실패 이력을 모두 보존해야 하므로 id 단독이 아니라
 * (id, runAt) 조합이 키가 됩니다.</p>
 *
 * @param id Annotation 식별자
 * @param runAt 시도 시각 (yyyy-MM-dd HH:mm:ss)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OutcomeKey(
    AnnotationId id,
    String runAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public OutcomeKey {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (runAt == null || runAt.isBlank()) {
            throw new IllegalArgumentException("runAt cannot be null or blank");
        }
    }
}
