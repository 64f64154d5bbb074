package com.ryuqq.tracker.core.model;

/**
 * 성공 로그(SuccessLog)의 한 행.
 *
 * <p>AnnotationId 하나당 최대 한 개만 존재합니다. 이 불변식은 저장소가 아니라
 * {@code FragmentAggregator}가 보장하며, 같은 id의 두 번째 성공은 덮어쓰지 않고 버립니다.</p>
 *
 * @param id Annotation 식별자
 * @param metrics 분석 지표
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SuccessRecord(
    AnnotationId id,
    BuscoMetrics metrics
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 metrics가 null인 경우
     */
    public SuccessRecord {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
    }
}
