package com.ryuqq.tracker.core.pending;

import com.ryuqq.tracker.core.model.AnnotationId;

import java.util.List;

/**
 * 우선순위 순서로 정렬된 pending 목록과 그 구성 내역.
 *
 * <p>ids는 {@code neverAttempted}개의 미시도 항목 뒤에 {@code failedRetry}개의 재시도 항목이 이어집니다.</p>
 *
 * @param ids 우선순위 순서의 pending id 목록 (중복 없음)
 * @param total 카탈로그 전체 항목 수
 * @param successful 성공 로그에 있는 항목 수
 * @param neverAttempted 한 번도 시도되지 않은 항목 수
 * @param failedRetry 이력은 있으나 아직 성공하지 못한 항목 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PendingSet(
    List<AnnotationId> ids,
    int total,
    int successful,
    int neverAttempted,
    int failedRetry
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException ids가 null이거나 개수가 맞지 않는 경우
     */
    public PendingSet {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        if (ids.size() != neverAttempted + failedRetry) {
            throw new IllegalArgumentException(
                "ids size must equal neverAttempted + failedRetry (ids: " + ids.size()
                    + ", neverAttempted: " + neverAttempted + ", failedRetry: " + failedRetry + ")"
            );
        }
        ids = List.copyOf(ids);
    }

    /**
     * 처리할 항목이 없는 PendingSet.
     *
     * @return 빈 PendingSet
     */
    public static PendingSet empty() {
        return new PendingSet(List.of(), 0, 0, 0, 0);
    }

    /**
     * pending 항목 수.
     *
     * @return ids 크기
     */
    public int size() {
        return ids.size();
    }

    /**
     * pending 항목이 없는지 확인.
     *
     * @return 비어 있으면 true
     */
    public boolean isEmpty() {
        return ids.isEmpty();
    }
}
