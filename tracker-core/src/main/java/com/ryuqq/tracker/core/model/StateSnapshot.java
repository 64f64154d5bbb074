package com.ryuqq.tracker.core.model;

import java.util.Set;

/**
 * 사이클 시작 시점의 canonical 상태 스냅샷.
 *
 * <p>사이클 도중에는 갱신되지 않습니다. 워커는 실행 중에 canonical 상태를 다시 읽지 않습니다.</p>
 *
 * @param catalogIds 카탈로그 전체 id 집합 (A)
 * @param successIds 성공 로그 id 집합 (S)
 * @param outcomeIds 결과 로그에 이력이 있는 id 집합 (E, 성공/실패 무관)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StateSnapshot(
    Set<AnnotationId> catalogIds,
    Set<AnnotationId> successIds,
    Set<AnnotationId> outcomeIds
) {

    /**
     * Compact Constructor (방어적 복사).
     *
     * @throws IllegalArgumentException 집합이 null인 경우
     */
    public StateSnapshot {
        if (catalogIds == null || successIds == null || outcomeIds == null) {
            throw new IllegalArgumentException("All id sets are required for StateSnapshot");
        }
        catalogIds = Set.copyOf(catalogIds);
        successIds = Set.copyOf(successIds);
        outcomeIds = Set.copyOf(outcomeIds);
    }
}
