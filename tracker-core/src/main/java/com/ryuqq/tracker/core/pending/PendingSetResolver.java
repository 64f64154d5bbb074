package com.ryuqq.tracker.core.pending;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.StateSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 스냅샷으로부터 pending 목록을 계산.
 *
 * <p><strong>계산 규칙:</strong></p>
 * <pre>
 * never_attempted   = sort(A − S − E)
 * previously_failed = sort(E − S)
 * pending           = never_attempted ++ previously_failed
 * </pre>
 *
 * <ul>
 *   <li>A: 카탈로그 id, S: 성공 id, E: 결과 로그 id (성공/실패 무관)</li>
 *   <li>미시도 항목이 먼저 용량을 차지하고, 실패 항목은 그 뒤에 재시도됩니다.</li>
 *   <li>정렬은 id의 자연 문자열 순서이므로 입력 상태가 같으면 결과도 같습니다.</li>
 *   <li>S에 있는 id는 결과 로그 이력이 있어도 절대 포함되지 않습니다 (sticky success).</li>
 * </ul>
 *
 * <p>E − S에는 카탈로그에 없는 id도 포함될 수 있습니다. 이력이 조용히 사라지지 않도록
 * 그대로 재시도 대상으로 보고하며, 위치 정보가 없는 항목은 워커가 건너뜁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PendingSetResolver {

    /**
     * pending 목록 계산.
     *
     * <p>카탈로그가 비어 있으면 오류 없이 빈 결과를 반환합니다.</p>
     *
     * @param snapshot 사이클 시작 시점의 스냅샷
     * @return 우선순위 순서의 PendingSet
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public PendingSet resolve(StateSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (snapshot.catalogIds().isEmpty()) {
            return PendingSet.empty();
        }

        Set<AnnotationId> success = snapshot.successIds();
        Set<AnnotationId> attempted = snapshot.outcomeIds();

        TreeSet<AnnotationId> neverAttempted = new TreeSet<>(snapshot.catalogIds());
        neverAttempted.removeAll(success);
        neverAttempted.removeAll(attempted);

        TreeSet<AnnotationId> failed = new TreeSet<>(attempted);
        failed.removeAll(success);

        List<AnnotationId> ids = new ArrayList<>(neverAttempted.size() + failed.size());
        ids.addAll(neverAttempted);
        ids.addAll(failed);

        return new PendingSet(
            ids,
            snapshot.catalogIds().size(),
            success.size(),
            neverAttempted.size(),
            failed.size()
        );
    }
}
