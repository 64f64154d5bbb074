package com.ryuqq.tracker.core.partition;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 한 사이클의 디스패치 계획.
 *
 * <p>외부 오케스트레이터가 소비하는 값입니다: chunk 인덱스 목록 {@code [0, N)},
 * chunk 수 N, 전체 pending 수.</p>
 *
 * @param chunkCount chunk 수 (N, pending이 없으면 0)
 * @param pendingCount 전체 pending 항목 수
 * @param eligibleCount 이번 사이클에 처리 대상인 항목 수 (우선순위 앞부분)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DispatchPlan(
    int chunkCount,
    int pendingCount,
    int eligibleCount
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 음수이거나 서로 맞지 않는 경우
     */
    public DispatchPlan {
        if (chunkCount < 0 || pendingCount < 0 || eligibleCount < 0) {
            throw new IllegalArgumentException(
                "counts must be non-negative (chunkCount: " + chunkCount
                    + ", pendingCount: " + pendingCount + ", eligibleCount: " + eligibleCount + ")"
            );
        }
        if (eligibleCount > pendingCount) {
            throw new IllegalArgumentException(
                "eligibleCount cannot exceed pendingCount (" + eligibleCount + " > " + pendingCount + ")"
            );
        }
    }

    /**
     * 처리할 것이 없는 계획.
     *
     * @return chunkCount=0, pendingCount=0
     */
    public static DispatchPlan empty() {
        return new DispatchPlan(0, 0, 0);
    }

    /**
     * chunk 인덱스 목록.
     *
     * @return [0, 1, ..., N-1]
     */
    public List<Integer> chunkIndices() {
        return IntStream.range(0, chunkCount).boxed().collect(Collectors.toList());
    }

    /**
     * chunk 인덱스 목록을 JSON 배열 문자열로 표현.
     *
     * @return 예: {@code [0, 1, 2]}, 비어 있으면 {@code []}
     */
    public String matrixJson() {
        // Python json.dumps 기본 구분자와 같은 형식: [0, 1]
        return chunkIndices().stream()
            .map(String::valueOf)
            .collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * 다음 사이클로 넘어가는 항목 수.
     *
     * @return pendingCount - eligibleCount
     */
    public int deferredCount() {
        return pendingCount - eligibleCount;
    }
}
