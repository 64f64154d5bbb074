package com.ryuqq.tracker.core.aggregate;

/**
 * 집계 한 번의 결과 요약.
 *
 * @param successAppended 성공 로그에 새로 추가된 행 수
 * @param successSkipped 이미 존재하여 건너뛴 성공 행 수
 * @param outcomeAppended 결과 로그에 새로 추가된 행 수
 * @param outcomeSkipped 이미 존재하여 건너뛴 결과 행 수
 * @param malformed 필수 컬럼이 없어 건너뛴 fragment 행 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AggregationReport(
    int successAppended,
    int successSkipped,
    int outcomeAppended,
    int outcomeSkipped,
    int malformed
) {

    /**
     * 새로 추가된 행이 없는지 확인.
     *
     * <p>같은 fragment 디렉토리를 두 번째로 집계하면 항상 true입니다.</p>
     *
     * @return 추가된 행이 없으면 true
     */
    public boolean isNoOp() {
        return successAppended == 0 && outcomeAppended == 0;
    }
}
