package com.ryuqq.tracker.adapter.runner;

/**
 * 워커 하나의 slice 처리 결과 요약.
 *
 * @param chunkIndex 워커 인덱스
 * @param assigned slice에 할당된 항목 수
 * @param succeeded 성공한 항목 수
 * @param failed 실패한 항목 수
 * @param skipped catalog에 없어 건너뛴 항목 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ChunkReport(
    int chunkIndex,
    int assigned,
    int succeeded,
    int failed,
    int skipped
) {

    public ChunkReport {
        if (succeeded + failed + skipped != assigned) {
            throw new IllegalArgumentException(
                "succeeded + failed + skipped must equal assigned (current: "
                    + succeeded + " + " + failed + " + " + skipped + " != " + assigned + ")"
            );
        }
    }
}
