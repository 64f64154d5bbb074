package com.ryuqq.tracker.core.outcome;

import java.nio.file.Path;

/**
 * 단계 성공 결과.
 *
 * @param artifact 단계가 남긴 산출물 경로 (단백질 파일, BUSCO 출력 디렉토리 등)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(Path artifact) implements StageResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException artifact가 null인 경우
     */
    public Ok {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
    }

    /**
     * Ok 생성.
     *
     * @param artifact 산출물 경로
     * @return Ok 인스턴스
     */
    public static Ok of(Path artifact) {
        return new Ok(artifact);
    }
}
