package com.ryuqq.tracker.core.outcome;

import com.ryuqq.tracker.core.model.FailureStep;

/**
 * 단계 실패 결과.
 *
 * <p>이번 시도에 한해 종료를 의미합니다. 다음 사이클의 PendingSetResolver가
 * 해당 항목을 재시도 대상으로 다시 포함합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>스크립트 없음 (script_missing)</li>
 *   <li>입력 파일 없음 (input_missing)</li>
 *   <li>외부 프로세스 non-zero exit (extract_proteins, run_busco)</li>
 *   <li>lineage 디렉토리 없음 (lineage_missing)</li>
 * </ul>
 *
 * @param step 실패한 단계
 * @param message 실패 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    FailureStep step,
    String message
) implements StageResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException step이 null 또는 NONE이거나 message가 비어 있는 경우
     */
    public Fail {
        if (step == null || step == FailureStep.NONE) {
            throw new IllegalArgumentException("step must name a failed stage (current: " + step + ")");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Fail 생성.
     *
     * @param step 실패한 단계
     * @param message 실패 메시지
     * @return Fail 인스턴스
     */
    public static Fail of(FailureStep step, String message) {
        return new Fail(step, message);
    }
}
