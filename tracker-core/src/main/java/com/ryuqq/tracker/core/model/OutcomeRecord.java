package com.ryuqq.tracker.core.model;

/**
 * 결과 로그(OutcomeLog)의 한 행.
 *
 * <p>모든 시도(성공/실패)가 append-only로 기록되며 수정되거나 삭제되지 않습니다.</p>
 *
 * <p><strong>step 규칙:</strong></p>
 * <ul>
 *   <li>result가 SUCCESS이면 step은 {@code NA}</li>
 *   <li>result가 FAIL이면 step은 실패한 단계 태그</li>
 * </ul>
 *
 * <p>step은 문자열로 보관합니다. 과거 버전이 기록한 알 수 없는 태그도 그대로 보존해야 하기 때문입니다.</p>
 *
 * @param id Annotation 식별자
 * @param runAt 시도 시각 (yyyy-MM-dd HH:mm:ss)
 * @param result 시도 결과
 * @param step step 태그
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record OutcomeRecord(
    AnnotationId id,
    String runAt,
    AttemptResult result,
    String step
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public OutcomeRecord {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (runAt == null || runAt.isBlank()) {
            throw new IllegalArgumentException("runAt cannot be null or blank");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (step == null || step.isBlank()) {
            throw new IllegalArgumentException("step cannot be null or blank");
        }
    }

    /**
     * 성공 시도 기록 생성.
     *
     * @param id Annotation 식별자
     * @param runAt 시도 시각
     * @return step이 NA인 OutcomeRecord
     */
    public static OutcomeRecord success(AnnotationId id, String runAt) {
        return new OutcomeRecord(id, runAt, AttemptResult.SUCCESS, FailureStep.NONE.tag());
    }

    /**
     * 실패 시도 기록 생성.
     *
     * @param id Annotation 식별자
     * @param runAt 시도 시각
     * @param step 실패한 단계
     * @return OutcomeRecord
     * @throws IllegalArgumentException step이 null이거나 NONE인 경우
     */
    public static OutcomeRecord failure(AnnotationId id, String runAt, FailureStep step) {
        if (step == null || step == FailureStep.NONE) {
            throw new IllegalArgumentException("failure step must name a failed stage (current: " + step + ")");
        }
        return new OutcomeRecord(id, runAt, AttemptResult.FAIL, step.tag());
    }

    /**
     * 중복 제거 키 조회.
     *
     * @return (id, runAt) 키
     */
    public OutcomeKey key() {
        return new OutcomeKey(id, runAt);
    }
}
