package com.ryuqq.tracker.core.outcome;

/**
 * 외부 단계(추출, 분석) 하나의 실행 결과.
 *
 * <p>StageResult는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 단계가 성공하고 산출물(artifact)을 남김</li>
 *   <li>{@link Fail}: 단계가 실패함, 실패한 step 태그 포함</li>
 * </ul>
 *
 * <p>단계 함수는 예외를 던지지 않고 StageResult를 반환합니다. 상태 머신은 이 값을 조합할 뿐
 * 단계 경계를 넘는 예외를 다루지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StageResult result = extractionStage.extract(item);
 * if (result instanceof Fail fail) {
 *     return fail.step();
 * }
 * Path proteins = ((Ok) result).artifact();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StageResult permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
