package com.ryuqq.tracker.core.model;

/**
 * 시도가 어느 단계에서 끝났는지를 나타내는 step 태그.
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>사전 조건 실패: {@link #SCRIPT_MISSING}, {@link #INPUT_MISSING}</li>
 *   <li>단계 실패: {@link #EXTRACT_PROTEINS}, {@link #LINEAGE_MISSING}, {@link #RUN_BUSCO}</li>
 *   <li>예상하지 못한 오류: {@link #UNEXPECTED_ERROR}</li>
 *   <li>성공: {@link #NONE} (TSV에는 {@code NA}로 기록)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureStep {

    NONE("NA"),

    SCRIPT_MISSING("script_missing"),

    INPUT_MISSING("input_missing"),

    EXTRACT_PROTEINS("extract_proteins"),

    LINEAGE_MISSING("lineage_missing"),

    RUN_BUSCO("run_busco"),

    UNEXPECTED_ERROR("unexpected_error");

    private final String tag;

    FailureStep(String tag) {
        this.tag = tag;
    }

    /**
     * TSV에 기록되는 태그.
     *
     * @return step 태그
     */
    public String tag() {
        return tag;
    }
}
