package com.ryuqq.tracker.core.model;

/**
 * 결과 로그 행의 result 컬럼 값.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AttemptResult {

    SUCCESS("success"),

    FAIL("fail");

    private final String tag;

    AttemptResult(String tag) {
        this.tag = tag;
    }

    /**
     * TSV에 기록되는 태그.
     *
     * @return success 또는 fail
     */
    public String tag() {
        return tag;
    }

    /**
     * 태그 문자열로부터 AttemptResult 조회 (대소문자 무시).
     *
     * @param tag 태그 문자열
     * @return AttemptResult
     * @throws IllegalArgumentException 알 수 없는 태그인 경우
     */
    public static AttemptResult fromTag(String tag) {
        if (tag != null) {
            for (AttemptResult result : values()) {
                if (result.tag.equalsIgnoreCase(tag.trim())) {
                    return result;
                }
            }
        }
        throw new IllegalArgumentException("Unknown attempt result: " + tag);
    }
}
