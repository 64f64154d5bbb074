package com.ryuqq.tracker.core.statemachine;

/**
 * 항목 하나에 대한 한 번의 시도의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼
 * EXTRACTING ──► FAILED (script_missing, input_missing, extract_proteins)
 *    │
 *    ▼
 * ANALYZING ───► FAILED (lineage_missing, run_busco)
 *    │
 *    ▼
 * PARSING ─────► FAILED (unexpected_error)
 *    │
 *    ▼
 * SUCCEEDED
 *
 * 금지된 전이:
 * - SUCCEEDED → * ❌
 * - FAILED → * ❌
 * - 단계 건너뛰기 (예: PENDING → ANALYZING) ❌
 * </pre>
 *
 * <p>FAILED는 이번 시도에 한한 종료 상태이며, 이후 사이클에서 새로운 시도가 시작될 수 있습니다.
 * SUCCEEDED는 전역 종료 상태입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AttemptState {

    /**
     * 대기 중 (아직 시작 안 됨).
     */
    PENDING,

    /**
     * 단백질 추출 중.
     */
    EXTRACTING,

    /**
     * BUSCO 분석 중.
     */
    ANALYZING,

    /**
     * 요약 리포트 파싱 중.
     */
    PARSING,

    /**
     * 성공.
     */
    SUCCEEDED,

    /**
     * 실패 (이번 시도 한정).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
