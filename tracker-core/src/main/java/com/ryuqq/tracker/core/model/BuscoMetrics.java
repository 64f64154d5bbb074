package com.ryuqq.tracker.core.model;

/**
 * BUSCO 요약 리포트에서 추출한 지표.
 *
 * <p>개별 필드가 리포트에 없으면 실패 대신 기본값을 사용합니다 (부분 데이터도 유용하기 때문).</p>
 *
 * <p><strong>필드별 기본값:</strong></p>
 * <ul>
 *   <li>lineage: 빈 문자열</li>
 *   <li>buscoCount: 0</li>
 *   <li>complete, single, duplicated, fragmented, missing: 0.0</li>
 * </ul>
 *
 * @param lineage lineage 데이터셋 이름 (예: eukaryota_odb12)
 * @param buscoCount 전체 BUSCO 개수
 * @param complete Complete 비율 (%)
 * @param single Complete and single-copy 비율 (%)
 * @param duplicated Complete and duplicated 비율 (%)
 * @param fragmented Fragmented 비율 (%)
 * @param missing Missing 비율 (%)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BuscoMetrics(
    String lineage,
    int buscoCount,
    double complete,
    double single,
    double duplicated,
    double fragmented,
    double missing
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException lineage가 null이거나 개수가 음수인 경우
     */
    public BuscoMetrics {
        if (lineage == null) {
            throw new IllegalArgumentException("lineage cannot be null");
        }
        if (buscoCount < 0) {
            throw new IllegalArgumentException("buscoCount must be non-negative (current: " + buscoCount + ")");
        }
    }

    /**
     * 모든 필드가 기본값인 지표 생성.
     *
     * @return 빈 BuscoMetrics
     */
    public static BuscoMetrics empty() {
        return new BuscoMetrics("", 0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
