package com.ryuqq.tracker.adapter.tsv;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.AttemptResult;
import com.ryuqq.tracker.core.model.BuscoMetrics;
import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.model.WorkItem;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * TSV 행과 도메인 레코드 간 변환기.
 *
 * <p>읽기 변환은 필수 컬럼이 없거나 값이 잘못된 경우 {@link Optional#empty()}를 반환합니다.
 * 호출자가 malformed 행으로 집계하고 건너뜁니다.</p>
 *
 * <p><strong>result 컬럼이 없는 과거 로그:</strong> step이 {@code NA}인 행은 success,
 * 나머지는 fail로 해석합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TsvRowMapper {

    // Utility class - prevent instantiation
    private TsvRowMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * SuccessRecord를 SuccessLog 행으로 변환.
     *
     * @param record 성공 레코드
     * @return 컬럼명 기준 행
     */
    public static Map<String, String> toRow(SuccessRecord record) {
        BuscoMetrics m = record.metrics();
        Map<String, String> row = new LinkedHashMap<>();
        row.put(TsvSchema.ID, record.id().getValue());
        row.put(TsvSchema.LINEAGE, m.lineage());
        row.put(TsvSchema.BUSCO_COUNT, Integer.toString(m.buscoCount()));
        row.put(TsvSchema.COMPLETE, Double.toString(m.complete()));
        row.put(TsvSchema.SINGLE, Double.toString(m.single()));
        row.put(TsvSchema.DUPLICATED, Double.toString(m.duplicated()));
        row.put(TsvSchema.FRAGMENTED, Double.toString(m.fragmented()));
        row.put(TsvSchema.MISSING, Double.toString(m.missing()));
        return row;
    }

    /**
     * OutcomeRecord를 OutcomeLog 행으로 변환.
     *
     * @param record 결과 레코드
     * @return 컬럼명 기준 행
     */
    public static Map<String, String> toRow(OutcomeRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(TsvSchema.ID, record.id().getValue());
        row.put(TsvSchema.RUN_AT, record.runAt());
        row.put(TsvSchema.RESULT, record.result().tag());
        row.put(TsvSchema.STEP, record.step());
        return row;
    }

    /**
     * SuccessLog 행 파싱.
     *
     * <p>id와 8개 컬럼이 모두 있어야 하며, 빈 숫자 값은 0으로 해석합니다.</p>
     *
     * @param row 컬럼명 기준 행
     * @return SuccessRecord (malformed이면 empty)
     */
    public static Optional<SuccessRecord> toSuccess(Map<String, String> row) {
        for (String column : TsvSchema.SUCCESS_HEADER) {
            if (!row.containsKey(column)) {
                return Optional.empty();
            }
        }
        Optional<AnnotationId> id = toId(row);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        try {
            BuscoMetrics metrics = new BuscoMetrics(
                row.get(TsvSchema.LINEAGE),
                parseInt(row.get(TsvSchema.BUSCO_COUNT)),
                parseDouble(row.get(TsvSchema.COMPLETE)),
                parseDouble(row.get(TsvSchema.SINGLE)),
                parseDouble(row.get(TsvSchema.DUPLICATED)),
                parseDouble(row.get(TsvSchema.FRAGMENTED)),
                parseDouble(row.get(TsvSchema.MISSING))
            );
            return Optional.of(new SuccessRecord(id.get(), metrics));
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            return Optional.empty();
        }
    }

    /**
     * OutcomeLog 행 파싱.
     *
     * @param row 컬럼명 기준 행
     * @return OutcomeRecord (malformed이면 empty)
     */
    public static Optional<OutcomeRecord> toOutcome(Map<String, String> row) {
        Optional<AnnotationId> id = toId(row);
        String runAt = row.get(TsvSchema.RUN_AT);
        String step = row.get(TsvSchema.STEP);
        if (id.isEmpty() || isBlank(runAt) || isBlank(step)) {
            return Optional.empty();
        }

        AttemptResult result;
        String tag = row.get(TsvSchema.RESULT);
        if (tag == null) {
            result = FailureStep.NONE.tag().equals(step) ? AttemptResult.SUCCESS : AttemptResult.FAIL;
        } else {
            try {
                result = AttemptResult.fromTag(tag);
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        return Optional.of(new OutcomeRecord(id.get(), runAt, result, step));
    }

    /**
     * WorkCatalog 행 파싱.
     *
     * @param row 컬럼명 기준 행
     * @return WorkItem (id가 잘못되었거나 locator가 비어 있으면 empty)
     */
    public static Optional<WorkItem> toWorkItem(Map<String, String> row) {
        Optional<AnnotationId> id = toId(row);
        String annotationUrl = row.get(TsvSchema.ANNOTATION_URL);
        String assemblyUrl = row.get(TsvSchema.ASSEMBLY_URL);
        if (id.isEmpty() || isBlank(annotationUrl) || isBlank(assemblyUrl)) {
            return Optional.empty();
        }
        return Optional.of(new WorkItem(id.get(), annotationUrl, assemblyUrl));
    }

    /**
     * 행의 annotation_id 파싱.
     *
     * @param row 컬럼명 기준 행
     * @return AnnotationId (없거나 유효하지 않으면 empty)
     */
    public static Optional<AnnotationId> toId(Map<String, String> row) {
        String value = row.get(TsvSchema.ID);
        if (!AnnotationId.isValid(value)) {
            return Optional.empty();
        }
        return Optional.of(AnnotationId.of(value));
    }

    private static int parseInt(String value) {
        return isBlank(value) ? 0 : Integer.parseInt(value.trim());
    }

    private static double parseDouble(String value) {
        return isBlank(value) ? 0.0 : Double.parseDouble(value.trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
