package com.ryuqq.tracker.adapter.tsv;

import java.util.List;

/**
 * Column layout of every tab-separated table the tracker reads or writes.
 *
 * <p><strong>Tables:</strong></p>
 * <pre>
 * annotations.tsv : annotation_id  annotation_url  assembly_url
 * BUSCO.tsv       : annotation_id  lineage  busco_count  complete  single  duplicated  fragmented  missing
 * log.tsv         : annotation_id  run_at  result  step
 * </pre>
 *
 * <p>The outcome log written by older runs has no {@code result} column
 * ({@link #LEGACY_OUTCOME_HEADER}); it is still readable, and appends to such a file
 * follow its own header.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TsvSchema {

    public static final String ID = "annotation_id";
    public static final String ANNOTATION_URL = "annotation_url";
    public static final String ASSEMBLY_URL = "assembly_url";

    public static final String LINEAGE = "lineage";
    public static final String BUSCO_COUNT = "busco_count";
    public static final String COMPLETE = "complete";
    public static final String SINGLE = "single";
    public static final String DUPLICATED = "duplicated";
    public static final String FRAGMENTED = "fragmented";
    public static final String MISSING = "missing";

    public static final String RUN_AT = "run_at";
    public static final String RESULT = "result";
    public static final String STEP = "step";

    public static final List<String> CATALOG_HEADER = List.of(ID, ANNOTATION_URL, ASSEMBLY_URL);

    public static final List<String> SUCCESS_HEADER = List.of(
        ID, LINEAGE, BUSCO_COUNT, COMPLETE, SINGLE, DUPLICATED, FRAGMENTED, MISSING
    );

    public static final List<String> OUTCOME_HEADER = List.of(ID, RUN_AT, RESULT, STEP);

    public static final List<String> LEGACY_OUTCOME_HEADER = List.of(ID, RUN_AT, STEP);

    public static final String SUCCESS_FRAGMENT_PREFIX = "result_";
    public static final String OUTCOME_FRAGMENT_PREFIX = "log_";
    public static final String FRAGMENT_SUFFIX = ".tsv";

    // Utility class - prevent instantiation
    private TsvSchema() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Success fragment file name for an id.
     *
     * @param id annotation id value
     * @return {@code result_<id>.tsv}
     */
    public static String successFragmentName(String id) {
        return SUCCESS_FRAGMENT_PREFIX + id + FRAGMENT_SUFFIX;
    }

    /**
     * Outcome fragment file name for an id.
     *
     * @param id annotation id value
     * @return {@code log_<id>.tsv}
     */
    public static String outcomeFragmentName(String id) {
        return OUTCOME_FRAGMENT_PREFIX + id + FRAGMENT_SUFFIX;
    }
}
