package com.ryuqq.tracker.adapter.runner;

import com.ryuqq.tracker.core.model.BuscoMetrics;
import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.outcome.Fail;
import com.ryuqq.tracker.core.outcome.Ok;
import com.ryuqq.tracker.core.outcome.StageResult;
import com.ryuqq.tracker.core.spi.AnalysisStage;
import com.ryuqq.tracker.core.spi.ExtractionStage;
import com.ryuqq.tracker.core.spi.FragmentSink;
import com.ryuqq.tracker.core.statemachine.AttemptState;
import com.ryuqq.tracker.core.statemachine.AttemptStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * 작업 항목 하나를 처리하는 상태 머신 실행기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * PENDING
 *   ├─ 스크립트 없음        → FAILED (script_missing)
 *   ├─ 입력 파일 없음        → FAILED (input_missing)
 *   ↓
 * EXTRACTING ─ 실패        → FAILED (extract_proteins)
 *   ↓
 * ANALYZING ── 실패        → FAILED (lineage_missing | run_busco)
 *   ↓
 * PARSING ──── 예외        → FAILED (unexpected_error)
 *   ↓
 * SUCCEEDED → result fragment + log fragment
 * </pre>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>예외를 호출자에게 전파하지 않음 (모든 예외는 unexpected_error로 기록)</li>
 *   <li>한 번의 시도는 정확히 하나의 outcome fragment를 남김</li>
 *   <li>성공 시에만 success fragment를 outcome fragment보다 먼저 기록</li>
 *   <li>성공 outcome 기록이 실패하면 success fragment를 제거한 뒤 unexpected_error로 기록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkerExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkerExecutor.class);

    public static final DateTimeFormatter RUN_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ExtractionStage extraction;
    private final AnalysisStage analysis;
    private final BuscoSummaryParser parser;
    private final FragmentSink sink;
    private final Clock clock;

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param extraction 단백질 추출 단계
     * @param analysis BUSCO 분석 단계
     * @param parser summary 파서
     * @param sink fragment 출력
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerExecutor(ExtractionStage extraction, AnalysisStage analysis, BuscoSummaryParser parser, FragmentSink sink) {
        this(extraction, analysis, parser, sink, Clock.systemDefaultZone());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param extraction 단백질 추출 단계
     * @param analysis BUSCO 분석 단계
     * @param parser summary 파서
     * @param sink fragment 출력
     * @param clock run_at 타임스탬프용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerExecutor(ExtractionStage extraction, AnalysisStage analysis, BuscoSummaryParser parser,
                          FragmentSink sink, Clock clock) {
        if (extraction == null) {
            throw new IllegalArgumentException("extraction cannot be null");
        }
        if (analysis == null) {
            throw new IllegalArgumentException("analysis cannot be null");
        }
        if (parser == null) {
            throw new IllegalArgumentException("parser cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.extraction = extraction;
        this.analysis = analysis;
        this.parser = parser;
        this.sink = sink;
        this.clock = clock;
    }

    /**
     * 작업 항목 하나 처리.
     *
     * @param item 처리할 항목
     * @return 기록한 outcome 행
     * @throws IllegalArgumentException item이 null인 경우
     */
    public OutcomeRecord execute(WorkItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }

        log.info("Starting BUSCO analysis for {}", item.id().getValue());
        AttemptState state = AttemptState.PENDING;
        try {
            // 1. 사전 조건
            Optional<Fail> precondition = extraction.checkTool()
                .or(analysis::checkTool)
                .or(() -> extraction.checkInputs(item));
            if (precondition.isPresent()) {
                return fail(item, state, precondition.get());
            }

            // 2. 단백질 추출
            state = AttemptStateTransition.transition(state, AttemptState.EXTRACTING);
            StageResult extracted = extraction.extract(item);
            if (extracted instanceof Fail fail) {
                return fail(item, state, fail);
            }
            Path proteinFile = ((Ok) extracted).artifact();

            // 3. BUSCO 분석
            state = AttemptStateTransition.transition(state, AttemptState.ANALYZING);
            StageResult analyzed = analysis.analyze(item.id(), proteinFile);
            if (analyzed instanceof Fail fail) {
                return fail(item, state, fail);
            }
            Path outputDir = ((Ok) analyzed).artifact();

            // 4. 결과 파싱
            state = AttemptStateTransition.transition(state, AttemptState.PARSING);
            BuscoMetrics metrics = parser.parse(outputDir);

            // 5. 기록
            OutcomeRecord outcome = OutcomeRecord.success(item.id(), now());
            sink.writeSuccess(new SuccessRecord(item.id(), metrics));
            writeSuccessOutcome(item, outcome);
            state = AttemptStateTransition.transition(state, AttemptState.SUCCEEDED);
            log.info("Successfully completed BUSCO analysis for {}", item.id().getValue());
            return outcome;

        } catch (Exception e) {
            log.error("Unexpected error for {} in state {}: {}", item.id().getValue(), state, e.getMessage(), e);
            return fail(item, state, Fail.of(FailureStep.UNEXPECTED_ERROR, describe(e)));
        }
    }

    private void writeSuccessOutcome(WorkItem item, OutcomeRecord outcome) {
        try {
            sink.writeOutcome(outcome);
        } catch (RuntimeException e) {
            // 실패 outcome과 success fragment는 함께 남지 않음
            try {
                sink.discardSuccess(item.id());
            } catch (RuntimeException discardFailure) {
                log.error("Could not remove success fragment for {}: {}",
                    item.id().getValue(), discardFailure.getMessage());
                e.addSuppressed(discardFailure);
            }
            throw e;
        }
    }

    private OutcomeRecord fail(WorkItem item, AttemptState state, Fail fail) {
        if (!state.isTerminal()) {
            AttemptStateTransition.transition(state, AttemptState.FAILED);
        }
        OutcomeRecord outcome = OutcomeRecord.failure(item.id(), now(), fail.step());
        log.error("{} failed at {}: {}", item.id().getValue(), fail.step().tag(), fail.message());
        try {
            sink.writeOutcome(outcome);
        } catch (RuntimeException e) {
            // 다음 사이클에서 미시도 항목으로 다시 선택됨
            log.error("Could not write outcome fragment for {}: {}", item.id().getValue(), e.getMessage());
        }
        return outcome;
    }

    private String now() {
        return LocalDateTime.now(clock).format(RUN_AT_FORMAT);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
