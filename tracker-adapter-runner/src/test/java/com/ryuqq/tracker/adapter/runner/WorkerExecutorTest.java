package com.ryuqq.tracker.adapter.runner;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.AttemptResult;
import com.ryuqq.tracker.core.model.BuscoMetrics;
import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.outcome.Fail;
import com.ryuqq.tracker.core.outcome.Ok;
import com.ryuqq.tracker.core.spi.AnalysisStage;
import com.ryuqq.tracker.core.spi.ExtractionStage;
import com.ryuqq.tracker.core.spi.FragmentSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * WorkerExecutor 유닛 테스트.
 *
 * <p>단계별 실패 태그, fragment 기록 순서, 예외 비전파를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorkerExecutorTest {

    private static final Path PROTEINS = Path.of("data/a_proteins.faa");
    private static final Path OUTPUT_DIR = Path.of("busco_a");
    private static final BuscoMetrics METRICS = new BuscoMetrics("eukaryota_odb12", 129, 95.3, 94.6, 0.7, 2.3, 2.4);

    @Mock
    private ExtractionStage extraction;

    @Mock
    private AnalysisStage analysis;

    @Mock
    private BuscoSummaryParser parser;

    @Mock
    private FragmentSink sink;

    private WorkerExecutor executor;
    private WorkItem item;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T09:30:15Z"), ZoneOffset.UTC);
        executor = new WorkerExecutor(extraction, analysis, parser, sink, clock);
        item = new WorkItem(AnnotationId.of("a"), "data/a.gff3.gz", "data/a.fna.gz");
    }

    // ============================================================
    // 1. 성공 경로
    // ============================================================

    @Test
    void execute_성공_시_success_fragment_후_outcome_fragment_기록() {
        // given
        when(extraction.extract(item)).thenReturn(Ok.of(PROTEINS));
        when(analysis.analyze(item.id(), PROTEINS)).thenReturn(Ok.of(OUTPUT_DIR));
        when(parser.parse(OUTPUT_DIR)).thenReturn(METRICS);

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.result()).isEqualTo(AttemptResult.SUCCESS);
        assertThat(outcome.step()).isEqualTo("NA");
        assertThat(outcome.runAt()).isEqualTo("2026-10-19 09:30:15");

        InOrder inOrder = inOrder(sink);
        inOrder.verify(sink).writeSuccess(new SuccessRecord(item.id(), METRICS));
        inOrder.verify(sink).writeOutcome(outcome);
        verifyNoMoreInteractions(sink);
    }

    // ============================================================
    // 2. 사전 조건 실패
    // ============================================================

    @Test
    void execute_추출_스크립트_없으면_script_missing_후_단계_실행_안함() {
        // given
        when(extraction.checkTool()).thenReturn(Optional.of(Fail.of(FailureStep.SCRIPT_MISSING, "no script")));

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.step()).isEqualTo("script_missing");
        verify(extraction, never()).extract(any());
        verify(analysis, never()).checkTool();
        verify(sink, never()).writeSuccess(any());
        verify(sink).writeOutcome(outcome);
    }

    @Test
    void execute_분석_스크립트_없으면_script_missing() {
        // given
        when(analysis.checkTool()).thenReturn(Optional.of(Fail.of(FailureStep.SCRIPT_MISSING, "no busco")));

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.step()).isEqualTo("script_missing");
        verify(extraction, never()).checkInputs(any());
    }

    @Test
    void execute_입력_파일_없으면_input_missing() {
        // given
        when(extraction.checkInputs(item)).thenReturn(Optional.of(Fail.of(FailureStep.INPUT_MISSING, "no gff")));

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.result()).isEqualTo(AttemptResult.FAIL);
        assertThat(outcome.step()).isEqualTo("input_missing");
        verify(extraction, never()).extract(any());
    }

    // ============================================================
    // 3. 단계 실패
    // ============================================================

    @Test
    void execute_추출_실패_시_extract_proteins_후_분석_안함() {
        // given
        when(extraction.extract(item)).thenReturn(Fail.of(FailureStep.EXTRACT_PROTEINS, "exit code 1"));

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.step()).isEqualTo("extract_proteins");
        verify(analysis, never()).analyze(any(), any());
    }

    @Test
    void execute_lineage_없으면_lineage_missing() {
        // given
        when(extraction.extract(item)).thenReturn(Ok.of(PROTEINS));
        when(analysis.analyze(item.id(), PROTEINS))
            .thenReturn(Fail.of(FailureStep.LINEAGE_MISSING, "not found"));

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.step()).isEqualTo("lineage_missing");
        verify(parser, never()).parse(any());
    }

    @Test
    void execute_BUSCO_실패_시_run_busco() {
        // given
        when(extraction.extract(item)).thenReturn(Ok.of(PROTEINS));
        when(analysis.analyze(item.id(), PROTEINS)).thenReturn(Fail.of(FailureStep.RUN_BUSCO, "exit code 2"));

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.step()).isEqualTo("run_busco");
        verify(sink, never()).writeSuccess(any());
    }

    // ============================================================
    // 4. 예외 처리: unexpected_error, 전파하지 않음
    // ============================================================

    @Test
    void execute_summary_없으면_unexpected_error() {
        // given
        when(extraction.extract(item)).thenReturn(Ok.of(PROTEINS));
        when(analysis.analyze(item.id(), PROTEINS)).thenReturn(Ok.of(OUTPUT_DIR));
        when(parser.parse(OUTPUT_DIR)).thenThrow(new IllegalStateException("BUSCO summary file not found in busco_a"));

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.step()).isEqualTo("unexpected_error");
        verify(sink, never()).writeSuccess(any());
        verify(sink).writeOutcome(outcome);
    }

    @Test
    void execute_단계에서_예외_발생해도_전파하지_않음() {
        // given
        when(extraction.extract(item)).thenThrow(new RuntimeException());

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.step()).isEqualTo("unexpected_error");
    }

    @Test
    void execute_outcome_fragment_기록_실패해도_전파하지_않음() {
        // given
        when(extraction.checkInputs(item)).thenReturn(Optional.of(Fail.of(FailureStep.INPUT_MISSING, "no gff")));
        doThrow(new UncheckedIOException(new IOException("disk full"))).when(sink).writeOutcome(any());

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.step()).isEqualTo("input_missing");
    }

    @Test
    void execute_success_fragment_기록_실패_시_unexpected_error_outcome_기록() {
        // given
        when(extraction.extract(item)).thenReturn(Ok.of(PROTEINS));
        when(analysis.analyze(item.id(), PROTEINS)).thenReturn(Ok.of(OUTPUT_DIR));
        when(parser.parse(OUTPUT_DIR)).thenReturn(METRICS);
        doThrow(new UncheckedIOException(new IOException("disk full"))).when(sink).writeSuccess(any());

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        ArgumentCaptor<OutcomeRecord> captor = ArgumentCaptor.forClass(OutcomeRecord.class);
        verify(sink).writeOutcome(captor.capture());
        assertThat(captor.getValue().step()).isEqualTo("unexpected_error");
        assertThat(outcome).isEqualTo(captor.getValue());
    }

    @Test
    void execute_성공_outcome_기록_실패_시_success_fragment_제거_후_unexpected_error() {
        // given
        when(extraction.extract(item)).thenReturn(Ok.of(PROTEINS));
        when(analysis.analyze(item.id(), PROTEINS)).thenReturn(Ok.of(OUTPUT_DIR));
        when(parser.parse(OUTPUT_DIR)).thenReturn(METRICS);
        doThrow(new UncheckedIOException(new IOException("disk full")))
            .doNothing()
            .when(sink).writeOutcome(any());

        // when
        OutcomeRecord outcome = executor.execute(item);

        // then
        assertThat(outcome.result()).isEqualTo(AttemptResult.FAIL);
        assertThat(outcome.step()).isEqualTo("unexpected_error");
        InOrder inOrder = inOrder(sink);
        inOrder.verify(sink).writeSuccess(any(SuccessRecord.class));
        inOrder.verify(sink).writeOutcome(any(OutcomeRecord.class));
        inOrder.verify(sink).discardSuccess(item.id());
        inOrder.verify(sink).writeOutcome(outcome);
    }
}
