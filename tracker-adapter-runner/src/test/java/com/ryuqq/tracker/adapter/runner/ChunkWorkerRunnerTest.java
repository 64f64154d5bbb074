package com.ryuqq.tracker.adapter.runner;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.StateSnapshot;
import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.partition.ChunkPartitioner;
import com.ryuqq.tracker.core.partition.PartitionConfig;
import com.ryuqq.tracker.core.pending.PendingSetResolver;
import com.ryuqq.tracker.core.spi.CatalogNotFoundException;
import com.ryuqq.tracker.core.spi.StateStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * ChunkWorkerRunner 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ChunkWorkerRunnerTest {

    private static final String RUN_AT = "2026-10-19 09:00:00";

    @Mock
    private StateStore store;

    @Mock
    private WorkerExecutor executor;

    @Test
    void run_stride_slice만_순서대로_처리() {
        // given: 8개 모두 미시도, 4개 워커
        givenState(List.of("a", "b", "c", "d", "e", "f", "g", "h"), Set.of(), Set.of());
        when(executor.execute(any())).thenAnswer(inv -> success(inv.getArgument(0)));
        ChunkWorkerRunner runner = runner(new PartitionConfig());

        // when
        ChunkReport report = runner.run(1, 4);

        // then
        ArgumentCaptor<WorkItem> captor = ArgumentCaptor.forClass(WorkItem.class);
        verify(executor, times(2)).execute(captor.capture());
        assertThat(captor.getAllValues()).extracting(w -> w.id().getValue()).containsExactly("b", "f");
        assertThat(report).isEqualTo(new ChunkReport(1, 2, 2, 0, 0));
    }

    @Test
    void run_실패_항목이_있어도_나머지_계속_처리() {
        // given
        givenState(List.of("a", "b", "c"), Set.of(), Set.of());
        when(executor.execute(any())).thenAnswer(inv -> {
            WorkItem item = inv.getArgument(0);
            return item.id().getValue().equals("b")
                ? OutcomeRecord.failure(item.id(), RUN_AT, FailureStep.RUN_BUSCO)
                : success(item);
        });

        // when
        ChunkReport report = runner(new PartitionConfig()).run(0, 1);

        // then
        verify(executor, times(3)).execute(any());
        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(report.failed()).isEqualTo(1);
    }

    @Test
    void run_이미_성공한_항목은_처리하지_않고_실패_항목은_뒤에_처리() {
        // given: a 성공, c 실패 이력
        givenState(List.of("a", "b", "c", "d"), Set.of("a"), Set.of("a", "c"));
        when(executor.execute(any())).thenAnswer(inv -> success(inv.getArgument(0)));

        // when
        runner(new PartitionConfig()).run(0, 1);

        // then
        ArgumentCaptor<WorkItem> captor = ArgumentCaptor.forClass(WorkItem.class);
        verify(executor, times(3)).execute(captor.capture());
        assertThat(captor.getAllValues()).extracting(w -> w.id().getValue()).containsExactly("b", "d", "c");
    }

    @Test
    void run_maxPerJob으로_slice_길이_제한() {
        // given
        givenState(List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j"), Set.of(), Set.of());
        when(executor.execute(any())).thenAnswer(inv -> success(inv.getArgument(0)));

        // when
        ChunkReport report = runner(new PartitionConfig().withMaxPerJob(2)).run(0, 2);

        // then
        ArgumentCaptor<WorkItem> captor = ArgumentCaptor.forClass(WorkItem.class);
        verify(executor, times(2)).execute(captor.capture());
        assertThat(captor.getAllValues()).extracting(w -> w.id().getValue()).containsExactly("a", "c");
        assertThat(report.assigned()).isEqualTo(2);
    }

    @Test
    void run_catalog에_없는_실패_이력은_건너뜀() {
        // given: x는 catalog에서 제거되었지만 실패 이력이 남아 있음
        Map<AnnotationId, WorkItem> catalog = catalogOf(List.of("a"));
        when(store.loadCatalog()).thenReturn(catalog);
        when(store.snapshot()).thenReturn(new StateSnapshot(catalog.keySet(), Set.of(), ids(Set.of("x"))));
        when(executor.execute(any())).thenAnswer(inv -> success(inv.getArgument(0)));

        // when
        ChunkReport report = runner(new PartitionConfig()).run(0, 1);

        // then
        verify(executor, times(1)).execute(catalog.get(AnnotationId.of("a")));
        assertThat(report).isEqualTo(new ChunkReport(0, 2, 1, 0, 1));
    }

    @Test
    void run_pending_없으면_아무것도_실행하지_않음() {
        // given
        givenState(List.of("a"), Set.of("a"), Set.of("a"));

        // when
        ChunkReport report = runner(new PartitionConfig()).run(0, 1);

        // then
        verifyNoInteractions(executor);
        assertThat(report.assigned()).isZero();
    }

    @Test
    void run_catalog_없으면_예외_전파() {
        // given
        when(store.loadCatalog()).thenThrow(new CatalogNotFoundException("annotations.tsv"));

        // when & then
        assertThatThrownBy(() -> runner(new PartitionConfig()).run(0, 1))
            .isInstanceOf(CatalogNotFoundException.class);
        verifyNoInteractions(executor);
    }

    @Test
    void run_잘못된_chunk_인덱스는_예외() {
        // given
        givenState(List.of("a"), Set.of(), Set.of());

        // when & then
        assertThatThrownBy(() -> runner(new PartitionConfig()).run(4, 4))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private ChunkWorkerRunner runner(PartitionConfig config) {
        return new ChunkWorkerRunner(store, new PendingSetResolver(), new ChunkPartitioner(config), executor);
    }

    private void givenState(List<String> catalogIds, Set<String> successIds, Set<String> outcomeIds) {
        Map<AnnotationId, WorkItem> catalog = catalogOf(catalogIds);
        when(store.loadCatalog()).thenReturn(catalog);
        when(store.snapshot()).thenReturn(new StateSnapshot(catalog.keySet(), ids(successIds), ids(outcomeIds)));
    }

    private static Map<AnnotationId, WorkItem> catalogOf(List<String> values) {
        Map<AnnotationId, WorkItem> catalog = new LinkedHashMap<>();
        for (String value : values) {
            AnnotationId id = AnnotationId.of(value);
            catalog.put(id, new WorkItem(id, "data/" + value + ".gff3.gz", "data/" + value + ".fna.gz"));
        }
        return catalog;
    }

    private static Set<AnnotationId> ids(Set<String> values) {
        return values.stream().map(AnnotationId::of).collect(Collectors.toSet());
    }

    private static OutcomeRecord success(WorkItem item) {
        return OutcomeRecord.success(item.id(), RUN_AT);
    }
}
