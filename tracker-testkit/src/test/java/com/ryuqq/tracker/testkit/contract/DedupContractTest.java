package com.ryuqq.tracker.testkit.contract;

import com.ryuqq.tracker.core.aggregate.AggregationReport;
import com.ryuqq.tracker.core.aggregate.FragmentAggregator;
import com.ryuqq.tracker.core.model.BuscoMetrics;
import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.model.SuccessRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: dedup keys of the canonical logs.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Two success fragments for one id in one pass → one SuccessLog row (first wins)</li>
 *   <li>Success fragment for an id already in the SuccessLog → dropped, not overwritten</li>
 *   <li>Two outcome fragments with same (id, runAt) → one row</li>
 *   <li>Two outcome fragments with same id, different runAt → both kept</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DedupContractTest extends AbstractContractTest {

    @Test
    void testDedup_TwoSuccessFragmentsSameId_OneRow() {
        // Given: 재실행된 워커가 같은 id의 성공 fragment를 다른 디렉토리에 남김
        InMemoryFragmentStore staleRun = new InMemoryFragmentStore("chunk-1-retry");
        fragments.writeSuccess(successRecord("a"));
        staleRun.writeSuccess(new SuccessRecord(
            AnnotationId.of("a"),
            new BuscoMetrics("eukaryota_odb12", 129, 10.0, 10.0, 0.0, 0.0, 90.0)
        ));
        FragmentAggregator aggregator = new FragmentAggregator(
            store, InMemoryFragmentStore.combine(fragments, staleRun)
        );

        // When
        AggregationReport report = aggregator.aggregate();

        // Then: "chunk-0" sorts before "chunk-1-retry", so its row wins
        assertSuccessRowCount("a", 1);
        assertEquals(1, report.successSkipped());
        assertEquals(95.3, store.getSuccessRows().get(0).metrics().complete());
    }

    @Test
    void testDedup_SuccessAlreadyCanonical_NotOverwritten() {
        // Given
        store.appendSuccesses(List.of(successRecord("a")));
        fragments.writeSuccess(new SuccessRecord(AnnotationId.of("a"), BuscoMetrics.empty()));

        // When
        new FragmentAggregator(store, fragments).aggregate();

        // Then
        assertSuccessRowCount("a", 1);
        assertEquals("eukaryota_odb12", store.getSuccessRows().get(0).metrics().lineage());
    }

    @Test
    void testDedup_SameIdSameRunAt_OneOutcomeRow() {
        // Given
        InMemoryFragmentStore otherWorker = new InMemoryFragmentStore("chunk-1");
        fragments.writeOutcome(failureRecord("b", RUN_AT, FailureStep.RUN_BUSCO));
        otherWorker.writeOutcome(failureRecord("b", RUN_AT, FailureStep.RUN_BUSCO));

        // When
        new FragmentAggregator(store, InMemoryFragmentStore.combine(fragments, otherWorker)).aggregate();

        // Then
        assertEquals(1, store.getOutcomeRows().size());
    }

    @Test
    void testDedup_SameIdDifferentRunAt_BothOutcomeRowsKept() {
        // Given: 두 사이클에 걸친 실패 이력
        fragments.writeOutcome(failureRecord("b", "2026-10-18 09:00:00", FailureStep.EXTRACT_PROTEINS));
        new FragmentAggregator(store, fragments).aggregate();

        InMemoryFragmentStore nextCycle = new InMemoryFragmentStore("cycle-2");
        nextCycle.writeOutcome(failureRecord("b", "2026-10-19 09:00:00", FailureStep.RUN_BUSCO));

        // When
        new FragmentAggregator(store, nextCycle).aggregate();

        // Then
        assertEquals(2, store.getOutcomeRows().size());
        assertEquals("extract_proteins", store.getOutcomeRows().get(0).step());
        assertEquals("run_busco", store.getOutcomeRows().get(1).step());
    }

    @Test
    void testDedup_OutcomeAlreadyCanonical_Skipped() {
        // Given
        store.appendOutcomes(List.of(failureRecord("c", RUN_AT, FailureStep.INPUT_MISSING)));
        fragments.writeOutcome(failureRecord("c", RUN_AT, FailureStep.INPUT_MISSING));

        // When
        AggregationReport report = new FragmentAggregator(store, fragments).aggregate();

        // Then
        assertEquals(0, report.outcomeAppended());
        assertEquals(1, store.getOutcomeRows().size());
    }
}
