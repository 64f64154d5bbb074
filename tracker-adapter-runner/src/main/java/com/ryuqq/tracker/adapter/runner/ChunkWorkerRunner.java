package com.ryuqq.tracker.adapter.runner;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.AttemptResult;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.partition.ChunkPartitioner;
import com.ryuqq.tracker.core.pending.PendingSet;
import com.ryuqq.tracker.core.pending.PendingSetResolver;
import com.ryuqq.tracker.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Chunk Worker Runner 구현체.
 *
 * <p>워커 하나가 자신의 stride slice를 순차 처리합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(chunkIndex, chunkCount) 호출
 *   ↓
 * store.snapshot() → resolver.resolve() → pending (우선순위 순서)
 *   ↓
 * partitioner.slice(pending, chunkIndex, chunkCount) → [id1, id2, ...]
 *   ↓
 * For each id:
 *   1. catalog에서 WorkItem 조회 (없으면 경고 후 건너뜀)
 *   2. executor.execute(item) → fragment 기록
 *   3. ✓ / ✗ 로그
 *   ↓
 * ChunkReport 반환
 * </pre>
 *
 * <p><strong>격리:</strong> 항목 하나의 실패는 다음 항목 처리에 영향을 주지 않습니다.
 * canonical 로그에는 쓰지 않으며, 결과는 모두 워커 전용 fragment로만 남습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ChunkWorkerRunner {

    private static final Logger log = LoggerFactory.getLogger(ChunkWorkerRunner.class);

    private final StateStore store;
    private final PendingSetResolver resolver;
    private final ChunkPartitioner partitioner;
    private final WorkerExecutor executor;

    /**
     * 생성자.
     *
     * @param store canonical 상태 저장소 (읽기 전용으로 사용)
     * @param resolver pending 계산기
     * @param partitioner slice 계산기
     * @param executor 항목 실행기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ChunkWorkerRunner(StateStore store, PendingSetResolver resolver, ChunkPartitioner partitioner,
                             WorkerExecutor executor) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        if (partitioner == null) {
            throw new IllegalArgumentException("partitioner cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.store = store;
        this.resolver = resolver;
        this.partitioner = partitioner;
        this.executor = executor;
    }

    /**
     * slice 처리.
     *
     * @param chunkIndex 워커 인덱스 (0부터)
     * @param chunkCount 전체 워커 수
     * @return 처리 결과 요약
     * @throws IllegalArgumentException 인덱스 범위가 잘못된 경우
     * @throws com.ryuqq.tracker.core.spi.CatalogNotFoundException catalog가 없는 경우
     */
    public ChunkReport run(int chunkIndex, int chunkCount) {
        Map<AnnotationId, WorkItem> catalog = store.loadCatalog();
        PendingSet pending = resolver.resolve(store.snapshot());
        List<AnnotationId> slice = partitioner.slice(pending.ids(), chunkIndex, chunkCount);

        int cap = partitioner.getConfig().maxPerJob();
        log.info("Chunk {}/{}: {} annotations to process{}",
            chunkIndex, chunkCount, slice.size(), cap > 0 ? " (capped at " + cap + ")" : "");

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (int i = 0; i < slice.size(); i++) {
            AnnotationId id = slice.get(i);
            log.info("[{}/{}] Processing {}", i + 1, slice.size(), id.getValue());

            WorkItem item = catalog.get(id);
            if (item == null) {
                skipped++;
                log.warn("  - {} is not in the catalog, skipping", id.getValue());
                continue;
            }

            OutcomeRecord outcome = executor.execute(item);
            if (outcome.result() == AttemptResult.SUCCESS) {
                succeeded++;
                log.info("  ✓ {}", id.getValue());
            } else {
                failed++;
                log.warn("  ✗ {} ({})", id.getValue(), outcome.step());
            }
        }

        log.info("Chunk {} complete: {} succeeded, {} failed out of {}",
            chunkIndex, succeeded, failed, slice.size());
        return new ChunkReport(chunkIndex, slice.size(), succeeded, failed, skipped);
    }
}
