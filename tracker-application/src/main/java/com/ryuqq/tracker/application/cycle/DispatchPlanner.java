package com.ryuqq.tracker.application.cycle;

import com.ryuqq.tracker.core.partition.ChunkPartitioner;
import com.ryuqq.tracker.core.partition.DispatchPlan;
import com.ryuqq.tracker.core.pending.PendingSet;
import com.ryuqq.tracker.core.pending.PendingSetResolver;
import com.ryuqq.tracker.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 사이클 시작 시 디스패치 계획을 계산하는 application 서비스.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * store.snapshot() → resolver.resolve() → partitioner.plan(P) → DispatchPlan
 * </pre>
 *
 * <p>catalog가 비어 있으면 경고 후 빈 계획을 반환합니다.
 * catalog 파일이 없으면 {@link com.ryuqq.tracker.core.spi.CatalogNotFoundException}이 전파됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DispatchPlanner {

    private static final Logger log = LoggerFactory.getLogger(DispatchPlanner.class);

    private final StateStore store;
    private final PendingSetResolver resolver;
    private final ChunkPartitioner partitioner;

    /**
     * 생성자.
     *
     * @param store canonical 상태 저장소
     * @param resolver pending 계산기
     * @param partitioner 분할기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DispatchPlanner(StateStore store, PendingSetResolver resolver, ChunkPartitioner partitioner) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        if (partitioner == null) {
            throw new IllegalArgumentException("partitioner cannot be null");
        }
        this.store = store;
        this.resolver = resolver;
        this.partitioner = partitioner;
    }

    /**
     * 디스패치 계획 계산.
     *
     * @return DispatchPlan (pending이 없으면 빈 계획)
     * @throws com.ryuqq.tracker.core.spi.CatalogNotFoundException catalog가 없는 경우
     */
    public DispatchPlan plan() {
        PendingSet pending = resolver.resolve(store.snapshot());
        if (pending.total() == 0) {
            log.warn("Work catalog is empty, nothing to process");
            return DispatchPlan.empty();
        }

        log.info("Total annotations : {}", pending.total());
        log.info("Successful        : {}", pending.successful());
        log.info("Never run         : {}", pending.neverAttempted());
        log.info("Failed (retry)    : {}", pending.failedRetry());
        log.info("Pending (total)   : {}", pending.size());

        DispatchPlan plan = partitioner.plan(pending.size());
        if (pending.isEmpty()) {
            log.info("No pending annotations, matrix will be empty and no worker will be started");
        } else if (partitioner.getConfig().hasBudget()) {
            log.info("Annotations this trigger: {} ({} deferred to next run)",
                plan.eligibleCount(), plan.deferredCount());
        }
        log.info("Chunks to create  : {}", plan.chunkCount());
        return plan;
    }
}
