package com.ryuqq.tracker.core.partition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 우선순위 순서의 pending 목록을 N개의 서로소 slice로 분할.
 *
 * <p><strong>계획 규칙 (P = pending 수, B = maxPerJob):</strong></p>
 * <pre>
 * B 설정 시:   eligible = min(maxChunks * B, P),  N = min(maxChunks, ceil(eligible / B))
 * B 미설정 시: eligible = P,                       N = min(maxChunks, P)
 * P == 0:      N = 0 (의도된 no-op)
 * </pre>
 *
 * <p><strong>Stride 할당:</strong> eligible 인덱스 i는 워커 {@code i mod N}에 할당됩니다.</p>
 * <pre>
 * [a,b,c,d,e,f,g,h], N=4
 *   chunk 0 → [a,e]
 *   chunk 1 → [b,f]
 *   chunk 2 → [c,g]
 *   chunk 3 → [d,h]
 * </pre>
 *
 * <p><strong>보장:</strong> N개의 slice는 eligible 앞부분을 정확히 분할합니다 (누락 없음, 중복 없음).
 * 동시 실행 워커가 락 없이 안전한 근거가 이 성질입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ChunkPartitioner {

    private final PartitionConfig config;

    /**
     * 기본 설정 생성자.
     */
    public ChunkPartitioner() {
        this(new PartitionConfig());
    }

    /**
     * 생성자.
     *
     * @param config 분할 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ChunkPartitioner(PartitionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 디스패치 계획 계산.
     *
     * @param pendingCount 전체 pending 수 (P)
     * @return DispatchPlan
     * @throws IllegalArgumentException pendingCount가 음수인 경우
     */
    public DispatchPlan plan(int pendingCount) {
        if (pendingCount < 0) {
            throw new IllegalArgumentException("pendingCount must be non-negative (current: " + pendingCount + ")");
        }
        if (pendingCount == 0) {
            return DispatchPlan.empty();
        }

        int eligible = eligibleCount(pendingCount);
        int chunkCount;
        if (config.hasBudget()) {
            int perJob = config.maxPerJob();
            int perJobChunks = eligible / perJob + (eligible % perJob == 0 ? 0 : 1);
            chunkCount = Math.min(config.maxChunks(), perJobChunks);
        } else {
            chunkCount = Math.min(config.maxChunks(), pendingCount);
        }
        return new DispatchPlan(chunkCount, pendingCount, eligible);
    }

    /**
     * 워커 하나의 slice 계산.
     *
     * <p>eligible 앞부분에서 {@code chunkIndex, chunkIndex + chunkCount, ...} 위치의 항목을 순서대로 취하고,
     * maxPerJob이 설정되어 있으면 그 개수로 자릅니다.</p>
     *
     * @param pending 우선순위 순서의 pending 목록
     * @param chunkIndex 워커 인덱스 (0 ≤ chunkIndex &lt; chunkCount)
     * @param chunkCount 전체 워커 수 (1 이상)
     * @param <T> 항목 타입
     * @return 이 워커의 slice (불변 목록)
     * @throws IllegalArgumentException 인덱스 범위가 잘못된 경우
     */
    public <T> List<T> slice(List<T> pending, int chunkIndex, int chunkCount) {
        if (pending == null) {
            throw new IllegalArgumentException("pending cannot be null");
        }
        if (chunkCount <= 0) {
            throw new IllegalArgumentException("chunkCount must be positive (current: " + chunkCount + ")");
        }
        if (chunkIndex < 0 || chunkIndex >= chunkCount) {
            throw new IllegalArgumentException(
                "chunkIndex must be in [0, " + chunkCount + ") (current: " + chunkIndex + ")"
            );
        }

        int eligible = eligibleCount(pending.size());
        int cap = config.hasBudget() ? config.maxPerJob() : Integer.MAX_VALUE;

        List<T> slice = new ArrayList<>();
        for (int i = chunkIndex; i < eligible && slice.size() < cap; i += chunkCount) {
            slice.add(pending.get(i));
        }
        return Collections.unmodifiableList(slice);
    }

    /**
     * 모든 워커의 slice 계산.
     *
     * @param pending 우선순위 순서의 pending 목록
     * @param <T> 항목 타입
     * @return chunk 인덱스 순서의 slice 목록 (pending이 비어 있으면 빈 목록)
     */
    public <T> List<List<T>> partition(List<T> pending) {
        if (pending == null) {
            throw new IllegalArgumentException("pending cannot be null");
        }
        DispatchPlan plan = plan(pending.size());
        List<List<T>> slices = new ArrayList<>(plan.chunkCount());
        for (int k = 0; k < plan.chunkCount(); k++) {
            slices.add(slice(pending, k, plan.chunkCount()));
        }
        return slices;
    }

    /**
     * 현재 설정 조회.
     *
     * @return PartitionConfig
     */
    public PartitionConfig getConfig() {
        return config;
    }

    private int eligibleCount(int pendingCount) {
        if (!config.hasBudget()) {
            return pendingCount;
        }
        long budget = (long) config.maxChunks() * config.maxPerJob();
        return (int) Math.min(budget, pendingCount);
    }
}
