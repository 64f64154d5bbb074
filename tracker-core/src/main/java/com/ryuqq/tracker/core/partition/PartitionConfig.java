package com.ryuqq.tracker.core.partition;

/**
 * ChunkPartitioner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxChunks: 한 사이클의 최대 워커(chunk) 수 (기본 256)</li>
 *   <li>maxPerJob: 워커 하나가 이번 사이클에 처리할 최대 항목 수 (0이면 제한 없음, 기본 0)</li>
 * </ul>
 *
 * <p>maxPerJob이 설정되면 이번 사이클에 처리할 수 있는 양은 {@code maxChunks * maxPerJob}으로 제한되고,
 * 나머지는 다음 사이클의 새 스냅샷으로 넘어갑니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxChunks 최대 chunk 수 (1 이상이어야 함)
 * @param maxPerJob chunk당 최대 항목 수 (0 = 제한 없음, 음수 불가)
 */
public record PartitionConfig(
    int maxChunks,
    int maxPerJob
) {

    /**
     * 기본 chunk 상한.
     */
    public static final int DEFAULT_MAX_CHUNKS = 256;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxChunks=256, maxPerJob=0 (제한 없음)</p>
     */
    public PartitionConfig() {
        this(DEFAULT_MAX_CHUNKS, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PartitionConfig {
        if (maxChunks <= 0) {
            throw new IllegalArgumentException(
                "maxChunks must be positive (current: " + maxChunks + ")"
            );
        }
        if (maxPerJob < 0) {
            throw new IllegalArgumentException(
                "maxPerJob must be non-negative (current: " + maxPerJob + ")"
            );
        }
    }

    /**
     * chunk당 제한이 설정되어 있는지 확인.
     *
     * @return maxPerJob이 0보다 크면 true
     */
    public boolean hasBudget() {
        return maxPerJob > 0;
    }

    /**
     * maxChunks만 변경한 새 인스턴스 생성.
     */
    public PartitionConfig withMaxChunks(int maxChunks) {
        return new PartitionConfig(maxChunks, maxPerJob);
    }

    /**
     * maxPerJob만 변경한 새 인스턴스 생성.
     */
    public PartitionConfig withMaxPerJob(int maxPerJob) {
        return new PartitionConfig(maxChunks, maxPerJob);
    }
}
