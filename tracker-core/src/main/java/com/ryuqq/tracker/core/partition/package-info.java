/**
 * Stride partitioning of the pending set.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.core.partition.PartitionConfig} - maxChunks / maxPerJob (immutable record)</li>
 *   <li>{@link com.ryuqq.tracker.core.partition.ChunkPartitioner} - Plan and per-worker slice</li>
 *   <li>{@link com.ryuqq.tracker.core.partition.DispatchPlan} - Values handed to the CI job matrix</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ChunkPartitioner partitioner = new ChunkPartitioner(new PartitionConfig(256, 3));
 * DispatchPlan plan = partitioner.plan(pending.size());       // coordinator
 * List&lt;AnnotationId&gt; mine = partitioner.slice(pending, k, plan.chunkCount()); // worker k
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.tracker.core.partition;
