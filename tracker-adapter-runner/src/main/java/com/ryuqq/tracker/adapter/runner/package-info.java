/**
 * Runner Adapter Layer - 워커 실행 구현체.
 *
 * <p>이 패키지는 워커 하나가 자신의 slice를 처리하는 데 필요한 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.tracker.adapter.runner.ChunkWorkerRunner} - slice 순차 처리</li>
 *   <li>{@link com.ryuqq.tracker.adapter.runner.WorkerExecutor} - 항목별 상태 머신</li>
 *   <li>{@link com.ryuqq.tracker.adapter.runner.ScriptExtractionStage},
 *       {@link com.ryuqq.tracker.adapter.runner.BuscoAnalysisStage} - 외부 스크립트 단계</li>
 *   <li>{@link com.ryuqq.tracker.adapter.runner.BuscoSummaryParser} - BUSCO summary 파서</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (ChunkWorkerRunner, WorkerExecutor)
 *   ↓ implements
 * core/spi (ExtractionStage, AnalysisStage)
 *   ↓ uses
 * core (PendingSetResolver, ChunkPartitioner, AttemptStateTransition)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tracker.adapter.runner;
