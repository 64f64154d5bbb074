/**
 * Cycle services - 사이클 단위 application 서비스.
 *
 * <p>한 사이클은 plan → run (N개 워커) → aggregate 순서로 진행됩니다.
 * 이 패키지는 plan 단계의 계획 계산과 CI 출력 변수 기록을 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.tracker.application.cycle;
