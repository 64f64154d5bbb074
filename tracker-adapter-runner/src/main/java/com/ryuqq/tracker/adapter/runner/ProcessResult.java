package com.ryuqq.tracker.adapter.runner;

/**
 * 외부 프로세스 실행 결과.
 *
 * @param exitCode 종료 코드 (timedOut이면 -1)
 * @param timedOut 제한 시간 초과로 강제 종료되었는지 여부
 * @param output 표준 출력과 표준 에러를 합친 내용
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProcessResult(int exitCode, boolean timedOut, String output) {

    public ProcessResult {
        if (output == null) {
            output = "";
        }
    }

    /**
     * 정상 종료 여부.
     *
     * @return 제한 시간 내에 종료 코드 0으로 끝났으면 true
     */
    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}
