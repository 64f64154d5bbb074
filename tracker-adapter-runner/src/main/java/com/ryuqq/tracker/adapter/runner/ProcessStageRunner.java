package com.ryuqq.tracker.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 외부 스크립트를 동기 실행하는 프로세스 실행기.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>작업 디렉토리를 {@link WorkerConfig#workDir()}로 설정</li>
 *   <li>stdout/stderr를 임시 파일로 합쳐서 수집 (파이프 버퍼 교착 방지)</li>
 *   <li>stageTimeout 초과 시 프로세스를 강제 종료하고 timedOut 결과 반환</li>
 * </ul>
 *
 * <p>실패한 실행의 출력은 WARN 로그로 남깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProcessStageRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessStageRunner.class);

    private final WorkerConfig config;

    /**
     * 생성자.
     *
     * @param config 작업자 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ProcessStageRunner(WorkerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 명령 실행 후 종료까지 대기.
     *
     * @param stepName 로그에 사용할 단계 이름
     * @param command 실행할 명령과 인자
     * @return 실행 결과
     * @throws IOException 프로세스를 시작할 수 없는 경우
     * @throws InterruptedException 대기 중 인터럽트된 경우 (프로세스는 강제 종료됨)
     */
    public ProcessResult run(String stepName, List<String> command) throws IOException, InterruptedException {
        log.info("Running {}: {}", stepName, String.join(" ", command));

        Path outputFile = Files.createTempFile("tracker-" + stepName + "-", ".log");
        try {
            Process process = new ProcessBuilder(command)
                .directory(config.workDir().toFile())
                .redirectErrorStream(true)
                .redirectOutput(outputFile.toFile())
                .start();

            ProcessResult result;
            try {
                result = waitFor(process, outputFile);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            if (result.timedOut()) {
                log.error("{} timed out after {}", stepName, config.stageTimeout());
            } else if (result.exitCode() != 0) {
                log.error("{} failed with exit code {}", stepName, result.exitCode());
                log.warn("{} output: {}", stepName, result.output());
            } else {
                log.info("{} completed successfully", stepName);
            }
            return result;
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    public WorkerConfig getConfig() {
        return config;
    }

    private ProcessResult waitFor(Process process, Path outputFile) throws IOException, InterruptedException {
        if (config.hasStageTimeout()) {
            boolean finished = process.waitFor(config.stageTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                return new ProcessResult(-1, true, read(outputFile));
            }
            return new ProcessResult(process.exitValue(), false, read(outputFile));
        }
        int exitCode = process.waitFor();
        return new ProcessResult(exitCode, false, read(outputFile));
    }

    private static String read(Path outputFile) throws IOException {
        return new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
    }
}
