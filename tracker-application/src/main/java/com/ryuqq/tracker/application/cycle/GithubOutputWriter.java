package com.ryuqq.tracker.application.cycle;

import com.ryuqq.tracker.core.partition.DispatchPlan;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * 디스패치 계획을 CI 출력 변수로 내보내는 writer.
 *
 * <p>{@code GITHUB_OUTPUT} 환경 변수가 있으면 해당 파일에 {@code key=value} 줄을 append하고,
 * 없으면 표준 출력에 씁니다.</p>
 *
 * <pre>
 * matrix=[0, 1, 2]
 * chunk_count=3
 * pending_count=7
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GithubOutputWriter {

    public static final String OUTPUT_VARIABLE = "GITHUB_OUTPUT";

    private final Path outputFile;
    private final PrintStream fallback;

    /**
     * 생성자.
     *
     * @param outputFile 출력 파일 (null이면 fallback 사용)
     * @param fallback 출력 파일이 없을 때 사용할 스트림
     * @throws IllegalArgumentException fallback이 null인 경우
     */
    public GithubOutputWriter(Path outputFile, PrintStream fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        this.outputFile = outputFile;
        this.fallback = fallback;
    }

    /**
     * 환경 변수로부터 writer 생성.
     *
     * @param environment 환경 변수
     * @param fallback GITHUB_OUTPUT이 없을 때 사용할 스트림
     * @return GithubOutputWriter
     */
    public static GithubOutputWriter fromEnvironment(Map<String, String> environment, PrintStream fallback) {
        String location = environment.get(OUTPUT_VARIABLE);
        Path outputFile = (location == null || location.isBlank()) ? null : Path.of(location);
        return new GithubOutputWriter(outputFile, fallback);
    }

    /**
     * 계획의 세 출력 변수 기록.
     *
     * @param plan 디스패치 계획
     * @throws UncheckedIOException 출력 파일에 쓸 수 없는 경우
     */
    public void write(DispatchPlan plan) {
        write("matrix", plan.matrixJson());
        write("chunk_count", Integer.toString(plan.chunkCount()));
        write("pending_count", Integer.toString(plan.pendingCount()));
    }

    /**
     * 출력 변수 하나 기록.
     *
     * @param key 변수 이름
     * @param value 값
     * @throws UncheckedIOException 출력 파일에 쓸 수 없는 경우
     */
    public void write(String key, String value) {
        String line = key + "=" + value;
        if (outputFile == null) {
            fallback.println(line);
            return;
        }
        try {
            Files.writeString(outputFile, line + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + outputFile, e);
        }
    }
}
