package com.ryuqq.tracker.application.cycle;

import com.ryuqq.tracker.core.partition.DispatchPlan;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * GithubOutputWriter 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GithubOutputWriterTest {

    @TempDir
    Path dir;

    @Test
    void GITHUB_OUTPUT_없으면_표준_출력에_기록() {
        // given
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        // when
        GithubOutputWriter.fromEnvironment(Map.of(), out).write(new DispatchPlan(3, 7, 7));

        // then
        assertThat(buffer.toString(StandardCharsets.UTF_8).lines())
            .containsExactly("matrix=[0, 1, 2]", "chunk_count=3", "pending_count=7");
    }

    @Test
    void GITHUB_OUTPUT_파일에_append() throws IOException {
        // given
        Path outputFile = dir.resolve("github_output");
        Files.writeString(outputFile, "previous=1\n");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        // when
        GithubOutputWriter.fromEnvironment(Map.of("GITHUB_OUTPUT", outputFile.toString()), out)
            .write(DispatchPlan.empty());

        // then
        assertThat(Files.readAllLines(outputFile))
            .containsExactly("previous=1", "matrix=[]", "chunk_count=0", "pending_count=0");
        assertThat(buffer.size()).isZero();
    }
}
