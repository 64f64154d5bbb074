package com.ryuqq.tracker.adapter.tsv;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.AttemptResult;
import com.ryuqq.tracker.core.model.BuscoMetrics;
import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.spi.FragmentBatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TsvFragmentWriter / TsvFragmentScanner 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TsvFragmentScannerTest {

    @TempDir
    Path artifacts;

    @Test
    @DisplayName("writer는 id로 결정되는 파일 이름에 헤더와 1행을 씀")
    void writer_fragment_형식() throws IOException {
        // Given
        TsvFragmentWriter writer = new TsvFragmentWriter(artifacts.resolve("chunk-0"));

        // When
        writer.writeSuccess(new SuccessRecord(AnnotationId.of("g1"),
            new BuscoMetrics("eukaryota_odb12", 255, 90.0, 89.5, 0.5, 4.0, 6.0)));
        writer.writeOutcome(OutcomeRecord.success(AnnotationId.of("g1"), "2026-10-19 09:00:00"));

        // Then
        assertThat(Files.readAllLines(artifacts.resolve("chunk-0/result_g1.tsv"))).containsExactly(
            "annotation_id\tlineage\tbusco_count\tcomplete\tsingle\tduplicated\tfragmented\tmissing",
            "g1\teukaryota_odb12\t255\t90.0\t89.5\t0.5\t4.0\t6.0");
        assertThat(Files.readAllLines(artifacts.resolve("chunk-0/log_g1.tsv"))).containsExactly(
            "annotation_id\trun_at\tresult\tstep",
            "g1\t2026-10-19 09:00:00\tsuccess\tNA");
        try (var listing = Files.list(artifacts.resolve("chunk-0"))) {
            assertThat(listing.map(p -> p.getFileName().toString()))
                .containsExactlyInAnyOrder("result_g1.tsv", "log_g1.tsv");
        }
    }

    @Test
    @DisplayName("scanner는 하위 디렉토리를 재귀 탐색하고 경로 순으로 반환")
    void scanner_재귀_정렬() {
        // Given
        new TsvFragmentWriter(artifacts.resolve("chunk-1"))
            .writeOutcome(OutcomeRecord.failure(AnnotationId.of("b"), "t1", FailureStep.RUN_BUSCO));
        new TsvFragmentWriter(artifacts.resolve("chunk-0"))
            .writeOutcome(OutcomeRecord.failure(AnnotationId.of("c"), "t1", FailureStep.INPUT_MISSING));
        new TsvFragmentWriter(artifacts.resolve("chunk-0/nested"))
            .writeOutcome(OutcomeRecord.success(AnnotationId.of("a"), "t1"));

        // When
        FragmentBatch batch = new TsvFragmentScanner(artifacts).collect();

        // Then
        assertThat(batch.outcomes()).extracting(r -> r.id().getValue())
            .containsExactly("c", "a", "b");
        assertThat(batch.successes()).isEmpty();
        assertThat(batch.malformed()).isZero();
    }

    @Test
    @DisplayName("필수 컬럼이 빠진 행은 malformed로 집계")
    void scanner_malformed_행() throws IOException {
        // Given
        Path chunk = Files.createDirectories(artifacts.resolve("chunk-0"));
        Files.write(chunk.resolve("log_x.tsv"), List.of("annotation_id\trun_at\tresult\tstep", "x\t\tfail\trun_busco"),
            StandardCharsets.UTF_8);
        Files.write(chunk.resolve("result_y.tsv"), List.of("annotation_id\tlineage", "y\teukaryota_odb12"),
            StandardCharsets.UTF_8);
        Files.write(chunk.resolve("log_z.tsv"), List.of("annotation_id\trun_at\tresult\tstep", "z\tt1\tmaybe\tNA"),
            StandardCharsets.UTF_8);
        Files.write(chunk.resolve("notes.tsv"), List.of("ignored"), StandardCharsets.UTF_8);

        // When
        FragmentBatch batch = new TsvFragmentScanner(artifacts).collect();

        // Then
        assertThat(batch.successes()).isEmpty();
        assertThat(batch.outcomes()).isEmpty();
        assertThat(batch.malformed()).isEqualTo(3);
    }

    @Test
    @DisplayName("result 컬럼이 없는 fragment는 step으로 결과를 판단")
    void scanner_과거_형식_fragment() throws IOException {
        // Given
        Path chunk = Files.createDirectories(artifacts.resolve("old"));
        Files.write(chunk.resolve("log_a.tsv"), List.of("annotation_id\trun_at\tstep", "a\tt1\tNA"),
            StandardCharsets.UTF_8);
        Files.write(chunk.resolve("log_b.tsv"), List.of("annotation_id\trun_at\tstep", "b\tt1\trun_busco"),
            StandardCharsets.UTF_8);

        // When
        FragmentBatch batch = new TsvFragmentScanner(artifacts).collect();

        // Then
        assertThat(batch.outcomes()).extracting(OutcomeRecord::result)
            .containsExactly(AttemptResult.SUCCESS, AttemptResult.FAIL);
    }

    @Test
    @DisplayName("빈 숫자 값은 0으로 해석")
    void scanner_빈_지표_기본값() throws IOException {
        // Given
        Path chunk = Files.createDirectories(artifacts.resolve("chunk-0"));
        Files.write(chunk.resolve("result_a.tsv"), List.of(
                "annotation_id\tlineage\tbusco_count\tcomplete\tsingle\tduplicated\tfragmented\tmissing",
                "a\t\t\t\t\t\t\t"),
            StandardCharsets.UTF_8);

        // When
        FragmentBatch batch = new TsvFragmentScanner(artifacts).collect();

        // Then
        assertThat(batch.successes()).hasSize(1);
        assertThat(batch.successes().get(0).metrics()).isEqualTo(BuscoMetrics.empty());
    }

    @Test
    @DisplayName("아티팩트 디렉토리가 없으면 UncheckedIOException")
    void scanner_디렉토리_없음() {
        assertThatThrownBy(() -> new TsvFragmentScanner(artifacts.resolve("missing")).collect())
            .isInstanceOf(UncheckedIOException.class);
    }
}
