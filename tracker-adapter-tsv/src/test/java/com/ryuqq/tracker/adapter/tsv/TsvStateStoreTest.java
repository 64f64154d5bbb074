package com.ryuqq.tracker.adapter.tsv;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.BuscoMetrics;
import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.model.OutcomeKey;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.StateSnapshot;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.spi.CatalogNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TsvStateStore 단위 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TsvStateStoreTest {

    @TempDir
    Path dir;

    private Path catalog;
    private Path successLog;
    private Path outcomeLog;
    private TsvStateStore store;

    @BeforeEach
    void setUp() {
        catalog = dir.resolve("annotations.tsv");
        successLog = dir.resolve("BUSCO.tsv");
        outcomeLog = dir.resolve("log.tsv");
        store = new TsvStateStore(catalog, successLog, outcomeLog);
    }

    @Test
    @DisplayName("catalog 파일이 없으면 CatalogNotFoundException")
    void snapshot_catalog_없음_예외() {
        assertThatThrownBy(() -> store.snapshot())
            .isInstanceOf(CatalogNotFoundException.class)
            .hasMessageContaining("annotations.tsv");
    }

    @Test
    @DisplayName("헤더 있는 catalog와 로그에서 snapshot 생성")
    void snapshot_헤더_있는_파일() throws IOException {
        // Given
        write(catalog,
            "annotation_id\tannotation_url\tassembly_url",
            "a\tu/a.gff3.gz\tu/a.fna.gz",
            "b\tu/b.gff3.gz\tu/b.fna.gz",
            "c\tu/c.gff3.gz\tu/c.fna.gz");
        write(successLog,
            "annotation_id\tlineage\tbusco_count\tcomplete\tsingle\tduplicated\tfragmented\tmissing",
            "a\teukaryota_odb12\t129\t95.3\t94.6\t0.7\t2.3\t2.4");
        write(outcomeLog,
            "annotation_id\trun_at\tresult\tstep",
            "a\t2026-10-18 10:00:00\tsuccess\tNA",
            "b\t2026-10-18 10:05:00\tfail\trun_busco");

        // When
        StateSnapshot snapshot = store.snapshot();

        // Then
        assertThat(snapshot.catalogIds()).containsExactlyInAnyOrder(id("a"), id("b"), id("c"));
        assertThat(snapshot.successIds()).containsExactly(id("a"));
        assertThat(snapshot.outcomeIds()).containsExactlyInAnyOrder(id("a"), id("b"));
    }

    @Test
    @DisplayName("헤더 없는 catalog도 위치 기준으로 읽음")
    void loadCatalog_헤더_없음() throws IOException {
        // Given
        write(catalog,
            "x1\thttps://host/x1.gff3.gz\thttps://host/x1.fna.gz",
            "x2\thttps://host/x2.gff3.gz\thttps://host/x2.fna.gz");

        // When
        Map<AnnotationId, WorkItem> items = store.loadCatalog();

        // Then
        assertThat(items).hasSize(2);
        assertThat(items.get(id("x1")).annotationUrl()).isEqualTo("https://host/x1.gff3.gz");
        assertThat(items.get(id("x2")).assemblyUrl()).isEqualTo("https://host/x2.fna.gz");
    }

    @Test
    @DisplayName("잘못된 id와 빈 줄은 건너뜀")
    void loadCatalog_잘못된_행_건너뜀() throws IOException {
        // Given
        write(catalog,
            "annotation_id\tannotation_url\tassembly_url",
            "ok\tu/ok.gff\tu/ok.fna",
            "",
            "bad/id\tu/bad.gff\tu/bad.fna",
            "short");

        // When
        Map<AnnotationId, WorkItem> items = store.loadCatalog();

        // Then
        assertThat(items.keySet()).containsExactly(id("ok"));
    }

    @Test
    @DisplayName("로그 파일이 없으면 빈 집합")
    void 로그_없음_빈_집합() throws IOException {
        // Given
        write(catalog, "annotation_id\tannotation_url\tassembly_url");

        // When & Then
        assertThat(store.loadSuccessIds()).isEmpty();
        assertThat(store.loadOutcomeKeys()).isEmpty();
        assertThat(store.snapshot().catalogIds()).isEmpty();
    }

    @Test
    @DisplayName("result 컬럼이 없는 과거 결과 로그도 키를 읽음")
    void loadOutcomeKeys_과거_형식() throws IOException {
        // Given
        write(outcomeLog,
            "annotation_id\trun_at\tstep",
            "a\t2026-10-18 10:00:00\textract_proteins",
            "a\t2026-10-18 11:00:00\tNA");

        // When
        var keys = store.loadOutcomeKeys();

        // Then
        assertThat(keys).containsExactlyInAnyOrder(
            new OutcomeKey(id("a"), "2026-10-18 10:00:00"),
            new OutcomeKey(id("a"), "2026-10-18 11:00:00")
        );
    }

    @Test
    @DisplayName("initialize는 없는 로그만 헤더와 함께 생성")
    void initialize_헤더_생성() throws IOException {
        // Given
        write(successLog, "annotation_id\tlineage\tbusco_count\tcomplete\tsingle\tduplicated\tfragmented\tmissing",
            "keep\tl\t1\t1.0\t1.0\t0.0\t0.0\t0.0");

        // When
        store.initialize();
        store.initialize();

        // Then
        assertThat(Files.readAllLines(outcomeLog)).containsExactly("annotation_id\trun_at\tresult\tstep");
        assertThat(Files.readAllLines(successLog)).hasSize(2);
    }

    @Test
    @DisplayName("append는 헤더 뒤에 완전한 행을 추가")
    void append_행_추가() throws IOException {
        // Given
        store.initialize();
        SuccessRecord success = new SuccessRecord(id("a"),
            new BuscoMetrics("eukaryota_odb12", 129, 95.3, 94.6, 0.7, 2.3, 2.4));
        OutcomeRecord outcome = OutcomeRecord.success(id("a"), "2026-10-19 09:00:00");

        // When
        store.appendSuccesses(List.of(success));
        store.appendOutcomes(List.of(outcome));

        // Then
        assertThat(Files.readAllLines(successLog)).containsExactly(
            "annotation_id\tlineage\tbusco_count\tcomplete\tsingle\tduplicated\tfragmented\tmissing",
            "a\teukaryota_odb12\t129\t95.3\t94.6\t0.7\t2.3\t2.4");
        assertThat(Files.readAllLines(outcomeLog)).containsExactly(
            "annotation_id\trun_at\tresult\tstep",
            "a\t2026-10-19 09:00:00\tsuccess\tNA");
    }

    @Test
    @DisplayName("과거 형식 결과 로그에 append하면 기존 헤더를 따름")
    void appendOutcomes_과거_헤더_유지() throws IOException {
        // Given
        write(outcomeLog, "annotation_id\trun_at\tstep", "a\t2026-10-18 10:00:00\trun_busco");

        // When
        store.appendOutcomes(List.of(
            OutcomeRecord.failure(id("b"), "2026-10-19 09:00:00", FailureStep.LINEAGE_MISSING)));

        // Then
        assertThat(Files.readAllLines(outcomeLog)).containsExactly(
            "annotation_id\trun_at\tstep",
            "a\t2026-10-18 10:00:00\trun_busco",
            "b\t2026-10-19 09:00:00\tlineage_missing");
    }

    @Test
    @DisplayName("마지막 줄바꿈이 없는 파일에 append해도 행이 합쳐지지 않음")
    void append_줄바꿈_없는_파일() throws IOException {
        // Given
        Files.writeString(outcomeLog, "annotation_id\trun_at\tresult\tstep\na\tt1\tfail\trun_busco",
            StandardCharsets.UTF_8);

        // When
        store.appendOutcomes(List.of(OutcomeRecord.success(id("a"), "t2")));

        // Then
        assertThat(Files.readAllLines(outcomeLog)).containsExactly(
            "annotation_id\trun_at\tresult\tstep",
            "a\tt1\tfail\trun_busco",
            "a\tt2\tsuccess\tNA");
    }

    @Test
    @DisplayName("빈 목록 append는 파일을 만들지 않음")
    void append_빈_목록_무시() {
        // When
        store.appendSuccesses(List.of());

        // Then
        assertThat(successLog).doesNotExist();
    }

    private static AnnotationId id(String value) {
        return AnnotationId.of(value);
    }

    private static void write(Path path, String... lines) throws IOException {
        Files.write(path, List.of(lines), StandardCharsets.UTF_8);
    }
}
