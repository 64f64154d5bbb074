package com.ryuqq.tracker.adapter.tsv;

import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.spi.FragmentBatch;
import com.ryuqq.tracker.core.spi.FragmentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 아티팩트 디렉토리를 재귀 탐색하여 fragment를 수집하는 FragmentSource 구현체.
 *
 * <p><strong>수집 규칙:</strong></p>
 * <ul>
 *   <li>{@code result_*.tsv}와 {@code log_*.tsv}만 대상 (임시 파일 제외)</li>
 *   <li>경로 문자열 순으로 정렬하여 실행마다 같은 순서 보장</li>
 *   <li>필수 컬럼이 없거나 값이 잘못된 행은 malformed로 집계하고 건너뜀</li>
 * </ul>
 *
 * <p>디렉토리가 없으면 {@link UncheckedIOException}을 던집니다.
 * 작업자 아티팩트가 하나도 전달되지 않은 상황을 조용히 넘기지 않기 위함입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TsvFragmentScanner implements FragmentSource {

    private static final Logger log = LoggerFactory.getLogger(TsvFragmentScanner.class);

    private final Path artifactsDir;

    /**
     * 생성자.
     *
     * @param artifactsDir 작업자 출력 디렉토리들을 담은 루트
     * @throws IllegalArgumentException artifactsDir가 null인 경우
     */
    public TsvFragmentScanner(Path artifactsDir) {
        if (artifactsDir == null) {
            throw new IllegalArgumentException("artifactsDir cannot be null");
        }
        this.artifactsDir = artifactsDir;
    }

    @Override
    public FragmentBatch collect() {
        if (!Files.isDirectory(artifactsDir)) {
            throw new UncheckedIOException(new NoSuchFileException(artifactsDir.toString()));
        }

        List<Path> successFiles = find(TsvSchema.SUCCESS_FRAGMENT_PREFIX);
        List<Path> outcomeFiles = find(TsvSchema.OUTCOME_FRAGMENT_PREFIX);
        log.info("Found {} success fragments and {} outcome fragments under {}",
            successFiles.size(), outcomeFiles.size(), artifactsDir);

        int malformed = 0;

        List<SuccessRecord> successes = new ArrayList<>();
        for (Path file : successFiles) {
            for (Map<String, String> row : TsvTable.read(file, TsvSchema.SUCCESS_HEADER).rows()) {
                Optional<SuccessRecord> record = TsvRowMapper.toSuccess(row);
                if (record.isPresent()) {
                    successes.add(record.get());
                } else {
                    malformed++;
                    log.warn("Skipping malformed success row in {}", file);
                }
            }
        }

        List<OutcomeRecord> outcomes = new ArrayList<>();
        for (Path file : outcomeFiles) {
            for (Map<String, String> row : TsvTable.read(file, TsvSchema.OUTCOME_HEADER).rows()) {
                Optional<OutcomeRecord> record = TsvRowMapper.toOutcome(row);
                if (record.isPresent()) {
                    outcomes.add(record.get());
                } else {
                    malformed++;
                    log.warn("Skipping malformed outcome row in {}", file);
                }
            }
        }

        return new FragmentBatch(successes, outcomes, malformed);
    }

    public Path getArtifactsDir() {
        return artifactsDir;
    }

    private List<Path> find(String prefix) {
        try (Stream<Path> paths = Files.walk(artifactsDir)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.startsWith(prefix) && name.endsWith(TsvSchema.FRAGMENT_SUFFIX);
                })
                .sorted((a, b) -> a.toString().compareTo(b.toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + artifactsDir, e);
        }
    }
}
