package com.ryuqq.tracker.adapter.tsv;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.spi.FragmentSink;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 작업자 전용 출력 디렉토리에 fragment 파일을 쓰는 FragmentSink 구현체.
 *
 * <p><strong>파일 이름 (id에서 결정적으로 생성):</strong></p>
 * <ul>
 *   <li>{@code result_<id>.tsv}: SuccessLog 헤더 + 1행</li>
 *   <li>{@code log_<id>.tsv}: OutcomeLog 헤더 + 1행</li>
 * </ul>
 *
 * <p>같은 사이클에서 같은 id를 다시 쓰면 이전 fragment를 덮어씁니다.
 * 서로 다른 작업자는 서로 다른 디렉토리를 사용하므로 충돌하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TsvFragmentWriter implements FragmentSink {

    private final Path outputDir;

    /**
     * 생성자.
     *
     * @param outputDir fragment 디렉토리 (없으면 첫 쓰기에서 생성)
     * @throws IllegalArgumentException outputDir가 null인 경우
     */
    public TsvFragmentWriter(Path outputDir) {
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir cannot be null");
        }
        this.outputDir = outputDir;
    }

    @Override
    public void writeSuccess(SuccessRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Path path = outputDir.resolve(TsvSchema.successFragmentName(record.id().getValue()));
        TsvTable.writeSingleRow(path, TsvSchema.SUCCESS_HEADER, TsvRowMapper.toRow(record));
    }

    @Override
    public void writeOutcome(OutcomeRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        Path path = outputDir.resolve(TsvSchema.outcomeFragmentName(record.id().getValue()));
        TsvTable.writeSingleRow(path, TsvSchema.OUTCOME_HEADER, TsvRowMapper.toRow(record));
    }

    @Override
    public void discardSuccess(AnnotationId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Path path = outputDir.resolve(TsvSchema.successFragmentName(id.getValue()));
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove " + path, e);
        }
    }

    public Path getOutputDir() {
        return outputDir;
    }
}
