package com.ryuqq.tracker.adapter.tsv;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.OutcomeKey;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.StateSnapshot;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.spi.CatalogNotFoundException;
import com.ryuqq.tracker.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * TSV 파일 기반 StateStore 구현체.
 *
 * <p><strong>파일:</strong></p>
 * <ul>
 *   <li>catalog: 필수. 없으면 {@link CatalogNotFoundException}. 헤더 없는 파일도 허용</li>
 *   <li>success log, outcome log: 없으면 빈 로그로 간주</li>
 * </ul>
 *
 * <p><strong>잘못된 행:</strong> 유효하지 않은 id를 가진 행은 경고 로그와 함께 건너뜁니다.
 * 파일 이름을 만들 수 없는 id가 작업자에게 전달되지 않게 하기 위함입니다.</p>
 *
 * <p><strong>동시성:</strong> 단일 coordinator가 사이클 사이에 호출한다고 가정합니다.
 * 파일 잠금은 사용하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TsvStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(TsvStateStore.class);

    private final Path catalogPath;
    private final Path successPath;
    private final Path outcomePath;

    /**
     * 생성자.
     *
     * @param catalogPath WorkCatalog 경로
     * @param successPath SuccessLog 경로
     * @param outcomePath OutcomeLog 경로
     * @throws IllegalArgumentException 경로가 null인 경우
     */
    public TsvStateStore(Path catalogPath, Path successPath, Path outcomePath) {
        if (catalogPath == null || successPath == null || outcomePath == null) {
            throw new IllegalArgumentException("catalogPath, successPath and outcomePath cannot be null");
        }
        this.catalogPath = catalogPath;
        this.successPath = successPath;
        this.outcomePath = outcomePath;
    }

    private TsvStateStore(Path successPath, Path outcomePath) {
        if (successPath == null || outcomePath == null) {
            throw new IllegalArgumentException("successPath and outcomePath cannot be null");
        }
        this.catalogPath = null;
        this.successPath = successPath;
        this.outcomePath = outcomePath;
    }

    /**
     * catalog 없이 두 로그만 다루는 저장소 생성 (집계 전용).
     *
     * <p>catalog를 읽는 메서드는 {@link CatalogNotFoundException}을 던집니다.</p>
     *
     * @param successPath SuccessLog 경로
     * @param outcomePath OutcomeLog 경로
     * @return TsvStateStore
     * @throws IllegalArgumentException 경로가 null인 경우
     */
    public static TsvStateStore logsOnly(Path successPath, Path outcomePath) {
        return new TsvStateStore(successPath, outcomePath);
    }

    @Override
    public StateSnapshot snapshot() {
        Set<AnnotationId> catalogIds = loadCatalogIds();
        Set<AnnotationId> successIds = loadSuccessIds();
        Set<AnnotationId> outcomeIds = new HashSet<>();
        for (OutcomeKey key : loadOutcomeKeys()) {
            outcomeIds.add(key.id());
        }
        return new StateSnapshot(catalogIds, successIds, outcomeIds);
    }

    @Override
    public Map<AnnotationId, WorkItem> loadCatalog() {
        TsvTable table = readCatalog();
        Map<AnnotationId, WorkItem> items = new LinkedHashMap<>();
        int skipped = 0;
        for (Map<String, String> row : table.rows()) {
            Optional<WorkItem> item = TsvRowMapper.toWorkItem(row);
            if (item.isPresent()) {
                items.put(item.get().id(), item.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} catalog rows without a valid id or locators in {}", skipped, catalogPath);
        }
        return items;
    }

    @Override
    public Set<AnnotationId> loadSuccessIds() {
        return loadIds(successPath, TsvSchema.SUCCESS_HEADER);
    }

    @Override
    public Set<OutcomeKey> loadOutcomeKeys() {
        Set<OutcomeKey> keys = new HashSet<>();
        if (!Files.exists(outcomePath)) {
            return keys;
        }
        int skipped = 0;
        for (Map<String, String> row : readOutcomeTable().rows()) {
            Optional<OutcomeRecord> record = TsvRowMapper.toOutcome(row);
            if (record.isPresent()) {
                keys.add(record.get().key());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} unreadable rows in {}", skipped, outcomePath);
        }
        return keys;
    }

    @Override
    public void initialize() {
        if (TsvTable.ensureHeader(successPath, TsvSchema.SUCCESS_HEADER)) {
            log.info("Created {} with header", successPath);
        }
        if (TsvTable.ensureHeader(outcomePath, TsvSchema.OUTCOME_HEADER)) {
            log.info("Created {} with header", outcomePath);
        }
    }

    @Override
    public void appendSuccesses(List<SuccessRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        List<Map<String, String>> rows = new ArrayList<>(records.size());
        for (SuccessRecord record : records) {
            rows.add(TsvRowMapper.toRow(record));
        }
        TsvTable.append(successPath, TsvSchema.SUCCESS_HEADER, rows);
    }

    @Override
    public void appendOutcomes(List<OutcomeRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        List<Map<String, String>> rows = new ArrayList<>(records.size());
        for (OutcomeRecord record : records) {
            rows.add(TsvRowMapper.toRow(record));
        }
        TsvTable.append(outcomePath, TsvSchema.OUTCOME_HEADER, rows);
    }

    /**
     * catalog 경로 조회.
     *
     * @return catalog 경로 ({@link #logsOnly}로 생성한 경우 null)
     */
    public Path getCatalogPath() {
        return catalogPath;
    }

    public Path getSuccessPath() {
        return successPath;
    }

    public Path getOutcomePath() {
        return outcomePath;
    }

    private Set<AnnotationId> loadCatalogIds() {
        Set<AnnotationId> ids = new HashSet<>();
        int skipped = 0;
        for (Map<String, String> row : readCatalog().rows()) {
            Optional<AnnotationId> id = TsvRowMapper.toId(row);
            if (id.isPresent()) {
                ids.add(id.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} catalog rows with an invalid id in {}", skipped, catalogPath);
        }
        return ids;
    }

    private Set<AnnotationId> loadIds(Path path, List<String> header) {
        Set<AnnotationId> ids = new HashSet<>();
        if (!Files.exists(path)) {
            return ids;
        }
        int skipped = 0;
        for (Map<String, String> row : TsvTable.read(path, header).rows()) {
            Optional<AnnotationId> id = TsvRowMapper.toId(row);
            if (id.isPresent()) {
                ids.add(id.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} rows with an invalid id in {}", skipped, path);
        }
        return ids;
    }

    private TsvTable readCatalog() {
        if (catalogPath == null) {
            throw new CatalogNotFoundException("(no catalog configured)");
        }
        if (!Files.exists(catalogPath)) {
            throw new CatalogNotFoundException(catalogPath.toString());
        }
        return TsvTable.read(catalogPath, TsvSchema.CATALOG_HEADER);
    }

    private TsvTable readOutcomeTable() {
        TsvTable table = TsvTable.read(outcomePath, TsvSchema.OUTCOME_HEADER);
        if (!table.hasColumn(TsvSchema.RESULT) && table.hasColumn(TsvSchema.STEP)) {
            log.debug("{} uses the legacy layout without a result column", outcomePath);
        }
        return table;
    }
}
