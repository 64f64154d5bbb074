package com.ryuqq.tracker.core.aggregate;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.OutcomeKey;
import com.ryuqq.tracker.core.model.OutcomeRecord;
import com.ryuqq.tracker.core.model.SuccessRecord;
import com.ryuqq.tracker.core.spi.FragmentBatch;
import com.ryuqq.tracker.core.spi.FragmentSource;
import com.ryuqq.tracker.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 워커들이 남긴 fragment를 canonical 로그에 병합.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 현재 dedup 키 로드
 *    - SuccessLog: id 집합
 *    - OutcomeLog: (id, runAt) 집합
 * 2. 두 로그가 없으면 헤더와 함께 생성
 * 3. 성공 fragment: id가 키에 없을 때만 추가하고 키 집합에 등록
 * 4. 결과 fragment: (id, runAt)가 키에 없을 때만 추가하고 키 집합에 등록
 * 5. 필수 컬럼이 빠진 행은 건너뜀 (FragmentSource가 malformed로 집계)
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>같은 fragment 디렉토리를 몇 번 집계해도 두 번째부터는 추가되는 행이 없음</li>
 *   <li>같은 id의 성공 fragment가 한 번의 집계 안에 두 개 있어도 첫 번째만 추가됨</li>
 *   <li>같은 id라도 runAt이 다른 결과 fragment는 모두 보존됨</li>
 * </ul>
 *
 * <p><strong>단일 writer:</strong> 집계는 사이클당 한 번, 다음 사이클의 스냅샷 이전에 완료되어야 합니다.
 * 동시에 두 집계를 실행하는 것은 지원하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FragmentAggregator {

    private static final Logger log = LoggerFactory.getLogger(FragmentAggregator.class);

    private final StateStore store;
    private final FragmentSource source;

    /**
     * 생성자.
     *
     * @param store canonical 상태 저장소
     * @param source fragment 스캐너
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FragmentAggregator(StateStore store, FragmentSource source) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.store = store;
        this.source = source;
    }

    /**
     * fragment 병합 실행.
     *
     * @return 집계 결과
     */
    public AggregationReport aggregate() {
        // 1. dedup 키 로드
        Set<AnnotationId> successKeys = new HashSet<>(store.loadSuccessIds());
        Set<OutcomeKey> outcomeKeys = new HashSet<>(store.loadOutcomeKeys());
        log.info("Existing success rows : {}", successKeys.size());
        log.info("Existing outcome rows : {}", outcomeKeys.size());

        // 2. 헤더 보장
        store.initialize();

        FragmentBatch batch = source.collect();

        // 3. 성공 fragment
        List<SuccessRecord> newSuccesses = new ArrayList<>();
        int successSkipped = 0;
        for (SuccessRecord record : batch.successes()) {
            if (successKeys.add(record.id())) {
                newSuccesses.add(record);
                log.info("  + success: {}", record.id().getValue());
            } else {
                successSkipped++;
                log.info("  ~ skip (already exists): {}", record.id().getValue());
            }
        }

        // 4. 결과 fragment
        List<OutcomeRecord> newOutcomes = new ArrayList<>();
        int outcomeSkipped = 0;
        for (OutcomeRecord record : batch.outcomes()) {
            if (outcomeKeys.add(record.key())) {
                newOutcomes.add(record);
                log.info("  + outcome: {} @ {} ({})", record.id().getValue(), record.runAt(), record.step());
            } else {
                outcomeSkipped++;
            }
        }

        store.appendSuccesses(newSuccesses);
        store.appendOutcomes(newOutcomes);

        if (batch.malformed() > 0) {
            log.warn("Skipped {} malformed fragment rows", batch.malformed());
        }
        log.info("Appended {} success rows and {} outcome rows.", newSuccesses.size(), newOutcomes.size());

        return new AggregationReport(
            newSuccesses.size(),
            successSkipped,
            newOutcomes.size(),
            outcomeSkipped,
            batch.malformed()
        );
    }
}
