package com.ryuqq.tracker.adapter.runner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 작업자 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scriptsDir: 외부 스크립트 디렉토리 (기본 {@code scripts})</li>
 *   <li>workDir: 외부 프로세스 작업 디렉토리, 상대 경로 기준 (기본 {@code .})</li>
 *   <li>lineageCandidates: lineage 데이터셋 후보 경로, 순서대로 탐색</li>
 *   <li>stageTimeout: 외부 프로세스 하나의 최대 실행 시간 (기본 null = 제한 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scriptsDir 스크립트 디렉토리
 * @param workDir 작업 디렉토리
 * @param lineageCandidates lineage 후보 경로 (1개 이상)
 * @param stageTimeout 단계별 제한 시간 (null이면 제한 없음, 설정 시 양수)
 */
public record WorkerConfig(
    Path scriptsDir,
    Path workDir,
    List<Path> lineageCandidates,
    Duration stageTimeout
) {

    public static final String EXTRACT_SCRIPT = "01_extract_proteins.sh";
    public static final String ANALYSIS_SCRIPT = "02_run_BUSCO.sh";

    public static final List<Path> DEFAULT_LINEAGE_CANDIDATES = List.of(
        Path.of("assets", "busco_downloads", "lineages", "eukaryota_odb12"),
        Path.of("eukaryota_odb12")
    );

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scriptsDir=scripts, workDir=., 기본 lineage 후보, stageTimeout 없음</p>
     */
    public WorkerConfig() {
        this(Path.of("scripts"), Path.of("."), DEFAULT_LINEAGE_CANDIDATES, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerConfig {
        if (scriptsDir == null) {
            throw new IllegalArgumentException("scriptsDir cannot be null");
        }
        if (workDir == null) {
            throw new IllegalArgumentException("workDir cannot be null");
        }
        if (lineageCandidates == null || lineageCandidates.isEmpty()) {
            throw new IllegalArgumentException("lineageCandidates cannot be null or empty");
        }
        if (stageTimeout != null && (stageTimeout.isZero() || stageTimeout.isNegative())) {
            throw new IllegalArgumentException(
                "stageTimeout must be positive (current: " + stageTimeout + ")"
            );
        }
        lineageCandidates = List.copyOf(lineageCandidates);
    }

    /**
     * 단계별 제한 시간 설정 여부.
     *
     * @return stageTimeout이 설정되어 있으면 true
     */
    public boolean hasStageTimeout() {
        return stageTimeout != null;
    }

    /**
     * 추출 스크립트 경로.
     *
     * @return scriptsDir/01_extract_proteins.sh
     */
    public Path extractScript() {
        return scriptsDir.resolve(EXTRACT_SCRIPT);
    }

    /**
     * 분석 스크립트 경로.
     *
     * @return scriptsDir/02_run_BUSCO.sh
     */
    public Path analysisScript() {
        return scriptsDir.resolve(ANALYSIS_SCRIPT);
    }

    /**
     * 작업 디렉토리 기준 경로 해석.
     *
     * @param location 절대 또는 상대 경로 문자열
     * @return 해석된 경로
     */
    public Path resolve(String location) {
        return workDir.resolve(location);
    }

    /**
     * scriptsDir만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withScriptsDir(Path scriptsDir) {
        return new WorkerConfig(scriptsDir, workDir, lineageCandidates, stageTimeout);
    }

    /**
     * workDir만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withWorkDir(Path workDir) {
        return new WorkerConfig(scriptsDir, workDir, lineageCandidates, stageTimeout);
    }

    /**
     * lineageCandidates만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withLineageCandidates(List<Path> lineageCandidates) {
        return new WorkerConfig(scriptsDir, workDir, lineageCandidates, stageTimeout);
    }

    /**
     * stageTimeout만 변경한 새 인스턴스 생성.
     */
    public WorkerConfig withStageTimeout(Duration stageTimeout) {
        return new WorkerConfig(scriptsDir, workDir, lineageCandidates, stageTimeout);
    }
}
