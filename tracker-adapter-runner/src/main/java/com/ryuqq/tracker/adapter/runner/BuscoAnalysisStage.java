package com.ryuqq.tracker.adapter.runner;

import com.ryuqq.tracker.core.model.AnnotationId;
import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.outcome.Fail;
import com.ryuqq.tracker.core.outcome.Ok;
import com.ryuqq.tracker.core.outcome.StageResult;
import com.ryuqq.tracker.core.spi.AnalysisStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * {@code 02_run_BUSCO.sh} 기반 BUSCO 분석 단계.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>lineage 후보 중 처음으로 존재하는 디렉토리 선택 (없으면 lineage_missing)</li>
 *   <li>{@code 02_run_BUSCO.sh <proteins.faa> <lineage_dir> busco_<id>} 실행 (실패 시 run_busco)</li>
 *   <li>작업 디렉토리 아래 {@code busco_<id>} 출력 디렉토리 반환</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BuscoAnalysisStage implements AnalysisStage {

    private static final Logger log = LoggerFactory.getLogger(BuscoAnalysisStage.class);

    private static final String STEP_NAME = "run_busco";
    private static final String OUTPUT_PREFIX = "busco_";

    private final WorkerConfig config;
    private final ProcessStageRunner processRunner;

    /**
     * 생성자.
     *
     * @param config 작업자 설정
     * @param processRunner 프로세스 실행기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BuscoAnalysisStage(WorkerConfig config, ProcessStageRunner processRunner) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (processRunner == null) {
            throw new IllegalArgumentException("processRunner cannot be null");
        }
        this.config = config;
        this.processRunner = processRunner;
    }

    @Override
    public Optional<Fail> checkTool() {
        Path script = config.analysisScript();
        if (!Files.exists(script)) {
            log.error("BUSCO script not found: {}", script);
            return Optional.of(Fail.of(FailureStep.SCRIPT_MISSING, "BUSCO script not found: " + script));
        }
        return Optional.empty();
    }

    @Override
    public StageResult analyze(AnnotationId id, Path proteinFile) {
        Optional<Path> lineage = findLineage();
        if (lineage.isEmpty()) {
            log.error("Lineage folder not found. Tried: {}", config.lineageCandidates());
            return Fail.of(FailureStep.LINEAGE_MISSING, "Lineage folder not found. Tried: " + config.lineageCandidates());
        }

        String outputName = outputNameFor(id);
        List<String> command = List.of(
            config.analysisScript().toString(),
            proteinFile.toString(),
            lineage.get().toString(),
            outputName
        );

        ProcessResult result;
        try {
            result = processRunner.run(STEP_NAME, command);
        } catch (IOException e) {
            log.error("Could not start {}: {}", STEP_NAME, e.getMessage());
            return Fail.of(FailureStep.RUN_BUSCO, "Could not start BUSCO: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Fail.of(FailureStep.RUN_BUSCO, "BUSCO interrupted");
        }

        if (!result.isSuccess()) {
            String reason = result.timedOut() ? "timed out" : "exit code " + result.exitCode();
            return Fail.of(FailureStep.RUN_BUSCO, "BUSCO execution failed (" + reason + ")");
        }
        return Ok.of(config.workDir().resolve(outputName));
    }

    /**
     * BUSCO 출력 디렉토리 이름.
     *
     * @param id annotation id
     * @return {@code busco_<id>}
     */
    public static String outputNameFor(AnnotationId id) {
        return OUTPUT_PREFIX + id.getValue();
    }

    private Optional<Path> findLineage() {
        for (Path candidate : config.lineageCandidates()) {
            Path resolved = config.workDir().resolve(candidate);
            if (Files.isDirectory(resolved)) {
                return Optional.of(resolved);
            }
        }
        return Optional.empty();
    }
}
