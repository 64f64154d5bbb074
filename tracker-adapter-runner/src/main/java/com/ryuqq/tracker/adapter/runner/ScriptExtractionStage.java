package com.ryuqq.tracker.adapter.runner;

import com.ryuqq.tracker.core.model.FailureStep;
import com.ryuqq.tracker.core.model.WorkItem;
import com.ryuqq.tracker.core.outcome.Fail;
import com.ryuqq.tracker.core.outcome.Ok;
import com.ryuqq.tracker.core.outcome.StageResult;
import com.ryuqq.tracker.core.spi.ExtractionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * {@code 01_extract_proteins.sh} 기반 단백질 추출 단계.
 *
 * <p>스크립트는 annotation 파일과 같은 디렉토리에 {@code <basename>_proteins.faa}를 생성합니다.
 * basename은 파일 이름에서 {@code .gz}, {@code .gff3}, {@code .gff} 순으로 확장자를 제거한 값입니다.</p>
 *
 * <pre>
 * data/GCF_1.gff3.gz  →  data/GCF_1_proteins.faa
 * data/GCF_2.gff      →  data/GCF_2_proteins.faa
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptExtractionStage implements ExtractionStage {

    private static final Logger log = LoggerFactory.getLogger(ScriptExtractionStage.class);

    private static final String STEP_NAME = "extract_proteins";
    private static final String PROTEIN_SUFFIX = "_proteins.faa";

    private final WorkerConfig config;
    private final ProcessStageRunner processRunner;

    /**
     * 생성자.
     *
     * @param config 작업자 설정
     * @param processRunner 프로세스 실행기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ScriptExtractionStage(WorkerConfig config, ProcessStageRunner processRunner) {
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
        Path script = config.extractScript();
        if (!Files.exists(script)) {
            log.error("Extract proteins script not found: {}", script);
            return Optional.of(Fail.of(FailureStep.SCRIPT_MISSING, "Extract proteins script not found: " + script));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Fail> checkInputs(WorkItem item) {
        Path annotation = config.resolve(item.annotationUrl());
        if (!Files.exists(annotation)) {
            log.error("GFF file not found: {}", annotation);
            return Optional.of(Fail.of(FailureStep.INPUT_MISSING, "GFF file not found: " + annotation));
        }
        Path assembly = config.resolve(item.assemblyUrl());
        if (!Files.exists(assembly)) {
            log.error("FASTA file not found: {}", assembly);
            return Optional.of(Fail.of(FailureStep.INPUT_MISSING, "FASTA file not found: " + assembly));
        }
        return Optional.empty();
    }

    @Override
    public StageResult extract(WorkItem item) {
        Path annotation = config.resolve(item.annotationUrl());
        Path assembly = config.resolve(item.assemblyUrl());
        List<String> command = List.of(
            config.extractScript().toString(),
            annotation.toString(),
            assembly.toString()
        );

        ProcessResult result;
        try {
            result = processRunner.run(STEP_NAME, command);
        } catch (IOException e) {
            log.error("Could not start {}: {}", STEP_NAME, e.getMessage());
            return Fail.of(FailureStep.EXTRACT_PROTEINS, "Could not start extraction: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Fail.of(FailureStep.EXTRACT_PROTEINS, "Extraction interrupted");
        }

        if (!result.isSuccess()) {
            String reason = result.timedOut() ? "timed out" : "exit code " + result.exitCode();
            return Fail.of(FailureStep.EXTRACT_PROTEINS, "Protein extraction failed (" + reason + ")");
        }

        Path proteinFile = proteinFileFor(annotation);
        if (!Files.exists(proteinFile)) {
            log.error("Protein file not found: {}", proteinFile);
            return Fail.of(FailureStep.EXTRACT_PROTEINS, "Protein file not found: " + proteinFile);
        }
        log.info("Protein file created: {}", proteinFile);
        return Ok.of(proteinFile);
    }

    /**
     * annotation 파일에 대응하는 단백질 파일 경로 계산.
     *
     * @param annotation annotation 파일 경로
     * @return 같은 디렉토리의 {@code <basename>_proteins.faa}
     */
    public static Path proteinFileFor(Path annotation) {
        String name = annotation.getFileName().toString();
        name = stripSuffix(name, ".gz");
        name = stripSuffix(name, ".gff3");
        name = stripSuffix(name, ".gff");
        return annotation.resolveSibling(name + PROTEIN_SUFFIX);
    }

    private static String stripSuffix(String name, String suffix) {
        return name.endsWith(suffix) ? name.substring(0, name.length() - suffix.length()) : name;
    }
}
