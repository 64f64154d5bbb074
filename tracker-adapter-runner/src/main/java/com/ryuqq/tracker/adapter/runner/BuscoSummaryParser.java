package com.ryuqq.tracker.adapter.runner;

import com.ryuqq.tracker.core.model.BuscoMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BUSCO {@code short_summary.*.txt} 파서.
 *
 * <p><strong>추출 항목:</strong></p>
 * <pre>
 * lineage dataset is: (\S+)        → lineage
 * C:95.3% S:94.6% D:0.7% F:2.3% M:2.4%
 * 129   Total BUSCO groups searched → buscoCount (대소문자 무시)
 * </pre>
 *
 * <p>찾지 못한 항목은 {@link BuscoMetrics} 기본값을 사용합니다.
 * summary 파일 자체가 없으면 {@link IllegalStateException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BuscoSummaryParser {

    private static final Logger log = LoggerFactory.getLogger(BuscoSummaryParser.class);

    private static final String SUMMARY_GLOB = "short_summary.*.txt";

    private static final Pattern LINEAGE = Pattern.compile("lineage dataset is: (\\S+)");
    private static final Pattern COMPLETE = percent("C");
    private static final Pattern SINGLE = percent("S");
    private static final Pattern DUPLICATED = percent("D");
    private static final Pattern FRAGMENTED = percent("F");
    private static final Pattern MISSING = percent("M");
    private static final Pattern TOTAL = Pattern.compile("(\\d+)\\s+total BUSCO", Pattern.CASE_INSENSITIVE);

    /**
     * 출력 디렉토리의 summary 파일 파싱.
     *
     * <p>summary 파일이 여러 개이면 이름 순으로 첫 번째를 사용합니다.</p>
     *
     * @param outputDir BUSCO 출력 디렉토리
     * @return 추출한 지표
     * @throws IllegalStateException summary 파일이 없는 경우
     * @throws UncheckedIOException 파일을 읽을 수 없는 경우
     */
    public BuscoMetrics parse(Path outputDir) {
        log.info("Parsing BUSCO results from {}", outputDir);

        List<Path> summaries = new ArrayList<>();
        if (Files.isDirectory(outputDir)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDir, SUMMARY_GLOB)) {
                for (Path path : stream) {
                    summaries.add(path);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list " + outputDir, e);
            }
        }
        if (summaries.isEmpty()) {
            throw new IllegalStateException("BUSCO summary file not found in " + outputDir);
        }
        Collections.sort(summaries);

        Path summary = summaries.get(0);
        log.info("Reading summary from {}", summary);
        try {
            String content = new String(Files.readAllBytes(summary), StandardCharsets.UTF_8);
            return parseContent(content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + summary, e);
        }
    }

    /**
     * summary 본문 파싱.
     *
     * @param content summary 파일 내용
     * @return 추출한 지표 (없는 항목은 기본값)
     */
    public BuscoMetrics parseContent(String content) {
        BuscoMetrics metrics = new BuscoMetrics(
            find(LINEAGE, content, ""),
            parseCount(find(TOTAL, content, "0")),
            Double.parseDouble(find(COMPLETE, content, "0.0")),
            Double.parseDouble(find(SINGLE, content, "0.0")),
            Double.parseDouble(find(DUPLICATED, content, "0.0")),
            Double.parseDouble(find(FRAGMENTED, content, "0.0")),
            Double.parseDouble(find(MISSING, content, "0.0"))
        );
        log.info("BUSCO results: {}", metrics);
        return metrics;
    }

    private static String find(Pattern pattern, String content, String fallback) {
        Matcher matcher = pattern.matcher(content);
        return matcher.find() ? matcher.group(1) : fallback;
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring out-of-range BUSCO count '{}', using 0", value);
            return 0;
        }
    }

    private static Pattern percent(String label) {
        return Pattern.compile(label + ":(\\d+(?:\\.\\d+)?)%");
    }
}
