package com.ryuqq.tracker.core.model;

/**
 * 카탈로그에 등록된 하나의 작업 항목.
 *
 * <p>외부 카탈로그 적재 프로세스가 한 번 생성하며, 이후 변경되거나 삭제되지 않습니다.</p>
 *
 * @param id Annotation 식별자
 * @param annotationUrl 유전체 feature 파일 위치 (GFF/GFF3, .gz 가능)
 * @param assemblyUrl 서열 파일 위치 (FASTA, .gz 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkItem(
    AnnotationId id,
    String annotationUrl,
    String assemblyUrl
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public WorkItem {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (annotationUrl == null || annotationUrl.isBlank()) {
            throw new IllegalArgumentException("annotationUrl cannot be null or blank");
        }
        if (assemblyUrl == null || assemblyUrl.isBlank()) {
            throw new IllegalArgumentException("assemblyUrl cannot be null or blank");
        }
    }
}
