package com.ryuqq.tracker.core.spi;

/**
 * 작업 카탈로그가 존재하지 않을 때 발생 (missing_catalog).
 *
 * <p>사이클 전체를 중단시키는 치명적 오류입니다. 비어 있는 카탈로그는 오류가 아닙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CatalogNotFoundException extends RuntimeException {

    private final String location;

    /**
     * 생성자.
     *
     * @param location 찾지 못한 카탈로그 위치
     */
    public CatalogNotFoundException(String location) {
        super("Work catalog not found: " + location);
        this.location = location;
    }

    /**
     * 찾지 못한 카탈로그 위치.
     *
     * @return 카탈로그 위치
     */
    public String getLocation() {
        return location;
    }
}
