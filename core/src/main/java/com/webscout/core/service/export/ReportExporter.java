package com.webscout.core.service.export;

import com.webscout.core.model.CrawlReport;

import java.io.IOException;
import java.nio.file.Path;

/** 크롤 결과를 파일로 내보내는 책임 */
public interface ReportExporter {
    /**
     * @param baseDir 출력 디렉터리 (null이면 현재 디렉터리)
     * @param report  정렬된 최종 보고서
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, CrawlReport report) throws IOException;
}
