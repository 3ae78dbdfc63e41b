package com.webscout.core.service.export;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webscout.core.model.CrawlReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 보고서 JSON Exporter (Jackson pretty printer).
 * 같은 대상이면 같은 파일명이라 이전 결과를 덮어쓴다.
 */
public class JsonReportExporter implements ReportExporter {

    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public Path export(Path baseDir, CrawlReport report) throws IOException {
        Objects.requireNonNull(report, "report");
        Path outFile = ReportNaming.jsonPath(baseDir, report.target);
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(outFile.toFile(), report);
        return outFile;
    }

    /** 저장된 보고서 다시 읽기 */
    public CrawlReport read(Path file) throws IOException {
        return om.readValue(file.toFile(), CrawlReport.class);
    }
}
