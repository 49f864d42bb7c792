package com.seccrawl.core.service;

import com.seccrawl.core.model.CrawlConfig;
import com.seccrawl.core.model.CrawlRecord;
import com.seccrawl.core.model.CrawlStats;

import java.nio.file.Path;
import java.util.List;

/**
 * 크롤 실행 1회의 결과.
 * @param outputFile 저장하지 않았으면 null
 */
public record CrawlReport(CrawlConfig.Mode mode,
                          List<? extends CrawlRecord> records,
                          Path outputFile,
                          CrawlStats.Snapshot stats) {
    public CrawlReport {
        records = List.copyOf(records);
    }
}
