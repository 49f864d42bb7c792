package com.seccrawl.core.sink;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.seccrawl.core.model.CrawlRecord;
import com.seccrawl.core.model.ExtractedElement;
import com.seccrawl.core.model.ExtractionRecord;
import com.seccrawl.core.model.Page;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CSV 투영.
 * - Page: url,title,status_code,num_links,num_images (페이지당 1행)
 * - ExtractionRecord: URL,Index,Text Content,HTML Content + 속성 컬럼(처음 나온 순서), 요소당 1행
 * 빈 속성 칸은 빈 문자열. 두 종류가 섞인 목록은 받지 않는다.
 */
public class CsvRecordWriter implements RecordWriter {

    static final List<String> PAGE_COLUMNS = List.of("url", "title", "status_code", "num_links", "num_images");
    static final List<String> ELEMENT_COLUMNS = List.of("URL", "Index", "Text Content", "HTML Content");

    // 구분자/따옴표/개행이 있는 값만 따옴표로 감싼다
    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();

    @Override
    public void check(List<? extends CrawlRecord> records) {
        boolean elements = isElements(records);
        for (CrawlRecord r : records) {
            if ((r instanceof ExtractionRecord) != elements) {
                throw new IllegalArgumentException("CSV output cannot mix page and element records");
            }
        }
    }

    @Override
    public void write(List<? extends CrawlRecord> records, OutputStream out) throws IOException {
        check(records);
        if (isElements(records)) writeElements(records, out);
        else writePages(records, out);
    }

    private static boolean isElements(List<? extends CrawlRecord> records) {
        return !records.isEmpty() && records.get(0) instanceof ExtractionRecord;
    }

    private void writePages(List<? extends CrawlRecord> records, OutputStream out) throws IOException {
        CsvSchema schema = schemaOf(PAGE_COLUMNS);
        try (SequenceWriter w = mapper.writer(schema).writeValues(out)) {
            for (CrawlRecord r : records) {
                Page p = (Page) r;
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("url", p.sourceUrl());
                row.put("title", p.getTitle() == null ? "" : p.getTitle());
                row.put("status_code", p.getStatusCode());
                row.put("num_links", p.getLinks().size());
                row.put("num_images", p.getImages().size());
                w.write(row);
            }
        }
    }

    private void writeElements(List<? extends CrawlRecord> records, OutputStream out) throws IOException {
        // 속성 컬럼: 전체 요소에서 처음 나온 순서
        Set<String> attrColumns = new LinkedHashSet<>();
        for (CrawlRecord r : records) {
            for (ExtractedElement el : ((ExtractionRecord) r).elements()) {
                for (String name : el.attributes().keySet()) {
                    if (!ELEMENT_COLUMNS.contains(name)) attrColumns.add(name);
                }
            }
        }
        List<String> columns = new ArrayList<>(ELEMENT_COLUMNS);
        columns.addAll(attrColumns);

        CsvSchema schema = schemaOf(columns);
        try (SequenceWriter w = mapper.writer(schema).writeValues(out)) {
            for (CrawlRecord r : records) {
                ExtractionRecord rec = (ExtractionRecord) r;
                int index = 0;
                for (ExtractedElement el : rec.elements()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("URL", rec.sourceUrl());
                    row.put("Index", index++);
                    row.put("Text Content", el.text());
                    row.put("HTML Content", el.html());
                    for (String a : attrColumns) row.put(a, el.attributes().getOrDefault(a, ""));
                    w.write(row);
                }
            }
        }
    }

    private static CsvSchema schemaOf(List<String> columns) {
        CsvSchema.Builder b = CsvSchema.builder();
        for (String c : columns) b.addColumn(c);
        return b.setUseHeader(true).build();
    }
}
