package com.seccrawl.core.sink;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.seccrawl.core.model.CrawlRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * 레코드 배열 전체를 pretty JSON 으로.
 * 필드 순서는 모델의 @JsonPropertyOrder, 비ASCII 문자는 이스케이프하지 않는다.
 */
public class JsonRecordWriter implements RecordWriter {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    @Override
    public void write(List<? extends CrawlRecord> records, OutputStream out) throws IOException {
        mapper.writeValue(out, records);
    }
}
