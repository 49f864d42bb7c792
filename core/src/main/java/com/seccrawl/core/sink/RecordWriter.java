package com.seccrawl.core.sink;

import com.seccrawl.core.model.CrawlRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/** 수집 결과를 한 가지 형식으로 쓰는 책임 (JSON/CSV) */
public interface RecordWriter {
    /**
     * @param records 수집 순서대로의 레코드
     * @param out     호출자가 열고 닫는 스트림(UTF-8 로 쓴다)
     */
    void write(List<? extends CrawlRecord> records, OutputStream out) throws IOException;

    /** 파일을 만들기 전에 호출. 이 형식으로 쓸 수 없는 목록이면 IllegalArgumentException. */
    default void check(List<? extends CrawlRecord> records) {}
}
