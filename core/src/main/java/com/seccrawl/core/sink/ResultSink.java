package com.seccrawl.core.sink;

import com.seccrawl.core.model.CrawlRecord;
import com.seccrawl.core.model.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/** 수집 결과를 타임스탬프 파일 1개로 저장. */
public final class ResultSink {

    private static final Logger LOG = LoggerFactory.getLogger(ResultSink.class);

    private final OutputNaming naming;
    private final RecordWriter json;
    private final RecordWriter csv;

    public ResultSink() { this(OutputNaming.systemDefault()); }

    public ResultSink(OutputNaming naming) {
        this(naming, new JsonRecordWriter(), new CsvRecordWriter());
    }

    ResultSink(OutputNaming naming, RecordWriter json, RecordWriter csv) {
        this.naming = Objects.requireNonNull(naming, "naming");
        this.json = Objects.requireNonNull(json, "json");
        this.csv = Objects.requireNonNull(csv, "csv");
    }

    /**
     * 형식 이름 버전. 이름은 I/O 전에 검증한다.
     * @throws com.seccrawl.core.error.ConfigurationException 지원하지 않는 형식(디렉터리도 만들지 않음)
     */
    public Path serialize(List<? extends CrawlRecord> records, Path dir, String format) throws IOException {
        return serialize(records, dir, OutputFormat.parse(format));
    }

    /** @return 생성된 파일 경로 */
    public Path serialize(List<? extends CrawlRecord> records, Path dir, OutputFormat format) throws IOException {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(format, "format");
        RecordWriter writer = (format == OutputFormat.CSV) ? csv : json;
        writer.check(records);

        Files.createDirectories(dir);
        while (true) {
            Path out = naming.resolve(dir, format);
            OutputStream raw;
            try {
                raw = Files.newOutputStream(out, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException race) {
                LOG.debug("Output name taken, retrying: {}", out);
                continue;
            }
            try (OutputStream os = new BufferedOutputStream(raw)) {
                writer.write(records, os);
            } catch (IOException | RuntimeException e) {
                // 쓰다 만 파일은 남기지 않는다
                try {
                    Files.deleteIfExists(out);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
            LOG.info("Results saved to {} ({} records)", out, records.size());
            return out;
        }
    }
}
