package com.seccrawl.core.sink;

import com.seccrawl.core.model.OutputFormat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;

/** 결과 파일 이름: crawl_results_yyyyMMdd_HHmmss.ext, 이미 있으면 _1, _2 ... */
public final class OutputNaming {

    public static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    public static final String PREFIX = "crawl_results_";

    private final Clock clock;

    public OutputNaming(Clock clock) { this.clock = clock; }

    public static OutputNaming systemDefault() { return new OutputNaming(Clock.systemDefaultZone()); }

    public String timestamp() {
        return TS_FMT.format(clock.instant().atZone(clock.getZone()));
    }

    public Path resolve(Path dir, OutputFormat format) {
        String base = PREFIX + timestamp();
        Path p = dir.resolve(base + "." + format.extension());
        for (int i = 1; Files.exists(p); i++) {
            p = dir.resolve(base + "_" + i + "." + format.extension());
        }
        return p;
    }
}
