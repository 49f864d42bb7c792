package com.seccrawl.app;

import com.seccrawl.app.logging.LogSetup;
import com.seccrawl.core.error.ConfigurationException;
import com.seccrawl.core.model.CrawlConfig;
import com.seccrawl.core.service.CrawlReport;
import com.seccrawl.core.service.CrawlService;
import com.seccrawl.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 명령행 진입점.
 * 종료 코드: 0 정상(일부 URL 누락 포함), 1 결과 저장 I/O 오류, 2 설정 오류
 */
public final class CrawlApp {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_CONFIG = 2;

    private CrawlApp() {}

    public static void main(String[] args) {
        // 로그 초기화 (-Dseccrawl.out.dir 없으면 "out")
        Path outRoot = Paths.get(System.getProperty("seccrawl.out.dir", "out"));
        LogSetup.configure(outRoot);
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CrawlConfig cfg;
        try {
            CliOptions opts = CliOptions.parse(args);
            if (opts.help) {
                out.println(CliOptions.USAGE);
                return EXIT_OK;
            }
            cfg = opts.applyTo(loadBase(opts));
            cfg.validate();
        } catch (ConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_CONFIG;
        } catch (IOException e) {
            err.println("Cannot read configuration: " + e.getMessage());
            return EXIT_CONFIG;
        }

        try {
            CrawlReport report = new CrawlService(cfg).run();
            out.printf("Collected %d record(s) -> %s%n", report.records().size(), report.outputFile());
            var s = report.stats();
            out.printf("requests=%d retries=%d fetchFailures=%d parseFailures=%d scopeRejections=%d%n",
                    s.requestsTotal(), s.retriesTotal(), s.fetchFailures(), s.parseFailures(), s.scopeRejections());
            return EXIT_OK;
        } catch (ConfigurationException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (IOException e) {
            LOG.error("Failed to save results", e);
            err.println("Failed to save results: " + e.getMessage());
            return EXIT_IO;
        }
    }

    /** --config → ./crawl.yml → 기본값 */
    static CrawlConfig loadBase(CliOptions opts) throws IOException {
        if (opts.configFile != null) return YamlConfigLoader.load(opts.configFile);
        if (Files.exists(Path.of("crawl.yml"))) return YamlConfigLoader.loadDefault();
        return CrawlConfig.defaults();
    }
}
