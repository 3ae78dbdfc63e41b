package com.webscout.cli;

import com.webscout.cli.console.ConsoleFindingPrinter;
import com.webscout.cli.console.ConsoleProgressLine;
import com.webscout.cli.logging.LogSetup;
import com.webscout.core.model.CrawlConfig;
import com.webscout.core.model.CrawlReport;
import com.webscout.core.service.CrawlService;
import com.webscout.core.service.export.JsonReportExporter;
import com.webscout.core.util.ProgressListener;
import com.webscout.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebScout CLI 진입점 (picocli).
 *
 * <pre>
 * # 기본(깊이 3)
 * webscout -u example.com
 *
 * # 무제한 깊이, 설정 파일 + 출력 디렉터리
 * webscout -u https://example.com -d 0 -c crawl.yml -o out
 * </pre>
 *
 * 종료 코드: 0 성공(Ctrl+C 중단 포함), 1 보고서 저장 실패, 2 잘못된 인자/설정.
 */
@Command(
    name = "webscout",
    description = "같은 호스트 안에서 BFS로 크롤하며 HTML 페이지, 백엔드 엔드포인트, JavaScript 함수명을 수집합니다.",
    mixinStandardHelpOptions = true,
    version = "webscout 0.1.0"
)
public class WebScoutCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(WebScoutCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_USAGE = 2;

    /** 셧다운 훅이 보고서 저장을 기다리는 최대 시간 */
    private static final long HOOK_WAIT_MS = 10_000L;

    @Option(names = {"-u", "--url"}, required = true,
            description = "Target URL to scan (http:// is assumed when no scheme is given)")
    private String url;

    @Option(names = {"-d", "--depth"},
            description = "Maximum crawl depth (default: 3, 0 = unlimited)")
    private Integer depth;

    @Option(names = {"-c", "--config"},
            description = "YAML configuration file (crawl.yml)")
    private Path configFile;

    @Option(names = {"-o", "--output"},
            description = "Directory for the JSON report and logs (default: .)")
    private Path outputDir;

    @Option(names = {"--concurrency"},
            description = "Number of pages fetched at the same time (default: 1)")
    private Integer concurrency;

    @Option(names = {"--delay-ms"},
            description = "Delay after each processed page in milliseconds (default: 500)")
    private Long delayMs;

    @Option(names = {"--no-color"}, description = "Disable colored output")
    private boolean noColor;

    @Option(names = {"--quiet"}, description = "Do not show the progress line")
    private boolean quiet;

    private final PrintStream out;
    private final PrintStream err;
    private final AtomicBoolean cancel = new AtomicBoolean(false);
    private volatile boolean interruptedByUser = false;

    public WebScoutCli() {
        this(System.out, System.err);
    }

    /** 테스트용: 출력 스트림 주입 */
    WebScoutCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        CrawlConfig cfg;
        try {
            cfg = buildConfig();
            cfg.validate();
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        LogSetup.configure(cfg.getOutputDir());

        Ansi ansi = noColor ? Ansi.OFF : Ansi.AUTO;
        printBanner(cfg);

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            // Ctrl+C: 크롤을 멈추고 보고서 저장까지 기다린다
            interruptedByUser = true;
            cancel.set(true);
            try {
                if (!finished.await(HOOK_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    LOG.warn("Report was not written within {} ms of interrupt", HOOK_WAIT_MS);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "webscout-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            CrawlService service = new CrawlService(cfg, new ConsoleFindingPrinter(out, ansi));
            ProgressListener progress = quiet ? ProgressListener.NONE : new ConsoleProgressLine(out);
            CrawlReport report = service.run(progress, cancel);

            out.println(service.wasCancelled()
                    ? "\n\nScan interrupted by user!"
                    : "\n\nScan complete! Final results:");

            Path file;
            try {
                file = new JsonReportExporter().export(cfg.getOutputDir(), report);
            } catch (IOException e) {
                LOG.error("Report write failed: {}", e.toString(), e);
                err.println("ERROR: could not write report: " + e.getMessage());
                return EXIT_IO;
            }
            printSummary(report, file);
            return EXIT_OK;
        } finally {
            finished.countDown();
            removeHook(hook);
        }
    }

    /** YAML(옵션) → CLI 옵션 덮어쓰기 */
    CrawlConfig buildConfig() throws IOException {
        CrawlConfig cfg = (configFile != null) ? YamlConfigLoader.load(configFile) : CrawlConfig.defaults();
        cfg.setTarget(normalizeTarget(url));
        if (depth != null) cfg.setMaxDepth(depth);
        if (concurrency != null) {
            if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
            cfg.setConcurrency(concurrency);
        }
        if (delayMs != null) {
            if (delayMs < 0) throw new IllegalArgumentException("delay must be >= 0");
            cfg.setDelayMs(delayMs);
        }
        if (outputDir != null) cfg.setOutputDir(outputDir);
        return cfg;
    }

    /** 스킴이 없으면 http:// 를 붙인다 */
    static String normalizeTarget(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return s;
        if (s.contains("://")) return s; // 다른 스킴은 validate()에서 거절
        return "http://" + s;
    }

    private void printBanner(CrawlConfig cfg) {
        out.println("\nStarting security scan for: " + cfg.getTarget());
        out.println("Maximum crawl depth: " + (cfg.isUnlimitedDepth() ? "unlimited" : String.valueOf(cfg.getMaxDepth())));
        out.println("Press Ctrl+C to stop early...\n");
        out.flush();
    }

    private void printSummary(CrawlReport report, Path file) {
        out.println("\nScan Summary:");
        out.println("- HTML Pages: " + report.stats.totalHtml);
        out.println("- Backend Endpoints: " + report.stats.totalBackend);
        out.println("- JavaScript Functions: " + report.stats.totalFunctions);
        out.println("- Report saved to: " + file);
        out.flush();
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // 이미 종료 시퀀스 진행 중
            LOG.debug("Shutdown in progress, hook stays registered");
        }
    }

    boolean isInterruptedByUser() {
        return interruptedByUser;
    }

    public static void main(String[] args) {
        WebScoutCli app = new WebScoutCli();
        int exitCode = new CommandLine(app).execute(args);
        // 셧다운 훅 실행 중 System.exit은 영원히 블록되므로 호출하지 않는다
        if (!app.isInterruptedByUser()) System.exit(exitCode);
    }
}
