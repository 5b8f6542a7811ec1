package com.linkscout.app.cli;

import com.linkscout.core.crawler.TreeBuilder;
import com.linkscout.core.crawler.TreeFlattener;
import com.linkscout.core.input.SeedFileReader;
import com.linkscout.core.model.AuditConfig;
import com.linkscout.core.model.BrokenLinkRecord;
import com.linkscout.core.model.TreeNode;
import com.linkscout.core.service.LinkHealthScanner;
import com.linkscout.core.service.export.CsvReportExporter;
import com.linkscout.core.service.export.OutputFiles;
import com.linkscout.core.service.export.TreeJsonExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 명령 처리기. 종료 코드만 돌려주고 System.exit 는 {@link Main} 이 한다.
 * <pre>
 *   linkscout crawl [url] [depth]
 *   linkscout scan  &lt;file.txt|file.csv&gt;
 * </pre>
 */
public final class LinkScoutCli {

    private static final Logger LOG = LoggerFactory.getLogger(LinkScoutCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_IO = 2;

    private final AuditConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public LinkScoutCli(AuditConfig config, PrintStream out, PrintStream err) {
        this.config = Objects.requireNonNull(config, "config");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public int run(String... args) {
        if (args == null || args.length == 0) {
            printUsage();
            return EXIT_USAGE;
        }
        String cmd = args[0].trim().toLowerCase(Locale.ROOT);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (cmd) {
                case "crawl": return crawl(rest);
                case "scan":  return scan(rest);
                case "help":
                case "-h":
                case "--help":
                    printUsage();
                    return EXIT_OK;
                default:
                    err.println("Unknown command: " + args[0]);
                    printUsage();
                    return EXIT_USAGE;
            }
        } catch (IOException e) {
            LOG.error("I/O failure: {}", e.getMessage(), e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    /* ---------------- crawl ---------------- */

    int crawl(String[] args) throws IOException {
        String url = (args.length > 0 && !args[0].isBlank()) ? args[0].trim() : config.getTarget();
        int depth = (args.length > 1) ? parseDepth(args[1], config.getMaxDepth()) : config.getMaxDepth();

        TreeBuilder builder = new TreeBuilder(config);
        TreeNode tree = builder.build(url, depth).orElse(null);

        Path outDir = config.getOutputDir();
        // JSON 쓰기가 실패해도 CSV 는 남긴다. 실패는 CSV 뒤에 다시 던짐
        IOException jsonFailure = null;
        try {
            Path json = new TreeJsonExporter().export(OutputFiles.linkTree(outDir), tree);
            out.println("Link tree has been saved to " + json);
        } catch (IOException e) {
            LOG.warn("Failed to write link tree: {}", e.getMessage(), e);
            jsonFailure = e;
        }

        Map<String, String> unique = (tree == null) ? Map.of() : TreeFlattener.uniqueLinks(tree);
        Path csv = new CsvReportExporter().exportUniqueLinks(OutputFiles.uniqueLinks(outDir), unique);
        out.println("Unique links (" + unique.size() + ") have been saved to " + csv);

        if (jsonFailure != null) throw jsonFailure;
        return EXIT_OK;
    }

    /** 정수가 아니거나 음수면 기본값 1 (경고 로그) */
    static int parseDepth(String raw, int fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) return fallback;
        try {
            int d = Integer.parseInt(s);
            if (d >= 0) return d;
        } catch (NumberFormatException ignored) {
            // 아래 경고로 처리
        }
        LOG.warn("Invalid depth '{}', using 1", raw);
        return 1;
    }

    /* ---------------- scan ---------------- */

    int scan(String[] args) throws IOException {
        String name = (args.length > 0) ? args[0].trim() : "";
        if (name.isEmpty()) {
            err.println("No input file provided. Exiting.");
            return EXIT_USAGE;
        }

        List<String> seeds = SeedFileReader.read(Path.of(name));
        out.println("Processing " + seeds.size() + " URLs concurrently...");

        List<BrokenLinkRecord> records = new LinkHealthScanner(config).scan(seeds);

        Path csv = new CsvReportExporter()
                .exportBrokenLinks(OutputFiles.brokenLinks(config.getOutputDir()), records);
        out.println("Broken link report written to " + csv + " (" + records.size() + " records).");
        return EXIT_OK;
    }

    private void printUsage() {
        err.println("Usage:");
        err.println("  linkscout crawl [url] [depth]   (default url " + AuditConfig.DEFAULT_TARGET + ", depth 1)");
        err.println("  linkscout scan <file>           (.txt: one URL per line, otherwise CSV first column)");
        err.println("System properties: -Dls.config=<yml> -Dls.out.dir=<dir> -Dls.log.level=<level>");
    }
}
