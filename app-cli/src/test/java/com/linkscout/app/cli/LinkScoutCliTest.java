package com.linkscout.app.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.linkscout.core.model.AuditConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LinkScoutCli — crawl / scan 명령")
class LinkScoutCliTest {

    @TempDir Path dir;

    private Path site;
    private Path outDir;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void mirror() throws Exception {
        site = Files.createDirectories(dir.resolve("site"));
        outDir = dir.resolve("out");
        Files.writeString(site.resolve("index.html"),
                "<html><head><title>Home</title></head><body>"
                        + "<a href='about.html'>About</a><a href='missing.html'>Missing</a>"
                        + "<a href='https://example.invalid/elsewhere'>ext</a></body></html>");
        Files.writeString(site.resolve("about.html"),
                "<html><head><title>About us</title></head><body><a href='index.html'>home</a></body></html>");
    }

    private LinkScoutCli cli() {
        AuditConfig cfg = AuditConfig.defaults().setOutputDir(outDir).setTimeoutMs(2000);
        return new LinkScoutCli(cfg,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static List<String[]> csvRows(Path file) throws Exception {
        CsvMapper m = new CsvMapper();
        m.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        m.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        try (MappingIterator<String[]> it = m.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(file.toFile())) {
            return it.readAll();
        }
    }

    private String seed() {
        return site.resolve("index.html").toUri().toString();
    }

    @Test
    void crawl_writes_tree_json_and_unique_links_csv() throws Exception {
        int code = cli().run("crawl", seed(), "2");

        assertThat(code).isEqualTo(LinkScoutCli.EXIT_OK);
        JsonNode tree = new ObjectMapper().readTree(outDir.resolve("link_tree.json").toFile());
        assertThat(tree.get("url").asText()).isEqualTo(seed());
        assertThat(tree.get("title").asText()).isEqualTo("Home");
        assertThat(tree.get("children")).hasSize(1); // missing.html 은 잘려나가고 외부 링크는 범위 밖
        assertThat(tree.get("children").get(0).get("title").asText()).isEqualTo("About us");

        List<String[]> rows = csvRows(outDir.resolve("unique_links.csv"));
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).containsExactly("URL", "Title");
        assertThat(rows.get(1)).containsExactly(seed(), "Home");
        assertThat(rows.get(2)).containsExactly(site.resolve("about.html").toUri().toString(), "About us");
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("link_tree.json");
    }

    @Test
    void unreachable_seed_still_writes_outputs() throws Exception {
        String absent = site.resolve("nope.html").toUri().toString();

        assertThat(cli().run("crawl", absent)).isEqualTo(LinkScoutCli.EXIT_OK);
        assertThat(Files.readString(outDir.resolve("link_tree.json")).trim()).isEqualTo("null");
        assertThat(Files.readAllLines(outDir.resolve("unique_links.csv"))).containsExactly("URL,Title");
    }

    @Test
    void unique_links_csv_is_written_even_when_tree_json_fails() throws Exception {
        // link_tree.json 자리에 디렉터리를 두면 JSON 쓰기는 실패한다
        Files.createDirectories(outDir.resolve("link_tree.json"));

        int code = cli().run("crawl", seed(), "1");

        assertThat(code).isEqualTo(LinkScoutCli.EXIT_IO);
        List<String[]> rows = csvRows(outDir.resolve("unique_links.csv"));
        assertThat(rows).hasSize(3);
        assertThat(rows.get(1)).containsExactly(seed(), "Home");
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("I/O error");
    }

    @Test
    void invalid_depth_falls_back_to_one() {
        assertThat(LinkScoutCli.parseDepth("abc", 1)).isEqualTo(1);
        assertThat(LinkScoutCli.parseDepth("-3", 5)).isEqualTo(1);
        assertThat(LinkScoutCli.parseDepth("", 4)).isEqualTo(4);
        assertThat(LinkScoutCli.parseDepth(" 7 ", 1)).isEqualTo(7);
    }

    @Test
    void scan_reports_broken_links_from_seed_file() throws Exception {
        Path seeds = Files.writeString(dir.resolve("seeds.txt"), seed() + "\n\n");

        int code = cli().run("scan", seeds.toString());

        assertThat(code).isEqualTo(LinkScoutCli.EXIT_OK);
        List<String[]> rows = csvRows(outDir.resolve("broken_links_output.csv"));
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsExactly("parent_url", "broken_link", "status", "error");
        assertThat(rows.get(1)).containsExactly(
                seed(), site.resolve("missing.html").toUri().toString(), "404", "Status 404");
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Processing 1 URLs concurrently");
    }

    @Test
    void scan_without_filename_exits_with_usage_code() {
        assertThat(cli().run("scan")).isEqualTo(LinkScoutCli.EXIT_USAGE);
        assertThat(cli().run("scan", "  ")).isEqualTo(LinkScoutCli.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("No input file provided");
    }

    @Test
    void scan_of_missing_file_is_an_io_failure() {
        int code = cli().run("scan", dir.resolve("absent.csv").toString());

        assertThat(code).isEqualTo(LinkScoutCli.EXIT_IO);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("absent.csv");
    }

    @Test
    void unknown_or_missing_command_prints_usage() {
        assertThat(cli().run()).isEqualTo(LinkScoutCli.EXIT_USAGE);
        assertThat(cli().run("explode")).isEqualTo(LinkScoutCli.EXIT_USAGE);
        assertThat(cli().run("--help")).isEqualTo(LinkScoutCli.EXIT_OK);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Usage:");
    }
}
