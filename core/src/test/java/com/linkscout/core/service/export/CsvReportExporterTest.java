package com.linkscout.core.service.export;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.linkscout.core.model.BrokenLinkRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvReportExporterTest {

    private final CsvReportExporter exporter = new CsvReportExporter();

    private static List<String[]> rows(Path file) throws Exception {
        CsvMapper m = new CsvMapper();
        m.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        m.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        try (MappingIterator<String[]> it = m.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(file.toFile())) {
            return it.readAll();
        }
    }

    @Test
    void unique_links_have_url_title_header_and_keep_order(@TempDir Path dir) throws Exception {
        Map<String, String> links = new LinkedHashMap<>();
        links.put("https://ex.com/", "Home");
        links.put("https://ex.com/a", "A, with comma");
        links.put("https://ex.com/b", "");

        Path file = exporter.exportUniqueLinks(OutputFiles.uniqueLinks(dir), links);

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8).get(0)).isEqualTo("URL,Title");
        List<String[]> rows = rows(file);
        assertThat(rows).hasSize(4);
        assertThat(rows.get(1)).containsExactly("https://ex.com/", "Home");
        assertThat(rows.get(2)).containsExactly("https://ex.com/a", "A, with comma");
        assertThat(rows.get(3)).containsExactly("https://ex.com/b", "");
    }

    @Test
    void broken_links_have_four_columns_and_blank_missing_status(@TempDir Path dir) throws Exception {
        List<BrokenLinkRecord> records = List.of(
                new BrokenLinkRecord("https://ex.com/p", "https://ex.com/p", 404, "Broken main page"),
                new BrokenLinkRecord("https://ex.com/p", "https://down.example/", null, "Connection refused"));

        Path file = exporter.exportBrokenLinks(OutputFiles.brokenLinks(dir.resolve("nested")), records);

        assertThat(file.getFileName().toString()).isEqualTo("broken_links_output.csv");
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8).get(0))
                .isEqualTo("parent_url,broken_link,status,error");
        List<String[]> rows = rows(file);
        assertThat(rows.get(1)).containsExactly("https://ex.com/p", "https://ex.com/p", "404", "Broken main page");
        assertThat(rows.get(2)).containsExactly("https://ex.com/p", "https://down.example/", "", "Connection refused");
    }

    @Test
    void empty_report_still_has_header(@TempDir Path dir) throws Exception {
        Path file = exporter.exportBrokenLinks(dir.resolve("b.csv"), List.of());
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8))
                .containsExactly("parent_url,broken_link,status,error");
    }

    @Test
    void header_and_rows_share_one_line_separator(@TempDir Path dir) throws Exception {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("https://ex.com/", "Home");
        Path file = exporter.exportUniqueLinks(dir.resolve("u.csv"), m);

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("URL,Title\nhttps://ex.com/,Home\n");
    }
}
