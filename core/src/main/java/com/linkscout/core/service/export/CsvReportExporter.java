package com.linkscout.core.service.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.linkscout.core.model.BrokenLinkRecord;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CSV 출력:
 * - unique_links.csv : URL,Title
 * - broken_links_output.csv : parent_url,broken_link,status,error (status 없으면 빈 칸)
 */
public class CsvReportExporter {

    // 필요한 칸만 따옴표 (구분자/따옴표/줄바꿈 포함 시)
    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    /** unique_links.csv 한 줄 */
    @JsonPropertyOrder({"URL", "Title"})
    record UniqueLinkRow(@JsonProperty("URL") String url, @JsonProperty("Title") String title) {}

    public Path exportUniqueLinks(Path file, Map<String, String> urlToTitle) throws IOException {
        CsvSchema schema = mapper.schemaFor(UniqueLinkRow.class);
        try (SequenceWriter seq = mapper.writer(schema).writeValues(open(file))) {
            seq.write(headerRow(schema));
            for (var e : urlToTitle.entrySet()) {
                seq.write(new UniqueLinkRow(e.getKey(), e.getValue()));
            }
        }
        return file;
    }

    public Path exportBrokenLinks(Path file, Collection<BrokenLinkRecord> records) throws IOException {
        CsvSchema schema = mapper.schemaFor(BrokenLinkRecord.class);
        try (SequenceWriter seq = mapper.writer(schema).writeValues(open(file))) {
            seq.write(headerRow(schema));
            for (BrokenLinkRecord r : records) seq.write(r);
        }
        return file;
    }

    // 헤더도 같은 생성기로 쓴다: 열 이름 → 열 이름인 한 줄. 행이 없어도 헤더는 남는다
    private static Map<String, String> headerRow(CsvSchema schema) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : schema.getColumnNames()) row.put(column, column);
        return row;
    }

    private static Writer open(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        return Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    }
}
