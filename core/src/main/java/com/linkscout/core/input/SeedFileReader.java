package com.linkscout.core.input;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 점검 대상 URL 목록 읽기.
 * - .txt : 비어있지 않은 줄 하나가 URL 하나
 * - 그 외 : CSV 로 보고 각 행의 첫 칸
 * UTF-8, BOM 은 제거한다. 입력 순서 유지, 중복은 그대로 둔다.
 */
public final class SeedFileReader {
    private SeedFileReader() {}

    public static List<String> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new IOException("input file not found: " + file.toAbsolutePath());
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') content = content.substring(1);

        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") ? fromLines(content) : fromCsv(content);
    }

    static List<String> fromLines(String content) {
        List<String> urls = new ArrayList<>();
        for (String line : content.split("\\R")) {
            String url = line.trim();
            if (!url.isEmpty()) urls.add(url);
        }
        return urls;
    }

    static List<String> fromCsv(String content) throws IOException {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);

        List<String> urls = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(content)) {
            while (it.hasNext()) {
                String[] row = it.next();
                if (row == null || row.length == 0 || row[0] == null) continue;
                String url = row[0].trim();
                if (!url.isEmpty()) urls.add(url);
            }
        }
        return urls;
    }
}
