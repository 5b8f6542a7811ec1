package com.linkscout.core.util;

import com.linkscout.core.model.AuditConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @Test
    void full_file_maps_every_section(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("linkscout.yml");
        Files.writeString(yml, String.join("\n",
                "timeoutMs: 2500",
                "followRedirects: false",
                "userAgent: \"Probe/1\"",
                "crawl:",
                "  target: \"https://ex.com/\"",
                "  maxDepth: 3",
                "scan:",
                "  seedConcurrency: 4",
                "  linkConcurrency: 8",
                "  errorStatuses: [404, 410, 500]",
                "  reportCheckFailures: true",
                "extractor:",
                "  attributes: [href, src]",
                "output:",
                "  dir: reports",
                ""));

        AuditConfig c = YamlConfigLoader.load(yml);

        assertThat(c.getTarget()).isEqualTo("https://ex.com/");
        assertThat(c.getMaxDepth()).isEqualTo(3);
        assertThat(c.getTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(c.isFollowRedirects()).isFalse();
        assertThat(c.getUserAgent()).isEqualTo("Probe/1");
        assertThat(c.getScan().getSeedConcurrency()).isEqualTo(4);
        assertThat(c.getScan().getLinkConcurrency()).isEqualTo(8);
        assertThat(c.getErrorStatuses()).containsExactlyInAnyOrder(404, 410, 500);
        assertThat(c.getScan().isReportCheckFailures()).isTrue();
        assertThat(c.getUrlAttributes()).containsExactly("href", "src");
        assertThat(c.getOutputDir()).isEqualTo(Path.of("reports"));
    }

    @Test
    void flat_keys_work_and_crawl_section_wins() {
        AuditConfig flat = YamlConfigLoader.fromYaml("target: https://flat.example/\nmaxDepth: 2\n");
        assertThat(flat.getTarget()).isEqualTo("https://flat.example/");
        assertThat(flat.getMaxDepth()).isEqualTo(2);

        AuditConfig both = YamlConfigLoader.fromYaml(
                "target: https://flat.example/\ncrawl:\n  target: https://crawl.example/\n");
        assertThat(both.getTarget()).isEqualTo("https://crawl.example/");
    }

    @Test
    void comma_separated_lists_are_accepted() {
        AuditConfig c = YamlConfigLoader.fromYaml("scan:\n  errorStatuses: \"404, 403\"\n");
        assertThat(c.getErrorStatuses()).containsExactlyInAnyOrder(404, 403);
    }

    @Test
    void empty_document_gives_defaults() {
        AuditConfig c = YamlConfigLoader.fromYaml("");
        assertThat(c.getTarget()).isEqualTo(AuditConfig.DEFAULT_TARGET);
        assertThat(c.getScan().getLinkConcurrency()).isEqualTo(20);
    }

    @Test
    void invalid_values_are_rejected() {
        assertThatThrownBy(() -> YamlConfigLoader.fromYaml("maxDepth: -2\n"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxDepth");
        assertThatThrownBy(() -> YamlConfigLoader.fromYaml("scan:\n  errorStatuses: [404, nope]\n"))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("errorStatuses");
    }

    @Test
    void missing_file_is_an_io_error_but_loadOrDefaults_falls_back(@TempDir Path dir) throws Exception {
        Path absent = dir.resolve("nope.yml");
        assertThatThrownBy(() -> YamlConfigLoader.load(absent)).isInstanceOf(IOException.class);
        assertThat(YamlConfigLoader.loadOrDefaults(absent).getMaxDepth()).isEqualTo(1);
    }
}
