package com.linkscout.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditConfigTest {

    @Test
    void defaults_match_documented_values() {
        AuditConfig c = AuditConfig.defaults();
        c.validate();

        assertThat(c.getTarget()).isEqualTo("https://hamzak.cloud");
        assertThat(c.getMaxDepth()).isEqualTo(1);
        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(c.getScan().getSeedConcurrency()).isEqualTo(10);
        assertThat(c.getScan().getLinkConcurrency()).isEqualTo(20);
        assertThat(c.getErrorStatuses()).containsExactly(404);
        assertThat(c.getScan().isReportCheckFailures()).isFalse();
        assertThat(c.getUrlAttributes()).contains("href", "src", "action", "oneclick");
    }

    @Test
    void fluent_setters_chain() {
        AuditConfig c = AuditConfig.defaults()
                .setTarget("file:///tmp/site/index.html")
                .setMaxDepth(3)
                .setTimeoutMs(2500)
                .setErrorStatuses(Set.of(404, 410))
                .setUrlAttributes(List.of("href", "src", "href"));

        assertThat(c.getTimeoutMs()).isEqualTo(2500);
        assertThat(c.getErrorStatuses()).containsExactlyInAnyOrder(404, 410);
        assertThat(c.getUrlAttributes()).containsExactly("href", "src");
    }

    @Test
    void empty_collections_keep_previous_values() {
        AuditConfig c = AuditConfig.defaults().setErrorStatuses(Set.of()).setUrlAttributes(List.of());
        assertThat(c.getErrorStatuses()).containsExactly(404);
        assertThat(c.getUrlAttributes()).isEqualTo(AuditConfig.DEFAULT_URL_ATTRIBUTES);
    }

    @Test
    void validate_names_the_offending_field() {
        assertThatThrownBy(() -> AuditConfig.defaults().setMaxDepth(-1).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxDepth");
        assertThatThrownBy(() -> AuditConfig.defaults().setTarget(" ").validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("target");
        assertThatThrownBy(() -> AuditConfig.defaults().setTimeout(Duration.ZERO).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("timeout");

        AuditConfig badPool = AuditConfig.defaults();
        badPool.getScan().setLinkConcurrency(0);
        assertThatThrownBy(badPool::validate)
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("linkConcurrency");

        assertThatThrownBy(() -> AuditConfig.defaults().setErrorStatuses(Set.of(42)).validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("errorStatuses");
    }
}
