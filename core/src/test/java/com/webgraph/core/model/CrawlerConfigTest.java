package com.webgraph.core.model;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class CrawlerConfigTest {

    @Test
    void defaultsAreValid() {
        CrawlerConfig cfg = CrawlerConfig.defaults();
        cfg.validate();

        assertThat(cfg.getSeeds()).isEmpty();
        assertThat(cfg.getAllowedDomains()).isEmpty();
        assertThat(cfg.getMaxDepth()).isEqualTo(1);
        assertThat(cfg.getMaxResults()).isNull();
        assertThat(cfg.isRestrictToSeedDomain()).isTrue();
        assertThat(cfg.isCanonicalizeUrls()).isFalse();
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(cfg.getTimeoutMsInt()).isEqualTo(10_000);
        assertThat(cfg.isFollowRedirects()).isTrue();
        assertThat(cfg.getUserAgent()).isEqualTo(CrawlerConfig.DEFAULT_USER_AGENT);
    }

    @Test
    void setTimeoutMsClampsToPositive() {
        CrawlerConfig cfg = CrawlerConfig.defaults().setTimeoutMs(0);
        assertThat(cfg.getTimeoutMsInt()).isEqualTo(1);

        cfg.setTimeoutMs(-5);
        assertThat(cfg.getTimeoutMsInt()).isEqualTo(1);

        cfg.validate(); // 여전히 유효해야 함
    }

    @Test
    void setConcurrencyHasLowerBoundOne() {
        CrawlerConfig cfg = CrawlerConfig.defaults().setConcurrency(0);
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        cfg.validate();
    }

    @Test
    void listsDropNullsAndAreImmutable() {
        CrawlerConfig cfg = CrawlerConfig.defaults()
                .setSeeds(Arrays.asList("https://a.com/", null, "https://b.com/"))
                .setAllowedDomains(null);

        assertThat(cfg.getSeeds()).containsExactly("https://a.com/", "https://b.com/");
        assertThat(cfg.getAllowedDomains()).isEmpty();
        assertThatThrownBy(() -> cfg.getSeeds().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void validateRejectsNegativeDepth() {
        CrawlerConfig cfg = CrawlerConfig.defaults().setMaxDepth(-1);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, cfg::validate);
        assertThat(ex).hasMessageContaining("maxDepth");
    }

    @Test
    void validateRejectsNonPositiveMaxResults() {
        assertThatThrownBy(() -> CrawlerConfig.defaults().setMaxResults(0).validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxResults");

        CrawlerConfig.defaults().setMaxResults(1).validate();
        CrawlerConfig.defaults().setMaxResults(null).validate();
    }

    @Test
    void validateRejectsBlankUserAgentAndZeroTimeout() {
        assertThatThrownBy(() -> CrawlerConfig.defaults().setUserAgent("  ").validate())
                .hasMessageContaining("userAgent");
        assertThatThrownBy(() -> CrawlerConfig.defaults().setTimeout(Duration.ZERO).validate())
                .hasMessageContaining("timeout");
    }

    @Test
    void fluentSettersChain() {
        CrawlerConfig cfg = CrawlerConfig.defaults()
                .setSeeds(List.of("https://a.com/"))
                .setAllowedDomains(List.of("a.com"))
                .setMaxDepth(3)
                .setMaxResults(50)
                .setRestrictToSeedDomain(false)
                .setCanonicalizeUrls(true)
                .setConcurrency(4)
                .setFollowRedirects(false)
                .setUserAgent("UA/1");
        cfg.validate();

        assertThat(cfg.getMaxDepth()).isEqualTo(3);
        assertThat(cfg.getMaxResults()).isEqualTo(50);
        assertThat(cfg.isRestrictToSeedDomain()).isFalse();
        assertThat(cfg.isCanonicalizeUrls()).isTrue();
        assertThat(cfg.getConcurrency()).isEqualTo(4);
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.getUserAgent()).isEqualTo("UA/1");
    }
}
