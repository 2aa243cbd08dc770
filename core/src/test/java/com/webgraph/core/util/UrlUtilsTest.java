package com.webgraph.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    @Test
    @DisplayName("domainOf: authority 그대로(포트 포함), 실패/상대경로는 빈 문자열")
    void domainOf() {
        assertThat(UrlUtils.domainOf("https://a.com/x?y=1")).isEqualTo("a.com");
        assertThat(UrlUtils.domainOf("http://a.com:8080/x")).isEqualTo("a.com:8080");
        assertThat(UrlUtils.domainOf("HTTP://Sub.A.com")).isEqualTo("Sub.A.com");
        assertThat(UrlUtils.domainOf("a.com/x")).isEmpty();
        assertThat(UrlUtils.domainOf("not a url")).isEmpty();
        assertThat(UrlUtils.domainOf(null)).isEmpty();
        assertThat(UrlUtils.domainOf("   ")).isEmpty();
    }

    @Test
    @DisplayName("canonicalize: scheme/host 소문자, 기본 포트/fragment 제거, 경로 정리")
    void canonicalize() {
        assertThat(UrlUtils.canonicalize("HTTP://EX.com:80/a//b#frag")).isEqualTo("http://ex.com/a/b");
        assertThat(UrlUtils.canonicalize("https://Ex.com:443")).isEqualTo("https://ex.com/");
        assertThat(UrlUtils.canonicalize("http://ex.com:8080/p?q=1")).isEqualTo("http://ex.com:8080/p?q=1");
        assertThat(UrlUtils.canonicalize("  https://ex.com/  ")).isEqualTo("https://ex.com/");
    }

    @Test
    @DisplayName("canonicalize: 퍼센트 인코딩은 그대로 보존 → 다른 URL은 다른 id")
    void canonicalize_keepsPercentEncoding() {
        assertThat(UrlUtils.canonicalize("http://A.com/?q=a%26b")).isEqualTo("http://a.com/?q=a%26b");
        assertThat(UrlUtils.canonicalize("http://a.com/?q=a&b")).isEqualTo("http://a.com/?q=a&b");
        assertThat(UrlUtils.canonicalize("http://a.com/?q=a%26b"))
                .isNotEqualTo(UrlUtils.canonicalize("http://a.com/?q=a&b"));

        assertThat(UrlUtils.canonicalize("http://a.com/x%2Fy")).isEqualTo("http://a.com/x%2Fy");
        assertThat(UrlUtils.canonicalize("http://a.com/x%2Fy"))
                .isNotEqualTo(UrlUtils.canonicalize("http://a.com/x/y"));
        assertThat(UrlUtils.canonicalize("http://a.com/a%20b")).isEqualTo("http://a.com/a%20b");
    }

    @Test
    void canonicalize_leavesUnparsableAsIs() {
        assertThat(UrlUtils.canonicalize("not a url")).isEqualTo("not a url");
        assertThat(UrlUtils.canonicalize("/relative/path")).isEqualTo("/relative/path");
        assertThat(UrlUtils.canonicalize(null)).isNull();
    }

    @Test
    void isHttpLike() {
        assertThat(UrlUtils.isHttpLike("http://a.com")).isTrue();
        assertThat(UrlUtils.isHttpLike(" HTTPS://a.com")).isTrue();
        assertThat(UrlUtils.isHttpLike("mailto:x@a.com")).isFalse();
        assertThat(UrlUtils.isHttpLike("javascript:void(0)")).isFalse();
        assertThat(UrlUtils.isHttpLike(null)).isFalse();
    }
}
