package com.webgraph.core.graph;

import com.webgraph.core.api.PageFetchException;
import com.webgraph.core.crawler.MapFetcher;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebNodeTest {

    @Test
    void domainIsAuthorityOfId() {
        assertThat(new WebNode("https://example.com/a/b?q=1", null).getDomain()).isEqualTo("example.com");
        assertThat(new WebNode("http://example.com:8080/", null).getDomain()).isEqualTo("example.com:8080");
    }

    @Test
    void malformedId_hasEmptyDomain() {
        assertThat(new WebNode("not a url", null).getDomain()).isEmpty();
        assertThat(new WebNode("example.com/page", null).getDomain()).isEmpty();
    }

    @Test
    void identityIsExactIdString() {
        WebNode a = new WebNode("http://a.com/x", url -> List.of("1"));
        WebNode b = new WebNode("http://a.com/x", null);
        WebNode c = new WebNode("http://a.com/x/", null);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c); // trailing slash 는 다른 노드
    }

    @Test
    void fetchDelegatesToFetcher() throws Exception {
        WebNode node = new WebNode("http://a.com/", url -> List.of(url + "1", url + "2"));
        assertThat(node.fetchConnectedHyperlinks()).containsExactly("http://a.com/1", "http://a.com/2");
    }

    @Test
    void fetcherFailure_isWrapped() {
        WebNode node = new WebNode("http://a.com/", url -> { throw new IOException("down"); });

        assertThatThrownBy(node::fetchConnectedHyperlinks)
                .isInstanceOf(PageFetchException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasMessageContaining("http://a.com/");
    }

    @Test
    void nullLinks_becomeEmpty() throws Exception {
        assertThat(new WebNode("http://a.com/", url -> null).fetchConnectedHyperlinks()).isEmpty();
    }

    @Test
    void fetchContent_delegatesToContentFetcher() throws Exception {
        WebNode node = new WebNode("http://a.com/", new MapFetcher().page("http://a.com/", "A", "hello"));

        assertThat(node.fetchContent().title()).isEqualTo("A");
        assertThat(node.fetchContent().markdown()).isEqualTo("hello");
    }

    @Test
    void fetchContent_linkOnlyFetcher_isUnsupported() {
        WebNode node = new WebNode("http://a.com/", url -> List.of());

        assertThatThrownBy(node::fetchContent)
                .isInstanceOf(PageFetchException.class)
                .hasCauseInstanceOf(UnsupportedOperationException.class);
    }
}
