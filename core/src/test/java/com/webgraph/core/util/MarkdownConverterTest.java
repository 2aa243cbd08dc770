package com.webgraph.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownConverterTest {

    @Test
    void headingsAndLinksBecomeMarkdown() {
        String md = MarkdownConverter.toMarkdown(
                "<h1>Title</h1><p>Hello <a href=\"http://a.com/x\">there</a></p>");

        assertThat(md).contains("# Title");
        assertThat(md).contains("Hello [there](http://a.com/x)");
        assertThat(md).doesNotContain("<p>", "<h1>");
    }

    @Test
    void blankInput_isEmpty() {
        assertThat(MarkdownConverter.toMarkdown(null)).isEmpty();
        assertThat(MarkdownConverter.toMarkdown("  ")).isEmpty();
    }
}
