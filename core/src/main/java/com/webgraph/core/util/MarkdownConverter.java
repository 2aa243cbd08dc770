package com.webgraph.core.util;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;

/** HTML 조각 → Markdown (flexmark html2md). 제목은 ATX(#) 스타일. */
public final class MarkdownConverter {
    private MarkdownConverter() {}

    private static final FlexmarkHtmlConverter CONVERTER = FlexmarkHtmlConverter.builder(
            new MutableDataSet().set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false)).build();

    public static String toMarkdown(String html) {
        if (html == null || html.isBlank()) return "";
        return CONVERTER.convert(html).trim();
    }
}
