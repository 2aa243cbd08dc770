package com.webgraph.core.service;

import com.webgraph.core.api.PageFetchException;
import com.webgraph.core.graph.WebGraph;
import com.webgraph.core.graph.WebNode;
import com.webgraph.core.model.PageContent;
import com.webgraph.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 그래프의 각 노드 페이지를 Markdown 파일로 저장.
 * - 파일명: 0001-host_path.md (노드 삽입 순서 번호 + URL slug)
 * - 첫 줄은 "<!-- source: url -->", 제목이 있으면 "# title" 을 붙인다
 * - 노드 하나의 fetch 실패는 로그만 남기고 건너뜀. 디렉터리/쓰기 실패는 IOException.
 */
public final class MarkdownExporter {

    private static final Logger LOG = LoggerFactory.getLogger(MarkdownExporter.class);
    private static final StructuredLog SLOG = StructuredLog.get(MarkdownExporter.class);

    private static final int MAX_SLUG = 80;

    public List<Path> export(WebGraph graph, Path outDir) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(outDir, "outDir");
        Files.createDirectories(outDir);

        List<Path> written = new ArrayList<>();
        int seq = 0, failed = 0;
        for (WebNode node : graph.allNodes()) {
            seq++;
            PageContent page;
            try {
                page = node.fetchContent();
            } catch (PageFetchException e) {
                failed++;
                LOG.warn("Markdown export skipped {}: {}", node.getId(),
                        e.getCause() != null ? e.getCause().toString() : e.getMessage());
                SLOG.warn("export-skipped", e.getCause(), "url", node.getId());
                continue;
            }
            Path file = outDir.resolve(fileName(seq, node.getId()));
            Files.writeString(file, render(page), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            written.add(file);
        }

        LOG.info("Markdown export: {} file(s) to {}, skipped={}", written.size(), outDir, failed);
        SLOG.info("export-done", "dir", outDir.toString(), "files", written.size(), "skipped", failed);
        return written;
    }

    static String render(PageContent page) {
        StringBuilder sb = new StringBuilder()
                .append("<!-- source: ").append(page.url()).append(" -->\n\n");
        if (!page.title().isBlank()) sb.append("# ").append(page.title().trim()).append("\n\n");
        sb.append(page.markdown());
        if (!page.markdown().endsWith("\n")) sb.append('\n');
        return sb.toString();
    }

    static String fileName(int seq, String url) {
        String s = url.replaceFirst("^[A-Za-z][A-Za-z0-9+.-]*://", "")
                .replaceAll("[^A-Za-z0-9._-]+", "_")
                .replaceAll("^_+|_+$", "")
                .toLowerCase(Locale.ROOT);
        if (s.isEmpty()) s = "page";
        if (s.length() > MAX_SLUG) s = s.substring(0, MAX_SLUG);
        return String.format(Locale.ROOT, "%04d-%s.md", seq, s);
    }
}
