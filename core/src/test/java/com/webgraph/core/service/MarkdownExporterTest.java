package com.webgraph.core.service;

import com.webgraph.core.crawler.MapFetcher;
import com.webgraph.core.crawler.WebCrawler;
import com.webgraph.core.graph.WebGraph;
import com.webgraph.core.model.CrawlerConfig;
import com.webgraph.core.model.PageContent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MarkdownExporter — 노드별 Markdown 파일")
class MarkdownExporterTest {

    @Test
    @DisplayName("노드 순서대로 파일 생성, 실패 노드는 건너뜀")
    void exportsEachNode_skipsFailures(@TempDir Path dir) throws Exception {
        MapFetcher fetcher = new MapFetcher()
                .link("http://a.com/", "http://a.com/ok", "http://a.com/bad")
                .page("http://a.com/", "Home", "welcome")
                .page("http://a.com/ok", "", "ok body")
                .fail("http://a.com/bad");
        WebGraph g = new WebCrawler(fetcher).crawl("http://a.com/", 1, null);

        List<Path> files = new MarkdownExporter().export(g, dir.resolve("md"));

        assertThat(files).extracting(p -> p.getFileName().toString())
                .containsExactly("0001-a.com.md", "0002-a.com_ok.md");
        assertThat(Files.readString(files.get(0)))
                .isEqualTo("<!-- source: http://a.com/ -->\n\n# Home\n\nwelcome\n");
        assertThat(Files.readString(files.get(1)))
                .isEqualTo("<!-- source: http://a.com/ok -->\n\nok body\n");
    }

    @Test
    void fileName_slugifiesUrl() {
        assertThat(MarkdownExporter.fileName(7, "https://Ex.com:8080/a/b?x=1"))
                .isEqualTo("0007-ex.com_8080_a_b_x_1.md");
        assertThat(MarkdownExporter.fileName(1, "://")).isEqualTo("0001-page.md");
        assertThat(MarkdownExporter.fileName(2, "http://a.com/" + "x".repeat(200)))
                .hasSize("0002-".length() + 80 + ".md".length());
    }

    @Test
    void render_withoutTitle_hasSourceAndBody() {
        String md = MarkdownExporter.render(new PageContent("http://a.com/", null, "body\n"));

        assertThat(md).isEqualTo("<!-- source: http://a.com/ -->\n\nbody\n");
    }

    @Test
    void serviceDelegatesExport(@TempDir Path dir) throws Exception {
        MapFetcher fetcher = new MapFetcher().page("http://a.com/", "A", "x");
        CrawlerConfig cfg = CrawlerConfig.defaults().setSeeds(List.of("http://a.com/")).setMaxDepth(0);
        GraphCrawlService svc = new GraphCrawlService(cfg, new WebCrawler(cfg, fetcher));

        List<Path> files = svc.exportMarkdown(svc.run(), dir);

        assertThat(files).hasSize(1);
        assertThat(Files.readString(files.get(0))).contains("# A");
    }
}
