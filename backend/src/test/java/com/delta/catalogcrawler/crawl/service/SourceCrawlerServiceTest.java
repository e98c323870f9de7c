package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.enrich.LinkEnricher;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlIssue;
import com.delta.catalogcrawler.crawl.model.CrawlSessionStatus;
import com.delta.catalogcrawler.crawl.model.IssueScope;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.model.SourceStage;
import com.delta.catalogcrawler.crawl.persistence.CrawlLedger;
import com.delta.catalogcrawler.crawl.persistence.PersistenceSink;
import com.delta.catalogcrawler.crawl.render.FetchErrorKind;
import com.delta.catalogcrawler.crawl.render.FetchException;
import com.delta.catalogcrawler.crawl.render.ManagedSourceRenderer;
import com.delta.catalogcrawler.crawl.render.RenderMode;
import com.delta.catalogcrawler.crawl.render.RenderSession;
import com.delta.catalogcrawler.crawl.render.SourceRenderer;
import com.delta.catalogcrawler.crawl.walk.PaginationWalker;
import com.delta.catalogcrawler.crawl.walk.WalkResult;
import com.delta.catalogcrawler.crawl.walk.WalkTermination;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceCrawlerServiceTest {
    private static final Source SOURCE = new Source("shop", "Shop", "https://shop.test/albums", null, null, RenderMode.RAW);

    @Mock
    private PaginationWalker walker;
    @Mock
    private LinkEnricher linkEnricher;
    @Mock
    private PersistenceSink persistenceSink;
    @Mock
    private CrawlLedger crawlLedger;
    @Mock
    private SourceRenderer rawRenderer;
    @Mock
    private ManagedSourceRenderer renderedRenderer;

    @Test
    void permanentFailureStillPersistsPartialRecords() {
        FetchException error = new FetchException("https://shop.test/albums?page=2", FetchErrorKind.PERMANENT, "blocked_403", null);
        CatalogRecord record = record("r1");
        when(crawlLedger.openSession(eq(7L), eq("shop"), any())).thenReturn(11L);
        when(walker.walk(eq(SOURCE), eq(rawRenderer), eq(5), any(), any())).thenReturn(new WalkResult(
            List.of(record),
            1,
            WalkTermination.FETCH_ERROR,
            error,
            List.of(new CrawlIssue("shop", IssueScope.SOURCE, error.getUrl(), "blocked_403", error.getMessage()))
        ));
        when(persistenceSink.upsert(record)).thenReturn(true);

        SourcePipelineResult result = service().crawlSource(SOURCE, context(true));

        assertThat(result.summary().stage()).isEqualTo(SourceStage.FAILED);
        assertThat(result.summary().error()).startsWith("blocked_403");
        assertThat(result.summary().recordsPersisted()).isEqualTo(1);
        verify(linkEnricher, never()).enrich(any(), any(), any(), any());
        verify(crawlLedger).closeSession(eq(11L), any(), eq(1), eq(1), eq(CrawlSessionStatus.FAILED), eq(error.getMessage()));
    }

    @Test
    void renderTimeoutKeepsSourceDoneWithPartialRecords() {
        Source rendered = new Source("shop", "Shop", "https://shop.test/albums", null, null, RenderMode.RENDERED);
        FetchException timeout = new FetchException("https://shop.test/albums?page=2", FetchErrorKind.TRANSIENT, "render_timeout", "navigation timed out");
        CatalogRecord first = record("r1");
        CatalogRecord second = record("r2");
        when(crawlLedger.openSession(eq(7L), eq("shop"), any())).thenReturn(14L);
        when(walker.walk(eq(rendered), eq(renderedRenderer), eq(5), any(), any())).thenReturn(new WalkResult(
            List.of(first, second),
            1,
            WalkTermination.FETCH_ERROR,
            timeout,
            List.of(new CrawlIssue("shop", IssueScope.SOURCE, timeout.getUrl(), "render_timeout", timeout.getMessage()))
        ));
        when(persistenceSink.upsert(any())).thenReturn(true);
        RenderSession session = new RenderSession(rawRenderer, () -> renderedRenderer);

        SourcePipelineResult result = service().crawlSource(rendered, new PipelineContext(7L, session, 5, false, () -> false, (sourceId, stage) -> {
        }));

        assertThat(result.summary().stage()).isEqualTo(SourceStage.DONE);
        assertThat(result.summary().termination()).isEqualTo(WalkTermination.FETCH_ERROR);
        assertThat(result.summary().error()).isNull();
        assertThat(result.summary().recordsPersisted()).isEqualTo(2);
        assertThat(result.records()).containsExactly(first, second);
        assertThat(result.summary().issues()).extracting(CrawlIssue::reasonCode).containsExactly("render_timeout");
        verify(crawlLedger).closeSession(eq(14L), any(), eq(1), eq(2), eq(CrawlSessionStatus.COMPLETED), isNull());
    }

    @Test
    void persistErrorIsRecordedPerRecord() {
        CatalogRecord good = record("good");
        CatalogRecord bad = record("bad");
        when(crawlLedger.openSession(eq(7L), eq("shop"), any())).thenReturn(12L);
        when(walker.walk(eq(SOURCE), eq(rawRenderer), eq(5), any(), any()))
            .thenReturn(new WalkResult(List.of(bad, good), 1, WalkTermination.EXHAUSTED, null, List.of()));
        when(persistenceSink.upsert(bad)).thenThrow(new IllegalStateException("constraint"));
        when(persistenceSink.upsert(good)).thenReturn(true);

        SourcePipelineResult result = service().crawlSource(SOURCE, context(false));

        assertThat(result.summary().stage()).isEqualTo(SourceStage.DONE);
        assertThat(result.summary().recordsPersisted()).isEqualTo(1);
        assertThat(result.summary().issues()).extracting(CrawlIssue::reasonCode).containsExactly("persist_error");
        verify(crawlLedger).closeSession(eq(12L), any(), eq(1), eq(2), eq(CrawlSessionStatus.COMPLETED), isNull());
    }

    @Test
    void emptyWalkClosesSessionAsNoRecords() {
        when(crawlLedger.openSession(eq(7L), eq("shop"), any())).thenReturn(13L);
        when(walker.walk(eq(SOURCE), eq(rawRenderer), eq(5), any(), any()))
            .thenReturn(new WalkResult(List.of(), 1, WalkTermination.EMPTY_FIRST_PAGE, null, List.of()));

        SourcePipelineResult result = service().crawlSource(SOURCE, context(true));

        assertThat(result.summary().stage()).isEqualTo(SourceStage.DONE);
        verify(linkEnricher, never()).enrich(any(), any(), any(), any());
        verify(crawlLedger).closeSession(eq(13L), any(), eq(1), eq(0), eq(CrawlSessionStatus.NO_RECORDS), isNull());
        verify(persistenceSink, never()).upsert(any());
        verify(walker).walk(eq(SOURCE), eq(rawRenderer), anyInt(), any(), any());
    }

    private SourceCrawlerService service() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setDefaultRenderMode(RenderMode.RAW);
        return new SourceCrawlerService(walker, linkEnricher, persistenceSink, crawlLedger, properties);
    }

    private PipelineContext context(boolean enrich) {
        RenderSession session = new RenderSession(rawRenderer, () -> {
            throw new IllegalStateException("no browser in unit tests");
        });
        return new PipelineContext(7L, session, 5, enrich, () -> false, (sourceId, stage) -> {
        });
    }

    private static CatalogRecord record(String id) {
        return new CatalogRecord(id, "shop", "Album", "https://shop.test/albums/" + id, null, null, null, null, null,
            Map.of(), null, Instant.now());
    }
}
