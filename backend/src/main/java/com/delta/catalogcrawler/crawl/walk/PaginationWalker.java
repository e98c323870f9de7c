package com.delta.catalogcrawler.crawl.walk;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.derive.FieldDeriver;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlIssue;
import com.delta.catalogcrawler.crawl.model.IssueScope;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.model.SourceStage;
import com.delta.catalogcrawler.crawl.parse.ListingPageParser;
import com.delta.catalogcrawler.crawl.parse.ParsedListingPage;
import com.delta.catalogcrawler.crawl.parse.RawCandidate;
import com.delta.catalogcrawler.crawl.render.FetchException;
import com.delta.catalogcrawler.crawl.render.FetchedPage;
import com.delta.catalogcrawler.crawl.render.SourceRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Follows a source's listing pages from its canonical URL until there is no next page, the page cap
 * is reached, a fetch fails, or the run is cancelled.
 */
@Component
public class PaginationWalker {
    private static final Logger log = LoggerFactory.getLogger(PaginationWalker.class);

    private final ListingPageParser parser;
    private final FieldDeriver fieldDeriver;
    private final CrawlerProperties properties;

    public PaginationWalker(ListingPageParser parser, FieldDeriver fieldDeriver, CrawlerProperties properties) {
        this.parser = parser;
        this.fieldDeriver = fieldDeriver;
        this.properties = properties;
    }

    public WalkResult walk(Source source, SourceRenderer renderer, int maxPages) {
        return walk(source, renderer, maxPages, () -> false, stage -> {
        });
    }

    public WalkResult walk(
        Source source,
        SourceRenderer renderer,
        int maxPages,
        BooleanSupplier cancelled,
        Consumer<SourceStage> stageListener
    ) {
        int pageCap = Math.max(1, maxPages);
        Map<String, CatalogRecord> records = new LinkedHashMap<>();
        List<CrawlIssue> issues = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String currentUrl = source.listingUrl();
        int pagesWalked = 0;

        while (true) {
            if (cancelled.getAsBoolean()) {
                log.info("Walk of {} cancelled after {} pages", source.id(), pagesWalked);
                return result(records, pagesWalked, WalkTermination.CANCELLED, null, issues);
            }
            visited.add(currentUrl);
            stageListener.accept(SourceStage.FETCHING);
            FetchedPage page;
            try {
                page = renderer.fetch(currentUrl);
            } catch (FetchException e) {
                log.warn("Fetch failed for {} page {} ({}): {}",
                    source.id(), pagesWalked + 1, e.getKind(), e.getReasonCode());
                issues.add(new CrawlIssue(source.id(), IssueScope.SOURCE, currentUrl, e.getReasonCode(), e.getMessage()));
                return result(records, pagesWalked, WalkTermination.FETCH_ERROR, e, issues);
            }
            pagesWalked++;

            stageListener.accept(SourceStage.PARSING);
            ParsedListingPage parsed = parse(source, page, issues);
            int added = accumulate(source, parsed.candidates(), records, issues);
            log.debug("{} page {}: {} candidates via {}, {} new records",
                source.id(), pagesWalked, parsed.candidates().size(), parsed.strategy(), added);

            if (pagesWalked == 1 && parsed.candidates().isEmpty()) {
                return result(records, pagesWalked, WalkTermination.EMPTY_FIRST_PAGE, null, issues);
            }
            if (!parsed.hasNextPage()) {
                return result(records, pagesWalked, WalkTermination.EXHAUSTED, null, issues);
            }
            String nextUrl = parsed.nextPageUrl();
            if (visited.contains(nextUrl)) {
                log.info("Pagination of {} loops back to {}; stopping", source.id(), nextUrl);
                return result(records, pagesWalked, WalkTermination.EXHAUSTED, null, issues);
            }
            if (pagesWalked >= pageCap) {
                return result(records, pagesWalked, WalkTermination.MAX_PAGES_REACHED, null, issues);
            }
            if (!pause(properties.getInterPageDelayMs())) {
                return result(records, pagesWalked, WalkTermination.CANCELLED, null, issues);
            }
            currentUrl = nextUrl;
        }
    }

    private ParsedListingPage parse(Source source, FetchedPage page, List<CrawlIssue> issues) {
        try {
            return parser.parse(page.body(), page.baseUrl());
        } catch (RuntimeException e) {
            log.warn("Parse failed for {} at {}", source.id(), page.finalUrl(), e);
            issues.add(new CrawlIssue(source.id(), IssueScope.PAGE, page.finalUrl(), "parse_error", e.getMessage()));
            return ParsedListingPage.empty(null);
        }
    }

    private int accumulate(
        Source source,
        List<RawCandidate> candidates,
        Map<String, CatalogRecord> records,
        List<CrawlIssue> issues
    ) {
        int added = 0;
        Instant capturedAt = Instant.now();
        for (RawCandidate candidate : candidates) {
            try {
                CatalogRecord record = fieldDeriver.assemble(source, candidate, capturedAt);
                if (records.putIfAbsent(record.id(), record) == null) {
                    added++;
                }
            } catch (RuntimeException e) {
                issues.add(new CrawlIssue(source.id(), IssueScope.RECORD, candidate.detailUrl(), "derive_error", e.getMessage()));
            }
        }
        return added;
    }

    private WalkResult result(
        Map<String, CatalogRecord> records,
        int pagesWalked,
        WalkTermination termination,
        FetchException error,
        List<CrawlIssue> issues
    ) {
        return new WalkResult(new ArrayList<>(records.values()), pagesWalked, termination, error, issues);
    }

    static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
