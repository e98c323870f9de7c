package com.delta.catalogcrawler.crawl.api;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.keywords.KeywordProvider;
import com.delta.catalogcrawler.crawl.model.CrawlRunRequest;
import com.delta.catalogcrawler.crawl.model.CrawlSession;
import com.delta.catalogcrawler.crawl.model.ProbeResult;
import com.delta.catalogcrawler.crawl.model.RunStateSnapshot;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.persistence.CatalogJdbcRepository;
import com.delta.catalogcrawler.crawl.service.CrawlOrchestratorService;
import com.delta.catalogcrawler.crawl.service.SourceProbeService;
import com.delta.catalogcrawler.crawl.source.SourceRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final SourceProbeService sourceProbeService;
    private final SourceRegistry sourceRegistry;
    private final KeywordProvider keywordProvider;
    private final CatalogJdbcRepository repository;
    private final CrawlerProperties properties;

    public CrawlController(
        CrawlOrchestratorService crawlOrchestratorService,
        SourceProbeService sourceProbeService,
        SourceRegistry sourceRegistry,
        KeywordProvider keywordProvider,
        CatalogJdbcRepository repository,
        CrawlerProperties properties
    ) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.sourceProbeService = sourceProbeService;
        this.sourceRegistry = sourceRegistry;
        this.keywordProvider = keywordProvider;
        this.repository = repository;
        this.properties = properties;
    }

    @PostMapping("/crawl/run")
    public ResponseEntity<?> runCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        CrawlRunRequest runRequest = toRunRequest(request);
        if (request != null && Boolean.TRUE.equals(request.async())) {
            Long crawlRunId = crawlOrchestratorService.startAsync(runRequest);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(new CrawlStartResponse(crawlRunId, "RUNNING"));
        }
        return ResponseEntity.ok(crawlOrchestratorService.run(runRequest));
    }

    @PostMapping("/crawl/stop")
    public Map<String, Object> stopCrawl() {
        boolean stopping = crawlOrchestratorService.cancel();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stopping", stopping);
        body.put("crawlRunId", crawlOrchestratorService.snapshot().crawlRunId());
        return body;
    }

    @GetMapping("/crawl/status")
    public RunStateSnapshot status() {
        return crawlOrchestratorService.snapshot();
    }

    @GetMapping("/crawl/sessions")
    public List<CrawlSession> recentSessions(@RequestParam(name = "limit", defaultValue = "20") int limit) {
        if (limit < 1 || limit > 500) {
            throw new ResponseStatusException(BAD_REQUEST, "limit must be between 1 and 500");
        }
        return repository.findRecentSessions(limit);
    }

    @GetMapping("/sources")
    public List<Source> sources() {
        return sourceRegistry.allSources();
    }

    @PostMapping("/sources/{sourceId}/probe")
    public ProbeResult probeSource(@PathVariable("sourceId") String sourceId) {
        return sourceProbeService.probe(sourceId);
    }

    @PostMapping("/keywords/reload")
    public Map<String, Object> reloadKeywords() {
        keywordProvider.reload();
        return Map.of("reloaded", true);
    }

    private CrawlRunRequest toRunRequest(CrawlApiRunRequest request) {
        if (request == null) {
            return CrawlRunRequest.defaults();
        }
        if (request.maxPagesPerSource() != null && request.maxPagesPerSource() < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "maxPagesPerSource must be at least 1");
        }
        if (request.concurrencyLimit() != null && request.concurrencyLimit() < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "concurrencyLimit must be at least 1");
        }
        if (request.concurrencyLimit() != null && request.concurrencyLimit() > properties.getConcurrencyLimit()) {
            // The pipeline pool is sized from crawler.concurrency-limit at startup.
            throw new ResponseStatusException(
                BAD_REQUEST,
                "concurrencyLimit must not exceed crawler.concurrency-limit (" + properties.getConcurrencyLimit() + ")"
            );
        }
        return new CrawlRunRequest(
            request.sources() == null ? List.of() : request.sources(),
            request.maxPagesPerSource(),
            request.concurrencyLimit(),
            request.enableLinkEnrichment()
        );
    }
}
