package com.delta.catalogcrawler.crawl.http;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void retriesServerErrorThenSucceeds() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
        server.start();

        HttpFetchResult result = client(1).get(server.url("/albums").toString(), "text/html");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("ok");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryBlockSignal() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(429).setBody("rate limit"));
        server.start();

        HttpFetchResult result = client(2).get(server.url("/albums").toString(), "text/html");

        assertThat(result.statusCode()).isEqualTo(429);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void postSendsBodyAndExtraHeaders() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"success\":true}"));
        server.start();

        HttpFetchResult result = client(0).post(
            server.url("/import").toString(),
            "{\"id\":\"a\"}\n",
            "text/plain",
            "application/json",
            Map.of("X-Test", "yes")
        );

        RecordedRequest request = server.takeRequest();
        assertThat(result.isSuccessful()).isTrue();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("X-Test")).isEqualTo("yes");
        assertThat(request.getHeader("Content-Type")).startsWith("text/plain");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"id\":\"a\"}\n");
    }

    private PoliteHttpClient client(int retries) {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setConcurrencyLimit(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(retries);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        executor = Executors.newFixedThreadPool(1);
        return new PoliteHttpClient(properties, executor);
    }
}
