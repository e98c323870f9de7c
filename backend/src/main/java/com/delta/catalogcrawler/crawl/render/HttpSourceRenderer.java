package com.delta.catalogcrawler.crawl.render;

import com.delta.catalogcrawler.crawl.http.PoliteHttpClient;
import com.delta.catalogcrawler.crawl.model.HttpFetchResult;
import org.springframework.stereotype.Component;

@Component
public class HttpSourceRenderer implements SourceRenderer {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8";

    private final PoliteHttpClient httpClient;

    public HttpSourceRenderer(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RenderMode mode() {
        return RenderMode.RAW;
    }

    @Override
    public FetchedPage fetch(String url) throws FetchException {
        HttpFetchResult result = httpClient.get(url, HTML_ACCEPT);
        if (result.errorCode() != null) {
            FetchErrorKind kind = "invalid_url".equals(result.errorCode())
                ? FetchErrorKind.PERMANENT
                : FetchErrorKind.TRANSIENT;
            throw new FetchException(url, kind, result.errorCode(), result.errorMessage());
        }
        if (!result.isSuccessful()) {
            throw new FetchException(url, FetchErrorKind.PERMANENT, reasonForStatus(result.statusCode()), null);
        }
        return new FetchedPage(
            url,
            result.finalUrlOrRequested(),
            result.statusCode(),
            result.body() == null ? "" : result.body()
        );
    }

    static String reasonForStatus(int status) {
        if (status == 403 || status == 429) {
            return "blocked_" + status;
        }
        return "http_" + status;
    }
}
