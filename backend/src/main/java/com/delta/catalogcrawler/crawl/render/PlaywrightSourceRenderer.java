package com.delta.catalogcrawler.crawl.render;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Headless Chromium renderer. Playwright objects are thread-confined, so the browser is created, used
 * and closed on a single dedicated render thread; callers block on the submitted render task.
 *
 * <p>The render deadline starts when the task reaches the render thread. Time spent queued behind
 * other pipelines' renders is not charged to the fetch. A failed browser launch is remembered and
 * every later fetch fails fast as permanent.
 */
public class PlaywrightSourceRenderer implements ManagedSourceRenderer {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightSourceRenderer.class);
    private static final long CLOSE_WAIT_SECONDS = 30;
    private static final long RESULT_GRACE_MS = 5000;
    private static final long QUEUE_POLL_MS = 250;

    private final CrawlerProperties properties;
    private final Supplier<Playwright> driverFactory;
    private final long resultGraceMs;
    private final ExecutorService renderThread;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Touched only from renderThread.
    private Playwright playwright;
    private Browser browser;
    private RuntimeException launchFailure;

    public PlaywrightSourceRenderer(CrawlerProperties properties) {
        this(properties, Playwright::create, RESULT_GRACE_MS);
    }

    PlaywrightSourceRenderer(CrawlerProperties properties, Supplier<Playwright> driverFactory, long resultGraceMs) {
        this.properties = properties;
        this.driverFactory = driverFactory;
        this.resultGraceMs = resultGraceMs;
        this.renderThread = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("browser-render");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public RenderMode mode() {
        return RenderMode.RENDERED;
    }

    @Override
    public FetchedPage fetch(String url) throws FetchException {
        if (closed.get()) {
            throw new FetchException(url, FetchErrorKind.PERMANENT, "renderer_closed", "browser already released");
        }
        int timeoutMs = properties.getRenderTimeoutSeconds() * 1000;
        CountDownLatch started = new CountDownLatch(1);
        Future<FetchedPage> future;
        try {
            future = renderThread.submit(() -> {
                started.countDown();
                return renderOnThread(url, timeoutMs);
            });
        } catch (RejectedExecutionException e) {
            throw new FetchException(url, FetchErrorKind.PERMANENT, "renderer_closed", e.getMessage(), e);
        }
        long waitMs = (long) timeoutMs + properties.getRenderSettleMs() + resultGraceMs;
        try {
            awaitStart(url, started, future);
            return future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchException(url, FetchErrorKind.TRANSIENT, "render_timeout", "no result after " + waitMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new FetchException(url, FetchErrorKind.TRANSIENT, "interrupted", e.getMessage(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException fetchException) {
                throw fetchException;
            }
            if (cause instanceof TimeoutError) {
                throw new FetchException(url, FetchErrorKind.TRANSIENT, "render_timeout", cause.getMessage(), cause);
            }
            throw new FetchException(url, FetchErrorKind.TRANSIENT, "render_error", String.valueOf(cause), cause);
        }
    }

    /**
     * Waits, without a deadline, until the task leaves the render queue. Each task ahead of it is
     * bounded by its own deadline.
     */
    private void awaitStart(String url, CountDownLatch started, Future<FetchedPage> future)
        throws InterruptedException, FetchException {
        while (!started.await(QUEUE_POLL_MS, TimeUnit.MILLISECONDS)) {
            if (future.isDone()) {
                return;
            }
            if (closed.get()) {
                future.cancel(true);
                throw new FetchException(url, FetchErrorKind.PERMANENT, "renderer_closed", "browser released while queued");
            }
        }
    }

    private FetchedPage renderOnThread(String url, int timeoutMs) throws FetchException {
        ensureBrowser(url);
        Browser.NewContextOptions contextOptions = new Browser.NewContextOptions()
            .setUserAgent(properties.getUserAgent())
            .setViewportSize(1920, 1080);
        try (BrowserContext context = browser.newContext(contextOptions)) {
            Page page = context.newPage();
            Response response = page.navigate(
                url,
                new Page.NavigateOptions()
                    .setTimeout(timeoutMs)
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
            );
            int status = response == null ? 200 : response.status();
            if (status < 200 || status >= 300) {
                throw new FetchException(url, FetchErrorKind.PERMANENT, HttpSourceRenderer.reasonForStatus(status), null);
            }
            if (properties.getRenderSettleMs() > 0) {
                page.waitForTimeout(properties.getRenderSettleMs());
            }
            return new FetchedPage(url, page.url(), status, page.content());
        }
    }

    private void ensureBrowser(String url) throws FetchException {
        if (browser != null) {
            return;
        }
        if (launchFailure != null) {
            throw new FetchException(url, FetchErrorKind.PERMANENT, "browser_unavailable", launchFailure.getMessage(), launchFailure);
        }
        log.info("Launching headless browser for rendered fetches");
        Playwright driver = null;
        try {
            driver = driverFactory.get();
            browser = driver.chromium().launch(
                new BrowserType.LaunchOptions()
                    .setHeadless(true)
                    .setArgs(List.of("--no-sandbox", "--disable-dev-shm-usage"))
            );
            playwright = driver;
        } catch (RuntimeException e) {
            launchFailure = e;
            log.warn("Headless browser launch failed; rendered fetches in this run will fail", e);
            closeDriver(driver);
            throw new FetchException(url, FetchErrorKind.PERMANENT, "browser_unavailable", e.getMessage(), e);
        }
    }

    private void closeDriver(Playwright driver) {
        if (driver == null) {
            return;
        }
        try {
            driver.close();
        } catch (RuntimeException e) {
            log.warn("Playwright driver close failed after launch error", e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            renderThread.submit(this::releaseOnThread).get(CLOSE_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while releasing headless browser");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Failed to release headless browser cleanly", e);
        } finally {
            renderThread.shutdownNow();
        }
    }

    private void releaseOnThread() {
        try {
            if (browser != null) {
                browser.close();
            }
        } catch (PlaywrightException e) {
            log.warn("Browser close failed", e);
        } finally {
            browser = null;
            if (playwright != null) {
                playwright.close();
                playwright = null;
                log.info("Headless browser released");
            }
        }
    }
}
