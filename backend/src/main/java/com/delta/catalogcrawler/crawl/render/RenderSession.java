package com.delta.catalogcrawler.crawl.render;

import java.util.function.Supplier;

/**
 * Per-run owner of the renderers. The rendering context is created on first request and released once
 * when the session closes; a session that never rendered never launches anything.
 */
public class RenderSession implements AutoCloseable {
    private final SourceRenderer rawRenderer;
    private final Supplier<? extends ManagedSourceRenderer> renderedFactory;
    private ManagedSourceRenderer renderedRenderer;
    private boolean closed;

    public RenderSession(SourceRenderer rawRenderer, Supplier<? extends ManagedSourceRenderer> renderedFactory) {
        this.rawRenderer = rawRenderer;
        this.renderedFactory = renderedFactory;
    }

    public SourceRenderer renderer(RenderMode mode) {
        if (mode != RenderMode.RENDERED) {
            return rawRenderer;
        }
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Render session already closed");
            }
            if (renderedRenderer == null) {
                renderedRenderer = renderedFactory.get();
            }
            return renderedRenderer;
        }
    }

    public synchronized boolean isRenderingContextOpen() {
        return renderedRenderer != null && !closed;
    }

    @Override
    public void close() {
        ManagedSourceRenderer toRelease;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toRelease = renderedRenderer;
        }
        if (toRelease != null) {
            toRelease.close();
        }
    }
}
