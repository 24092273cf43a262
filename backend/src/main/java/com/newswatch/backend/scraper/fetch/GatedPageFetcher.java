package com.newswatch.backend.scraper.fetch;

import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Admission gate in front of a {@link PageFetcher}: at most {@code limit} requests are in
 * flight at once, further callers block until a slot frees.
 */
@Slf4j
public class GatedPageFetcher implements PageFetcher {

    private final PageFetcher delegate;
    private final Semaphore permits;
    private final int limit;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxObservedInFlight = new AtomicInteger();

    public GatedPageFetcher(PageFetcher delegate, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("concurrency limit must be at least 1, got " + limit);
        }
        this.delegate = delegate;
        this.limit = limit;
        this.permits = new Semaphore(limit, true);
    }

    @Override
    public Optional<String> fetch(String url) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to fetch {}", url);
            return Optional.empty();
        }
        try {
            int current = inFlight.incrementAndGet();
            maxObservedInFlight.accumulateAndGet(current, Math::max);
            return delegate.fetch(url);
        } finally {
            inFlight.decrementAndGet();
            permits.release();
        }
    }

    public int getLimit() {
        return limit;
    }

    public int getMaxObservedInFlight() {
        return maxObservedInFlight.get();
    }
}
