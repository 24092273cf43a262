package com.newswatch.backend.scraper.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GatedPageFetcherTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(16);

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Observed in-flight requests never exceed the limit")
    void observedConcurrencyNeverExceedsLimit() {
        // given
        final int limit = 3;
        FakePageFetcher transport = new FakePageFetcher().delay(50);
        for (int i = 0; i < 30; i++) transport.stub("https://example.com/p" + i, "<p>" + i + "</p>");
        GatedPageFetcher gated = new GatedPageFetcher(transport, limit);

        // when
        List<CompletableFuture<Optional<String>>> calls = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            String url = "https://example.com/p" + i;
            calls.add(CompletableFuture.supplyAsync(() -> gated.fetch(url), pool));
        }
        calls.forEach(CompletableFuture::join);

        // then
        assertThat(gated.getMaxObservedInFlight()).isBetween(1, limit);
        assertThat(transport.getRequests()).hasSize(30);
        assertThat(calls).allSatisfy(call -> assertThat(call.join()).isPresent());
    }

    @Test
    @DisplayName("Transport failures come back as an absent page and release the slot")
    void failureReleasesSlot() {
        GatedPageFetcher gated = new GatedPageFetcher(new FakePageFetcher(), 1);

        assertThat(gated.fetch("https://example.com/missing")).isEmpty();
        assertThat(gated.fetch("https://example.com/missing-too")).isEmpty();
    }

    @Test
    @DisplayName("A thrown transport error still releases the slot")
    void exceptionReleasesSlot() {
        PageFetcher broken = url -> {
            throw new IllegalStateException("boom");
        };
        GatedPageFetcher gated = new GatedPageFetcher(broken, 1);

        assertThatThrownBy(() -> gated.fetch("https://example.com/a")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> gated.fetch("https://example.com/b")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new GatedPageFetcher(new FakePageFetcher(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
