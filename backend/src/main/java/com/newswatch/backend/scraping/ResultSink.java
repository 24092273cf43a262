package com.newswatch.backend.scraping;

import com.newswatch.backend.model.ArticleRecord;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded hand-off between the crawlers (many producers) and one consumer. Producers block in
 * {@link #put} while the sink is full. Records come out in arrival order.
 */
@Slf4j
public class ResultSink {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final BlockingQueue<ArticleRecord> queue;
    private final AtomicInteger received = new AtomicInteger();
    private volatile boolean closed;

    public ResultSink(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("sink capacity must be at least 1, got " + capacity);
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Blocks while the sink is full. Fails with {@link IllegalStateException} once the sink is
     * closed, including while waiting for space.
     */
    public void put(ArticleRecord record) throws InterruptedException {
        while (!closed) {
            if (queue.offer(record, POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                received.incrementAndGet();
                return;
            }
        }
        throw new IllegalStateException("Result sink is closed");
    }

    public Optional<ArticleRecord> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Signals that no producer will put any more records
     */
    public void close() {
        closed = true;
    }

    /**
     * Closes the sink on behalf of a consumer that stopped reading. Buffered records are
     * discarded and blocked producers fail on their next wake-up.
     */
    public void abandon() {
        closed = true;
        int dropped = queue.size();
        queue.clear();
        log.warn("Result sink abandoned, {} buffered records dropped", dropped);
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isExhausted() {
        return closed && queue.isEmpty();
    }

    /**
     * Hands every record to {@code consumer} until the sink is closed and empty.
     */
    public void drain(Consumer<ArticleRecord> consumer) throws InterruptedException {
        while (!isExhausted()) {
            poll(POLL_INTERVAL).ifPresent(consumer);
        }
        log.debug("Result sink drained after {} records", received.get());
    }

    public int getReceivedCount() {
        return received.get();
    }

    public int size() {
        return queue.size();
    }
}
