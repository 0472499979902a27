package com.warden.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decorator that hands events to a single writer thread through a bounded queue.
 * <p>
 * The request thread only stamps the event (so the timestamp reflects the decision, not the
 * write) and enqueues it. A full queue drops the event with a warning; nothing is retried.
 * {@link #close()} stops accepting events and drains what is already queued.
 */
public class AsyncAuditSink implements AuditSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncAuditSink.class);

    private final AuditSink delegate;
    private final Clock clock;
    private final ThreadPoolExecutor writer;
    private final AtomicLong dropped = new AtomicLong();

    public AsyncAuditSink(AuditSink delegate, int queueCapacity) {
        this(delegate, queueCapacity, Clock.systemUTC());
    }

    public AsyncAuditSink(AuditSink delegate, int queueCapacity, Clock clock) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        this.delegate = delegate;
        this.clock = clock;
        this.writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "audit-writer");
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public void record(AuditEvent event) {
        if (event == null) {
            return;
        }
        AuditEvent stamped = event.complete(clock, () -> UUID.randomUUID().toString());
        try {
            writer.execute(() -> delegate.record(stamped));
        } catch (RejectedExecutionException e) {
            long total = dropped.incrementAndGet();
            log.warn("Audit queue full or closed, dropped event {} (type={}, dropped so far={})",
                    stamped.eventId(), stamped.eventType().value(), total);
        }
    }

    /** Number of events dropped because the queue was full or the sink was closed. */
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Audit writer did not drain within 5s, {} events abandoned",
                        writer.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
