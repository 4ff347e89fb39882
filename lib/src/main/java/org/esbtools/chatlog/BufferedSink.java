/*
 *  Copyright 2016 esbtools Contributors and/or its affiliates.
 *
 *  This file is part of esbtools.
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.esbtools.chatlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decorates any {@link ChatEventSink}, holding logged events in memory until {@link #flush()} is
 * called, at which point all buffered events are handed to the wrapped sink.
 *
 * <p>{@link #log(ChatEvent)} never does any I/O; it only appends to the buffer and returns an
 * already completed future. This makes it safe to call from an event source which must not block.
 * Something else is expected to call {@link #flush()} periodically, typically a
 * {@link PeriodicSinkFlushRoute}.
 *
 * <p>Delivery is at-least-once. Any event the wrapped sink fails to record (or does not record
 * within the delivery timeout) is put back in the buffer and retried on the next flush, forever,
 * with no backoff. A sink which always fails will grow the buffer without bound. An event whose
 * delivery timed out may still complete later, in which case it will be recorded twice.
 *
 * <p>The buffer is swapped out atomically at the start of a flush, so events logged while a flush
 * is in progress are never lost: they will either make it in for the current batch or be kept for
 * the next. Only one flush runs at a time; a flush requested while another is in progress is
 * skipped.
 *
 * @param <S> The type of the wrapped sink
 */
@ThreadSafe
public class BufferedSink<S extends ChatEventSink> implements ChatEventSink {
    private final S delegate;
    private final Duration deliveryTimeout;

    private final Object bufferLock = new Object();
    private List<ChatEvent> buffer = new ArrayList<>();

    private final AtomicBoolean flushing = new AtomicBoolean(false);

    private static final Logger log = LoggerFactory.getLogger(BufferedSink.class);

    public static final Duration DEFAULT_DELIVERY_TIMEOUT = Duration.ofSeconds(30);

    public BufferedSink(S delegate) {
        this(delegate, DEFAULT_DELIVERY_TIMEOUT);
    }

    /**
     * @param deliveryTimeout How long to wait for the wrapped sink to record one event during a
     *                        flush before giving up on it until the next flush.
     */
    public BufferedSink(S delegate, Duration deliveryTimeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.deliveryTimeout = Objects.requireNonNull(deliveryTimeout, "deliveryTimeout");
    }

    public S delegate() {
        return delegate;
    }

    @Override
    public CompletableFuture<Void> log(ChatEvent event) {
        Objects.requireNonNull(event, "event");

        synchronized (bufferLock) {
            buffer.add(event);
        }

        return CompletableFuture.completedFuture(null);
    }

    /**
     * Hands every buffered event to the wrapped sink and waits for each to be recorded. Events
     * which fail are put back in the buffer.
     *
     * <p>Blocks the calling thread until every delivery has completed or timed out, so this should
     * not be called from the event source's thread.
     *
     * @return The number of events the wrapped sink recorded successfully. If another flush was
     * already in progress, nothing is done and zero is returned.
     */
    public int flush() {
        if (!flushing.compareAndSet(false, true)) {
            log.debug("Flush of {} already in progress; skipping.", delegate);
            return 0;
        }

        try {
            return doFlush();
        } finally {
            flushing.set(false);
        }
    }

    /**
     * @return A snapshot of the events currently waiting for the next flush.
     */
    public List<ChatEvent> buffered() {
        synchronized (bufferLock) {
            return Collections.unmodifiableList(new ArrayList<>(buffer));
        }
    }

    public boolean isFlushing() {
        return flushing.get();
    }

    private int doFlush() {
        List<ChatEvent> batch;

        synchronized (bufferLock) {
            batch = buffer;
            buffer = new ArrayList<>();
        }

        if (batch.isEmpty()) {
            return 0;
        }

        log.debug("Flushing {} events to {}", batch.size(), delegate);

        List<PendingDelivery> deliveries = new ArrayList<>(batch.size());
        List<ChatEvent> failures = new ArrayList<>();

        // Begin all deliveries before waiting on any of them.
        for (ChatEvent event : batch) {
            try {
                deliveries.add(new PendingDelivery(event, delegate.log(event)));
            } catch (Exception e) {
                log.error("Failed to log event to " + delegate + ", will retry next flush: " +
                        event, e);
                failures.add(event);
            }
        }

        int delivered = 0;

        for (PendingDelivery delivery : deliveries) {
            try {
                delivery.result.get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
                delivered++;
            } catch (ExecutionException e) {
                log.error("Failed to log event to " + delegate + ", will retry next flush: " +
                        delivery.event, e.getCause());
                failures.add(delivery.event);
            } catch (TimeoutException e) {
                log.warn("Timed out logging event to {} after {}, will retry next flush: {}",
                        delegate, deliveryTimeout, delivery.event);
                failures.add(delivery.event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted logging event to {}, will retry next flush: {}",
                        delegate, delivery.event);
                failures.add(delivery.event);
            }
        }

        if (!failures.isEmpty()) {
            synchronized (bufferLock) {
                buffer.addAll(failures);
            }
        }

        log.debug("Flushed {} events to {}; {} requeued", delivered, delegate, failures.size());

        return delivered;
    }

    @Override
    public String toString() {
        return "BufferedSink{" + delegate + "}";
    }

    private static final class PendingDelivery {
        final ChatEvent event;
        final CompletableFuture<Void> result;

        PendingDelivery(ChatEvent event, CompletableFuture<Void> result) {
            this.event = event;
            this.result = Objects.requireNonNull(result, "result");
        }
    }
}
