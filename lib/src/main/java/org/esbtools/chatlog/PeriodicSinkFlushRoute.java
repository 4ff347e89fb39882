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

import org.apache.camel.builder.RouteBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Flushes a {@link BufferedSink} on a fixed interval using a Camel timer.
 *
 * <p>Camel's timer waits for one exchange to finish before scheduling the next, so flushes of the
 * same sink never overlap. A flush which fails entirely is logged and the next tick tries again;
 * nothing propagates back to whatever is logging events.
 */
public class PeriodicSinkFlushRoute extends RouteBuilder {
    private final BufferedSink<?> sink;
    private final Duration flushInterval;

    private final int idCount = idCounter.getAndIncrement();
    private final String routeId;

    private static final AtomicInteger idCounter = new AtomicInteger(0);

    private static final Logger log = LoggerFactory.getLogger(PeriodicSinkFlushRoute.class);

    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);

    public PeriodicSinkFlushRoute(BufferedSink<?> sink) {
        this(sink, DEFAULT_FLUSH_INTERVAL);
    }

    public PeriodicSinkFlushRoute(BufferedSink<?> sink, Duration flushInterval) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");

        if (flushInterval.isNegative() || flushInterval.isZero()) {
            throw new IllegalArgumentException("flushInterval must be positive but was " +
                    flushInterval);
        }

        this.routeId = "sinkFlusher-" + idCount;
    }

    public String routeId() {
        return routeId;
    }

    @Override
    public void configure() throws Exception {
        long periodMillis = flushInterval.toMillis();

        from("timer:" + routeId + "?delay=" + periodMillis + "&period=" + periodMillis)
        .routeId(routeId)
        .process(exchange -> {
            try {
                int flushed = sink.flush();
                if (flushed > 0) {
                    log.debug("Route {} flushed {} events from {}", routeId, flushed, sink);
                }
            } catch (Exception e) {
                log.error("Unexpected failure flushing " + sink + " on route " + routeId +
                        ", will try again in " + flushInterval, e);
            }
        });
    }
}
