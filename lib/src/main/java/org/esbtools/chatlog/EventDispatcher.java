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

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fans each {@link ChatEvent} out to every configured {@link ChatEventSink}, in the order the
 * sinks were configured.
 *
 * <p>There is no atomicity across sinks. A sink which throws or fails does not stop the event from
 * reaching the remaining sinks. Failures are reported back through the returned future, which the
 * caller may examine or ignore; nothing is ever thrown from {@link #dispatch(ChatEvent)}.
 *
 * <p>Buffered sinks (see {@link BufferedSink}) accept events immediately, so they never fail here.
 */
public class EventDispatcher {
    private final List<ChatEventSink> sinks;

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    public EventDispatcher(List<? extends ChatEventSink> sinks) {
        this.sinks = ImmutableList.copyOf(sinks);
    }

    public List<ChatEventSink> sinks() {
        return sinks;
    }

    /**
     * @return A future which completes once every sink has accepted the event, or completes
     * exceptionally with a {@link SinkFailureException} if any of them failed. The other sinks'
     * failures, if more than one failed, are suppressed in that exception.
     */
    public CompletableFuture<Void> dispatch(ChatEvent event) {
        List<CompletableFuture<Void>> results = new ArrayList<>(sinks.size());

        for (ChatEventSink sink : sinks) {
            CompletableFuture<Void> result;

            try {
                result = sink.log(event);
            } catch (Exception e) {
                result = new CompletableFuture<>();
                result.completeExceptionally(e);
            }

            results.add(result.whenComplete((ignored, failure) -> {
                if (failure != null) {
                    log.warn("Sink " + sink + " failed to log event " + event, unwrap(failure));
                }
            }));
        }

        return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]))
                .handle((ignored, allOfFailure) -> {
                    if (allOfFailure == null) {
                        return null;
                    }

                    SinkFailureException failure = null;

                    for (CompletableFuture<Void> result : results) {
                        Throwable cause = failureOf(result);
                        if (cause == null) continue;

                        if (failure == null) {
                            failure = new SinkFailureException(
                                    "Failed to log event to one or more sinks: " + event, cause);
                        } else {
                            failure.addSuppressed(cause);
                        }
                    }

                    throw new CompletionException(failure);
                });
    }

    private static Throwable failureOf(CompletableFuture<Void> result) {
        if (!result.isCompletedExceptionally()) {
            return null;
        }

        try {
            result.join();
            return null;
        } catch (CompletionException e) {
            return unwrap(e);
        } catch (RuntimeException e) {
            return e;
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
