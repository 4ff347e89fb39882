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

package org.esbtools.chatlog.elasticsearch;

import org.esbtools.chatlog.ChatEvent;
import org.esbtools.chatlog.ChatEventSink;
import org.esbtools.chatlog.SinkFailureException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Indexes each event as a new document in the store. Meant to be wrapped in a
 * {@link org.esbtools.chatlog.BufferedSink} so requests happen off the event source's thread and
 * failures are retried.
 */
public class SearchIndexSink implements ChatEventSink {
    private final DocumentManager<ChatEvent> chatEvents;

    public SearchIndexSink(DocumentManager<ChatEvent> chatEvents) {
        this.chatEvents = Objects.requireNonNull(chatEvents, "chatEvents");
    }

    @Override
    public CompletableFuture<Void> log(ChatEvent event) {
        return chatEvents.create(event).handle((document, failure) -> {
            if (failure != null) {
                Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                        ? failure.getCause()
                        : failure;
                throw new CompletionException(
                        new SinkFailureException("Failed to index event " + event, cause));
            }
            return null;
        });
    }

    @Override
    public String toString() {
        return "SearchIndexSink{" + chatEvents.type().index() + "/" +
                chatEvents.type().docType() + "}";
    }
}
