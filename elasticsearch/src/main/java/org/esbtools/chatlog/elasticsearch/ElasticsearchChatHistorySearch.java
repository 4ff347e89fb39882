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
import org.esbtools.chatlog.ChatHistorySearch;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Searches recorded events with a Lucene query string, oldest first. Only the first page of
 * results is returned.
 */
public class ElasticsearchChatHistorySearch implements ChatHistorySearch {
    private final DocumentManager<ChatEvent> chatEvents;

    public ElasticsearchChatHistorySearch(DocumentManager<ChatEvent> chatEvents) {
        this.chatEvents = Objects.requireNonNull(chatEvents, "chatEvents");
    }

    @Override
    public CompletableFuture<List<ChatEvent>> search(String query) {
        return chatEvents.filter(query)
                .orderBy(ChatEventDocumentType.TIME)
                .fetch()
                .thenApply(SearchResult::documents);
    }
}
