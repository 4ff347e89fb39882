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

import org.esbtools.chatlog.elasticsearch.client.ElasticsearchClient;
import org.esbtools.chatlog.elasticsearch.model.DocumentType;
import org.esbtools.chatlog.elasticsearch.query.FreeTextQuery;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Operations on a whole index or many documents at once. Kept apart from
 * {@link DocumentManager} since they are destructive or expensive.
 */
public class IndexAdmin {
    private final ElasticsearchClient client;
    private final String index;
    private final String docType;

    public IndexAdmin(ElasticsearchClient client, DocumentType<?> type) {
        this(client, type.index(), type.docType());
    }

    public IndexAdmin(ElasticsearchClient client, String index, String docType) {
        this.client = Objects.requireNonNull(client, "client");
        this.index = Objects.requireNonNull(index, "index");
        this.docType = Objects.requireNonNull(docType, "docType");
    }

    public CompletableFuture<JsonNode> createIndex() {
        return createIndex(null);
    }

    public CompletableFuture<JsonNode> createIndex(@Nullable JsonNode mapping) {
        return client.createIndex(index, mapping);
    }

    public CompletableFuture<JsonNode> deleteIndex() {
        return client.deleteIndex(index);
    }

    public CompletableFuture<JsonNode> optimize() {
        return client.optimize(index);
    }

    /** Makes recently indexed documents visible to searches. */
    public CompletableFuture<JsonNode> refresh() {
        return client.refresh(index);
    }

    /** @param luceneQuery Documents matching this query string are deleted. */
    public CompletableFuture<JsonNode> deleteByQuery(String luceneQuery) {
        return client.deleteByQuery(index, docType, new FreeTextQuery(luceneQuery).toJson());
    }

    public CompletableFuture<JsonNode> deleteAllDocuments() {
        return deleteByQuery("*:*");
    }
}
