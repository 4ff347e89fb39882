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
import org.esbtools.chatlog.elasticsearch.client.ElasticsearchException;
import org.esbtools.chatlog.elasticsearch.model.Document;
import org.esbtools.chatlog.elasticsearch.model.DocumentType;
import org.esbtools.chatlog.elasticsearch.query.Query;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for storing and finding documents of one {@link DocumentType}.
 *
 * @param <T> The model type
 */
public class DocumentManager<T> {
    private final ElasticsearchClient client;
    private final DocumentType<T> type;

    public DocumentManager(ElasticsearchClient client, DocumentType<T> type) {
        this.client = Objects.requireNonNull(client, "client");
        this.type = Objects.requireNonNull(type, "type");
    }

    public DocumentType<T> type() {
        return type;
    }

    /**
     * @param freeText Lucene query string, or {@code null} to match on fields only.
     * @param fieldEquals Fields which must have exactly these values.
     */
    public LazyResultSet<T> filter(@Nullable String freeText, Map<String, String> fieldEquals) {
        return new LazyResultSet<>(client, type).filter(freeText, fieldEquals);
    }

    public LazyResultSet<T> filter(String freeText) {
        return filter(freeText, ImmutableMap.of());
    }

    public LazyResultSet<T> query(Query... fragments) {
        return new LazyResultSet<>(client, type).filter(Arrays.asList(fragments));
    }

    public LazyResultSet<T> all() {
        return new LazyResultSet<>(client, type);
    }

    /**
     * Finds the one document matching the query.
     *
     * @return A future which fails with {@link DocumentDoesNotExistException} if nothing matches,
     * or {@link MultipleDocumentsReturnedException} if more than one document does.
     */
    public CompletableFuture<T> get(@Nullable String freeText, Map<String, String> fieldEquals) {
        return filter(freeText, fieldEquals).limit(2).fetch().thenApply(result -> {
            long matches = Math.max(result.totalCount(), result.documents().size());

            if (matches > 1) {
                throw new CompletionException(new MultipleDocumentsReturnedException(
                        "Expected one " + type.docType() + " matching " + describe(freeText,
                                fieldEquals), matches));
            }

            if (result.documents().isEmpty()) {
                throw new CompletionException(new DocumentDoesNotExistException(
                        "No " + type.docType() + " matching " + describe(freeText, fieldEquals)));
            }

            return result.documents().get(0);
        });
    }

    /**
     * @return A future which fails with {@link DocumentDoesNotExistException} if there is no
     * document with that id.
     */
    public CompletableFuture<T> getById(String id) {
        return client.get(type.index(), type.docType(), id).thenApply(response -> {
            boolean found = response.path("found").asBoolean(response.path("exists").asBoolean(false));

            if (!found || !response.path("_source").isObject()) {
                throw new CompletionException(new DocumentDoesNotExistException(
                        "No " + type.docType() + " with id " + id));
            }

            try {
                return type.fromDocument(Document.fromHit(response));
            } catch (IllegalArgumentException e) {
                throw new CompletionException(new ElasticsearchException(
                        "Could not read " + type.docType() + " " + id + ": " + response, e));
            }
        });
    }

    /**
     * Stores the model as a new document.
     *
     * @return The stored document, with the id the store assigned it.
     */
    public CompletableFuture<Document> create(T model) {
        Document document = type.toDocument(model);

        return client.index(document.toJson(), type.index(), type.docType(),
                document.id().orElse(null))
                .thenApply(response -> {
                    JsonNode id = response.path("_id");
                    return id.isValueNode() ? document.withId(id.asText()) : document;
                });
    }

    public CompletableFuture<JsonNode> delete(String id) {
        return client.deleteById(type.index(), type.docType(), id);
    }

    private static String describe(@Nullable String freeText, Map<String, String> fieldEquals) {
        return (freeText == null ? "" : "'" + freeText + "' ") + fieldEquals;
    }
}
