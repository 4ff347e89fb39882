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
import org.esbtools.chatlog.elasticsearch.model.DocumentType;
import org.esbtools.chatlog.elasticsearch.model.FacetCount;
import org.esbtools.chatlog.elasticsearch.query.Queries;
import org.esbtools.chatlog.elasticsearch.query.Query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * A search which is only run when its results are needed, and only again once it has changed.
 *
 * <p>Building methods ({@link #filter(List)}, {@link #orderBy(String)}, {@link #facet(String...)},
 * {@link #limit(int)}, {@link #offset(int)}, {@link #slice(Integer, Integer)}) change the search
 * and return this same result set, so they chain. Each marks the result set dirty. Accessors
 * ({@link #count()}, {@link #documents()}, {@link #facets()} and so on) run the search if it is
 * dirty, cache the results, and mark it clean.
 *
 * <p>Accessors block while the search runs. {@link #fetch()} runs it without blocking.
 *
 * <p>Not thread safe. A change made while a fetch is in flight leaves the result set dirty once
 * that fetch completes.
 *
 * @param <T> Model type of the documents
 */
@NotThreadSafe
public class LazyResultSet<T> implements Iterable<T> {
    private final ElasticsearchClient client;
    private final DocumentType<T> type;

    private final List<Query> fragments = new ArrayList<>();
    private final List<String> facetFields = new ArrayList<>();
    @Nullable
    private String orderBy = null;
    private int size = DEFAULT_SIZE;
    private int offset = 0;

    private boolean needsRefresh = true;
    private long modifications = 0;
    private SearchResult<T> cached = emptyResult();

    private static final Logger log = LoggerFactory.getLogger(LazyResultSet.class);

    public static final int DEFAULT_SIZE = 100;

    public LazyResultSet(ElasticsearchClient client, DocumentType<T> type) {
        this.client = Objects.requireNonNull(client, "client");
        this.type = Objects.requireNonNull(type, "type");
    }

    /** Adds fragments which matching documents must also match. */
    public LazyResultSet<T> filter(List<? extends Query> extraFragments) {
        fragments.addAll(extraFragments);
        return modified();
    }

    /**
     * @see Queries#parseQuery(String, Map)
     */
    public LazyResultSet<T> filter(@Nullable String freeText, Map<String, String> fieldEquals) {
        return filter(Queries.parseQuery(freeText, fieldEquals));
    }

    /**
     * @param field Field to sort by, ascending, or descending if prefixed with {@code -}.
     */
    public LazyResultSet<T> orderBy(String field) {
        Objects.requireNonNull(field, "field");

        if (field.startsWith("-")) {
            return orderBy(field.substring(1), true);
        }

        return orderBy(field, false);
    }

    public LazyResultSet<T> orderBy(String field, boolean descending) {
        if (field.isEmpty()) {
            throw new InvalidQueryUsageException("Order field must not be empty.");
        }

        orderBy = field + (descending ? ":desc" : ":asc");
        return modified();
    }

    /** Adds fields to count terms of across all matching documents. */
    public LazyResultSet<T> facet(String... fields) {
        facetFields.addAll(Arrays.asList(fields));
        return modified();
    }

    /** Sets the page size. */
    public LazyResultSet<T> limit(int size) {
        if (size < 0) {
            throw new InvalidQueryUsageException("Negative limit is not supported: " + size);
        }

        this.size = size;
        return modified();
    }

    public LazyResultSet<T> offset(int offset) {
        if (offset < 0) {
            throw new InvalidQueryUsageException("Negative offset is not supported: " + offset);
        }

        this.offset = offset;
        return modified();
    }

    /**
     * Restricts results to positions {@code start} (inclusive) to {@code stop} (exclusive) among
     * all matches, without running the search. Either bound may be left out to keep the current
     * offset or size. Always marks the result set dirty.
     */
    public LazyResultSet<T> slice(@Nullable Integer start, @Nullable Integer stop) {
        if ((start != null && start < 0) || (stop != null && stop < 0)) {
            throw new InvalidQueryUsageException("Negative indexing is not supported: [" +
                    start + ":" + stop + "]");
        }

        int newOffset = start == null ? offset : start;

        if (stop != null && stop < newOffset) {
            throw new InvalidQueryUsageException("Slice stop must not be before start: [" +
                    start + ":" + stop + "]");
        }

        offset = newOffset;

        if (stop != null) {
            size = stop - newOffset;
        }

        return modified();
    }

    public boolean isDirty() {
        return needsRefresh;
    }

    /** The query the search would currently run. */
    public Query query() {
        return Queries.combine(fragments);
    }

    public ObjectNode requestBody() {
        return Queries.buildRequestBody(query(), facetFields);
    }

    public Optional<String> sort() {
        return Optional.ofNullable(orderBy);
    }

    public int size() {
        return size;
    }

    public int offset() {
        return offset;
    }

    public List<String> facetFields() {
        return Collections.unmodifiableList(facetFields);
    }

    /**
     * Runs the search if the result set is dirty, caching the results. Completes with the cached
     * results straight away if it is clean.
     */
    public CompletableFuture<SearchResult<T>> fetch() {
        if (!needsRefresh) {
            return CompletableFuture.completedFuture(cached);
        }

        long fetchedAt = modifications;
        ObjectNode body = requestBody();

        log.debug("Searching {}/{} with {} (sort={}, size={}, from={})", type.index(),
                type.docType(), body, orderBy, size, offset);

        return client.search(type.index(), type.docType(), body, orderBy, size, offset)
                .thenApply(response -> {
                    SearchResult<T> result;

                    try {
                        result = SearchResult.fromResponse(response, type);
                    } catch (ElasticsearchException e) {
                        throw new CompletionException(e);
                    }

                    if (modifications == fetchedAt) {
                        cached = result;
                        needsRefresh = false;
                    }

                    return result;
                });
    }

    /** The number of documents on the current page. */
    public int count() throws ElasticsearchException, InterruptedException {
        return materialize().documents().size();
    }

    /** Runs the search if needed and returns the current page. */
    public SearchResult<T> materialize() throws ElasticsearchException, InterruptedException {
        if (!needsRefresh) {
            return cached;
        }

        try {
            return fetch().get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();

            if (cause instanceof ElasticsearchException) {
                throw (ElasticsearchException) cause;
            }

            throw new ElasticsearchException("Search of " + type.index() + "/" + type.docType() +
                    " failed", cause);
        }
    }

    public List<T> documents() throws ElasticsearchException, InterruptedException {
        return materialize().documents();
    }

    /**
     * @throws InvalidQueryUsageException If the index is negative.
     * @throws IndexOutOfBoundsException If there is no document at that position on the page.
     */
    public T get(int index) throws ElasticsearchException, InterruptedException {
        if (index < 0) {
            throw new InvalidQueryUsageException("Negative indexing is not supported: " + index);
        }

        List<T> documents = documents();

        if (index >= documents.size()) {
            throw new IndexOutOfBoundsException("No document at " + index + ", only " +
                    documents.size() + " on this page.");
        }

        return documents.get(index);
    }

    /**
     * Iterates over the documents on the current page, running the search first if needed.
     *
     * @throws CompletionException If the search fails or is interrupted, with the
     * {@link ElasticsearchException} or {@link InterruptedException} as its cause.
     */
    @Override
    public Iterator<T> iterator() {
        try {
            return documents().iterator();
        } catch (ElasticsearchException e) {
            throw new CompletionException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    public Map<String, List<FacetCount>> facets() throws ElasticsearchException,
            InterruptedException {
        return materialize().facets();
    }

    public long totalCount() throws ElasticsearchException, InterruptedException {
        return materialize().totalCount();
    }

    public Optional<Long> tookMillis() throws ElasticsearchException, InterruptedException {
        return materialize().tookMillis();
    }

    public boolean timedOut() throws ElasticsearchException, InterruptedException {
        return materialize().timedOut();
    }

    @Override
    public String toString() {
        return "LazyResultSet{" +
                "index=" + type.index() +
                ", docType=" + type.docType() +
                ", fragments=" + fragments +
                ", facetFields=" + facetFields +
                ", orderBy=" + orderBy +
                ", size=" + size +
                ", offset=" + offset +
                ", needsRefresh=" + needsRefresh +
                '}';
    }

    private LazyResultSet<T> modified() {
        modifications++;
        needsRefresh = true;
        return this;
    }

    private static <T> SearchResult<T> emptyResult() {
        return new SearchResult<>(ImmutableList.of(), Collections.emptyMap(), 0, null, false);
    }
}
