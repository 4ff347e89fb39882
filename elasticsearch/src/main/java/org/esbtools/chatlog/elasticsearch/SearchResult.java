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

import org.esbtools.chatlog.elasticsearch.client.ElasticsearchException;
import org.esbtools.chatlog.elasticsearch.model.Document;
import org.esbtools.chatlog.elasticsearch.model.DocumentType;
import org.esbtools.chatlog.elasticsearch.model.FacetCount;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One page of search results, as parsed from a search response. Immutable.
 *
 * @param <T> Model type of the documents
 */
public final class SearchResult<T> {
    private final List<T> documents;
    private final Map<String, List<FacetCount>> facets;
    private final long totalCount;
    @Nullable
    private final Long tookMillis;
    private final boolean timedOut;

    public SearchResult(List<T> documents, Map<String, List<FacetCount>> facets, long totalCount,
            @Nullable Long tookMillis, boolean timedOut) {
        this.documents = ImmutableList.copyOf(documents);
        this.facets = ImmutableMap.copyOf(facets);
        this.totalCount = totalCount;
        this.tookMillis = tookMillis;
        this.timedOut = timedOut;
    }

    /**
     * Reads the hit total ({@code hits.total}, either a number or an object with a {@code value}),
     * the hits themselves, any terms facets, and the {@code took} and {@code timed_out} stats.
     *
     * @throws ElasticsearchException If a hit cannot be read as the given document type.
     */
    public static <T> SearchResult<T> fromResponse(JsonNode response, DocumentType<T> type)
            throws ElasticsearchException {
        JsonNode hits = response.path("hits");
        JsonNode total = hits.path("total");
        long totalCount = total.isObject() ? total.path("value").asLong(0) : total.asLong(0);

        ImmutableList.Builder<T> documents = ImmutableList.builder();
        for (JsonNode hit : hits.path("hits")) {
            try {
                documents.add(type.fromDocument(Document.fromHit(hit)));
            } catch (IllegalArgumentException e) {
                throw new ElasticsearchException("Could not read search hit as " + type.docType() +
                        ": " + hit, e);
            }
        }

        ImmutableMap.Builder<String, List<FacetCount>> facets = ImmutableMap.builder();
        Iterator<Map.Entry<String, JsonNode>> facetFields = response.path("facets").fields();
        while (facetFields.hasNext()) {
            Map.Entry<String, JsonNode> facet = facetFields.next();
            ImmutableList.Builder<FacetCount> counts = ImmutableList.builder();
            for (JsonNode term : facet.getValue().path("terms")) {
                counts.add(new FacetCount(term.path("term").asText(), term.path("count").asLong()));
            }
            facets.put(facet.getKey(), counts.build());
        }

        JsonNode took = response.path("took");

        return new SearchResult<>(documents.build(), facets.build(), totalCount,
                took.isNumber() ? took.asLong() : null,
                response.path("timed_out").asBoolean(false));
    }

    /** The documents on this page. */
    public List<T> documents() {
        return documents;
    }

    /** Term counts per faceted field, in the order the store returned them. */
    public Map<String, List<FacetCount>> facets() {
        return facets;
    }

    /** How many documents matched in total, across all pages. */
    public long totalCount() {
        return totalCount;
    }

    public Optional<Long> tookMillis() {
        return Optional.ofNullable(tookMillis);
    }

    public boolean timedOut() {
        return timedOut;
    }

    @Override
    public String toString() {
        return "SearchResult{" +
                "documents=" + documents +
                ", facets=" + facets +
                ", totalCount=" + totalCount +
                ", tookMillis=" + tookMillis +
                ", timedOut=" + timedOut +
                '}';
    }
}
