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

package org.esbtools.chatlog.elasticsearch.query;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

public abstract class Queries {
    /**
     * Turns fragments into one query: {@link MatchAllQuery} if there are none, the fragment itself
     * if it is a lone {@link RawQuery}, otherwise an {@link AndQuery} of all of them.
     */
    public static Query combine(List<? extends Query> fragments) {
        if (fragments.isEmpty()) {
            return MatchAllQuery.INSTANCE;
        }

        if (fragments.size() == 1 && fragments.get(0) instanceof RawQuery) {
            return fragments.get(0);
        }

        return new AndQuery(fragments);
    }

    /**
     * Builds a search request body, {@code {"query": ..., "facets": ...}}. The facets element is
     * only included if facets are requested, with one terms facet per field, named after it.
     *
     * <p>A {@link RawQuery} is returned as is, without facets.
     */
    public static ObjectNode buildRequestBody(Query query, List<String> facetFields) {
        if (query instanceof RawQuery) {
            return (ObjectNode) query.toJson();
        }

        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.set("query", query.toJson());

        if (!facetFields.isEmpty()) {
            ObjectNode facets = body.putObject("facets");
            for (String field : facetFields) {
                facets.putObject(field).putObject("terms").put("field", field);
            }
        }

        return body;
    }

    /**
     * @return A {@link FreeTextQuery} for the text if there is some, followed by a
     * {@link TermQuery} for each field and value in iteration order.
     */
    public static List<Query> parseQuery(@Nullable String freeText,
            Map<String, String> fieldEquals) {
        ImmutableList.Builder<Query> queries = ImmutableList.builder();

        if (freeText != null && !freeText.isEmpty()) {
            queries.add(new FreeTextQuery(freeText));
        }

        for (Map.Entry<String, String> fieldEqual : fieldEquals.entrySet()) {
            queries.add(new TermQuery(fieldEqual.getKey(), fieldEqual.getValue()));
        }

        return queries.build();
    }
}
