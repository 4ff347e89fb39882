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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Any JSON, passed to the store as is. Useful for query types nothing else here supports, like
 * ranges.
 *
 * <p>As the only fragment of a query, this is the entire request body: it is not wrapped in a
 * {@code query} element and no facets are added to it.
 */
public final class RawQuery implements Query {
    private final JsonNode json;

    /**
     * @throws IllegalArgumentException If the JSON is not an object.
     */
    public RawQuery(JsonNode json) {
        if (!Objects.requireNonNull(json, "json").isObject()) {
            throw new IllegalArgumentException("Raw query must be a JSON object but was: " + json);
        }
        this.json = json.deepCopy();
    }

    @Override
    public JsonNode toJson() {
        return json.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return json.equals(((RawQuery) o).json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    @Override
    public String toString() {
        return "RawQuery(" + json + ")";
    }
}
