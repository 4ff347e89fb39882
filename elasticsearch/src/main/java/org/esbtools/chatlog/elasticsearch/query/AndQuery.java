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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Matches documents which match every one of its fragments. The fragments are used as a filter
 * inside a constant score query, so they all contribute equally (not at all) to relevance:
 *
 * <pre>{"constant_score": {"filter": {"and": [...]}}}</pre>
 *
 * <p>Free text fragments are wrapped in a {@code query} element, since the filter syntax requires
 * it.
 */
public final class AndQuery implements Query {
    private final List<Query> fragments;

    /**
     * @throws IllegalArgumentException If there are no fragments.
     */
    public AndQuery(List<? extends Query> fragments) {
        if (fragments.isEmpty()) {
            throw new IllegalArgumentException("AndQuery needs at least one fragment.");
        }
        this.fragments = ImmutableList.copyOf(fragments);
    }

    public List<Query> fragments() {
        return fragments;
    }

    @Override
    public JsonNode toJson() {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        ObjectNode query = factory.objectNode();
        ArrayNode and = query.putObject("constant_score").putObject("filter").putArray("and");

        for (Query fragment : fragments) {
            if (fragment instanceof FreeTextQuery) {
                and.addObject().set("query", fragment.toJson());
            } else {
                and.add(fragment.toJson());
            }
        }

        return query;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fragments.equals(((AndQuery) o).fragments);
    }

    @Override
    public int hashCode() {
        return fragments.hashCode();
    }

    @Override
    public String toString() {
        return "AndQuery" + fragments;
    }
}
