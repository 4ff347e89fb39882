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

import org.esbtools.chatlog.elasticsearch.model.FieldValue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Matches documents whose field has exactly the given value: {@code {"term": {field: value}}}.
 */
public final class TermQuery implements Query {
    private final String field;
    private final FieldValue value;

    public TermQuery(String field, String value) {
        this(field, FieldValue.of(value));
    }

    public TermQuery(String field, FieldValue value) {
        this.field = Objects.requireNonNull(field, "field");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String field() {
        return field;
    }

    public FieldValue value() {
        return value;
    }

    @Override
    public JsonNode toJson() {
        ObjectNode term = JsonNodeFactory.instance.objectNode();
        term.putObject("term").set(field, value.toJson());
        return term;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TermQuery termQuery = (TermQuery) o;
        return field.equals(termQuery.field) && value.equals(termQuery.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, value);
    }

    @Override
    public String toString() {
        return "TermQuery(" + field + "=" + value + ")";
    }
}
