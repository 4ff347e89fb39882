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

package org.esbtools.chatlog.elasticsearch.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The stored form of a model: an ordered map of field names to {@link FieldValue}s, plus the id
 * the store assigned it, if it has been stored. Immutable.
 */
public final class Document {
    @Nullable
    private final String id;
    private final Map<String, FieldValue> fields;

    private Document(@Nullable String id, Map<String, FieldValue> fields) {
        this.id = id;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a document from a search hit or get response, which has the fields under
     * {@code _source} and the id under {@code _id}. Null fields are left out.
     *
     * @throws IllegalArgumentException If there is no {@code _source} object, or a field has an
     * unsupported value.
     */
    public static Document fromHit(JsonNode hit) {
        JsonNode source = hit.path("_source");

        if (!source.isObject()) {
            throw new IllegalArgumentException("Expected _source object in hit: " + hit);
        }

        Builder builder = builder();
        JsonNode id = hit.path("_id");

        if (id.isValueNode() && !id.isNull()) {
            builder.id(id.asText());
        }

        Iterator<Map.Entry<String, JsonNode>> sourceFields = source.fields();
        while (sourceFields.hasNext()) {
            Map.Entry<String, JsonNode> field = sourceFields.next();
            if (!field.getValue().isNull()) {
                builder.put(field.getKey(), FieldValue.fromJson(field.getValue()));
            }
        }

        return builder.build();
    }

    public Optional<String> id() {
        return Optional.ofNullable(id);
    }

    public Map<String, FieldValue> fields() {
        return fields;
    }

    public Optional<FieldValue> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public Document withId(String id) {
        return new Document(Objects.requireNonNull(id, "id"), fields);
    }

    /** The fields as a JSON object, without the id. */
    public ObjectNode toJson() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        for (Map.Entry<String, FieldValue> field : fields.entrySet()) {
            json.set(field.getKey(), field.getValue().toJson());
        }
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Document document = (Document) o;
        return Objects.equals(id, document.id) && fields.equals(document.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fields);
    }

    @Override
    public String toString() {
        return "Document{id=" + id + ", fields=" + fields + "}";
    }

    public static final class Builder {
        @Nullable
        private String id;
        private final Map<String, FieldValue> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(@Nullable String id) {
            this.id = id;
            return this;
        }

        public Builder put(String field, FieldValue value) {
            fields.put(Objects.requireNonNull(field, "field"),
                    Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String field, String value) {
            return put(field, FieldValue.of(value));
        }

        /** Does nothing if the value is null. */
        public Builder putIfPresent(String field, @Nullable String value) {
            if (value != null) {
                put(field, value);
            }
            return this;
        }

        public Document build() {
            return new Document(id, fields);
        }
    }
}
