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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.collect.ImmutableList;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A single value of a {@link Document} field. Only a few kinds of values are supported: strings,
 * numbers, timestamps and lists of strings.
 *
 * <p>Timestamps are stored as (possibly fractional) seconds since the epoch. Since that is just a
 * number in the store, values read back from the store are never {@link Kind#TIMESTAMP}; use
 * {@link #asInstant()} on the number instead.
 */
public final class FieldValue {
    private final Kind kind;
    private final Object value;
    private final ImmutableList<String> strings;

    public enum Kind {
        STRING, NUMBER, TIMESTAMP, STRING_LIST
    }

    private FieldValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
        this.strings = ImmutableList.of();
    }

    private FieldValue(ImmutableList<String> strings) {
        this.kind = Kind.STRING_LIST;
        this.value = strings;
        this.strings = strings;
    }

    public static FieldValue of(String value) {
        return new FieldValue(Kind.STRING, value);
    }

    public static FieldValue of(long value) {
        return new FieldValue(Kind.NUMBER, BigDecimal.valueOf(value));
    }

    public static FieldValue of(BigDecimal value) {
        return new FieldValue(Kind.NUMBER, value);
    }

    public static FieldValue of(Instant value) {
        return new FieldValue(Kind.TIMESTAMP, value);
    }

    public static FieldValue of(List<String> values) {
        return new FieldValue(ImmutableList.copyOf(values));
    }

    /**
     * @throws IllegalArgumentException If the JSON is not a string, number, or array of strings.
     */
    public static FieldValue fromJson(JsonNode json) {
        if (json.isTextual()) {
            return of(json.asText());
        }

        if (json.isNumber()) {
            return of(json.decimalValue());
        }

        if (json.isArray()) {
            ImmutableList.Builder<String> strings = ImmutableList.builder();
            for (JsonNode element : json) {
                if (!element.isValueNode() || element.isNull()) {
                    throw new IllegalArgumentException("Unsupported list element: " + element);
                }
                strings.add(element.asText());
            }
            return of(strings.build());
        }

        throw new IllegalArgumentException("Unsupported field value: " + json);
    }

    public Kind kind() {
        return kind;
    }

    public JsonNode toJson() {
        JsonNodeFactory json = JsonNodeFactory.withExactBigDecimals(true);

        switch (kind) {
            case STRING:
                return json.textNode((String) value);
            case NUMBER:
                return json.numberNode((BigDecimal) value);
            case TIMESTAMP:
                return json.numberNode(toEpochSeconds((Instant) value));
            case STRING_LIST:
                ArrayNode array = json.arrayNode();
                for (String element : strings) {
                    array.add(element);
                }
                return array;
            default:
                throw new IllegalStateException("Unknown kind: " + kind);
        }
    }

    /** Strings as they are, numbers and timestamps as their JSON text, lists joined by commas. */
    public String asString() {
        switch (kind) {
            case STRING:
                return (String) value;
            case STRING_LIST:
                return String.join(",", asStrings());
            default:
                return toJson().asText();
        }
    }

    public BigDecimal asNumber() {
        switch (kind) {
            case NUMBER:
                return (BigDecimal) value;
            case TIMESTAMP:
                return toEpochSeconds((Instant) value);
            default:
                throw new IllegalStateException("Not a number: " + this);
        }
    }

    /**
     * Reads a timestamp, or a number of seconds since the epoch, as an instant with millisecond
     * precision.
     */
    public Instant asInstant() {
        if (kind == Kind.TIMESTAMP) {
            return (Instant) value;
        }

        BigDecimal millis = asNumber().movePointRight(3);
        return Instant.ofEpochMilli(millis.setScale(0, RoundingMode.HALF_UP).longValueExact());
    }

    public List<String> asStrings() {
        if (kind != Kind.STRING_LIST) {
            throw new IllegalStateException("Not a list of strings: " + this);
        }
        return strings;
    }

    private static BigDecimal toEpochSeconds(Instant instant) {
        return BigDecimal.valueOf(instant.toEpochMilli()).movePointLeft(3);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldValue that = (FieldValue) o;
        if (kind == Kind.NUMBER && that.kind == Kind.NUMBER) {
            return ((BigDecimal) value).compareTo((BigDecimal) that.value) == 0;
        }
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        if (kind == Kind.NUMBER) {
            return Objects.hash(kind, ((BigDecimal) value).stripTrailingZeros());
        }
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
