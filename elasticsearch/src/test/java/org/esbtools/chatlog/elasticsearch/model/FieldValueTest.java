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

import static com.google.common.truth.Truth.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;

@RunWith(JUnit4.class)
public class FieldValueTest {
    ObjectMapper mapper = new ObjectMapper();

    @Test
    public void shouldWriteTimestampsAsEpochSecondsWithoutExponent() {
        FieldValue time = FieldValue.of(Instant.parse("2016-03-01T14:02:11.250Z"));

        assertThat(time.toJson().toString()).isEqualTo("1456840931.250");
    }

    @Test
    public void shouldReadEpochSecondsAsInstantToTheMillisecond() throws Exception {
        FieldValue read = FieldValue.fromJson(mapper.readTree("1456840931.2504"));

        assertThat(read.kind()).isEqualTo(FieldValue.Kind.NUMBER);
        assertThat(read.asInstant()).isEqualTo(Instant.parse("2016-03-01T14:02:11.250Z"));
    }

    @Test
    public void shouldConsiderNumbersEqualRegardlessOfScale() {
        assertThat(FieldValue.of(new BigDecimal("2.50"))).isEqualTo(FieldValue.of(new BigDecimal("2.5")));
        assertThat(FieldValue.of(new BigDecimal("2.50")).hashCode())
                .isEqualTo(FieldValue.of(new BigDecimal("2.5")).hashCode());
    }

    @Test
    public void shouldReadArraysAsStringLists() throws Exception {
        FieldValue list = FieldValue.fromJson(mapper.readTree("[\"a\", 2, true]"));

        assertThat(list.asStrings()).containsExactly("a", "2", "true").inOrder();
        assertThat(list.asString()).isEqualTo("a,2,true");
        assertThat(FieldValue.of(Arrays.asList("a", "2", "true"))).isEqualTo(list);
    }

    @Test
    public void shouldWriteStringListsAsArrays() {
        FieldValue list = FieldValue.of(Arrays.asList("#esb", "#lightblue"));

        assertThat(list.kind()).isEqualTo(FieldValue.Kind.STRING_LIST);
        assertThat(list.toJson().toString()).isEqualTo("[\"#esb\",\"#lightblue\"]");
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectObjects() throws Exception {
        FieldValue.fromJson(mapper.readTree("{\"nested\":true}"));
    }

    @Test(expected = IllegalStateException.class)
    public void shouldNotReadStringsAsNumbers() {
        FieldValue.of("twelve").asNumber();
    }
}
