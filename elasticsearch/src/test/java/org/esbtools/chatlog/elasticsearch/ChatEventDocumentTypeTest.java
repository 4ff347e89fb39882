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

import static com.google.common.truth.Truth.assertThat;

import org.esbtools.chatlog.ChatEvent;
import org.esbtools.chatlog.ChatEventKind;
import org.esbtools.chatlog.elasticsearch.model.Document;
import org.esbtools.chatlog.elasticsearch.model.FieldValue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.math.BigDecimal;
import java.time.Instant;

@RunWith(JUnit4.class)
public class ChatEventDocumentTypeTest {
    ChatEventDocumentType type = new ChatEventDocumentType();
    ObjectMapper mapper = new ObjectMapper();

    Instant time = Instant.parse("2016-03-01T14:02:11.250Z");

    @Test
    public void shouldStoreEventFieldsWithTimeInEpochSeconds() throws Exception {
        ChatEvent event = new ChatEvent(time, "alice", "#esb", ChatEventKind.MESSAGE, "hi",
                "freenode");

        ObjectNode json = type.toDocument(event).toJson();

        assertThat(json.remove("time").decimalValue()).isEquivalentAccordingToCompareTo(
                new BigDecimal("1456840931.25"));
        assertThat(json).isEqualTo(mapper.readTree(
                "{\"message\":\"hi\",\"user\":\"alice\",\"channel\":\"#esb\"," +
                        "\"server\":\"freenode\",\"kind\":\"MESSAGE\"}"));
    }

    @Test
    public void shouldLeaveOutChannelAndMessageWhenEventHasNone() {
        ChatEvent event = new ChatEvent(time, ChatEvent.SYSTEM_ACTOR, null,
                ChatEventKind.CONNECT, null, "freenode");

        Document document = type.toDocument(event);

        assertThat(document.fields()).doesNotContainKey(ChatEventDocumentType.CHANNEL);
        assertThat(document.fields()).doesNotContainKey(ChatEventDocumentType.MESSAGE);
        assertThat(type.fromDocument(document)).isEqualTo(event);
    }

    @Test
    public void shouldReadDocumentsWrittenWithoutKindOrServer() {
        Document document = Document.builder()
                .put(ChatEventDocumentType.USER, "bob")
                .put(ChatEventDocumentType.TIME, FieldValue.of(1456840931L))
                .put(ChatEventDocumentType.MESSAGE, "old line")
                .build();

        ChatEvent event = type.fromDocument(document);

        assertThat(event.kind()).isEqualTo(ChatEventKind.MESSAGE);
        assertThat(event.origin()).isEmpty();
        assertThat(event.time()).isEqualTo(Instant.parse("2016-03-01T14:02:11Z"));
        assertThat(event.payload().orElse(null)).isEqualTo("old line");
    }

    @Test
    public void shouldReadBackMillisecondEventTimesExactlyFromStoredJson() throws Exception {
        ChatEvent event = new ChatEvent(time, "alice", "#esb", ChatEventKind.ACTION,
                "* alice waves", "freenode");
        ObjectNode hit = mapper.createObjectNode().put("_id", "1");
        hit.set("_source", mapper.readTree(type.toDocument(event).toJson().toString()));

        assertThat(type.fromDocument(Document.fromHit(hit))).isEqualTo(event);
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectDocumentsWithoutUser() {
        type.fromDocument(Document.builder()
                .put(ChatEventDocumentType.TIME, FieldValue.of(1456840931L))
                .build());
    }
}
