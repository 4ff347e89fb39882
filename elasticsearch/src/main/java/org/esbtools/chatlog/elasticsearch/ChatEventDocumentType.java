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

import org.esbtools.chatlog.ChatEvent;
import org.esbtools.chatlog.ChatEventKind;
import org.esbtools.chatlog.elasticsearch.model.Document;
import org.esbtools.chatlog.elasticsearch.model.DocumentType;
import org.esbtools.chatlog.elasticsearch.model.FieldValue;

import java.util.Objects;

/**
 * Stores {@link ChatEvent}s as flat documents:
 *
 * <pre>{"message": ..., "user": ..., "channel": ..., "time": ..., "server": ..., "kind": ...}</pre>
 *
 * <p>{@code time} is seconds since the epoch. {@code channel} and {@code message} are left out when
 * the event has none.
 */
public class ChatEventDocumentType implements DocumentType<ChatEvent> {
    private final String index;
    private final String docType;

    public static final String MESSAGE = "message";
    public static final String USER = "user";
    public static final String CHANNEL = "channel";
    public static final String TIME = "time";
    public static final String SERVER = "server";
    public static final String KIND = "kind";

    public static final String DEFAULT_INDEX = "chatlines";
    public static final String DEFAULT_DOC_TYPE = "chatline";

    public ChatEventDocumentType() {
        this(DEFAULT_INDEX, DEFAULT_DOC_TYPE);
    }

    public ChatEventDocumentType(String index, String docType) {
        this.index = Objects.requireNonNull(index, "index");
        this.docType = Objects.requireNonNull(docType, "docType");
    }

    @Override
    public String index() {
        return index;
    }

    @Override
    public String docType() {
        return docType;
    }

    @Override
    public Document toDocument(ChatEvent event) {
        return Document.builder()
                .putIfPresent(MESSAGE, event.payload().orElse(null))
                .put(USER, event.actor())
                .putIfPresent(CHANNEL, event.channel().orElse(null))
                .put(TIME, FieldValue.of(event.time()))
                .put(SERVER, event.origin())
                .put(KIND, event.kind().name())
                .build();
    }

    @Override
    public ChatEvent fromDocument(Document document) {
        FieldValue time = document.get(TIME).orElseThrow(() ->
                new IllegalArgumentException("Chat event document has no time: " + document));
        FieldValue user = document.get(USER).orElseThrow(() ->
                new IllegalArgumentException("Chat event document has no user: " + document));

        ChatEventKind kind = document.get(KIND)
                .map(k -> ChatEventKind.valueOf(k.asString()))
                .orElse(ChatEventKind.MESSAGE);

        return new ChatEvent(
                time.asInstant(),
                user.asString(),
                document.get(CHANNEL).map(FieldValue::asString).orElse(null),
                kind,
                document.get(MESSAGE).map(FieldValue::asString).orElse(null),
                document.get(SERVER).map(FieldValue::asString).orElse(""));
    }
}
