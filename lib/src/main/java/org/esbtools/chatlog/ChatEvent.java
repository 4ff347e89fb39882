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

package org.esbtools.chatlog;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable record of something observed on a chat network: a message, an action, a user
 * joining, the connection dropping, and so on.
 *
 * <p>Events without a channel are system events. These are not tied to any one conversation, like
 * connecting or a nick change.
 */
public final class ChatEvent {
    private final Instant time;
    private final String actor;
    @Nullable
    private final String channel;
    private final ChatEventKind kind;
    @Nullable
    private final String payload;
    private final String origin;

    /** Actor used for events the logger itself produces rather than some chat user. */
    public static final String SYSTEM_ACTOR = "SYSTEM";

    public ChatEvent(Instant time, String actor, @Nullable String channel, ChatEventKind kind,
            @Nullable String payload, String origin) {
        this.time = Objects.requireNonNull(time, "time");
        this.actor = Objects.requireNonNull(actor, "actor");
        this.channel = channel;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.payload = payload;
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public static ChatEvent system(Instant time, ChatEventKind kind, String payload, String origin) {
        return new ChatEvent(time, SYSTEM_ACTOR, null, kind, payload, origin);
    }

    public Instant time() {
        return time;
    }

    public String actor() {
        return actor;
    }

    public Optional<String> channel() {
        return Optional.ofNullable(channel);
    }

    public ChatEventKind kind() {
        return kind;
    }

    public Optional<String> payload() {
        return Optional.ofNullable(payload);
    }

    /** The network (host) the event was observed on. */
    public String origin() {
        return origin;
    }

    public boolean isSystemEvent() {
        return channel == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChatEvent chatEvent = (ChatEvent) o;
        return Objects.equals(time, chatEvent.time) &&
                Objects.equals(actor, chatEvent.actor) &&
                Objects.equals(channel, chatEvent.channel) &&
                kind == chatEvent.kind &&
                Objects.equals(payload, chatEvent.payload) &&
                Objects.equals(origin, chatEvent.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, actor, channel, kind, payload, origin);
    }

    @Override
    public String toString() {
        return "ChatEvent{" +
                "time=" + time +
                ", actor='" + actor + '\'' +
                ", channel='" + channel + '\'' +
                ", kind=" + kind +
                ", payload='" + payload + '\'' +
                ", origin='" + origin + '\'' +
                '}';
    }
}
