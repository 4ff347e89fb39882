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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Turns chat network callbacks into {@link ChatEvent}s and dispatches them to the configured
 * sinks. Each callback produces at most one event.
 *
 * <p>Messages sent privately to the logger, messages addressed to it ({@code "nick: ..."}), and
 * messages from ignored nicks are not recorded; they are only written to the debug log. Private
 * and addressed messages are then handed to a {@link ChatCommandHandler}.
 *
 * <p>Event times come from the provided clock, truncated to milliseconds, but never go backwards:
 * if the clock reports a time earlier than the last event's, the last event's time is reused.
 */
public class ChatEventRecorder implements ChatEventListener {
    private final String nick;
    private final String origin;
    private final EventDispatcher dispatcher;
    private final IgnoreList ignoreList;
    private final ChatCommandHandler commands;
    private final Clock clock;

    private Instant lastEventTime = Instant.MIN;

    private static final Logger log = LoggerFactory.getLogger(ChatEventRecorder.class);

    /**
     * @param nick The logger's own nick on the network, used to recognize private and addressed
     *             messages.
     * @param origin The network the events come from, recorded with each event.
     */
    public ChatEventRecorder(String nick, String origin, EventDispatcher dispatcher,
            IgnoreList ignoreList, ChatHistorySearch search, ChatReplier replier, Clock clock) {
        this.nick = Objects.requireNonNull(nick, "nick");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.ignoreList = Objects.requireNonNull(ignoreList, "ignoreList");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.commands = new ChatCommandHandler(nick, ignoreList, search, replier, this::record);
    }

    @Override
    public void onConnect() {
        record(ChatEventKind.CONNECT, ChatEvent.SYSTEM_ACTOR, null, "CONNECTION ESTABLISHED");
    }

    @Override
    public void onDisconnect(String reason) {
        record(ChatEventKind.DISCONNECT, ChatEvent.SYSTEM_ACTOR, null, "CONNECTION LOST: " + reason);
    }

    @Override
    public void onJoin(String channel) {
        record(ChatEventKind.JOIN, ChatEvent.SYSTEM_ACTOR, null, "JOINED CHANNEL (" + channel + ")");
    }

    @Override
    public void onMessage(String actor, String channel, String text) {
        boolean isPrivate = channel.equals(nick);

        if (isPrivate || ignoreList.isIgnored(actor) || ChatCommandHandler.isAddressedTo(nick, text)) {
            log.debug("Not recording message from {} on {}: {}", actor, channel, text);
        } else {
            record(ChatEventKind.MESSAGE, actor, channel, text);
        }

        try {
            commands.handle(actor, channel, text);
        } catch (Exception e) {
            log.error("Failed to handle possible command from " + actor + " on " + channel +
                    ": " + text, e);
        }
    }

    @Override
    public void onAction(String actor, String channel, String text) {
        record(ChatEventKind.ACTION, actor, channel, "* " + actor + " " + text);
    }

    @Override
    public void onNickChange(String oldNick, String newNick) {
        record(ChatEventKind.NICK_CHANGE, ChatEvent.SYSTEM_ACTOR, null,
                oldNick + " CHANGED NICK TO " + newNick);
    }

    @Override
    public void onUserJoined(String actor, String channel) {
        record(ChatEventKind.JOIN, actor, channel, actor + " JOINED " + channel);
    }

    @Override
    public void onUserLeft(String actor, String channel) {
        record(ChatEventKind.LEAVE, actor, channel, actor + " LEFT " + channel);
    }

    /**
     * Captures a new event now and dispatches it. Sink failures are logged by the dispatcher and
     * otherwise only reported through the returned future.
     */
    public CompletableFuture<Void> record(ChatEventKind kind, String actor, @Nullable String channel,
            @Nullable String payload) {
        ChatEvent event = new ChatEvent(nextEventTime(), actor, channel, kind, payload, origin);
        return dispatcher.dispatch(event);
    }

    private synchronized Instant nextEventTime() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        if (now.isBefore(lastEventTime)) {
            now = lastEventTime;
        }

        lastEventTime = now;
        return now;
    }
}
