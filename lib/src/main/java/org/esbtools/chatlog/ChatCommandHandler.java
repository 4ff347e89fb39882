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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Responds to commands addressed to the logger, either privately or by prefixing a channel
 * message with the logger's nick and a colon ({@code "logbot: search foo"}).
 *
 * <p>Supported commands:
 * <ul>
 *     <li>{@code help [topic]}</li>
 *     <li>{@code search <query>} searches recorded history via {@link ChatHistorySearch}</li>
 *     <li>{@code ignore [nick]} stops recording messages from a nick (the sender by default)</li>
 *     <li>{@code unignore [nick]} resumes recording messages from a nick</li>
 * </ul>
 */
public class ChatCommandHandler {
    private final String nick;
    private final IgnoreList ignoreList;
    private final ChatHistorySearch search;
    private final ChatReplier replier;
    private final Recording recording;

    /** Results below this count are replied wherever the search was asked. */
    static final int PUBLIC_RESULT_LIMIT = 2;

    /** Results below this count (and at or above the public limit) are listed privately. */
    static final int PRIVATE_RESULT_LIMIT = 10;

    private static final Logger log = LoggerFactory.getLogger(ChatCommandHandler.class);

    public ChatCommandHandler(String nick, IgnoreList ignoreList, ChatHistorySearch search,
            ChatReplier replier, Recording recording) {
        this.nick = Objects.requireNonNull(nick, "nick");
        this.ignoreList = Objects.requireNonNull(ignoreList, "ignoreList");
        this.search = Objects.requireNonNull(search, "search");
        this.replier = Objects.requireNonNull(replier, "replier");
        this.recording = Objects.requireNonNull(recording, "recording");
    }

    /**
     * @return {@code true} if the message was addressed to the logger and so was treated as a
     * command.
     */
    public boolean handle(String user, String channel, String message) {
        String replyTo = null;
        String command = message;

        if (channel.equals(nick)) {
            replyTo = user;
        }

        if (isAddressedTo(nick, message)) {
            command = message.substring(nick.length() + 1);
            replyTo = channel;
        }

        if (replyTo == null) {
            return false;
        }

        String[] split = command.trim().split("\\s+", 2);
        String name = split[0].toLowerCase();
        String args = split.length > 1 ? split[1] : null;

        log.debug("Handling command '{}' from {} on {} with args: {}", name, user, channel, args);

        Optional<String> reply;

        switch (name) {
            case "help":
                reply = Optional.of(help(args));
                break;
            case "search":
                reply = search(args, channel, user);
                break;
            case "ignore":
                reply = Optional.of(ignore(user, args == null ? user : args));
                break;
            case "unignore":
                reply = Optional.of(unignore(user, args == null ? user : args));
                break;
            default:
                reply = Optional.of("logger and searchbot - try \"help\"");
        }

        String target = replyTo;
        reply.ifPresent(text -> replier.reply(target, text));

        return true;
    }

    static boolean isAddressedTo(String nick, String message) {
        return message.startsWith(nick + ":");
    }

    private static String help(@Nullable String topic) {
        if ("search".equals(topic)) {
            return "search <lucene query> - searches for messages";
        }
        if ("ignore".equals(topic)) {
            return "ignore <optional: nick> - ignores you, or a given nick";
        }
        if ("unignore".equals(topic)) {
            return "unignore <optional: nick> - unignores you, or a given nick";
        }
        if ("stats".equals(topic)) {
            return "stats - returns some stats";
        }
        return "commands: search, ignore, unignore";
    }

    private String ignore(String requestedBy, String target) {
        if (!ignoreList.ignore(target)) {
            return target + " is already ignored, I can't ignore " + target + " any harder!";
        }

        recording.record(ChatEventKind.IGNORE, requestedBy, null, "IGNORING " + target);
        return "I'm now ignoring " + target;
    }

    private String unignore(String requestedBy, String target) {
        if (!ignoreList.unignore(target)) {
            return "I already wasn't ignoring " + target;
        }

        recording.record(ChatEventKind.UNIGNORE, requestedBy, null, "UNIGNORING " + target);
        return "I'm paying attention to " + target + " now";
    }

    /**
     * Starts a search and replies once it completes. Replies happen on whatever thread completes
     * the search.
     */
    private Optional<String> search(@Nullable String query, String channel, String user) {
        if (query == null || query.trim().isEmpty()) {
            return Optional.of(help("search"));
        }

        String replyTo = channel.equals(nick) ? user : channel;

        search.search(query).whenComplete((results, failure) -> {
            try {
                if (failure != null) {
                    log.warn("Search for '" + query + "' failed", failure);
                    replier.reply(replyTo, describeSearchFailure(failure));
                    return;
                }

                replyWithResults(results, replyTo, user);
            } catch (Exception e) {
                log.error("Failed to reply with results of search for '" + query + "'", e);
            }
        });

        return Optional.empty();
    }

    private void replyWithResults(List<ChatEvent> results, String replyTo, String user) {
        int count = results.size();

        if (count < PUBLIC_RESULT_LIMIT) {
            replier.reply(replyTo, count + " results returned");
            for (ChatEvent result : results) {
                replier.reply(replyTo, toResultLine(result));
            }
        } else if (count < PRIVATE_RESULT_LIMIT) {
            replier.reply(replyTo, count + " results returned");
            for (ChatEvent result : results) {
                replier.reply(user, toResultLine(result));
            }
        } else {
            replier.reply(replyTo, count + " results returned, narrow your search");
        }
    }

    private static String toResultLine(ChatEvent result) {
        return "[" + result.time() + "] <" + result.actor() + "> " + result.payload().orElse("");
    }

    private static String describeSearchFailure(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains("SearchPhaseExecutionException")) {
                return "Invalid Query";
            }
        }
        return "Something went wrong, please try again later";
    }

    /**
     * Records events the command handler itself produces, such as {@link ChatEventKind#IGNORE}.
     */
    public interface Recording {
        void record(ChatEventKind kind, String actor, @Nullable String channel,
                @Nullable String payload);
    }
}
