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

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.esbtools.chatlog.testing.ChatEvents;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@RunWith(JUnit4.class)
public class ChatCommandHandlerTest {
    static final String NICK = "logbot";

    ChatReplier replier = mock(ChatReplier.class);
    IgnoreList ignoreList = new IgnoreList();
    List<String> searches = new ArrayList<>();
    List<String> recorded = new ArrayList<>();

    CompletableFuture<List<ChatEvent>> searchResult =
            CompletableFuture.completedFuture(Collections.emptyList());

    ChatHistorySearch search = query -> {
        searches.add(query);
        return searchResult;
    };

    ChatCommandHandler handler = new ChatCommandHandler(NICK, ignoreList, search, replier,
            (kind, actor, channel, payload) -> recorded.add(kind + " " + actor + " " + payload));

    @Test
    public void shouldIgnoreMessagesNotAddressedToTheLogger() {
        assertThat(handler.handle("alice", "#a", "search foo")).isFalse();

        verify(replier, never()).reply(anyString(), anyString());
        assertThat(searches).isEmpty();
    }

    @Test
    public void shouldReplyToChannelWhenAddressedWithNickPrefix() {
        assertThat(handler.handle("alice", "#a", "logbot: help")).isTrue();

        verify(replier).reply("#a", "commands: search, ignore, unignore");
    }

    @Test
    public void shouldReplyToUserWhenMessagedPrivately() {
        assertThat(handler.handle("alice", NICK, "help search")).isTrue();

        verify(replier).reply("alice", "search <lucene query> - searches for messages");
    }

    @Test
    public void shouldAnswerUnknownCommandsWithHint() {
        handler.handle("alice", NICK, "dance");

        verify(replier).reply("alice", "logger and searchbot - try \"help\"");
    }

    @Test
    public void shouldIgnoreSenderByDefaultAndRecordIgnoreEvent() {
        handler.handle("alice", "#a", "logbot: ignore");

        assertThat(ignoreList.isIgnored("alice")).isTrue();
        assertThat(ignoreList.ignored()).containsExactly("alice");
        assertThat(recorded).containsExactly("IGNORE alice IGNORING alice");
        verify(replier).reply("#a", "I'm now ignoring alice");
    }

    @Test
    public void shouldNotRecordIgnoreOfAlreadyIgnoredNick() {
        ignoreList.ignore("bob");

        handler.handle("alice", NICK, "ignore bob");

        assertThat(recorded).isEmpty();
        verify(replier).reply("alice", "bob is already ignored, I can't ignore bob any harder!");
    }

    @Test
    public void shouldUnignoreNickAndRecordUnignoreEvent() {
        ignoreList.ignore("bob");

        handler.handle("alice", NICK, "unignore bob");

        assertThat(ignoreList.isIgnored("bob")).isFalse();
        assertThat(ignoreList.ignored()).isEmpty();
        assertThat(recorded).containsExactly("UNIGNORE alice UNIGNORING bob");
        verify(replier).reply("alice", "I'm paying attention to bob now");
    }

    @Test
    public void shouldSayWhenUnignoringNickWhichWasNotIgnored() {
        handler.handle("alice", NICK, "unignore");

        verify(replier).reply("alice", "I already wasn't ignoring alice");
    }

    @Test
    public void shouldSearchWithEverythingAfterCommand() {
        handler.handle("alice", "#a", "logbot: search user:bob AND hello");

        assertThat(searches).containsExactly("user:bob AND hello");
    }

    @Test
    public void shouldReplySingleResultWhereAsked() {
        searchResult = CompletableFuture.completedFuture(
                Collections.singletonList(ChatEvents.message("bob", "#a", "hello")));

        handler.handle("alice", "#a", "logbot: search hello");

        verify(replier).reply("#a", "1 results returned");
        verify(replier).reply("#a", "[2016-03-01T14:02:11Z] <bob> hello");
    }

    @Test
    public void shouldListSeveralResultsPrivately() {
        List<ChatEvent> results = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            results.add(ChatEvents.message("bob", "#a", "hello " + i));
        }
        searchResult = CompletableFuture.completedFuture(results);

        handler.handle("alice", "#a", "logbot: search hello");

        verify(replier).reply("#a", "3 results returned");
        verify(replier, times(3)).reply(eq("alice"), anyString());
    }

    @Test
    public void shouldAskToNarrowSearchWithTooManyResults() {
        List<ChatEvent> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            results.add(ChatEvents.message("bob", "#a", "hello " + i));
        }
        searchResult = CompletableFuture.completedFuture(results);

        handler.handle("alice", "#a", "logbot: search hello");

        verify(replier).reply("#a", "10 results returned, narrow your search");
        verify(replier, never()).reply(eq("alice"), anyString());
    }

    @Test
    public void shouldReplyInvalidQueryWhenStoreRejectsQuery() {
        CompletableFuture<List<ChatEvent>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new Exception("Store error",
                new Exception("SearchPhaseExecutionException[Failed to execute phase]")));
        searchResult = failed;

        handler.handle("alice", "#a", "logbot: search ((");

        verify(replier).reply("#a", "Invalid Query");
    }

    @Test
    public void shouldReplyGenericFailureWhenSearchFailsOtherwise() {
        CompletableFuture<List<ChatEvent>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new Exception("Connection refused"));
        searchResult = failed;

        handler.handle("alice", "#a", "logbot: search hello");

        verify(replier).reply("#a", "Something went wrong, please try again later");
    }

    @Test
    public void shouldShowSearchHelpWhenSearchHasNoQuery() {
        handler.handle("alice", NICK, "search");

        assertThat(searches).isEmpty();
        verify(replier).reply("alice", "search <lucene query> - searches for messages");
    }
}
