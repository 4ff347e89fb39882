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
import static org.junit.Assert.fail;

import org.esbtools.chatlog.testing.ChatEvents;
import org.esbtools.chatlog.testing.FailingSink;
import org.esbtools.chatlog.testing.RecordingSink;
import org.esbtools.chatlog.testing.TestLogger;

import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

@RunWith(JUnit4.class)
public class EventDispatcherTest {
    @Rule
    public TestLogger testLogger = new TestLogger();

    ChatEvent hello = ChatEvents.message("alice", "#a", "hello");

    @Test
    public void shouldLogEventToEverySink() throws Exception {
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();
        EventDispatcher dispatcher = new EventDispatcher(Arrays.asList(first, second));

        dispatcher.dispatch(hello).get(1, TimeUnit.SECONDS);

        assertThat(first.logged()).containsExactly(hello);
        assertThat(second.logged()).containsExactly(hello);
    }

    @Test
    public void shouldStillLogToRemainingSinksWhenOneThrows() throws Exception {
        RecordingSink after = new RecordingSink();
        EventDispatcher dispatcher = new EventDispatcher(
                Arrays.asList(FailingSink.throwing(), after));

        CompletableFuture<Void> result = dispatcher.dispatch(hello);

        assertThat(after.logged()).containsExactly(hello);
        assertThat(result.isCompletedExceptionally()).isTrue();
    }

    @Test
    public void shouldFailWithSinkFailureExceptionSuppressingAdditionalFailures() throws Exception {
        RecordingSink ok = new RecordingSink();
        EventDispatcher dispatcher = new EventDispatcher(Arrays.asList(
                FailingSink.withFailedFutures(), ok, FailingSink.throwing()));

        try {
            dispatcher.dispatch(hello).get(1, TimeUnit.SECONDS);
            fail("Expected dispatch to fail");
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(SinkFailureException.class);
            assertThat(e.getCause().getCause()).hasMessageThat().isEqualTo("Simulated failure");
            assertThat(e.getCause().getSuppressed()).hasLength(1);
            assertThat(e.getCause().getSuppressed()[0])
                    .hasMessageThat().isEqualTo("Simulated thrown failure");
        }

        assertThat(ok.logged()).containsExactly(hello);
    }

    @Test
    public void shouldAcceptEventImmediatelyWhenSinksAreBuffered() throws Exception {
        BufferedSink<FailingSink> buffered = new BufferedSink<>(FailingSink.withFailedFutures());
        EventDispatcher dispatcher = new EventDispatcher(Arrays.asList(buffered));

        CompletableFuture<Void> result = dispatcher.dispatch(hello);

        assertThat(result.isDone()).isTrue();
        assertThat(result.isCompletedExceptionally()).isFalse();
        assertThat(buffered.buffered()).containsExactly(hello);
    }
}
