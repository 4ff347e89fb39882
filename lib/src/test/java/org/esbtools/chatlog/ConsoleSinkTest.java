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

import org.esbtools.chatlog.testing.ChatEvents;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

@RunWith(JUnit4.class)
public class ConsoleSinkTest {
    Logger console = (Logger) LoggerFactory.getLogger("chatlog.console.test");
    ListAppender<ILoggingEvent> appender = new ListAppender<>();

    ConsoleSink sink = new ConsoleSink(console, new ChatEventLines(ZoneOffset.UTC));

    @Before
    public void attachAppender() {
        appender.start();
        console.addAppender(appender);
    }

    @After
    public void detachAppender() {
        console.detachAppender(appender);
        appender.stop();
    }

    @Test
    public void shouldWriteFormattedLineImmediately() {
        CompletableFuture<Void> result = sink.log(ChatEvents.message("alice", "#a", "hello"));

        assertThat(result.isDone()).isTrue();
        assertThat(appender.list).hasSize(1);
        assertThat(appender.list.get(0).getFormattedMessage())
                .isEqualTo("[#a] Tue Mar  1 14:02:11 2016 :  <alice> hello");
    }

    @Test
    public void shouldNotInterpretPayloadAsFormatPattern() {
        sink.log(ChatEvents.message("alice", "#a", "look {} here"));

        assertThat(appender.list.get(0).getFormattedMessage()).endsWith("<alice> look {} here");
    }
}
