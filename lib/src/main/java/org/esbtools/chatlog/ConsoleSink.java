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

import java.util.concurrent.CompletableFuture;

/**
 * Writes every event straight through to the application log, as formatted by
 * {@link ChatEventLines}, on the caller's thread.
 */
public class ConsoleSink implements ChatEventSink {
    private final Logger console;
    private final ChatEventLines lines;

    public static final String CONSOLE_LOGGER_NAME = "chatlog.console";

    public ConsoleSink() {
        this(LoggerFactory.getLogger(CONSOLE_LOGGER_NAME), ChatEventLines.inSystemZone());
    }

    public ConsoleSink(Logger console, ChatEventLines lines) {
        this.console = console;
        this.lines = lines;
    }

    @Override
    public CompletableFuture<Void> log(ChatEvent event) {
        console.info("{}", lines.toLine(event));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String toString() {
        return "ConsoleSink{" + console.getName() + "}";
    }
}
