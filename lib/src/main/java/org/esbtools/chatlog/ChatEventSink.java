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

import java.util.concurrent.CompletableFuture;

/**
 * A destination which durably (or semi-durably) records {@link ChatEvent}s: the console, files on
 * disk, a search index...
 *
 * <p>Implementations may perform I/O, including network I/O, and so report their outcome
 * asynchronously. The returned future completes normally once the event is recorded, or
 * exceptionally if it could not be. Implementations may also throw directly if they fail before
 * any work could be started; callers should treat both the same way.
 *
 * @see BufferedSink
 * @see EventDispatcher
 */
public interface ChatEventSink {
    CompletableFuture<Void> log(ChatEvent event);
}
