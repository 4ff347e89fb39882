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

/**
 * Thrown, or used to complete a future exceptionally, when a {@link ChatEventSink} could not
 * record an event.
 *
 * <p>When one dispatch fails for several sinks, the first failure is the cause and the others are
 * attached as suppressed exceptions.
 */
public class SinkFailureException extends Exception {
    public SinkFailureException(String message) {
        super(message);
    }

    public SinkFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
