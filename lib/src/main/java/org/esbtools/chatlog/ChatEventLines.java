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

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats {@link ChatEvent}s as single human readable log lines, like:
 *
 * <pre>[#esbtools] Tue Mar  1 14:02:11 2016 :  &lt;alechenninger&gt; hello there</pre>
 *
 * <p>System events, which have no channel, are shown under {@link #SYSTEM_CHANNEL}.
 */
public final class ChatEventLines {
    public static final String SYSTEM_CHANNEL = "SYSTEM_LOG";

    private final DateTimeFormatter timeFormat;

    private static final String ASCTIME_PATTERN = "EEE MMM ppd HH:mm:ss yyyy";

    public ChatEventLines(ZoneId zone) {
        this.timeFormat = DateTimeFormatter.ofPattern(ASCTIME_PATTERN, Locale.US)
                .withZone(Objects.requireNonNull(zone, "zone"));
    }

    public static ChatEventLines inSystemZone() {
        return new ChatEventLines(ZoneId.systemDefault());
    }

    public String toLine(ChatEvent event) {
        return "[" + event.channel().orElse(SYSTEM_CHANNEL) + "] " +
                timeFormat.format(event.time()) + " :  <" + event.actor() + "> " +
                event.payload().orElse("");
    }
}
