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

package org.esbtools.chatlog.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Everything needed to wire up a chat log: who we are on the network, where events are written,
 * and how often buffered sinks are flushed.
 */
public interface ChatLogConfig {
    /** The logger's own nick. Private messages and messages starting with "nick:" are commands. */
    String getNick();

    /** The network events are observed on, recorded as each event's origin. */
    String getNetwork();

    /** Host names or URLs of the store's nodes, in order of preference for ties. */
    List<String> getStoreNodes();

    String getStoreIndex();

    String getStoreDocType();

    /** How long one request to one store node may take before it is considered failed. */
    Duration getStoreRequestTimeout();

    /**
     * How many different nodes are tried for one request before giving up. Values less than one
     * mean every node.
     */
    int getStoreNodeAttemptLimit();

    Duration getFlushInterval();

    /** How long a flush waits for a single event to be recorded before requeueing it. */
    Duration getFlushDeliveryTimeout();

    Path getLogDirectory();

    /** Size in bytes at which the system log file is rotated. */
    long getSystemLogRotateLength();

    /** Channels which get their own daily log file. */
    List<String> getChannels();
}
