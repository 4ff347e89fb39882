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

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * {@link ChatLogConfig} whose values may be changed at any time. Every change is logged.
 *
 * <p>Components read values when they are built, so changes are generally only seen by components
 * built afterwards.
 */
@ThreadSafe
public class MutableChatLogConfig implements ChatLogConfig {
    private volatile String nick = "chatlog";
    private volatile String network = "localhost";
    private volatile List<String> storeNodes = ImmutableList.of("localhost:9200");
    private volatile String storeIndex = "chatlines";
    private volatile String storeDocType = "chatline";
    private volatile Duration storeRequestTimeout = Duration.ofSeconds(10);
    private volatile int storeNodeAttemptLimit = 0;
    private volatile Duration flushInterval = Duration.ofSeconds(5);
    private volatile Duration flushDeliveryTimeout = Duration.ofSeconds(30);
    private volatile Path logDirectory = Paths.get("logs");
    private volatile long systemLogRotateLength = 1_000_000;
    private volatile List<String> channels = ImmutableList.of();

    private static final Logger log = LoggerFactory.getLogger(MutableChatLogConfig.class);

    /**
     * Uses defaults suitable for a store running on localhost and no channel files.
     */
    public MutableChatLogConfig() {}

    @Override
    public String getNick() {
        return nick;
    }

    public MutableChatLogConfig setNick(String nick) {
        String old = this.nick;
        this.nick = Objects.requireNonNull(nick, "nick");
        logChange("Nick", old, nick);
        return this;
    }

    @Override
    public String getNetwork() {
        return network;
    }

    public MutableChatLogConfig setNetwork(String network) {
        String old = this.network;
        this.network = Objects.requireNonNull(network, "network");
        logChange("Network", old, network);
        return this;
    }

    @Override
    public List<String> getStoreNodes() {
        return storeNodes;
    }

    public MutableChatLogConfig setStoreNodes(Collection<String> storeNodes) {
        List<String> old = this.storeNodes;
        List<String> nodes = ImmutableList.copyOf(Objects.requireNonNull(storeNodes, "storeNodes"));

        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("At least one store node is required.");
        }

        this.storeNodes = nodes;
        logChange("Store nodes", old, nodes);
        return this;
    }

    @Override
    public String getStoreIndex() {
        return storeIndex;
    }

    public MutableChatLogConfig setStoreIndex(String storeIndex) {
        String old = this.storeIndex;
        this.storeIndex = Objects.requireNonNull(storeIndex, "storeIndex");
        logChange("Store index", old, storeIndex);
        return this;
    }

    @Override
    public String getStoreDocType() {
        return storeDocType;
    }

    public MutableChatLogConfig setStoreDocType(String storeDocType) {
        String old = this.storeDocType;
        this.storeDocType = Objects.requireNonNull(storeDocType, "storeDocType");
        logChange("Store doctype", old, storeDocType);
        return this;
    }

    @Override
    public Duration getStoreRequestTimeout() {
        return storeRequestTimeout;
    }

    public MutableChatLogConfig setStoreRequestTimeout(Duration storeRequestTimeout) {
        Duration old = this.storeRequestTimeout;
        this.storeRequestTimeout = Objects.requireNonNull(storeRequestTimeout, "storeRequestTimeout");
        logChange("Store request timeout", old, storeRequestTimeout);
        return this;
    }

    @Override
    public int getStoreNodeAttemptLimit() {
        return storeNodeAttemptLimit;
    }

    public MutableChatLogConfig setStoreNodeAttemptLimit(int storeNodeAttemptLimit) {
        int old = this.storeNodeAttemptLimit;
        this.storeNodeAttemptLimit = storeNodeAttemptLimit;
        logChange("Store node attempt limit", old, storeNodeAttemptLimit);
        return this;
    }

    @Override
    public Duration getFlushInterval() {
        return flushInterval;
    }

    public MutableChatLogConfig setFlushInterval(Duration flushInterval) {
        Duration old = this.flushInterval;
        this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
        logChange("Flush interval", old, flushInterval);
        return this;
    }

    @Override
    public Duration getFlushDeliveryTimeout() {
        return flushDeliveryTimeout;
    }

    public MutableChatLogConfig setFlushDeliveryTimeout(Duration flushDeliveryTimeout) {
        Duration old = this.flushDeliveryTimeout;
        this.flushDeliveryTimeout = Objects.requireNonNull(flushDeliveryTimeout,
                "flushDeliveryTimeout");
        logChange("Flush delivery timeout", old, flushDeliveryTimeout);
        return this;
    }

    @Override
    public Path getLogDirectory() {
        return logDirectory;
    }

    public MutableChatLogConfig setLogDirectory(Path logDirectory) {
        Path old = this.logDirectory;
        this.logDirectory = Objects.requireNonNull(logDirectory, "logDirectory");
        logChange("Log directory", old, logDirectory);
        return this;
    }

    @Override
    public long getSystemLogRotateLength() {
        return systemLogRotateLength;
    }

    public MutableChatLogConfig setSystemLogRotateLength(long systemLogRotateLength) {
        if (systemLogRotateLength <= 0) {
            throw new IllegalArgumentException("systemLogRotateLength must be positive but was " +
                    systemLogRotateLength);
        }

        long old = this.systemLogRotateLength;
        this.systemLogRotateLength = systemLogRotateLength;
        logChange("System log rotate length", old, systemLogRotateLength);
        return this;
    }

    @Override
    public List<String> getChannels() {
        return channels;
    }

    public MutableChatLogConfig setChannels(Collection<String> channels) {
        List<String> old = this.channels;
        this.channels = ImmutableList.copyOf(Objects.requireNonNull(channels, "channels"));
        logChange("Channels", old, this.channels);
        return this;
    }

    private static void logChange(String name, Object old, Object updated) {
        if (!Objects.equals(old, updated)) {
            log.info("{} updated. Old value was {}. New value is {}.", name, old, updated);
        }
    }
}
