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

package org.esbtools.chatlog.file;

import org.esbtools.chatlog.ChatEvent;
import org.esbtools.chatlog.ChatEventLines;
import org.esbtools.chatlog.ChatEventSink;
import org.esbtools.chatlog.SinkFailureException;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;
import com.google.common.collect.ImmutableMap;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes each configured channel's events to its own file, {@code <directory>/<channel>.log},
 * rotated daily. Everything else goes to {@code <directory>/system.logs}, which is rotated by size
 * instead: system events, and events from channels that were not configured. The latter are
 * prefixed with {@link #UNKNOWN_CHANNEL_PREFIX} so they stand out.
 *
 * <p>Files are written by Logback appenders on a private {@link LoggerContext}, so the
 * application's own logging configuration neither affects nor sees these files. Writes happen on a
 * single worker thread, in the order events were logged.
 */
public class MultiChannelFileSink implements ChatEventSink, Closeable {
    private final Path directory;
    private final ChatEventLines lines;
    private final LoggerContext context;
    private final Map<String, ChannelFile> channelFiles;
    private final ChannelFile systemFile;
    private final ExecutorService writer;

    private static final AtomicInteger idCounter = new AtomicInteger(0);

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(MultiChannelFileSink.class);

    public static final long DEFAULT_SYSTEM_ROTATE_LENGTH = 1_000_000;
    public static final String SYSTEM_FILE_NAME = "system.logs";
    public static final String UNKNOWN_CHANNEL_PREFIX = "-- Received message from unknown channel:\n\t";

    /** Logback will not keep more rotated files than this in a fixed window. */
    static final int MAX_SYSTEM_FILE_ARCHIVES = 20;

    public MultiChannelFileSink(Path directory, Collection<String> channels) {
        this(directory, channels, DEFAULT_SYSTEM_ROTATE_LENGTH);
    }

    public MultiChannelFileSink(Path directory, Collection<String> channels,
            long systemRotateLength) {
        this(directory, channels, systemRotateLength, ChatEventLines.inSystemZone(),
                Executors.newSingleThreadExecutor(r -> {
                    Thread thread = new Thread(r, "chatlog-file-writer");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    /**
     * @param systemRotateLength Size in bytes past which the system file is rotated.
     * @param writer Executor which performs all file writes. Should be single threaded to keep
     *               lines in order. Shut down when this sink is closed.
     */
    public MultiChannelFileSink(Path directory, Collection<String> channels,
            long systemRotateLength, ChatEventLines lines, ExecutorService writer) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.lines = Objects.requireNonNull(lines, "lines");
        this.writer = Objects.requireNonNull(writer, "writer");

        if (systemRotateLength <= 0) {
            throw new IllegalArgumentException("systemRotateLength must be positive but was " +
                    systemRotateLength);
        }

        context = new LoggerContext();
        context.setName("chatlog-files-" + idCounter.getAndIncrement());

        ImmutableMap.Builder<String, ChannelFile> files = ImmutableMap.builder();
        for (String channel : channels) {
            files.put(channel, dailyFile(channel));
        }
        channelFiles = files.build();

        systemFile = sizeRotatedFile(systemRotateLength);

        log.info("Logging channels {} to {}", channelFiles.keySet(), directory.toAbsolutePath());
    }

    @Override
    public CompletableFuture<Void> log(ChatEvent event) {
        return CompletableFuture.runAsync(() -> {
            try {
                write(event);
            } catch (SinkFailureException e) {
                throw new CompletionException(e);
            }
        }, writer);
    }

    /** Writes the event to its file on the calling thread. */
    void write(ChatEvent event) throws SinkFailureException {
        String line = lines.toLine(event);
        ChannelFile file = event.channel().map(channelFiles::get).orElse(null);

        if (file == null) {
            file = systemFile;

            if (!event.isSystemEvent()) {
                line = UNKNOWN_CHANNEL_PREFIX + line;
            }
        }

        file.write(line);
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void close() {
        writer.shutdown();

        try {
            if (!writer.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Timed out waiting for pending writes to {}", directory);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        context.stop();
    }

    @Override
    public String toString() {
        return "MultiChannelFileSink{" + directory + ", channels=" + channelFiles.keySet() + "}";
    }

    private ChannelFile dailyFile(String channel) {
        String path = directory.resolve(channel + ".log").toString();
        RollingFileAppender<ILoggingEvent> appender = newAppender(channel, path);

        TimeBasedRollingPolicy<ILoggingEvent> rolling = new TimeBasedRollingPolicy<>();
        rolling.setContext(context);
        rolling.setParent(appender);
        rolling.setFileNamePattern(path + ".%d{yyyy_MM_dd}");
        rolling.start();

        appender.setRollingPolicy(rolling);
        appender.start();

        return new ChannelFile(path, loggerFor("channel." + channel, appender), appender);
    }

    private ChannelFile sizeRotatedFile(long rotateLength) {
        String path = directory.resolve(SYSTEM_FILE_NAME).toString();
        RollingFileAppender<ILoggingEvent> appender = newAppender("system", path);

        FixedWindowRollingPolicy rolling = new FixedWindowRollingPolicy();
        rolling.setContext(context);
        rolling.setParent(appender);
        rolling.setFileNamePattern(path + ".%i");
        rolling.setMinIndex(1);
        rolling.setMaxIndex(MAX_SYSTEM_FILE_ARCHIVES);
        rolling.start();

        SizeBasedTriggeringPolicy<ILoggingEvent> triggering = new SizeBasedTriggeringPolicy<>();
        triggering.setContext(context);
        triggering.setMaxFileSize(new FileSize(rotateLength));
        triggering.start();

        appender.setRollingPolicy(rolling);
        appender.setTriggeringPolicy(triggering);
        appender.start();

        return new ChannelFile(path, loggerFor("system", appender), appender);
    }

    private RollingFileAppender<ILoggingEvent> newAppender(String name, String path) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%msg%n");
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();

        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName(name);
        appender.setFile(path);
        appender.setAppend(true);
        appender.setEncoder(encoder);
        return appender;
    }

    private Logger loggerFor(String name, RollingFileAppender<ILoggingEvent> appender) {
        Logger logger = context.getLogger(name);
        logger.setAdditive(false);
        logger.setLevel(Level.INFO);
        logger.addAppender(appender);
        return logger;
    }

    private static final class ChannelFile {
        final String path;
        final Logger logger;
        final RollingFileAppender<ILoggingEvent> appender;

        ChannelFile(String path, Logger logger, RollingFileAppender<ILoggingEvent> appender) {
            this.path = path;
            this.logger = logger;
            this.appender = appender;
        }

        void write(String line) throws SinkFailureException {
            if (!appender.isStarted()) {
                throw new SinkFailureException("Log file " + path + " is not open for writing.");
            }

            logger.info("{}", line);

            // Logback stops an appender whose write failed.
            if (!appender.isStarted()) {
                throw new SinkFailureException("Failed to write to log file " + path);
            }
        }
    }
}
