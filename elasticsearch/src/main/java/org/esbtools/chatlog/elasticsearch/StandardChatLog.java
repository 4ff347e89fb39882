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

package org.esbtools.chatlog.elasticsearch;

import org.esbtools.chatlog.BufferedSink;
import org.esbtools.chatlog.ChatEvent;
import org.esbtools.chatlog.ChatEventListener;
import org.esbtools.chatlog.ChatEventRecorder;
import org.esbtools.chatlog.ChatHistorySearch;
import org.esbtools.chatlog.ChatReplier;
import org.esbtools.chatlog.ConsoleSink;
import org.esbtools.chatlog.EventDispatcher;
import org.esbtools.chatlog.IgnoreList;
import org.esbtools.chatlog.PeriodicSinkFlushRoute;
import org.esbtools.chatlog.config.ChatLogConfig;
import org.esbtools.chatlog.elasticsearch.client.ElasticsearchClient;
import org.esbtools.chatlog.elasticsearch.client.JdkHttpTransport;
import org.esbtools.chatlog.file.MultiChannelFileSink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import org.apache.camel.CamelContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;

/**
 * The usual chat log: every event goes to the console right away, and to rotating files and the
 * search index in batches, flushed periodically by Camel routes. Searches from chat commands go to
 * the same index.
 *
 * <p>Hand {@link #listener()} to the chat network connection, and add {@link #routes()} to a
 * started {@link CamelContext} (see {@link #addRoutesTo(CamelContext)}).
 */
public class StandardChatLog implements Closeable {
    private final ConsoleSink console;
    private final BufferedSink<MultiChannelFileSink> files;
    private final BufferedSink<SearchIndexSink> searchIndex;
    private final EventDispatcher dispatcher;
    private final List<PeriodicSinkFlushRoute> routes;
    private final DocumentManager<ChatEvent> chatEvents;
    private final IndexAdmin indexAdmin;
    private final IgnoreList ignoreList = new IgnoreList();
    private final ChatEventRecorder recorder;

    private static final Logger log = LoggerFactory.getLogger(StandardChatLog.class);

    public StandardChatLog(ChatLogConfig config, ChatReplier replier) {
        this(config, new ElasticsearchClient(config.getStoreNodes(), new JdkHttpTransport(),
                config.getStoreRequestTimeout(), config.getStoreNodeAttemptLimit(),
                new ObjectMapper(), ForkJoinPool.commonPool()),
                replier, Clock.systemDefaultZone());
    }

    public StandardChatLog(ChatLogConfig config, ElasticsearchClient client, ChatReplier replier,
            Clock clock) {
        Objects.requireNonNull(config, "config");

        ChatEventDocumentType documentType =
                new ChatEventDocumentType(config.getStoreIndex(), config.getStoreDocType());
        chatEvents = new DocumentManager<>(client, documentType);
        indexAdmin = new IndexAdmin(client, documentType);

        console = new ConsoleSink();
        files = new BufferedSink<>(
                new MultiChannelFileSink(config.getLogDirectory(), config.getChannels(),
                        config.getSystemLogRotateLength()),
                config.getFlushDeliveryTimeout());
        searchIndex = new BufferedSink<>(new SearchIndexSink(chatEvents),
                config.getFlushDeliveryTimeout());

        dispatcher = new EventDispatcher(Arrays.asList(console, files, searchIndex));

        routes = ImmutableList.of(
                new PeriodicSinkFlushRoute(files, config.getFlushInterval()),
                new PeriodicSinkFlushRoute(searchIndex, config.getFlushInterval()));

        ChatHistorySearch search = new ElasticsearchChatHistorySearch(chatEvents);

        recorder = new ChatEventRecorder(config.getNick(), config.getNetwork(), dispatcher,
                ignoreList, search, replier, clock);

        log.info("Chat log for {} on {} writing to console, {} and {}", config.getNick(),
                config.getNetwork(), files.delegate(), searchIndex.delegate());
    }

    public ChatEventListener listener() {
        return recorder;
    }

    public EventDispatcher dispatcher() {
        return dispatcher;
    }

    public List<PeriodicSinkFlushRoute> routes() {
        return routes;
    }

    public void addRoutesTo(CamelContext context) throws Exception {
        for (PeriodicSinkFlushRoute route : routes) {
            context.addRoutes(route);
        }
    }

    public DocumentManager<ChatEvent> chatEvents() {
        return chatEvents;
    }

    public IndexAdmin indexAdmin() {
        return indexAdmin;
    }

    public IgnoreList ignoreList() {
        return ignoreList;
    }

    public BufferedSink<MultiChannelFileSink> files() {
        return files;
    }

    public BufferedSink<SearchIndexSink> searchIndex() {
        return searchIndex;
    }

    /**
     * Flushes whatever is still buffered one last time, then closes the log files. Events which
     * still cannot be delivered are logged and dropped.
     */
    @Override
    public void close() {
        files.flush();
        searchIndex.flush();

        List<ChatEvent> undelivered = ImmutableList.<ChatEvent>builder()
                .addAll(files.buffered())
                .addAll(searchIndex.buffered())
                .build();

        if (!undelivered.isEmpty()) {
            log.warn("Closing chat log with {} undelivered events: {}", undelivered.size(),
                    undelivered);
        }

        files.delegate().close();
    }
}
