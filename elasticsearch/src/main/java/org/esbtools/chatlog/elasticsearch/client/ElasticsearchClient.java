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

package org.esbtools.chatlog.elasticsearch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;

/**
 * Asynchronous client for an Elasticsearch compatible store reached over HTTP, spread across one or
 * more nodes.
 *
 * <p>Each request is attempted against the node with the fewest past failures first. If that node
 * cannot be reached, times out, or responds with something that is not JSON, its score is
 * decremented (see {@link NodeScores}) and the request is attempted against the next node. This
 * continues until a node responds or the attempt limit is reached, in which case the request fails
 * with {@link NoNodesAvailableException}.
 *
 * <p>A JSON response with a top level {@code error} field fails the request with
 * {@link StoreErrorException} regardless of its HTTP status, and is not attempted anywhere else.
 *
 * <p>No method blocks. Encoding request bodies and decoding responses happens on the codec
 * executor, so continuations of the returned futures generally run there too.
 */
public class ElasticsearchClient {
    private final NodeScores nodes;
    private final HttpTransport transport;
    private final Duration requestTimeout;
    private final int attemptLimit;
    private final ObjectMapper mapper;
    private final Executor codecExecutor;

    private static final Escaper pathEscaper = UrlEscapers.urlPathSegmentEscaper();
    private static final Escaper paramEscaper = UrlEscapers.urlFormParameterEscaper();

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchClient.class);

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public ElasticsearchClient(List<String> nodes) {
        this(nodes, new JdkHttpTransport(), DEFAULT_REQUEST_TIMEOUT, 0, new ObjectMapper(),
                ForkJoinPool.commonPool());
    }

    /**
     * @param nodes Host and port ({@code "localhost:9200"}) or base URL of each node.
     * @param requestTimeout Time allowed for a single attempt against a single node.
     * @param attemptLimit How many different nodes to try per request. Less than one means all.
     * @param codecExecutor Runs JSON encoding and decoding.
     */
    public ElasticsearchClient(List<String> nodes, HttpTransport transport,
            Duration requestTimeout, int attemptLimit, ObjectMapper mapper,
            Executor codecExecutor) {
        this.nodes = new NodeScores(Objects.requireNonNull(nodes, "nodes"));
        this.transport = Objects.requireNonNull(transport, "transport");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.attemptLimit = attemptLimit;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.codecExecutor = Objects.requireNonNull(codecExecutor, "codecExecutor");
    }

    public NodeScores nodeScores() {
        return nodes;
    }

    /**
     * Sends a request to the store with failover as described above.
     *
     * @param path Path beneath the node's base URL, starting with {@code /}. Segments must already
     *             be escaped.
     * @param params URL parameters, escaped by this method.
     */
    public CompletableFuture<JsonNode> request(String method, String path, @Nullable JsonNode body,
            Map<String, ?> params) {
        String pathAndQuery = params.isEmpty()
                ? path
                : path + "?" + toQueryString(params);

        return CompletableFuture.supplyAsync(() -> encode(body), codecExecutor)
                .thenCompose(encoded -> attempt(method, pathAndQuery, encoded,
                        nodes.ranked(attemptLimit), 0, null));
    }

    /**
     * @param orderBy Sort parameter as the store understands it, like {@code "time:desc"}.
     */
    public CompletableFuture<JsonNode> search(String index, String doctype, JsonNode query,
            @Nullable String orderBy, @Nullable Integer size, @Nullable Integer offset) {
        Map<String, Object> params = new LinkedHashMap<>();

        if (size != null) {
            params.put("size", size);
        }
        if (offset != null) {
            params.put("from", offset);
        }
        if (orderBy != null) {
            params.put("sort", orderBy);
        }

        return request("GET", path(index, doctype, "_search"), query, params);
    }

    /**
     * Stores a document, with the given id if there is one (replacing any document with that id),
     * otherwise with an id the store assigns. The response includes the id as {@code _id}.
     */
    public CompletableFuture<JsonNode> index(JsonNode document, String index, String doctype,
            @Nullable String id) {
        if (id == null) {
            return request("POST", path(index, doctype) + "/", document, ImmutableMap.of());
        }
        return request("PUT", path(index, doctype, id), document, ImmutableMap.of());
    }

    public CompletableFuture<JsonNode> get(String index, String doctype, String id) {
        return request("GET", path(index, doctype, id), null, ImmutableMap.of());
    }

    public CompletableFuture<JsonNode> deleteById(String index, String doctype, String id) {
        return request("DELETE", path(index, doctype, id), null, ImmutableMap.of());
    }

    public CompletableFuture<JsonNode> deleteByQuery(String index, String doctype, JsonNode query) {
        return request("DELETE", path(index, doctype, "_query"), query, ImmutableMap.of());
    }

    /** @param index The index to refresh, or {@code null} for every index. */
    public CompletableFuture<JsonNode> refresh(@Nullable String index) {
        String path = index == null ? "/_refresh" : path(index, "_refresh");
        return request("POST", path, null, ImmutableMap.of());
    }

    /** @param index The index to optimize, or {@code null} for every index. */
    public CompletableFuture<JsonNode> optimize(@Nullable String index) {
        String path = index == null ? "/_optimize" : path(index, "_optimize");
        return request("POST", path, null, ImmutableMap.of());
    }

    public CompletableFuture<JsonNode> createIndex(String index, @Nullable JsonNode mapping) {
        return request("PUT", path(index), mapping, ImmutableMap.of());
    }

    public CompletableFuture<JsonNode> deleteIndex(String index) {
        return request("DELETE", path(index), null, ImmutableMap.of());
    }

    private CompletableFuture<JsonNode> attempt(String method, String pathAndQuery,
            @Nullable String body, List<String> candidates, int attempt,
            @Nullable Throwable lastFailure) {
        if (attempt >= candidates.size()) {
            CompletableFuture<JsonNode> noNodes = new CompletableFuture<>();
            noNodes.completeExceptionally(new NoNodesAvailableException(attempt, lastFailure));
            return noNodes;
        }

        String node = candidates.get(attempt);
        CompletableFuture<JsonNode> response;

        try {
            URI uri = URI.create(baseUrl(node) + pathAndQuery);
            log.debug("Attempt {} of {}: {} {}", attempt + 1, candidates.size(), method, uri);

            response = transport.send(method, uri, body, requestTimeout)
                    .thenApplyAsync(r -> decode(node, r), codecExecutor);
        } catch (Exception e) {
            response = new CompletableFuture<>();
            response.completeExceptionally(e);
        }

        return response.handle((json, failure) -> {
            if (failure == null) {
                return CompletableFuture.completedFuture(json);
            }

            Throwable cause = unwrap(failure);

            if (cause instanceof StoreErrorException) {
                CompletableFuture<JsonNode> storeError = new CompletableFuture<>();
                storeError.completeExceptionally(cause);
                return storeError;
            }

            TransportException nodeFailure = cause instanceof TransportException
                    ? (TransportException) cause
                    : new TransportException(node, cause);

            if (lastFailure != null) {
                nodeFailure.addSuppressed(lastFailure);
            }

            nodes.recordFailure(node);
            log.warn("{} {} failed on node {}, {} node(s) left to try: {}", method, pathAndQuery,
                    node, candidates.size() - attempt - 1, cause.toString());

            return attempt(method, pathAndQuery, body, candidates, attempt + 1, nodeFailure);
        }).thenCompose(Function.identity());
    }

    @Nullable
    private String encode(@Nullable JsonNode body) {
        if (body == null) {
            return null;
        }

        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new CompletionException(
                    new ElasticsearchException("Could not encode request body: " + body, e));
        }
    }

    private JsonNode decode(String node, HttpTransport.Response response) {
        JsonNode json;

        try {
            json = mapper.readTree(response.body());
        } catch (Exception e) {
            throw new CompletionException(new TransportException(node, e));
        }

        if (json == null || json.isMissingNode()) {
            throw new CompletionException(new TransportException(node,
                    "Empty response with status " + response.status()));
        }

        if (json.hasNonNull("error")) {
            throw new CompletionException(new StoreErrorException(response.status(), json));
        }

        return json;
    }

    static String baseUrl(String node) {
        String url = node.contains("://") ? node : "http://" + node;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    static String path(String... segments) {
        List<String> escaped = new ArrayList<>(segments.length);
        for (String segment : segments) {
            escaped.add(pathEscaper.escape(segment));
        }
        return "/" + Joiner.on('/').join(escaped);
    }

    private static String toQueryString(Map<String, ?> params) {
        List<String> pairs = new ArrayList<>(params.size());
        for (Map.Entry<String, ?> param : params.entrySet()) {
            pairs.add(paramEscaper.escape(param.getKey()) + "=" +
                    paramEscaper.escape(String.valueOf(param.getValue())));
        }
        return Joiner.on('&').join(pairs);
    }

    private static Throwable unwrap(Throwable failure) {
        while (failure instanceof CompletionException && failure.getCause() != null) {
            failure = failure.getCause();
        }
        return failure;
    }
}
