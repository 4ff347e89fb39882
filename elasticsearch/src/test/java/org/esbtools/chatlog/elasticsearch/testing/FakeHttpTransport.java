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

package org.esbtools.chatlog.elasticsearch.testing;

import org.esbtools.chatlog.elasticsearch.client.HttpTransport;

import javax.annotation.Nullable;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Answers requests per node (host and port) with scripted behavior, remembering every request.
 * Nodes with no behavior refuse connections.
 */
public class FakeHttpTransport implements HttpTransport {
    private final Map<String, Function<Request, CompletableFuture<Response>>> nodes =
            new ConcurrentHashMap<>();
    private final List<Request> requests = new ArrayList<>();

    public FakeHttpTransport respond(String node, String json) {
        return respond(node, request -> json);
    }

    public FakeHttpTransport respond(String node, Function<Request, String> json) {
        nodes.put(node, request ->
                CompletableFuture.completedFuture(new Response(200, json.apply(request))));
        return this;
    }

    public FakeHttpTransport respondWithStatus(String node, int status, String body) {
        nodes.put(node, request -> CompletableFuture.completedFuture(new Response(status, body)));
        return this;
    }

    public FakeHttpTransport refuse(String node) {
        nodes.remove(node);
        return this;
    }

    public FakeHttpTransport timeOut(String node) {
        nodes.put(node, request -> failed(new TimeoutException("Simulated timeout")));
        return this;
    }

    @Override
    public CompletableFuture<Response> send(String method, URI uri, @Nullable String body,
            Duration timeout) {
        Request request = new Request(method, uri, body);

        synchronized (requests) {
            requests.add(request);
        }

        Function<Request, CompletableFuture<Response>> behavior = nodes.get(request.node());

        if (behavior == null) {
            return failed(new ConnectException("Simulated connection refused: " + request.node()));
        }

        return behavior.apply(request);
    }

    public List<Request> requests() {
        synchronized (requests) {
            return new ArrayList<>(requests);
        }
    }

    public List<String> requestedNodes() {
        return requests().stream().map(Request::node).collect(Collectors.toList());
    }

    public Request lastRequest() {
        List<Request> all = requests();
        if (all.isEmpty()) {
            throw new AssertionError("No requests were sent.");
        }
        return all.get(all.size() - 1);
    }

    public void clearRequests() {
        synchronized (requests) {
            requests.clear();
        }
    }

    private static CompletableFuture<Response> failed(Throwable failure) {
        CompletableFuture<Response> future = new CompletableFuture<>();
        future.completeExceptionally(failure);
        return future;
    }

    public static final class Request {
        public final String method;
        public final URI uri;
        @Nullable
        public final String body;

        Request(String method, URI uri, @Nullable String body) {
            this.method = method;
            this.uri = uri;
            this.body = body;
        }

        public String node() {
            return uri.getAuthority();
        }

        /** Path and query string, as the store sees them. */
        public String target() {
            return uri.getRawQuery() == null
                    ? uri.getRawPath()
                    : uri.getRawPath() + "?" + uri.getRawQuery();
        }

        @Override
        public String toString() {
            return method + " " + uri + (body == null ? "" : " " + body);
        }
    }
}
