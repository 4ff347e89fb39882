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

import javax.annotation.Nullable;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Sends one HTTP request to one node. Implementations must not block the caller; the response (or
 * failure) is delivered through the returned future.
 *
 * <p>Any failure to get a response, including exceeding the timeout, should complete the future
 * exceptionally. A response with an error status is still a response.
 */
public interface HttpTransport {
    CompletableFuture<Response> send(String method, URI uri, @Nullable String body,
            Duration timeout);

    final class Response {
        private final int status;
        private final String body;

        public Response(int status, String body) {
            this.status = status;
            this.body = body;
        }

        public int status() {
            return status;
        }

        public String body() {
            return body;
        }

        @Override
        public String toString() {
            return "Response{status=" + status + ", body='" + body + "'}";
        }
    }
}
