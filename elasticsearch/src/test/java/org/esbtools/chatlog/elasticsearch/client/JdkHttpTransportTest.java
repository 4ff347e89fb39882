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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

import com.google.common.io.ByteStreams;
import com.sun.net.httpserver.HttpServer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

@RunWith(JUnit4.class)
public class JdkHttpTransportTest {
    HttpServer server;
    boolean running;
    URI base;

    AtomicReference<String> receivedMethod = new AtomicReference<>();
    AtomicReference<String> receivedBody = new AtomicReference<>();

    JdkHttpTransport transport = new JdkHttpTransport();

    @Before
    public void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/chatlines", exchange -> {
            receivedMethod.set(exchange.getRequestMethod());
            receivedBody.set(new String(ByteStreams.toByteArray(exchange.getRequestBody()),
                    StandardCharsets.UTF_8));

            byte[] response = "{\"error\":\"IndexMissingException\",\"status\":404}"
                    .getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(404, response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        });
        server.start();
        running = true;
        base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @After
    public void stopServer() {
        if (running) {
            server.stop(0);
        }
    }

    @Test
    public void shouldSendMethodAndBodyAndReturnErrorStatusAsResponse() throws Exception {
        HttpTransport.Response response = transport.send("GET",
                base.resolve("/chatlines/chatline/_search"), "{\"query\":{}}",
                Duration.ofSeconds(5)).get();

        assertThat(response.status()).isEqualTo(404);
        assertThat(response.body()).contains("IndexMissingException");
        assertThat(receivedMethod.get()).isEqualTo("GET");
        assertThat(receivedBody.get()).isEqualTo("{\"query\":{}}");
    }

    @Test
    public void shouldFailWhenNodeRefusesConnection() throws Exception {
        URI unreachable = base;
        server.stop(0);
        running = false;

        try {
            transport.send("GET", unreachable.resolve("/chatlines"), null, Duration.ofSeconds(5))
                    .get();
            fail("Expected request to fail");
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(IOException.class);
        }
    }
}
