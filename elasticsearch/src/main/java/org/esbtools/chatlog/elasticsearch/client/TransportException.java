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

/**
 * A request to a single node failed before a usable response came back: the connection failed,
 * the attempt timed out, or the response body could not be decoded. Another node may still succeed.
 */
public class TransportException extends ElasticsearchException {
    private final String node;

    public TransportException(String node, String message) {
        super("Request to " + node + " failed: " + message);
        this.node = node;
    }

    public TransportException(String node, Throwable cause) {
        super("Request to " + node + " failed: " + cause, cause);
        this.node = node;
    }

    public String node() {
        return node;
    }
}
