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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The store answered, but reported an error in the response body. This is not retried against
 * other nodes, since they would very likely say the same thing.
 */
public class StoreErrorException extends ElasticsearchException {
    private final int status;
    private final JsonNode response;

    public StoreErrorException(int status, JsonNode response) {
        super(describe(status, response));
        this.status = status;
        this.response = response;
    }

    public int status() {
        return status;
    }

    public JsonNode response() {
        return response;
    }

    private static String describe(int status, JsonNode response) {
        JsonNode error = response.path("error");
        String description = error.isTextual() ? error.asText() : error.toString();
        return "Store responded with error (status " + status + "): " +
                (description.isEmpty() ? "Unknown Error" : description);
    }
}
