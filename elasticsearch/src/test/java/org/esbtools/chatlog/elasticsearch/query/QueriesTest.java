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

package org.esbtools.chatlog.elasticsearch.query;

import static com.google.common.truth.Truth.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@RunWith(JUnit4.class)
public class QueriesTest {
    ObjectMapper mapper = new ObjectMapper();

    JsonNode json(String json) throws IOException {
        return mapper.readTree(json.replace('\'', '"'));
    }

    @Test
    public void shouldParseFreeTextFollowedByFieldTerms() {
        List<Query> fragments = Queries.parseQuery("hello*",
                ImmutableMap.of("user", "bob", "channel", "#esb"));

        assertThat(fragments).containsExactly(
                new FreeTextQuery("hello*"),
                new TermQuery("user", "bob"),
                new TermQuery("channel", "#esb")).inOrder();
    }

    @Test
    public void shouldSkipMissingOrEmptyFreeText() {
        assertThat(Queries.parseQuery(null, ImmutableMap.of("user", "bob")))
                .containsExactly(new TermQuery("user", "bob"));
        assertThat(Queries.parseQuery("", Collections.<String, String>emptyMap())).isEmpty();
    }

    @Test
    public void shouldCombineNoFragmentsIntoMatchAll() throws Exception {
        Query query = Queries.combine(Collections.<Query>emptyList());

        assertThat(query).isSameInstanceAs(MatchAllQuery.INSTANCE);
        assertThat(query.toJson()).isEqualTo(json("{'match_all':{}}"));
    }

    @Test
    public void shouldCombineFragmentsIntoConstantScoreAndFilter() throws Exception {
        Query query = Queries.combine(Queries.parseQuery("foo",
                ImmutableMap.of("user", "bob")));

        assertThat(query.toJson()).isEqualTo(json("{'constant_score':{'filter':{'and':[" +
                "{'query':{'query_string':{'query':'foo'}}}," +
                "{'term':{'user':'bob'}}" +
                "]}}}"));
    }

    @Test
    public void shouldBuildRequestBodyWithTermsFacetPerField() throws Exception {
        JsonNode body = Queries.buildRequestBody(MatchAllQuery.INSTANCE,
                Arrays.asList("user", "channel"));

        assertThat(body).isEqualTo(json("{'query':{'match_all':{}},'facets':{" +
                "'user':{'terms':{'field':'user'}}," +
                "'channel':{'terms':{'field':'channel'}}}}"));
    }

    @Test
    public void shouldLeaveOutFacetsWhenNoneRequested() throws Exception {
        JsonNode body = Queries.buildRequestBody(new TermQuery("user", "bob"),
                Collections.<String>emptyList());

        assertThat(body).isEqualTo(json("{'query':{'term':{'user':'bob'}}}"));
    }

    @Test
    public void shouldUseLoneRawQueryAsEntireRequestBody() throws Exception {
        JsonNode raw = json("{'query':{'range':{'time':{'gte':1456840800}}},'size':5}");

        Query query = Queries.combine(Collections.singletonList(new RawQuery(raw)));
        JsonNode body = Queries.buildRequestBody(query, Collections.singletonList("user"));

        assertThat(body).isEqualTo(raw);
    }

    @Test
    public void shouldNotShareStateWithRawJson() throws Exception {
        JsonNode raw = json("{'match_all':{}}");
        RawQuery query = new RawQuery(raw);

        ((ObjectNode) raw).put("changed", true);

        assertThat(query.toJson()).isEqualTo(json("{'match_all':{}}"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectRawQueriesWhichAreNotObjects() throws Exception {
        new RawQuery(json("['not','an','object']"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectEmptyAndQuery() {
        new AndQuery(Collections.<Query>emptyList());
    }
}
