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

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps a failure score per store node. Every node starts at zero and loses a point each time a
 * request to it fails. Scores are never reset, so a node which has failed before is only preferred
 * again once the others have failed more.
 */
@ThreadSafe
public class NodeScores {
    private final Map<String, Integer> scores = new LinkedHashMap<>();

    public NodeScores(Collection<String> nodes) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("At least one node is required.");
        }

        for (String node : nodes) {
            scores.put(node, 0);
        }
    }

    /**
     * @param limit How many nodes to return at most. Less than one means all of them.
     * @return Nodes with the fewest failures first. Nodes with the same score keep the order they
     * were configured in.
     */
    public synchronized List<String> ranked(int limit) {
        List<String> ranked = new ArrayList<>(scores.keySet());
        ranked.sort(Comparator.comparing(scores::get, Comparator.reverseOrder()));

        if (limit >= 1 && limit < ranked.size()) {
            ranked = ranked.subList(0, limit);
        }

        return ImmutableList.copyOf(ranked);
    }

    public synchronized void recordFailure(String node) {
        scores.computeIfPresent(node, (n, score) -> score - 1);
    }

    public synchronized int score(String node) {
        Integer score = scores.get(node);

        if (score == null) {
            throw new IllegalArgumentException("Unknown node: " + node);
        }

        return score;
    }

    public synchronized List<String> nodes() {
        return ImmutableList.copyOf(scores.keySet());
    }

    @Override
    public synchronized String toString() {
        return "NodeScores" + scores;
    }
}
