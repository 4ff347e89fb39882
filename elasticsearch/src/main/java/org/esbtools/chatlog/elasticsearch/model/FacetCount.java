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

package org.esbtools.chatlog.elasticsearch.model;

import java.util.Objects;

/**
 * How many matching documents share one term of a faceted field.
 */
public final class FacetCount {
    private final String term;
    private final long count;

    public FacetCount(String term, long count) {
        this.term = Objects.requireNonNull(term, "term");
        this.count = count;
    }

    public String term() {
        return term;
    }

    public long count() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FacetCount that = (FacetCount) o;
        return count == that.count && term.equals(that.term);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, count);
    }

    @Override
    public String toString() {
        return "(" + term + ", " + count + ")";
    }
}
