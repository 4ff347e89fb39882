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

package org.esbtools.chatlog;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Nicks whose messages should not be recorded.
 */
@ThreadSafe
public class IgnoreList {
    private final Set<String> nicks = Collections.synchronizedSet(new LinkedHashSet<>());

    public IgnoreList() {}

    public IgnoreList(Collection<String> initiallyIgnored) {
        nicks.addAll(initiallyIgnored);
    }

    /** @return {@code false} if the nick was already ignored. */
    public boolean ignore(String nick) {
        return nicks.add(nick);
    }

    /** @return {@code false} if the nick was not ignored to begin with. */
    public boolean unignore(String nick) {
        return nicks.remove(nick);
    }

    public boolean isIgnored(String nick) {
        return nicks.contains(nick);
    }

    public Set<String> ignored() {
        synchronized (nicks) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(nicks));
        }
    }
}
