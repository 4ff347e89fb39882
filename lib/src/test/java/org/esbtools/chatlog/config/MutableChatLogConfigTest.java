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

package org.esbtools.chatlog.config;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@RunWith(JUnit4.class)
public class MutableChatLogConfigTest {
    MutableChatLogConfig config = new MutableChatLogConfig();

    @Test
    public void shouldDefaultToFiveSecondFlushesAndOneMegabyteSystemLog() {
        assertThat(config.getFlushInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getSystemLogRotateLength()).isEqualTo(1_000_000L);
        assertThat(config.getStoreNodeAttemptLimit()).isEqualTo(0);
    }

    @Test
    public void shouldCopyChannelsSoLaterChangesToArgumentAreNotSeen() {
        List<String> channels = new ArrayList<>(Arrays.asList("#a", "#b"));

        config.setChannels(channels);
        channels.add("#c");

        assertThat(config.getChannels()).containsExactly("#a", "#b").inOrder();
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRequireAtLeastOneStoreNode() {
        config.setStoreNodes(Collections.emptyList());
    }

    @Test(expected = NullPointerException.class)
    public void shouldRejectNullNick() {
        config.setNick(null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectNonPositiveRotateLength() {
        config.setSystemLogRotateLength(0);
    }
}
