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

/**
 * Callbacks a chat network client invokes as it observes things happening on the network, after
 * it has taken care of the protocol itself.
 *
 * @see ChatEventRecorder
 */
public interface ChatEventListener {
    void onConnect();

    void onDisconnect(String reason);

    /** Called when this client has joined a channel. */
    void onJoin(String channel);

    void onMessage(String actor, String channel, String text);

    void onAction(String actor, String channel, String text);

    void onNickChange(String oldNick, String newNick);

    /** Called when some other user has joined a channel this client is in. */
    void onUserJoined(String actor, String channel);

    void onUserLeft(String actor, String channel);
}
