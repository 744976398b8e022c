/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mscbot.port.inbound;

import me.golemcore.mscbot.domain.model.RoomMessage;

import java.util.function.Consumer;

/**
 * Port for the chat transport. The bot drives it from a single loop: each call
 * to {@link #sync()} delivers pending invites and messages to the registered
 * handlers on the calling thread.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "matrix").
     */
    String getChannelType();

    /**
     * Whether the channel is configured to run at all.
     */
    boolean isEnabled();

    /**
     * Connects to the transport and skips any history that accumulated while the
     * bot was offline.
     */
    void start();

    void stop();

    boolean isRunning();

    /**
     * Fetches new events once and dispatches them to the handlers.
     */
    void sync();

    /**
     * Sends a markdown message to a room. The transport renders the HTML body.
     */
    void sendMessage(String roomId, String markdown);

    /**
     * Registers the handler for text messages in joined rooms.
     */
    void onMessage(Consumer<RoomMessage> handler);

    /**
     * Registers the handler for room invites; it receives the room id.
     */
    void onInvite(Consumer<String> handler);
}
