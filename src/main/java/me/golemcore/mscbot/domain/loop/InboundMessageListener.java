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

package me.golemcore.mscbot.domain.loop;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mscbot.domain.model.RoomMessage;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.inbound.ChannelPort;
import me.golemcore.mscbot.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

/**
 * Handles text messages delivered by a channel: messages addressed to the bot
 * as {@code <prefix>: <command>} are executed and the reply is posted back to
 * the room.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundMessageListener {

    private final CommandPort commandPort;
    private final BotProperties properties;

    public void onMessage(ChannelPort channel, RoomMessage message) {
        if (!message.isText() || message.body() == null) {
            return;
        }

        String body = message.body().trim();
        String prefix = properties.getCommandPrefix() + ":";
        if (!body.startsWith(prefix)) {
            return;
        }

        String command = body.substring(prefix.length()).trim();
        log.info("[Inbound] Command from {} in {}: {}", message.senderId(), message.roomId(), command);
        CommandPort.CommandResult result = commandPort.execute(message.roomId(), command);

        try {
            channel.sendMessage(message.roomId(), result.output());
            log.debug("[Inbound] Replied in {}", message.roomId());
        } catch (RuntimeException e) {
            log.warn("[Inbound] Unable to post to {}: {}", message.roomId(), e.getMessage());
        }
    }

    public void onInvite(String roomId) {
        log.info("[Inbound] Joined room {}", roomId);
    }
}
