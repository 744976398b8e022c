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

/**
 * Port for executing operator commands addressed to the bot.
 */
public interface CommandPort {

    /**
     * Interprets and executes a command issued in a room.
     *
     * @param roomId
     *            room the command was sent from
     * @param text
     *            command text with the bot prefix already removed
     * @return reply to post back to the room
     */
    CommandResult execute(String roomId, String text);

    /**
     * Represents the result of a command execution including success status and output message.
     */
    record CommandResult(
            boolean success,
            String output
    ) {
        /**
         * Creates a successful command result.
         */
        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        /**
         * Creates a failed command result with error message.
         */
        public static CommandResult failure(String error) {
            return new CommandResult(false, error);
        }
    }
}
