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

package me.golemcore.mscbot.domain.service;

import me.golemcore.mscbot.domain.model.CommandKind;
import me.golemcore.mscbot.domain.model.ParsedCommand;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps chat text (without the bot prefix) to a {@link CommandKind} and its raw
 * argument tokens.
 *
 * <p>
 * Kinds are tried in declaration order and the first kind with any matching
 * phrase wins. Arguments are whatever follows the longest matching phrase of
 * that kind.
 */
@Service
public class CommandInterpreter {

    public Optional<ParsedCommand> interpret(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String original = text.trim();
        String normalized = original.toLowerCase(Locale.ROOT);

        for (CommandKind kind : CommandKind.values()) {
            if (kind.variants().stream().anyMatch(normalized::startsWith)) {
                int phraseLength = longestVariant(kind, normalized).length();
                // Lower-casing may change the length of some scripts.
                String source = original.length() == normalized.length() ? original : normalized;
                return Optional.of(new ParsedCommand(kind, tokenize(source.substring(phraseLength))));
            }
        }
        return Optional.empty();
    }

    private static String longestVariant(CommandKind kind, String normalized) {
        String longest = "";
        for (String variant : kind.variants()) {
            if (normalized.startsWith(variant) && variant.length() > longest.length()) {
                longest = variant;
            }
        }
        return longest;
    }

    private static List<String> tokenize(String remainder) {
        String trimmed = remainder.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(trimmed.split("\\s+"))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
