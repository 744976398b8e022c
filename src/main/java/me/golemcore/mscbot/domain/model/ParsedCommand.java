package me.golemcore.mscbot.domain.model;

import java.util.List;

/**
 * Result of matching operator text against the command table: the command kind
 * and the whitespace-separated tokens that followed the matched phrase.
 */
public record ParsedCommand(CommandKind kind, List<String> arguments) {

    public ParsedCommand {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public boolean hasArguments() {
        return !arguments.isEmpty();
    }

    public String firstArgument() {
        return arguments.isEmpty() ? null : arguments.get(0);
    }
}
