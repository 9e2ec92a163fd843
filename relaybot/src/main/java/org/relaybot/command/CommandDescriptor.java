package org.relaybot.command;

import org.relaybot.command.permission.PermissionLevel;

import java.util.List;

/**
 * Static description of a command, shown in help and used for the permission gate.
 */
public record CommandDescriptor(
    String name,
    List<String> aliases,
    String description,
    String usage,
    PermissionLevel permission,
    String category
) {
    public CommandDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Command name must not be blank");
        }
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        description = description == null ? "" : description;
        usage = usage == null ? "" : usage;
        if (permission == null) permission = PermissionLevel.NONE;
    }

    public static CommandDescriptor of(String name, String description, PermissionLevel permission) {
        return new CommandDescriptor(name, List.of(), description, "", permission, "general");
    }
}
