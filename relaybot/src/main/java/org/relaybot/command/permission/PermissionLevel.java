package org.relaybot.command.permission;

/**
 * Ordered permission levels. A requirement is met by any level with an equal or higher ordinal.
 */
public enum PermissionLevel {
    NONE,
    MODERATOR,
    ADMIN,
    BOT_OWNER;

    public boolean covers(PermissionLevel required) {
        return compareTo(required) >= 0;
    }

    public static PermissionLevel max(PermissionLevel a, PermissionLevel b) {
        if (a == null) return b == null ? NONE : b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }
}
