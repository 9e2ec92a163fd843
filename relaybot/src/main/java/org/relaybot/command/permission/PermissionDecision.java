package org.relaybot.command.permission;

public enum PermissionDecision {
    /** The actor's effective level covers the requirement. */
    ACCEPTED,
    /** The actor's effective level is too low. */
    REJECTED,
    /** The actor is blacklisted; the bot does not answer at all. */
    IGNORED
}
