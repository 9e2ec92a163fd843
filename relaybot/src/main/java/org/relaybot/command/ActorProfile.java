package org.relaybot.command;

import org.relaybot.command.permission.PermissionLevel;

/**
 * Stored settings of a user that matter for permission checks.
 *
 * @param actorId      Discord user id
 * @param grantedLevel level granted explicitly, independent of guild roles
 * @param blacklisted  whether the bot ignores this user
 */
public record ActorProfile(long actorId, PermissionLevel grantedLevel, boolean blacklisted) {

    public ActorProfile {
        if (grantedLevel == null) grantedLevel = PermissionLevel.NONE;
    }

    public static ActorProfile empty(long actorId) {
        return new ActorProfile(actorId, PermissionLevel.NONE, false);
    }
}
