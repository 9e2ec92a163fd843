package org.relaybot.command.permission;

import org.relaybot.command.ActorProfile;
import org.relaybot.command.Membership;

/**
 * Decides whether an actor meets a {@link PermissionLevel}.
 * <p>
 * The effective level is the higher of the level derived from the actor's guild membership and the level
 * granted in the stored profile. Missing membership or profile count as {@link PermissionLevel#NONE}, so
 * evaluation never fails.
 */
public class PermissionEvaluator {

    private final RoleTiers tiers;

    public PermissionEvaluator(RoleTiers tiers) {
        this.tiers = tiers == null ? RoleTiers.none() : tiers;
    }

    public PermissionDecision evaluate(PermissionLevel required, Membership membership, ActorProfile profile) {
        if (profile != null && profile.blacklisted()) {
            return PermissionDecision.IGNORED;
        }
        // A missing requirement means the same as NONE, as in CommandDescriptor
        if (required == null || required == PermissionLevel.NONE) {
            return PermissionDecision.ACCEPTED;
        }
        PermissionLevel effective = effectiveLevel(membership, profile);
        return effective.covers(required) ? PermissionDecision.ACCEPTED : PermissionDecision.REJECTED;
    }

    public PermissionLevel effectiveLevel(Membership membership, ActorProfile profile) {
        PermissionLevel granted = profile == null ? PermissionLevel.NONE : profile.grantedLevel();
        return PermissionLevel.max(membershipLevel(membership, profile), granted);
    }

    PermissionLevel membershipLevel(Membership membership, ActorProfile profile) {
        long actorId = membership != null ? membership.actorId() : profile != null ? profile.actorId() : 0L;
        if (tiers.botOwnerIds().contains(actorId)) {
            return PermissionLevel.BOT_OWNER;
        }
        if (membership == null) {
            return PermissionLevel.NONE;
        }
        if (membership.administrator() || membership.hasAnyRole(tiers.adminRoleIds())) {
            return PermissionLevel.ADMIN;
        }
        if (membership.hasAnyRole(tiers.moderatorRoleIds())) {
            return PermissionLevel.MODERATOR;
        }
        return PermissionLevel.NONE;
    }
}
