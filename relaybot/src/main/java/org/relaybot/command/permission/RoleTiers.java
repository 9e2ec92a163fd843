package org.relaybot.command.permission;

import java.util.Set;

/**
 * Maps guild roles and user ids to permission levels.
 *
 * @param adminRoleIds     roles granting {@link PermissionLevel#ADMIN}
 * @param moderatorRoleIds roles granting {@link PermissionLevel#MODERATOR}
 * @param botOwnerIds      users granted {@link PermissionLevel#BOT_OWNER} wherever they are
 */
public record RoleTiers(Set<Long> adminRoleIds, Set<Long> moderatorRoleIds, Set<Long> botOwnerIds) {

    public RoleTiers {
        adminRoleIds = adminRoleIds == null ? Set.of() : Set.copyOf(adminRoleIds);
        moderatorRoleIds = moderatorRoleIds == null ? Set.of() : Set.copyOf(moderatorRoleIds);
        botOwnerIds = botOwnerIds == null ? Set.of() : Set.copyOf(botOwnerIds);
    }

    public static RoleTiers none() {
        return new RoleTiers(Set.of(), Set.of(), Set.of());
    }
}
