package org.relaybot.command;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.ISnowflake;
import net.dv8tion.jda.api.entities.Member;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A user's roles inside one guild, detached from the JDA cache.
 */
public record Membership(long actorId, long scopeId, Set<Long> roleIds, boolean administrator) {

    public Membership {
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }

    public static Membership of(Member member) {
        Set<Long> roles = member.getRoles().stream()
                .map(ISnowflake::getIdLong)
                .collect(Collectors.toSet());
        return new Membership(
                member.getIdLong(),
                member.getGuild().getIdLong(),
                roles,
                member.hasPermission(Permission.ADMINISTRATOR)
        );
    }

    public boolean hasAnyRole(Collection<Long> candidates) {
        for (Long id : candidates) {
            if (roleIds.contains(id)) return true;
        }
        return false;
    }
}
