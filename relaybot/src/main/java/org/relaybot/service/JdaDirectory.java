package org.relaybot.service;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import org.relaybot.command.Membership;

import java.util.Optional;

/**
 * Reads guilds and members from JDA's cache. Requires the member cache of the home guild to be enabled.
 */
public class JdaDirectory implements Directory {

    private final JDA jda;
    private final long homeGuildId;

    public JdaDirectory(JDA jda, long homeGuildId) {
        this.jda = jda;
        this.homeGuildId = homeGuildId;
    }

    @Override
    public long homeScopeId() {
        return homeGuildId;
    }

    @Override
    public Optional<Membership> resolveMembership(long actorId, long scopeId) {
        Guild guild = jda.getGuildById(scopeId);
        if (guild == null) {
            return Optional.empty();
        }
        Member member = guild.getMemberById(actorId);
        return Optional.ofNullable(member).map(Membership::of);
    }
}
