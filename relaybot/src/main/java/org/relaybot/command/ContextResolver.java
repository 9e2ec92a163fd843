package org.relaybot.command;

import org.relaybot.service.Directory;

import java.util.Optional;

/**
 * Works out the guild, member and reply channel of an invocation.
 * <p>
 * Guild messages carry all three. Direct messages fall back to the home guild: the author must be a member
 * there to get privileges or a reply channel.
 */
public class ContextResolver {

    private final Directory directory;

    public ContextResolver(Directory directory) {
        this.directory = directory;
    }

    public long resolveScope(Invocation invocation) {
        return invocation.isScopeBound() ? invocation.scopeId() : directory.homeScopeId();
    }

    public Optional<Membership> resolveMembership(Invocation invocation) {
        if (invocation.isScopeBound()) {
            return Optional.ofNullable(invocation.attachedMembership());
        }
        return directory.resolveMembership(invocation.actorId(), directory.homeScopeId());
    }

    public Optional<ChannelRef> resolveChannel(Invocation invocation, Optional<Membership> membership) {
        if (invocation.isScopeBound()) {
            return Optional.of(ChannelRef.guild(invocation.channelId(), invocation.scopeId()));
        }
        return membership.map(m -> ChannelRef.direct(invocation.actorId()));
    }
}
