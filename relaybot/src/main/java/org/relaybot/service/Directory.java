package org.relaybot.service;

import org.relaybot.command.Membership;

import java.util.Optional;

/**
 * Guild and member lookups.
 */
public interface Directory {

    /** The guild the bot serves, used when an invocation has no guild of its own. */
    long homeScopeId();

    Optional<Membership> resolveMembership(long actorId, long scopeId);
}
