package org.relaybot.service;

import org.relaybot.command.ActorProfile;

public interface ProfileStore {

    /**
     * @return the stored profile, or {@link ActorProfile#empty(long)} for unknown users
     */
    ActorProfile getProfile(long actorId);
}
