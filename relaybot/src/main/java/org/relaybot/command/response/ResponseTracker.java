package org.relaybot.command.response;

import java.util.List;

/**
 * Remembers which messages the bot sent in reply to which invocation.
 * <p>
 * One tracker exists per running bot and is shared by every command execution, so implementations must
 * accept concurrent {@link #register} calls.
 */
public interface ResponseTracker {

    /**
     * Records one response.
     *
     * @return {@code false} if the invocation was already forgotten; the response is not tracked and the
     * caller should delete it
     */
    boolean register(long invocationMessageId, long responseChannelId, long responseMessageId);

    /**
     * @return the responses of an invocation in registration order, empty if none are known
     */
    List<ResponseRecord> responsesFor(long invocationMessageId);

    /**
     * Removes and returns the responses of an invocation. Later {@link #register} calls for it are refused.
     */
    List<ResponseRecord> forget(long invocationMessageId);
}
