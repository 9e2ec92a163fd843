package org.relaybot.command;

/**
 * A guild, member or channel lookup came back empty where a value was required.
 */
public class ResolutionFailure extends RuntimeException {

    public ResolutionFailure(String message) {
        super(message);
    }
}
