package org.relaybot.command;

/**
 * A response could not be delivered. Carried by the future returned from {@code respond}.
 */
public class DispatchFailure extends RuntimeException {

    public DispatchFailure(String message) {
        super(message);
    }

    public DispatchFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
