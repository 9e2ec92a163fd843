package org.relaybot.command.response;

/**
 * Links one bot message to the invocation it answered.
 */
public record ResponseRecord(long invocationMessageId, long responseChannelId, long responseMessageId) {}
