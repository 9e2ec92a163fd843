package org.relaybot.command;

public record SentMessage(long channelId, long messageId) {}
