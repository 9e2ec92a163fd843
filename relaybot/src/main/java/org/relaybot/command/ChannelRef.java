package org.relaybot.command;

/**
 * Where a response goes: a guild channel, or the direct channel of a user.
 */
public record ChannelRef(Kind kind, long id, Long scopeId) {

    public enum Kind { GUILD, DIRECT }

    public static ChannelRef guild(long channelId, long scopeId) {
        return new ChannelRef(Kind.GUILD, channelId, scopeId);
    }

    /**
     * @param recipientId user id of the recipient, not a channel id
     */
    public static ChannelRef direct(long recipientId) {
        return new ChannelRef(Kind.DIRECT, recipientId, null);
    }

    public boolean isDirect() {
        return kind == Kind.DIRECT;
    }
}
