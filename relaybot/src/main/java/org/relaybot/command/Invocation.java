package org.relaybot.command;

import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;

/**
 * The message that triggered one command execution.
 *
 * @param messageId          id of the triggering message, the key of every response record
 * @param channelId          channel the message was posted in
 * @param actorId            author of the message
 * @param scopeId            guild id, {@code null} for direct messages
 * @param attachedMembership member attached to a guild message, may be {@code null}
 */
public record Invocation(long messageId, long channelId, long actorId, Long scopeId, Membership attachedMembership) {

    public static Invocation of(Message message) {
        if (!message.isFromGuild()) {
            return new Invocation(message.getIdLong(), message.getChannel().getIdLong(),
                    message.getAuthor().getIdLong(), null, null);
        }
        Member member = message.getMember();
        return new Invocation(
                message.getIdLong(),
                message.getChannel().getIdLong(),
                message.getAuthor().getIdLong(),
                message.getGuild().getIdLong(),
                member == null ? null : Membership.of(member)
        );
    }

    public static Invocation direct(long messageId, long channelId, long actorId) {
        return new Invocation(messageId, channelId, actorId, null, null);
    }

    public boolean isScopeBound() {
        return scopeId != null;
    }
}
