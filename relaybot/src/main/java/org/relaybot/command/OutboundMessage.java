package org.relaybot.command;

import net.dv8tion.jda.api.entities.Message.MentionType;
import net.dv8tion.jda.api.entities.MessageEmbed;

import java.util.EnumSet;
import java.util.Set;

/**
 * One message ready for the transport: text, an embed, or both.
 *
 * @param suppressedMentions mention types that must not notify anyone
 */
public record OutboundMessage(String content, MessageEmbed embed, Set<MentionType> suppressedMentions) {

    public static final Set<MentionType> BROADCAST_MENTIONS = Set.copyOf(EnumSet.of(MentionType.EVERYONE, MentionType.HERE));

    public OutboundMessage {
        if ((content == null || content.isBlank()) && embed == null) {
            throw new IllegalArgumentException("Message must have content or an embed");
        }
        suppressedMentions = suppressedMentions == null ? Set.of() : Set.copyOf(suppressedMentions);
    }

    public static OutboundMessage text(String content) {
        return new OutboundMessage(content, null, BROADCAST_MENTIONS);
    }

    public static OutboundMessage embed(MessageEmbed embed) {
        return new OutboundMessage(null, embed, Set.of());
    }
}
