package org.relaybot.command;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;
import org.relaybot.util.EmbedConvention;

/**
 * The payload shapes a command can respond with. All of them normalize to one {@link OutboundMessage}.
 */
public sealed interface Response {

    OutboundMessage normalize();

    record Text(String content) implements Response {
        @Override
        public OutboundMessage normalize() {
            if (content == null || content.isBlank()) {
                throw new IllegalArgumentException("Response text must not be empty");
            }
            return OutboundMessage.text(content);
        }
    }

    record Structured(MessageEmbed embed) implements Response {
        @Override
        public OutboundMessage normalize() {
            if (embed == null) {
                throw new IllegalArgumentException("Response embed must not be null");
            }
            return OutboundMessage.embed(embed);
        }
    }

    record StructuredBuilder(EmbedBuilder builder) implements Response {
        @Override
        public OutboundMessage normalize() {
            if (builder == null || builder.isEmpty()) {
                throw new IllegalArgumentException("Response embed builder must not be empty");
            }
            return OutboundMessage.embed(builder.build());
        }
    }

    record StructuredConvention(EmbedConvention convention) implements Response {
        @Override
        public OutboundMessage normalize() {
            if (convention == null || convention.isEmpty()) {
                throw new IllegalArgumentException("Response embed must not be empty");
            }
            return OutboundMessage.embed(convention.toEmbed());
        }
    }
}
