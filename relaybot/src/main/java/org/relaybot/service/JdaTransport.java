package org.relaybot.service;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.Message.MentionType;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.requests.RestAction;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;
import net.dv8tion.jda.api.utils.messages.MessageCreateData;
import org.relaybot.command.ChannelRef;
import org.relaybot.command.DispatchFailure;
import org.relaybot.command.OutboundMessage;
import org.relaybot.command.SentMessage;

import java.util.EnumSet;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Transport} on top of JDA's REST queue. Rate limits and retries stay with JDA's requester.
 */
public class JdaTransport implements Transport {

    private final JDA jda;

    public JdaTransport(JDA jda) {
        this.jda = jda;
    }

    @Override
    public CompletableFuture<SentMessage> send(ChannelRef target, OutboundMessage message) {
        MessageCreateData data = toMessageData(message);
        RestAction<Message> action;
        if (target.isDirect()) {
            action = jda.openPrivateChannelById(target.id()).flatMap(channel -> channel.sendMessage(data));
        } else {
            GuildMessageChannel channel = jda.getChannelById(GuildMessageChannel.class, target.id());
            if (channel == null) {
                return CompletableFuture.failedFuture(new DispatchFailure("Channel introuvable : " + target.id()));
            }
            action = channel.sendMessage(data);
        }
        return action.submit().thenApply(sent -> new SentMessage(sent.getChannel().getIdLong(), sent.getIdLong()));
    }

    @Override
    public CompletableFuture<Void> delete(long channelId, long messageId) {
        MessageChannel channel = jda.getChannelById(MessageChannel.class, channelId);
        if (channel == null) {
            channel = jda.getPrivateChannelById(channelId);
        }
        if (channel == null) {
            return CompletableFuture.failedFuture(new DispatchFailure("Channel introuvable : " + channelId));
        }
        return channel.deleteMessageById(messageId).submit();
    }

    static MessageCreateData toMessageData(OutboundMessage message) {
        MessageCreateBuilder builder = new MessageCreateBuilder();
        if (message.content() != null) {
            builder.setContent(message.content());
        }
        if (message.embed() != null) {
            builder.setEmbeds(message.embed());
        }
        if (!message.suppressedMentions().isEmpty()) {
            EnumSet<MentionType> allowed = EnumSet.allOf(MentionType.class);
            allowed.removeAll(message.suppressedMentions());
            builder.setAllowedMentions(allowed);
        }
        return builder.build();
    }
}
