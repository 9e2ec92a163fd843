package org.relaybot.service;

import org.relaybot.command.ChannelRef;
import org.relaybot.command.OutboundMessage;
import org.relaybot.command.SentMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound side of the chat platform.
 */
public interface Transport {

    /**
     * Queues {@code message} for {@code target}. Implementations must hand the message to the platform before
     * returning so that consecutive calls keep their order.
     */
    CompletableFuture<SentMessage> send(ChannelRef target, OutboundMessage message);

    CompletableFuture<Void> delete(long channelId, long messageId);
}
