package org.relaybot.command.response;

import net.dv8tion.jda.api.events.message.MessageBulkDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageDeleteEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.relaybot.service.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Deletes the bot's answers when the message that triggered them is deleted.
 */
public class ResponseCleanupListener extends ListenerAdapter {

    private static final Logger log = LoggerFactory.getLogger(ResponseCleanupListener.class);

    private final ResponseTracker tracker;
    private final Transport transport;

    public ResponseCleanupListener(ResponseTracker tracker, Transport transport) {
        this.tracker = tracker;
        this.transport = transport;
    }

    @Override
    public void onMessageDelete(MessageDeleteEvent event) {
        cleanup(event.getMessageIdLong());
    }

    @Override
    public void onMessageBulkDelete(MessageBulkDeleteEvent event) {
        for (String id : event.getMessageIds()) {
            cleanup(Long.parseLong(id));
        }
    }

    /**
     * @return the number of responses scheduled for deletion
     */
    public int cleanup(long invocationMessageId) {
        List<ResponseRecord> records = tracker.forget(invocationMessageId);
        for (ResponseRecord record : records) {
            transport.delete(record.responseChannelId(), record.responseMessageId())
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            // Already deleted by a moderator, or channel gone
                            log.debug("Suppression de la réponse {} impossible", record.responseMessageId(), error);
                        }
                    });
        }
        if (!records.isEmpty()) {
            log.debug("Invocation {} supprimée, {} réponse(s) retirée(s)", invocationMessageId, records.size());
        }
        return records.size();
    }
}
