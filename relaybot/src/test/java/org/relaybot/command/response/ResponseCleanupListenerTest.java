package org.relaybot.command.response;

import net.dv8tion.jda.api.events.message.MessageBulkDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageDeleteEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.relaybot.command.ActorProfile;
import org.relaybot.command.Arguments;
import org.relaybot.command.CommandDescriptor;
import org.relaybot.command.CommandServices;
import org.relaybot.command.ContextResolver;
import org.relaybot.command.DispatchContext;
import org.relaybot.command.DispatchFailure;
import org.relaybot.command.Invocation;
import org.relaybot.command.Membership;
import org.relaybot.command.SentMessage;
import org.relaybot.command.permission.PermissionEvaluator;
import org.relaybot.command.permission.PermissionLevel;
import org.relaybot.command.permission.RoleTiers;
import org.relaybot.service.Directory;
import org.relaybot.service.HelpFormatter;
import org.relaybot.service.Transport;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResponseCleanupListenerTest {

    private InMemoryResponseTracker tracker;
    private Transport transport;
    private ResponseCleanupListener listener;

    @BeforeEach
    void setUp() {
        tracker = new InMemoryResponseTracker();
        transport = mock(Transport.class);
        when(transport.delete(anyLong(), anyLong())).thenReturn(CompletableFuture.completedFuture(null));
        listener = new ResponseCleanupListener(tracker, transport);
    }

    @Test
    void shouldDeleteTrackedResponsesWhenInvocationIsDeleted() {
        tracker.register(1L, 20L, 100L);
        tracker.register(1L, 21L, 101L);
        MessageDeleteEvent event = mock(MessageDeleteEvent.class);
        when(event.getMessageIdLong()).thenReturn(1L);

        listener.onMessageDelete(event);

        verify(transport).delete(20L, 100L);
        verify(transport).delete(21L, 101L);
        assertTrue(tracker.responsesFor(1L).isEmpty());
    }

    @Test
    void shouldIgnoreMessagesThatAreNotInvocations() {
        assertEquals(0, listener.cleanup(5L));

        verify(transport, never()).delete(anyLong(), anyLong());
    }

    @Test
    void shouldHandleBulkDeletes() {
        tracker.register(1L, 20L, 100L);
        tracker.register(2L, 20L, 200L);
        MessageBulkDeleteEvent event = mock(MessageBulkDeleteEvent.class);
        when(event.getMessageIds()).thenReturn(List.of("1", "2", "3"));

        listener.onMessageBulkDelete(event);

        verify(transport).delete(20L, 100L);
        verify(transport).delete(20L, 200L);
        assertEquals(0, tracker.size());
    }

    @Test
    void shouldKeepGoingWhenADeleteFails() {
        tracker.register(1L, 20L, 100L);
        tracker.register(1L, 20L, 101L);
        when(transport.delete(20L, 100L)).thenReturn(CompletableFuture.failedFuture(new DispatchFailure("Unknown Message")));

        assertEquals(2, listener.cleanup(1L));

        verify(transport).delete(20L, 101L);
    }

    @Test
    void shouldDeleteReplyThatLandsAfterTheInvocationWasDeleted() throws Exception {
        CompletableFuture<SentMessage> inFlight = new CompletableFuture<>();
        when(transport.send(any(), any())).thenReturn(inFlight);
        Directory directory = mock(Directory.class);
        when(directory.homeScopeId()).thenReturn(500L);
        CommandServices services = new CommandServices(tracker, new PermissionEvaluator(RoleTiers.none()),
                new ContextResolver(directory), transport, mock(HelpFormatter.class));
        Invocation invocation = new Invocation(1L, 2L, 42L, 500L, new Membership(42L, 500L, Set.of(), false));
        DispatchContext ctx = new DispatchContext(CommandDescriptor.of("ping", "Répond pong", PermissionLevel.NONE),
                Arguments.empty(), invocation, ActorProfile.empty(42L), services);

        CompletableFuture<SentMessage> pending = ctx.respond("hi");
        assertEquals(0, listener.cleanup(1L));
        inFlight.complete(new SentMessage(2L, 99L));

        assertEquals(new SentMessage(2L, 99L), pending.get(1, TimeUnit.SECONDS));
        verify(transport).delete(2L, 99L);
        assertTrue(tracker.responsesFor(1L).isEmpty());
        assertEquals(0, tracker.size());
    }
}
