package org.relaybot.command;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.relaybot.command.permission.PermissionEvaluator;
import org.relaybot.command.permission.PermissionLevel;
import org.relaybot.command.permission.RoleTiers;
import org.relaybot.command.response.InMemoryResponseTracker;
import org.relaybot.command.response.ResponseRecord;
import org.relaybot.service.Directory;
import org.relaybot.service.EmbedHelpFormatter;
import org.relaybot.service.ProfileStore;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CommandClientTest {

    private static final long HOME = 500L;
    private static final long ACTOR = 42L;
    private static final long CHANNEL = 77L;
    private static final long INVOCATION = 9001L;

    private RecordingTransport transport;
    private InMemoryResponseTracker tracker;
    private ProfileStore profiles;
    private ExecutorService executor;
    private CommandClient client;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        tracker = new InMemoryResponseTracker();
        profiles = mock(ProfileStore.class);
        when(profiles.getProfile(ACTOR)).thenReturn(ActorProfile.empty(ACTOR));
        Directory directory = mock(Directory.class);
        when(directory.homeScopeId()).thenReturn(HOME);
        executor = Executors.newSingleThreadExecutor();

        CommandServices services = new CommandServices(
                tracker,
                new PermissionEvaluator(RoleTiers.none()),
                new ContextResolver(directory),
                transport,
                new EmbedHelpFormatter("!")
        );
        client = new CommandClient(services, profiles, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRunPermittedCommandWithItsOwnContext() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        TestCommand command = new TestCommand(PermissionLevel.NONE, ctx -> {
            runs.incrementAndGet();
            assertEquals("a b", ctx.args().join());
            ctx.respond("pong");
        });

        client.execute(command, Arguments.of("a", "b"), invocation()).get(1, TimeUnit.SECONDS);
        transport.last().future().complete(new SentMessage(CHANNEL, 1L));

        assertEquals(1, runs.get());
        assertEquals("pong", transport.last().message().content());
        assertEquals(List.of(new ResponseRecord(INVOCATION, CHANNEL, 1L)), client.responseTracker().responsesFor(INVOCATION));
    }

    @Test
    void shouldAnswerWithPermissionNoticeWhenRejected() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        TestCommand command = new TestCommand(PermissionLevel.ADMIN, ctx -> runs.incrementAndGet());

        CompletableFuture<Void> done = client.execute(command, Arguments.empty(), invocation());
        assertFalse(done.isDone());
        transport.last().future().complete(new SentMessage(CHANNEL, 2L));
        done.get(1, TimeUnit.SECONDS);

        assertEquals(0, runs.get());
        assertTrue(transport.last().message().embed().getTitle().contains("Permission insuffisante"));
        assertEquals(1, tracker.responsesFor(INVOCATION).size());
    }

    @Test
    void shouldStaySilentForBlacklistedActors() throws Exception {
        when(profiles.getProfile(ACTOR)).thenReturn(new ActorProfile(ACTOR, PermissionLevel.ADMIN, true));
        AtomicInteger runs = new AtomicInteger();

        client.execute(new TestCommand(PermissionLevel.NONE, ctx -> runs.incrementAndGet()),
                Arguments.empty(), invocation()).get(1, TimeUnit.SECONDS);

        assertEquals(0, runs.get());
        assertTrue(transport.sends.isEmpty());
    }

    @Test
    void shouldUseStoredGrantForGate() throws Exception {
        when(profiles.getProfile(ACTOR)).thenReturn(new ActorProfile(ACTOR, PermissionLevel.ADMIN, false));
        AtomicInteger runs = new AtomicInteger();

        client.execute(new TestCommand(PermissionLevel.ADMIN, ctx -> runs.incrementAndGet()),
                Arguments.empty(), invocation()).get(1, TimeUnit.SECONDS);

        assertEquals(1, runs.get());
    }

    @Test
    void shouldReportHandlerCrashToTheUser() throws Exception {
        TestCommand command = new TestCommand(PermissionLevel.NONE, ctx -> {
            throw new IllegalStateException("boom");
        });

        client.execute(command, Arguments.empty(), invocation()).get(1, TimeUnit.SECONDS);

        assertEquals(1, transport.sends.size());
        assertTrue(transport.last().message().embed().getDescription().contains("boom"));
    }

    @Test
    void shouldFallBackToEmptyProfileWhenStoreFails() {
        when(profiles.getProfile(ACTOR)).thenThrow(new IllegalStateException("database locked"));
        TestCommand command = new TestCommand(PermissionLevel.NONE, ctx -> { });

        DispatchContext ctx = client.createContext(command, Arguments.empty(), invocation());

        assertEquals(ActorProfile.empty(ACTOR), ctx.profile());
        assertSame(command.descriptor(), ctx.command());
    }

    private static Invocation invocation() {
        return new Invocation(INVOCATION, CHANNEL, ACTOR, HOME, new Membership(ACTOR, HOME, Set.of(), false));
    }

    private static final class TestCommand implements Command {
        private final CommandDescriptor descriptor;
        private final Consumer<DispatchContext> body;

        TestCommand(PermissionLevel level, Consumer<DispatchContext> body) {
            this.descriptor = CommandDescriptor.of("test", "Commande de test", level);
            this.body = body;
        }

        @Override
        public CommandDescriptor descriptor() {
            return descriptor;
        }

        @Override
        public void execute(DispatchContext ctx) {
            body.accept(ctx);
        }
    }
}
