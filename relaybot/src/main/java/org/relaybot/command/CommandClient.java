package org.relaybot.command;

import org.relaybot.command.permission.PermissionDecision;
import org.relaybot.command.response.ResponseTracker;
import org.relaybot.service.ProfileStore;
import org.relaybot.util.EmbedConvention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs matched commands. Builds one {@link DispatchContext} per invocation, applies the command's permission
 * level, and executes the handler on the worker pool.
 */
public class CommandClient {

    private static final Logger log = LoggerFactory.getLogger(CommandClient.class);

    private final CommandServices services;
    private final ProfileStore profiles;
    private final ExecutorService executor;

    public CommandClient(CommandServices services, ProfileStore profiles, ExecutorService executor) {
        this.services = services;
        this.profiles = profiles;
        this.executor = executor;
    }

    public ResponseTracker responseTracker() {
        return services.responses();
    }

    public DispatchContext createContext(Command command, Arguments args, Invocation invocation) {
        ActorProfile profile = loadProfile(invocation.actorId());
        return new DispatchContext(command.descriptor(), args, invocation, profile, services);
    }

    /**
     * Executes {@code command} for {@code invocation}.
     *
     * @return completes when the handler returned, or when the permission notice was sent
     */
    public CompletableFuture<Void> execute(Command command, Arguments args, Invocation invocation) {
        DispatchContext ctx = createContext(command, args, invocation);
        CommandDescriptor descriptor = command.descriptor();
        PermissionDecision decision = ctx.decide(descriptor.permission());

        if (decision == PermissionDecision.IGNORED) {
            log.debug("Utilisateur {} ignoré (blacklist), commande {}", invocation.actorId(), descriptor.name());
            return CompletableFuture.completedFuture(null);
        }
        if (decision == PermissionDecision.REJECTED) {
            log.info("Permission {} refusée à {} pour {}", descriptor.permission(), invocation.actorId(), descriptor.name());
            return ctx.respond(EmbedConvention.error("Permission insuffisante",
                            "Cette commande nécessite la permission `" + descriptor.permission() + "`."))
                    .thenApply(sent -> null);
        }
        return CompletableFuture.runAsync(() -> run(command, ctx), executor);
    }

    private void run(Command command, DispatchContext ctx) {
        try {
            command.execute(ctx);
        } catch (Exception e) {
            log.error("Erreur lors de l'exécution de la commande {} (invocation {})",
                    command.descriptor().name(), ctx.messageId(), e);
            ctx.respond(EmbedConvention.error("Erreur", "Une erreur est survenue : " + e.getMessage()))
                    .whenComplete((sent, error) -> {
                        if (error != null) {
                            log.warn("Impossible de signaler l'erreur pour l'invocation {}", ctx.messageId(), error);
                        }
                    });
        }
    }

    private ActorProfile loadProfile(long actorId) {
        try {
            ActorProfile profile = profiles.getProfile(actorId);
            return profile == null ? ActorProfile.empty(actorId) : profile;
        } catch (RuntimeException e) {
            log.warn("Lecture du profil {} impossible, profil vide utilisé", actorId, e);
            return ActorProfile.empty(actorId);
        }
    }
}
