package org.relaybot.command;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;
import org.relaybot.command.permission.PermissionDecision;
import org.relaybot.command.permission.PermissionLevel;
import org.relaybot.command.response.ResponseRecord;
import org.relaybot.util.EmbedConvention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Everything a command needs while it runs: the invocation, its arguments, the author's profile, and the
 * means to answer and to check permissions.
 * <p>
 * One instance serves exactly one invocation. Every message sent through {@code respond} is registered with
 * the shared {@link org.relaybot.command.response.ResponseTracker} once Discord acknowledges it, keyed by the
 * id of the triggering message.
 */
public class DispatchContext {

    private static final Logger log = LoggerFactory.getLogger(DispatchContext.class);

    private final CommandDescriptor command;
    private final Arguments args;
    private final Invocation invocation;
    private final ActorProfile profile;
    private final CommandServices services;

    private final long scopeId;
    private final Membership membership;
    private final ChannelRef channel;

    public DispatchContext(CommandDescriptor command, Arguments args, Invocation invocation, ActorProfile profile,
                           CommandServices services) {
        this.command = command;
        this.args = args == null ? Arguments.empty() : args;
        this.invocation = invocation;
        this.profile = profile == null ? ActorProfile.empty(invocation.actorId()) : profile;
        this.services = services;

        ContextResolver resolver = services.resolver();
        Optional<Membership> resolved = resolver.resolveMembership(invocation);
        this.scopeId = resolver.resolveScope(invocation);
        this.membership = resolved.orElse(null);
        this.channel = resolver.resolveChannel(invocation, resolved).orElse(null);
    }

    public CommandDescriptor command() {
        return command;
    }

    public Arguments args() {
        return args;
    }

    public Invocation invocation() {
        return invocation;
    }

    public ActorProfile profile() {
        return profile;
    }

    public long messageId() {
        return invocation.messageId();
    }

    public long actorId() {
        return invocation.actorId();
    }

    public long scopeId() {
        return scopeId;
    }

    public Optional<Membership> membership() {
        return Optional.ofNullable(membership);
    }

    public Optional<ChannelRef> channel() {
        return Optional.ofNullable(channel);
    }

    /**
     * @return the responses already acknowledged for this invocation
     */
    public List<ResponseRecord> responses() {
        return services.responses().responsesFor(invocation.messageId());
    }

    /**
     * Sends {@code content} as plain text. {@code @everyone} and {@code @here} are not expanded.
     */
    public CompletableFuture<SentMessage> respond(String content) {
        return normalizeAndSend(new Response.Text(content));
    }

    public CompletableFuture<SentMessage> respond(MessageEmbed embed) {
        return normalizeAndSend(new Response.Structured(embed));
    }

    public CompletableFuture<SentMessage> respond(EmbedBuilder embedBuilder) {
        return normalizeAndSend(new Response.StructuredBuilder(embedBuilder));
    }

    public CompletableFuture<SentMessage> respond(EmbedConvention embed) {
        return normalizeAndSend(new Response.StructuredConvention(embed));
    }

    /**
     * Sends the help embed of the running command.
     */
    public CompletableFuture<SentMessage> sendHelp() {
        return respond(services.helpFormatter().renderHelp(command));
    }

    public boolean hasAdmin() {
        return hasPermission(PermissionLevel.ADMIN);
    }

    public boolean hasModerator() {
        return hasPermission(PermissionLevel.MODERATOR);
    }

    public boolean hasPermission(PermissionLevel level) {
        return decide(level) == PermissionDecision.ACCEPTED;
    }

    public PermissionDecision decide(PermissionLevel level) {
        return services.permissions().evaluate(level, membership, profile);
    }

    /**
     * Validates and sends one response. An empty payload throws right away; delivery problems complete the
     * returned future with a {@link DispatchFailure} and leave the tracker untouched.
     */
    private CompletableFuture<SentMessage> normalizeAndSend(Response response) {
        OutboundMessage message = response.normalize();
        if (channel == null) {
            ResolutionFailure cause = new ResolutionFailure("Utilisateur " + invocation.actorId()
                    + " introuvable sur le serveur " + scopeId);
            return CompletableFuture.failedFuture(
                    new DispatchFailure("Aucun salon de réponse pour l'invocation " + invocation.messageId(), cause));
        }

        CompletableFuture<SentMessage> pending;
        try {
            pending = services.transport().send(channel, message);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        return pending.handle((sent, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.debug("Échec de la réponse à l'invocation {} dans {}", invocation.messageId(), channel, cause);
                throw cause instanceof DispatchFailure failure
                        ? failure
                        : new DispatchFailure("Échec de l'envoi de la réponse à l'invocation " + invocation.messageId(), cause);
            }
            if (!services.responses().register(invocation.messageId(), sent.channelId(), sent.messageId())) {
                // The invocation was deleted while this reply was in flight
                discard(sent);
            }
            return sent;
        });
    }

    private void discard(SentMessage sent) {
        log.debug("Invocation {} déjà supprimée, suppression de la réponse {}", invocation.messageId(), sent.messageId());
        services.transport().delete(sent.channelId(), sent.messageId())
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.debug("Suppression de la réponse {} impossible", sent.messageId(), error);
                    }
                });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
