package org.relaybot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.ChunkingFilter;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import org.relaybot.command.CommandClient;
import org.relaybot.command.CommandServices;
import org.relaybot.command.ContextResolver;
import org.relaybot.command.permission.PermissionEvaluator;
import org.relaybot.command.response.InMemoryResponseTracker;
import org.relaybot.command.response.ResponseCleanupListener;
import org.relaybot.command.response.ResponseTracker;
import org.relaybot.service.EmbedHelpFormatter;
import org.relaybot.service.JdaDirectory;
import org.relaybot.service.JdaTransport;
import org.relaybot.service.ProfileStore;
import org.relaybot.service.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point. Connects to Discord and wires the command client; command routing is plugged in on top of
 * {@link #commandClient()}.
 */
public class RelayBot {

    private static final Logger log = LoggerFactory.getLogger(RelayBot.class);

    private final JDA jda;
    private final CommandClient commandClient;
    private final ExecutorService executor;

    RelayBot(JDA jda, CommandClient commandClient, ExecutorService executor) {
        this.jda = jda;
        this.commandClient = commandClient;
        this.executor = executor;
    }

    public static void main(String[] args) throws Exception {
        BotConfig config = BotConfig.load();

        JDA jda = JDABuilder.createDefault(config.token())
                .enableIntents(GatewayIntent.MESSAGE_CONTENT, GatewayIntent.GUILD_MEMBERS, GatewayIntent.DIRECT_MESSAGES)
                .setMemberCachePolicy(MemberCachePolicy.ALL)
                .setChunkingFilter(ChunkingFilter.include(config.homeGuildId()))
                .build();
        jda.awaitReady();

        RelayBot bot = wire(jda, config, new DatabaseManager(config.databaseUrl()));
        Runtime.getRuntime().addShutdownHook(new Thread(bot::shutdown, "RelayBot-Shutdown"));
        log.info("Bot démarré avec succès !");
    }

    static RelayBot wire(JDA jda, BotConfig config, ProfileStore profiles) {
        ExecutorService executor = Executors.newFixedThreadPool(config.commandThreads());
        ResponseTracker tracker = new InMemoryResponseTracker(config.responseTtl());
        Transport transport = new JdaTransport(jda);

        CommandServices services = new CommandServices(
                tracker,
                new PermissionEvaluator(config.roleTiers()),
                new ContextResolver(new JdaDirectory(jda, config.homeGuildId())),
                transport,
                new EmbedHelpFormatter(config.prefix())
        );

        jda.addEventListener(new ResponseCleanupListener(tracker, transport));
        return new RelayBot(jda, new CommandClient(services, profiles, executor), executor);
    }

    /**
     * Lets running commands finish for a few seconds, then disconnects from Discord.
     */
    public void shutdown() {
        log.info("Arrêt du bot...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        jda.shutdown();
    }

    public JDA jda() {
        return jda;
    }

    public CommandClient commandClient() {
        return commandClient;
    }

    ExecutorService executor() {
        return executor;
    }
}
