package org.relaybot;

import io.github.cdimascio.dotenv.Dotenv;
import org.relaybot.command.permission.RoleTiers;

import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Startup settings, read from the environment or a {@code .env} file.
 */
public record BotConfig(
    String token,
    long homeGuildId,
    RoleTiers roleTiers,
    String databaseUrl,
    Duration responseTtl,
    int commandThreads,
    String prefix
) {

    public static BotConfig load() {
        return fromEnv(Dotenv.configure().ignoreIfMissing().load());
    }

    public static BotConfig fromEnv(Dotenv dotenv) {
        String token = dotenv.get("DISCORD_TOKEN");
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("DISCORD_TOKEN manquant");
        }
        String homeGuild = dotenv.get("HOME_GUILD_ID");
        if (homeGuild == null || homeGuild.isBlank()) {
            throw new IllegalArgumentException("HOME_GUILD_ID manquant");
        }

        RoleTiers tiers = new RoleTiers(
                parseIds("ADMIN_ROLE_IDS", dotenv.get("ADMIN_ROLE_IDS")),
                parseIds("MODERATOR_ROLE_IDS", dotenv.get("MODERATOR_ROLE_IDS")),
                parseIds("BOT_OWNER_IDS", dotenv.get("BOT_OWNER_IDS"))
        );

        return new BotConfig(
                token,
                parseLong("HOME_GUILD_ID", homeGuild),
                tiers,
                dotenv.get("DATABASE_URL", "jdbc:sqlite:relaybot.db"),
                Duration.ofMinutes(parseLong("RESPONSE_TTL_MINUTES", dotenv.get("RESPONSE_TTL_MINUTES", "60"))),
                (int) parseLong("COMMAND_THREADS", dotenv.get("COMMAND_THREADS", "10")),
                dotenv.get("COMMAND_PREFIX", "!")
        );
    }

    static Set<Long> parseIds(String key, String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> parseLong(key, s))
                .collect(Collectors.toSet());
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valeur invalide pour " + key + " : " + value, e);
        }
    }
}
