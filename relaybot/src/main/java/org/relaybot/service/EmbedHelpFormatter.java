package org.relaybot.service;

import org.relaybot.command.CommandDescriptor;
import org.relaybot.command.permission.PermissionLevel;
import org.relaybot.util.EmbedConvention;

import java.util.stream.Collectors;

public class EmbedHelpFormatter implements HelpFormatter {

    private final String prefix;

    public EmbedHelpFormatter(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public EmbedConvention renderHelp(CommandDescriptor command) {
        EmbedConvention embed = EmbedConvention.info("Aide - " + prefix + command.name(),
                command.description().isBlank() ? "Aucune description." : command.description());

        String usage = command.usage().isBlank() ? command.name() : command.name() + " " + command.usage();
        embed.addField("📝 Utilisation", "`" + prefix + usage + "`", false);

        if (!command.aliases().isEmpty()) {
            String aliases = command.aliases().stream()
                    .map(alias -> "`" + prefix + alias + "`")
                    .collect(Collectors.joining(", "));
            embed.addField("🔁 Alias", aliases, true);
        }
        if (command.permission() != PermissionLevel.NONE) {
            embed.addField("🔒 Permission", command.permission().name(), true);
        }
        embed.setFooter("Catégorie : " + command.category());
        return embed;
    }
}
