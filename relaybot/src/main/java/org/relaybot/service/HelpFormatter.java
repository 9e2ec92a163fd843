package org.relaybot.service;

import org.relaybot.command.CommandDescriptor;
import org.relaybot.util.EmbedConvention;

public interface HelpFormatter {
    EmbedConvention renderHelp(CommandDescriptor command);
}
