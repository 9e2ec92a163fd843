package org.relaybot.command;

public interface Command {
    CommandDescriptor descriptor();
    void execute(DispatchContext ctx);
}
