package org.relaybot.command;

import org.relaybot.command.permission.PermissionEvaluator;
import org.relaybot.command.response.ResponseTracker;
import org.relaybot.service.HelpFormatter;
import org.relaybot.service.Transport;

/**
 * Long-lived collaborators shared by every {@link DispatchContext}.
 */
public record CommandServices(
    ResponseTracker responses,
    PermissionEvaluator permissions,
    ContextResolver resolver,
    Transport transport,
    HelpFormatter helpFormatter
) {}
