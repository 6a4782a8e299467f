package org.dataapi.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Sends one command to the service. Implementations perform no retries.
 *
 * The returned Mono fails with {@link DataApiResponseException} when the service rejected the command,
 * {@link DataApiTimeoutException} when {@link CommandOptions#timeout()} elapsed, and
 * {@link DataApiHttpException} for any other transport failure.
 */
@FunctionalInterface
public interface CommandExecutor {
    Mono<CommandResponse> execute(ObjectNode command, CommandOptions options);

    /** Name of a command object, which is its single top-level key. */
    static String commandName(ObjectNode command) {
        var names = command.fieldNames();
        return names.hasNext() ? names.next() : "<empty>";
    }
}
