package org.dataapi.transport;

import java.time.Duration;

import lombok.Builder;

/**
 * Where a command is addressed and how long the caller is willing to wait for it. Null fields fall back to
 * the executor's defaults: the connection's namespace, no collection (a namespace-level command), and the
 * executor's default timeout.
 */
@Builder(toBuilder = true)
public record CommandOptions(
    String namespace,
    String collection,
    Duration timeout
) {
    public static final CommandOptions DEFAULTS = CommandOptions.builder().build();

    public static CommandOptions forCollection(String namespace, String collection) {
        return CommandOptions.builder().namespace(namespace).collection(collection).build();
    }

    public CommandOptions withTimeout(Duration timeout) {
        return timeout == null ? this : toBuilder().timeout(timeout).build();
    }
}
