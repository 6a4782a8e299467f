package org.dataapi.transport;

import java.time.Duration;

import lombok.Getter;

/**
 * The per-call timeout elapsed before the service answered. Nothing can be assumed about whether the
 * command took effect.
 */
@Getter
public class DataApiTimeoutException extends DataApiException {
    private final String commandName;
    private final Duration timeout;

    public DataApiTimeoutException(String commandName, Duration timeout, Throwable cause) {
        super("Command " + commandName + " timed out after " + timeout.toMillis() + "ms", cause);
        this.commandName = commandName;
        this.timeout = timeout;
    }
}
