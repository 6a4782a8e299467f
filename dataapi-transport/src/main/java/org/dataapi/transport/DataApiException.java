package org.dataapi.transport;

/**
 * Root of every error raised by the client.
 */
public class DataApiException extends RuntimeException {
    public DataApiException(String message) {
        super(message);
    }

    public DataApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
