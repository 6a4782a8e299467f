package org.dataapi.transport;

import lombok.Getter;

/**
 * The exchange failed at the HTTP level: a server-side failure status, or a body that is not a Data API
 * response at all. Connection failures carry {@link #NO_RESPONSE} as their status.
 */
@Getter
public class DataApiHttpException extends DataApiException {
    public static final int NO_RESPONSE = 0;

    private final int statusCode;
    private final String body;

    public DataApiHttpException(int statusCode, String message, String body) {
        super("HTTP " + statusCode + ": " + message);
        this.statusCode = statusCode;
        this.body = body;
    }

    public DataApiHttpException(int statusCode, String message, String body, Throwable cause) {
        super("HTTP " + statusCode + ": " + message, cause);
        this.statusCode = statusCode;
        this.body = body;
    }
}
