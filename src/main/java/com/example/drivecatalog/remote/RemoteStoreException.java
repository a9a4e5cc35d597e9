package com.example.drivecatalog.remote;

import java.io.IOException;
import java.util.OptionalInt;

/**
 * Failure talking to the remote store. The message is prefixed with the failed operation and
 * suffixed with the HTTP status when one is known.
 */
public class RemoteStoreException extends IOException {
    private final String operation;
    private final Integer statusCode;

    public RemoteStoreException(String message, String operation, Integer statusCode, Throwable cause) {
        super(describe(message, operation, statusCode), cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public String getOperation() {
        return operation;
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    private static String describe(String message, String operation, Integer statusCode) {
        String full = message;
        if (operation != null) {
            full = "Failed to " + operation + ": " + message;
        }
        if (statusCode != null) {
            full = full + " (HTTP " + statusCode + ")";
        }
        return full;
    }
}
