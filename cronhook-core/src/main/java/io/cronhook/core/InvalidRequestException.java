package io.cronhook.core;

/**
 * The request itself is malformed (missing workspace id, missing trigger list, unreadable body).
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
