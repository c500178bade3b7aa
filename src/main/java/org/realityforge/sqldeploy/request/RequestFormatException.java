package org.realityforge.sqldeploy.request;

public final class RequestFormatException extends RuntimeException {
    public RequestFormatException(final String message) {
        super(message);
    }

    public RequestFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
