package com.outcast.rivalry.service;

/**
 * The league provider could not be reached at all, or the engine could not schedule work.
 * Surfaces to users as "rivalry data temporarily unavailable".
 */
public class RivalryUnavailableException extends RuntimeException {

    public RivalryUnavailableException(String message) {
        super(message);
    }

    public RivalryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
