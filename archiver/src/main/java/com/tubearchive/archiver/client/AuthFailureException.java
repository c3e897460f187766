package com.tubearchive.archiver.client;

/**
 * The account's credentials were rejected. The account is unusable for the
 * rest of the run.
 */
public class AuthFailureException extends PlaylistSourceException {

    public AuthFailureException(String message) {
        super(message);
    }

    public AuthFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
