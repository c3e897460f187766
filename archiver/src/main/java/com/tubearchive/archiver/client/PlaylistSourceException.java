package com.tubearchive.archiver.client;

/**
 * A playlist listing, metadata lookup or removal could not be completed.
 */
public class PlaylistSourceException extends Exception {

    public PlaylistSourceException(String message) {
        super(message);
    }

    public PlaylistSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
