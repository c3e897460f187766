package com.tubearchive.archiver.media;

/**
 * The muxer could not be started or exited with a failure status.
 */
public class MuxException extends Exception {

    public MuxException(String message) {
        super(message);
    }

    public MuxException(String message, Throwable cause) {
        super(message, cause);
    }
}
