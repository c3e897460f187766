package com.tubearchive.archiver.media;

/**
 * External stream-copy muxer. Never re-encodes.
 */
public interface MediaMuxer {

    void mux(MuxRequest request) throws MuxException;
}
