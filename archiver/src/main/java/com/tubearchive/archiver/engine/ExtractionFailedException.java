package com.tubearchive.archiver.engine;

/**
 * Every pass, profile and retry of the attempt plan failed for a video. The
 * video stays out of the ledger and is tried again on the next run.
 */
public class ExtractionFailedException extends Exception {

    private final String videoId;
    private final int attempts;

    public ExtractionFailedException(String videoId, int attempts) {
        super("Extraction failed for " + videoId + " after " + attempts + " attempts");
        this.videoId = videoId;
        this.attempts = attempts;
    }

    public String getVideoId() {
        return videoId;
    }

    public int getAttempts() {
        return attempts;
    }
}
