package com.tubearchive.archiver.engine;

/**
 * One entry of an {@link AttemptPlan}. A step without a profile runs the
 * extractor with its own defaults (no headers, no client override).
 */
public record AttemptStep(
        String label,
        String formatSelector,
        ExtractionProfile profile
) {

    public boolean isDefault() {
        return profile == null;
    }
}
