package com.tubearchive.archiver.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered extraction attempts for one video: the extractor's own defaults
 * first, then every profile of the chain in order, then a generic
 * best-quality fallback. Every plan, whatever the strictness mode, contains
 * at least one default step and one {@value #BEST_FALLBACK_FORMAT} step.
 */
public final class AttemptPlan {

    /** WebM (VP9/Opus) preferred, MP4 (H.264/AAC) accepted, capped at 1080p. */
    static final String STRICT_FORMAT =
            "bestvideo[ext=webm][height<=1080]+bestaudio[ext=webm]/"
                    + "bestvideo[ext=webm][height<=720]+bestaudio[ext=webm]/"
                    + "bestvideo[ext=mp4][height<=1080]+bestaudio[ext=m4a]/"
                    + "bestvideo[ext=mp4][height<=720]+bestaudio[ext=m4a]";

    static final String RELAXED_FORMAT = "bestvideo*+bestaudio/best";

    public static final String BEST_FALLBACK_FORMAT = "best";

    private final List<AttemptStep> steps;

    private AttemptPlan(List<AttemptStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public static AttemptPlan build(StrictnessMode mode) {
        return build(mode, ExtractionProfile.CHAIN);
    }

    public static AttemptPlan build(StrictnessMode mode, List<ExtractionProfile> chain) {
        String format = formatFor(mode);
        List<AttemptStep> steps = new ArrayList<>();
        steps.add(new AttemptStep("default", format, null));
        for (ExtractionProfile profile : chain) {
            steps.add(new AttemptStep(profile.name(), format, profile));
        }
        steps.add(new AttemptStep("best-fallback", BEST_FALLBACK_FORMAT, null));
        return new AttemptPlan(steps);
    }

    static String formatFor(StrictnessMode mode) {
        return switch (mode) {
            case STRICT -> STRICT_FORMAT;
            case RELAXED -> RELAXED_FORMAT;
        };
    }

    public List<AttemptStep> steps() {
        return steps;
    }

    public boolean hasDefaultStep() {
        return steps.stream().anyMatch(AttemptStep::isDefault);
    }

    public boolean hasBestFallbackStep() {
        return steps.stream()
                .anyMatch(s -> isBestFallback(s.formatSelector()));
    }

    /**
     * True when the selector ends in the generic {@code best} alternative,
     * which any source with at least one playable format satisfies.
     */
    static boolean isBestFallback(String formatSelector) {
        if (formatSelector == null) {
            return false;
        }
        return formatSelector.equals(BEST_FALLBACK_FORMAT)
                || formatSelector.endsWith("/" + BEST_FALLBACK_FORMAT);
    }
}
