package com.tubearchive.archiver.orchestrator;

import java.util.List;

/**
 * Outcome of a run: display names of archived and failed videos. A skipped
 * run (lock held elsewhere) has no results.
 */
public record RunSummary(
        List<String> succeeded,
        List<String> failed,
        long totalDurationMs,
        boolean skipped
) {

    public RunSummary {
        succeeded = succeeded != null ? List.copyOf(succeeded) : List.of();
        failed = failed != null ? List.copyOf(failed) : List.of();
    }

    public static RunSummary lockHeld() {
        return new RunSummary(List.of(), List.of(), 0, true);
    }

    public int successCount() {
        return succeeded.size();
    }

    public int failureCount() {
        return failed.size();
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public boolean hasResults() {
        return !succeeded.isEmpty() || !failed.isEmpty();
    }

    /**
     * Plain-text message for the notification transport.
     */
    public String notificationMessage() {
        StringBuilder msg = new StringBuilder("TubeArchive Summary\n");
        msg.append("✔ Success: ").append(successCount()).append('\n');
        msg.append("✖ Failed: ").append(failureCount()).append("\n\n");

        if (!succeeded.isEmpty()) {
            msg.append("Downloaded:\n");
            succeeded.forEach(name -> msg.append("• ").append(name).append('\n'));
            msg.append('\n');
        }
        if (!failed.isEmpty()) {
            msg.append("Failed:\n");
            failed.forEach(name -> msg.append("• ").append(name).append('\n'));
        }
        return msg.toString().stripTrailing();
    }
}
