package com.tubearchive.archiver.process;

import java.util.List;

/**
 * Outcome of an external command. Output holds the combined stdout/stderr
 * lines, trimmed to the most recent ones.
 */
public record CommandResult(
        int exitCode,
        List<String> output,
        boolean timedOut
) {

    public CommandResult {
        output = output != null ? List.copyOf(output) : List.of();
    }

    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    public String lastLine() {
        for (int i = output.size() - 1; i >= 0; i--) {
            String line = output.get(i);
            if (line != null && !line.isBlank()) {
                return line.trim();
            }
        }
        return null;
    }
}
