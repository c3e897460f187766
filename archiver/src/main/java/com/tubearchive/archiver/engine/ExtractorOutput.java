package com.tubearchive.archiver.engine;

import java.nio.file.Path;

/**
 * What the extraction layer reported after a completed run. The reported
 * file may be null when the layer did not print its final path.
 */
public record ExtractorOutput(Path reportedFile) {
}
