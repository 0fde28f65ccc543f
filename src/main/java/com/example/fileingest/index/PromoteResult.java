package com.example.fileingest.index;

import java.nio.file.Path;

/**
 * Outcome of promoting a quarantined copy. {@code demotedPath} is null when no primary file was
 * left to demote.
 */
public record PromoteResult(Path primaryPath, Path demotedPath) {
}
