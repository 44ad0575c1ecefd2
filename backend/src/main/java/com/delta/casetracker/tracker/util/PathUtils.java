package com.delta.casetracker.tracker.util;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class PathUtils {
    private PathUtils() {
    }

    /**
     * Resolves a configured path against the working directory when it is relative.
     */
    public static Path resolve(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
