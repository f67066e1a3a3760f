package com.ryuqq.scapipeline.core.spi;

/**
 * Path of a file or directory inside the configuration repository, using {@code /} as separator.
 *
 * @param path the relative path
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConfigPath(String path) {

    public ConfigPath {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
    }

    /**
     * Returns the last path segment.
     *
     * @return the file name
     */
    public String fileName() {
        int index = path.lastIndexOf('/');
        return index < 0 ? path : path.substring(index + 1);
    }

    /**
     * Returns this path relative to a parent directory path.
     *
     * @param parent the parent directory
     * @return the relative path, or the full path if it is not below the parent
     */
    public String relativeTo(ConfigPath parent) {
        String prefix = parent.path().endsWith("/") ? parent.path() : parent.path() + "/";
        return path.startsWith(prefix) ? path.substring(prefix.length()) : path;
    }

    @Override
    public String toString() {
        return path;
    }
}
