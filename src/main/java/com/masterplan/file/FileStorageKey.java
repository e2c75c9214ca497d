package com.masterplan.file;

import java.util.Objects;

/**
 * A unique identifier for a file within a project, in a namespace drawn from an enum of known categories.
 * This maps to {project}/{category}/{path} in local storage, and would map to an object key in S3-style storage.
 * This avoids passing around a lot of directory names as strings, and avoids mistakes where such strings are
 * mismatched across different function calls.
 */
public class FileStorageKey {

    public final String project;
    public final FileCategory category;
    public final String path;

    public FileStorageKey (String project, FileCategory category, String path) {
        checkForDirectoryTraversal(project);
        checkForDirectoryTraversal(path);
        if (project.isBlank() || project.contains("/")) {
            throw new IllegalArgumentException("Project slug must be a single non-empty path segment: " + project);
        }
        this.project = project;
        this.category = category;
        this.path = path;
    }

    /** Return a key for a file nested below this one, treating this key as a directory. */
    public FileStorageKey resolve (String childPath) {
        String combined = path.isEmpty() ? childPath : String.join("/", path, childPath);
        return new FileStorageKey(project, category, combined);
    }

    /** The slash-separated path of this file relative to the root of the storage. */
    public String fullPath () {
        if (path.isEmpty()) {
            return String.join("/", project, category.directoryName());
        }
        return String.join("/", project, category.directoryName(), path);
    }

    @Override
    public String toString () {
        return String.format("[File storage key: project='%s', category='%s', path='%s']", project, category, path);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileStorageKey that = (FileStorageKey) o;
        return project.equals(that.project) && category == that.category && path.equals(that.path);
    }

    @Override
    public int hashCode () {
        return Objects.hash(project, category, path);
    }

    /**
     * Validate user-provided paths to ensure they do not contain any sequence that would allow accessing files
     * outside the intended file storage directory.
     */
    public static void checkForDirectoryTraversal (String path) {
        if (path.contains("../") || path.contains("..\\") || path.equals("..") || path.startsWith("/")) {
            throw new IllegalArgumentException("Path looks like it could be a directory traversal attack.");
        }
    }

}
