package com.masterplan.file;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Store files for all projects. Files in the RELEASES category are treated as immutable once put into storage:
 * implementations must refuse to replace a key that already exists, and should make stored files read-only.
 * For simplicity, methods that store and remove files are all blocking calls. If you add a file, all other components
 * of the system are known to be able to see it as soon as the method returns.
 *
 * The only mutable per-project state (which release is current) is deliberately not handled here, see
 * ReleasePointerStore.
 */
public interface FileStorage {

    /**
     * Takes an already existing file on the local filesystem and registers it as a permanent, immutable file.
     * The file should be created in a scratch location, completely written out and closed before this method is
     * called on it. The source file may be moved rather than copied, so the caller must not use it afterward.
     * @throws StorageException if the key already exists or the file cannot be stored.
     */
    void moveIntoStorage (FileStorageKey fileStorageKey, File file);

    /**
     * Files returned from this method must be treated as immutable. Never write to them.
     */
    File getFile (FileStorageKey fileStorageKey);

    /**
     * Get the URL for the File identified by the FileStorageKey. This provides a way for a browser-based viewer to
     * read the file without going through the backend. This can be a CDN URL or a file server URL when running locally.
     */
    String getURL (FileStorageKey fileStorageKey);

    boolean exists (FileStorageKey fileStorageKey);

    /**
     * List the keys of all files below the given key, which is interpreted as a directory. Returned paths are full
     * paths within the key's category, in lexical order. Returns an empty list if nothing is stored there.
     */
    List<FileStorageKey> list (FileStorageKey directoryKey);

    /**
     * Names of the immediate children (files or directories) of the given key, which is interpreted as a directory.
     * Sorted lexically. Returns an empty list if nothing is stored there.
     */
    List<String> listChildren (FileStorageKey directoryKey);

    /**
     * Recursively delete everything below the given key. This is only for cleaning up artifacts that were never
     * referenced by any published pointer, such as a release directory left behind by a failed publish.
     */
    void deleteRecursively (FileStorageKey directoryKey);

    //// Convenience methods usable with all concrete subclasses.

    default InputStream getInputStream (FileStorageKey fileStorageKey) throws IOException {
        return new BufferedInputStream(new FileInputStream(getFile(fileStorageKey)));
    }

}
