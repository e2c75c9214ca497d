package com.masterplan.file;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * This implementation of FileStorage stores files in a local directory hierarchy laid out exactly like the object
 * keys a CDN-backed bucket would use: {project}/{category}/{path}.
 */
public class LocalFileStorage implements FileStorage {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFileStorage.class);

    public interface Config {
        // The local directory where all project files are stored.
        String localStorageDirectory ();
        // The port where the browser can fetch files. Parameter name aligned with the HttpApi server port parameter.
        int serverPort ();
    }

    public final String directory;
    private final String urlPrefix;

    public LocalFileStorage (Config config) {
        this(config.localStorageDirectory(), String.format("http://localhost:%s/files", config.serverPort()));
    }

    public LocalFileStorage (String directory, String urlPrefix) {
        this.directory = directory;
        this.urlPrefix = urlPrefix;
        new File(directory).mkdirs();
    }

    /**
     * Move the File into the FileStorage by moving the passed in file to the Path represented by the FileStorageKey.
     * It is possible that on some systems (Windows) the file cannot be moved and it will be copied instead, leaving
     * the source file in place. An existing file is never replaced.
     */
    @Override
    public void moveIntoStorage (FileStorageKey key, File sourceFile) {
        // Get the destination file path inside FileStorage, and ensure all its parent directories exist.
        File storedFile = getFile(key);
        if (storedFile.exists()) {
            throw new StorageException("Refusing to overwrite immutable stored file " + key.fullPath());
        }
        storedFile.getParentFile().mkdirs();
        try {
            try {
                Files.move(sourceFile.toPath(), storedFile.toPath());
            } catch (FileAlreadyExistsException e) {
                // Lost a race with another writer between the existence check and the move.
                throw new StorageException("Refusing to overwrite immutable stored file " + key.fullPath(), e);
            } catch (FileSystemException e) {
                // The default Windows filesystem (NTFS) does not always allow moving files that are still mapped
                // or scanned by another process. Fall back on copying, which leaves the source in place.
                Files.copy(sourceFile.toPath(), storedFile.toPath());
                LOG.info("Could not move {} because of FileSystem restrictions (probably NTFS). Copied instead.",
                        sourceFile.getName());
            }
            setReadOnly(storedFile);
        } catch (IOException e) {
            throw new StorageException("Could not store file " + key.fullPath(), e);
        }
    }

    @Override
    public File getFile (FileStorageKey key) {
        return new File(String.join("/", directory, key.fullPath()));
    }

    /**
     * Return a URL for the file as accessed through the backend's own static file server.
     * This exists to allow the same viewer to work locally and in cloud deployments.
     */
    @Override
    public String getURL (FileStorageKey key) {
        return String.join("/", urlPrefix, key.fullPath());
    }

    @Override
    public boolean exists (FileStorageKey key) {
        return getFile(key).exists();
    }

    @Override
    public List<FileStorageKey> list (FileStorageKey directoryKey) {
        Path root = getFile(directoryKey).toPath();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .map(p -> directoryKey.resolve(root.relativize(p).toString().replace(File.separatorChar, '/')))
                    .sorted((a, b) -> a.path.compareTo(b.path))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Could not list stored files below " + directoryKey.fullPath(), e);
        }
    }

    @Override
    public List<String> listChildren (FileStorageKey directoryKey) {
        String[] names = getFile(directoryKey).list();
        if (names == null) {
            return List.of();
        }
        return Arrays.stream(names).sorted().collect(Collectors.toList());
    }

    @Override
    public void deleteRecursively (FileStorageKey directoryKey) {
        File root = getFile(directoryKey);
        if (!root.exists()) {
            LOG.warn("Attempted to delete non-existing path: {}", root);
            return;
        }
        FileUtils.deleteRecursively(root);
    }

    /**
     * Set the file to be read-only and accessible only by the current user.
     * All files in our FileStorage are set to read-only as a safeguard against corruption under concurrent access.
     * We first do the POSIX atomic call, which should cover all deployment environments, then fall back on the
     * portable File methods to cover any development environments using other filesystems.
     */
    public static void setReadOnly (File file) {
        try {
            try {
                Files.setPosixFilePermissions(file.toPath(), EnumSet.of(PosixFilePermission.OWNER_READ));
            } catch (UnsupportedOperationException e) {
                LOG.warn("POSIX permissions unsupported on this filesystem. Falling back on portable NIO methods.");
                if (!(file.setReadable(true) && file.setWritable(false))) {
                    LOG.error("Could not set read-only permissions on file {}", file);
                }
            }
        } catch (Exception e) {
            LOG.error("Could not set read-only permissions on file {}", file, e);
        }
    }

}
