package com.masterplan.file;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

public abstract class FileUtils {

    /**
     * Tile pyramids and manifests are built up in a temporary directory before being moved into storage.
     * @return File temporary directory
     */
    public static File createScratchDirectory () {
        try {
            return Files.createTempDirectory("com.masterplan.file").toFile();
        } catch (IOException e) {
            throw new StorageException("Could not create scratch directory.", e);
        }
    }

    /**
     * This is used to make files that will be written, then closed and put into the FileStorage.
     * This method doesn't belong on the FileStorage, which deals only with immutable system-wide files.
     *
     * @param type a short string revealing what kind of file this is, just to make filenames more human readable.
     * @return File a file to write to
     */
    public static File createScratchFile (String type) {
        try {
            File tempFile = File.createTempFile("com.masterplan.file", type);
            // The file deletion shutdown hook applies to the temp file path, not the file contents.
            // If the file is moved to another path (which we often do) it will not be deleted.
            tempFile.deleteOnExit();
            return tempFile;
        } catch (IOException e) {
            throw new StorageException("Could not create scratch file.", e);
        }
    }

    /** Write the given bytes to a new scratch file. */
    public static File createScratchFile (byte[] bytes, String type) {
        File scratch = createScratchFile(type);
        try {
            Files.write(scratch.toPath(), bytes);
        } catch (IOException e) {
            throw new StorageException("Could not write scratch file.", e);
        }
        return scratch;
    }

    /** Delete a file or a whole directory tree. Does nothing if the file does not exist. */
    public static void deleteRecursively (File file) {
        if (file == null || !file.exists()) return;
        try {
            // Scratch and storage directories are never shared with other users, so the insecure fallback used on
            // filesystems without SecureDirectoryStream support is acceptable.
            MoreFiles.deleteRecursively(file.toPath(), RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            throw new StorageException("Could not delete " + file, e);
        }
    }

}
