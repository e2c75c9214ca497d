package com.masterplan.release;

import com.masterplan.file.FileStorageKey;
import com.masterplan.file.StorageException;
import com.masterplan.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * Keeps the current-release pointer of each project in {project}/current-release.json, beside the immutable
 * release directories. The pointer is replaced by writing a temporary file and renaming it over the old one, so
 * readers see either the old pointer or the new one and never a partial file.
 *
 * All pointer writes for a project happen under that project's lock. The same lock is held for the whole publish
 * of a release, so publishes and rollbacks of one project never interleave.
 */
public class ReleasePointerStore {

    private static final Logger LOG = LoggerFactory.getLogger(ReleasePointerStore.class);

    public static final String POINTER_FILE_NAME = "current-release.json";

    private final File storageRoot;

    private final ConcurrentHashMap<String, ReentrantLock> projectLocks = new ConcurrentHashMap<>();

    public ReleasePointerStore (File storageRoot) {
        this.storageRoot = storageRoot;
    }

    public ReentrantLock lockFor (String projectSlug) {
        return projectLocks.computeIfAbsent(projectSlug, p -> new ReentrantLock());
    }

    /** @return the current pointer, or null if nothing has been published for the project yet. */
    @Nullable
    public ReleasePointer getCurrent (String projectSlug) {
        File file = pointerFile(projectSlug);
        if (!file.exists()) {
            return null;
        }
        try {
            return JsonUtil.objectMapper.readValue(file, ReleasePointer.class);
        } catch (IOException e) {
            throw new StorageException("Could not read release pointer for project " + projectSlug, e);
        }
    }

    /**
     * Point the project at the given release. The caller is responsible for making sure the release is complete.
     */
    public ReleasePointer setCurrent (String projectSlug, String releaseId) {
        ReentrantLock lock = lockFor(projectSlug);
        lock.lock();
        try {
            ReleasePointer previous = getCurrent(projectSlug);
            String previousId = previous == null ? null : previous.releaseId;
            if (releaseId.equals(previousId)) {
                LOG.info("Project {} already points at release {}.", projectSlug, releaseId);
                return previous;
            }
            ReleasePointer pointer = new ReleasePointer(
                projectSlug, releaseId, previousId, Instant.now().truncatedTo(ChronoUnit.MILLIS));
            write(pointerFile(projectSlug), pointer);
            LOG.info("Project {} now points at release {} (was {}).", projectSlug, releaseId, previousId);
            return pointer;
        } finally {
            lock.unlock();
        }
    }

    private static void write (File target, ReleasePointer pointer) {
        Path targetPath = target.toPath();
        try {
            Files.createDirectories(targetPath.getParent());
            Path temp = Files.createTempFile(targetPath.getParent(), ".current-release", ".tmp");
            try {
                Files.write(temp, JsonUtil.toPrettyJsonBytes(pointer));
                try {
                    Files.move(temp, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    LOG.warn("Filesystem does not support atomic rename, replacing {} non-atomically.", target);
                    Files.move(temp, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new StorageException("Could not write release pointer " + target, e);
        }
    }

    private File pointerFile (String projectSlug) {
        FileStorageKey.checkForDirectoryTraversal(projectSlug);
        return new File(new File(storageRoot, projectSlug), POINTER_FILE_NAME);
    }

}
