package com.masterplan.release;

import java.time.Instant;

/**
 * Which release of a project the viewer should load. This is the only mutable record the publish pipeline writes.
 */
public class ReleasePointer {

    public String projectSlug;
    public String releaseId;

    /** The release this one replaced, kept so an operator can see what a rollback would return to. */
    public String previousReleaseId;

    public Instant updatedAt;

    public ReleasePointer () { }

    public ReleasePointer (String projectSlug, String releaseId, String previousReleaseId, Instant updatedAt) {
        this.projectSlug = projectSlug;
        this.releaseId = releaseId;
        this.previousReleaseId = previousReleaseId;
        this.updatedAt = updatedAt;
    }

}
