package com.masterplan.drafts;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.masterplan.file.FileCategory;
import com.masterplan.file.FileStorageKey;
import com.masterplan.release.ReleaseConfig;

/**
 * An editable version of a project, as described by {project}/uploads/{version}/draft.json. The descriptor names the
 * base image and overlay document (relative to its own directory) and carries the configuration block that will be
 * copied into the release.
 */
public class Draft {

    public static final String DESCRIPTOR_FILE_NAME = "draft.json";

    /** Set from the storage location, not read from the descriptor. */
    @JsonIgnore
    public String projectSlug;

    /** Set from the storage location, not read from the descriptor. */
    @JsonIgnore
    public String version;

    /** File name of the raster base image. */
    public String baseImage;

    /** File name of the SVG overlay document. */
    public String overlays;

    public String overlayType = "unit";

    /** Optional regular expression restricting which SVG elements become overlays. */
    public String idPattern;

    public ReleaseConfig config;

    @JsonIgnore
    public String getDraftId () {
        return draftId(projectSlug, version);
    }

    @JsonIgnore
    public FileStorageKey getBaseImageKey () {
        return baseImage == null ? null : directoryKey(projectSlug, version).resolve(baseImage);
    }

    @JsonIgnore
    public FileStorageKey getOverlayDocumentKey () {
        return overlays == null ? null : directoryKey(projectSlug, version).resolve(overlays);
    }

    public static String draftId (String projectSlug, String version) {
        return projectSlug + "/" + version;
    }

    /**
     * Split a draft id into project slug and version.
     * @throws IllegalArgumentException if the id is not of the form project/version.
     */
    public static String[] parseDraftId (String draftId) {
        String[] parts = draftId == null ? new String[0] : draftId.split("/", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Draft id must be of the form project/version: " + draftId);
        }
        FileStorageKey.checkForDirectoryTraversal(parts[0]);
        FileStorageKey.checkForDirectoryTraversal(parts[1]);
        return parts;
    }

    public static FileStorageKey directoryKey (String projectSlug, String version) {
        return new FileStorageKey(projectSlug, FileCategory.UPLOADS, version);
    }

    @Override
    public String toString () {
        return "[draft " + getDraftId() + "]";
    }

}
