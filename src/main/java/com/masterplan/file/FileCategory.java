package com.masterplan.file;

import java.util.Locale;

/**
 * Every file we handle belongs to one project and one category within that project, corresponding to the
 * subdirectory (or object key prefix) where it's stored. UPLOADS holds the mutable draft assets written by the
 * editing tools. RELEASES holds immutable published output, one subdirectory per release id.
 */
public enum FileCategory {

    UPLOADS, RELEASES;

    /** @return a String for the directory or key prefix containing all files in this category. */
    public String directoryName () {
        return this.name().toLowerCase(Locale.ROOT);
    }

}
