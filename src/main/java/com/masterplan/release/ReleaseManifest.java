package com.masterplan.release;

import com.google.common.hash.Hashing;
import com.masterplan.util.JsonUtil;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The release.json document: everything the viewer needs to display one published version of a master plan.
 * A manifest is written exactly once, next to its tiles, and never updated. Publishing again creates a new manifest
 * under a new release id.
 *
 * The checksum covers the canonical JSON serialization of every other field (sorted keys, no whitespace), so any
 * reader can detect a truncated or altered manifest with {@link #verifyChecksum()}.
 */
public class ReleaseManifest {

    public static final int SCHEMA_VERSION = 3;

    public static final String CHECKSUM_PREFIX = "sha256:";

    public int version = SCHEMA_VERSION;
    public String releaseId;
    public String projectSlug;
    public String draftId;
    public Instant publishedAt;
    public String checksum;
    public ReleaseConfig config;
    public TileConfig tiles;
    public List<ManifestOverlay> overlays = new ArrayList<>();

    public ReleaseManifest () { }

    /** Shallow copy, used to serialize the body without the checksum field. */
    private ReleaseManifest (ReleaseManifest other) {
        this.version = other.version;
        this.releaseId = other.releaseId;
        this.projectSlug = other.projectSlug;
        this.draftId = other.draftId;
        this.publishedAt = other.publishedAt;
        this.checksum = other.checksum;
        this.config = other.config;
        this.tiles = other.tiles;
        this.overlays = other.overlays;
    }

    public String computeChecksum () {
        ReleaseManifest body = new ReleaseManifest(this);
        body.checksum = null;
        byte[] canonical = JsonUtil.toCanonicalJsonBytes(body);
        return CHECKSUM_PREFIX + Hashing.sha256().hashBytes(canonical).toString();
    }

    public boolean verifyChecksum () {
        return checksum != null && checksum.equals(computeChecksum());
    }

}
