package com.masterplan.drafts;

import com.masterplan.geometry.VectorDocument;
import com.masterplan.tiles.SourceImage;

/**
 * Where the publish pipeline gets its inputs. Drafts are owned and edited elsewhere; this is strictly read access.
 */
public interface DraftRepository {

    /**
     * @return the draft, or null if there is no draft with that id.
     * @throws IllegalArgumentException if the id is malformed.
     */
    Draft findDraft (String draftId);

    /** Decode the draft's base image, refusing images with more than maxPixels pixels. */
    SourceImage readBaseImage (Draft draft, long maxPixels);

    VectorDocument readOverlayDocument (Draft draft);

    /** True if both input assets named by the draft are present. */
    boolean assetsExist (Draft draft);

}
