package com.masterplan.release;

/** What a successful publish produced. */
public class PublishedRelease {

    public final String releaseId;
    public final String releaseUrl;
    public final int tileCount;
    public final String checksum;

    public PublishedRelease (String releaseId, String releaseUrl, int tileCount, String checksum) {
        this.releaseId = releaseId;
        this.releaseUrl = releaseUrl;
        this.tileCount = tileCount;
        this.checksum = checksum;
    }

}
