package com.masterplan.tiles;

import java.util.Locale;

/**
 * Encodings that tiles can be written in. Names here are the values accepted in configuration and written into the
 * release manifest.
 */
public enum TileFormat {

    PNG("png", "png", "image/png", true),
    JPEG("jpg", "jpeg", "image/jpeg", false);

    /** File extension used in tile paths. */
    public final String extension;

    /** ImageIO format name used to look up a writer. */
    public final String imageIoName;

    public final String mimeType;

    /** Lossless formats ignore the quality setting and preserve transparency. */
    public final boolean lossless;

    TileFormat (String extension, String imageIoName, String mimeType, boolean lossless) {
        this.extension = extension;
        this.imageIoName = imageIoName;
        this.mimeType = mimeType;
        this.lossless = lossless;
    }

    public static TileFormat forName (String name) {
        if (name == null) {
            throw new IllegalArgumentException("Tile format must be specified.");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "png":
                return PNG;
            case "jpg":
            case "jpeg":
                return JPEG;
            default:
                throw new IllegalArgumentException("Unsupported tile format: " + name);
        }
    }

    @Override
    public String toString () {
        return extension;
    }

}
