package com.masterplan.tiles;

/**
 * Parameters controlling how a pyramid is cut and encoded. The constructor validates all of them, so a generator
 * never starts work with settings it would reject halfway through.
 */
public class TileOptions {

    public interface Config {
        int tileSize ();
        int tileOverlap ();
        String tileFormat ();
        int tileQuality ();
        long maxSourcePixels ();
    }

    public final int tileSize;
    public final int overlap;
    public final TileFormat format;
    public final int quality;

    public TileOptions (int tileSize, int overlap, TileFormat format, int quality) {
        if (tileSize < 1) {
            throw new IllegalArgumentException("Tile size must be at least 1, was " + tileSize);
        }
        if (overlap < 0 || overlap >= tileSize) {
            throw new IllegalArgumentException(
                String.format("Tile overlap must be in [0, %d), was %d", tileSize, overlap));
        }
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("Tile quality must be between 1 and 100, was " + quality);
        }
        if (format == null) {
            throw new IllegalArgumentException("Tile format must be specified.");
        }
        this.tileSize = tileSize;
        this.overlap = overlap;
        this.format = format;
        this.quality = quality;
    }

    public static TileOptions fromConfig (Config config) {
        return new TileOptions(
            config.tileSize(),
            config.tileOverlap(),
            TileFormat.forName(config.tileFormat()),
            config.tileQuality()
        );
    }

    @Override
    public String toString () {
        return String.format("%d px tiles, overlap %d, %s quality %d", tileSize, overlap, format, quality);
    }

}
