package com.masterplan.release;

import com.masterplan.tiles.TilePyramid;

/** The tiles section of a manifest, enough for a deep-zoom viewer to address every tile. */
public class TileConfig {

    /** Tile directory relative to the manifest. */
    public String baseUrl = "tiles";
    public String format;
    public int tileSize;
    public int overlap;
    public int levels;
    public int width;
    public int height;
    public int tileCount;

    public TileConfig () { }

    public static TileConfig forPyramid (TilePyramid pyramid) {
        TileConfig config = new TileConfig();
        config.format = pyramid.format.extension;
        config.tileSize = pyramid.tileSize;
        config.overlap = pyramid.overlap;
        config.levels = pyramid.levels.size();
        config.width = pyramid.width;
        config.height = pyramid.height;
        config.tileCount = pyramid.tileCount();
        return config;
    }

}
