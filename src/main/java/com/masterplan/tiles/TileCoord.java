package com.masterplan.tiles;

import java.util.Objects;

/** The address of one tile within a pyramid. Level 0 is the lowest resolution. */
public class TileCoord {

    public final int level;
    public final int col;
    public final int row;

    public TileCoord (int level, int col, int row) {
        this.level = level;
        this.col = col;
        this.row = row;
    }

    /** Path of this tile relative to the pyramid root, e.g. 3/1_0.png */
    public String relativePath (TileFormat format) {
        return level + "/" + col + "_" + row + "." + format.extension;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TileCoord other = (TileCoord) o;
        return level == other.level && col == other.col && row == other.row;
    }

    @Override
    public int hashCode () {
        return Objects.hash(level, col, row);
    }

    @Override
    public String toString () {
        return String.format("[tile %d/%d_%d]", level, col, row);
    }

}
