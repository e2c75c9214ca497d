package com.masterplan.tiles;

import com.google.common.base.Preconditions;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One resolution of a tile pyramid: its pixel dimensions and the grid of tiles that cover it.
 * Instances are immutable and carry no pixels, so they can be computed up front and reused for validation.
 */
public class TileLevel {

    public final int level;
    public final int width;
    public final int height;
    public final int tileSize;
    public final int overlap;
    public final int cols;
    public final int rows;

    public TileLevel (int level, int width, int height, int tileSize, int overlap) {
        Preconditions.checkArgument(width >= 1 && height >= 1, "Level dimensions must be positive.");
        Preconditions.checkArgument(tileSize >= 1, "Tile size must be positive.");
        this.level = level;
        this.width = width;
        this.height = height;
        this.tileSize = tileSize;
        this.overlap = overlap;
        this.cols = ceilDiv(width, tileSize);
        this.rows = ceilDiv(height, tileSize);
    }

    public int tileCount () {
        return cols * rows;
    }

    /** All tile coordinates in this level, column-major as they are encoded. */
    public List<TileCoord> tiles () {
        List<TileCoord> tiles = new ArrayList<>(tileCount());
        for (int col = 0; col < cols; col++) {
            for (int row = 0; row < rows; row++) {
                tiles.add(new TileCoord(level, col, row));
            }
        }
        return Collections.unmodifiableList(tiles);
    }

    /**
     * The pixel region of this level covered by the given tile. The nominal tile_size square is clipped at the right
     * and bottom edges, and extended by the overlap only on sides that have a neighbouring tile.
     */
    public Rectangle region (int col, int row) {
        Preconditions.checkElementIndex(col, cols, "tile column");
        Preconditions.checkElementIndex(row, rows, "tile row");
        int x0 = col * tileSize;
        int y0 = row * tileSize;
        int x1 = Math.min(x0 + tileSize, width);
        int y1 = Math.min(y0 + tileSize, height);
        if (col > 0) x0 -= overlap;
        if (row > 0) y0 -= overlap;
        if (col < cols - 1) x1 = Math.min(x1 + overlap, width);
        if (row < rows - 1) y1 = Math.min(y1 + overlap, height);
        return new Rectangle(x0, y0, x1 - x0, y1 - y0);
    }

    static int ceilDiv (int a, int b) {
        return (a + b - 1) / b;
    }

    @Override
    public String toString () {
        return String.format("[level %d %dx%d, %dx%d tiles]", level, width, height, cols, rows);
    }

}
