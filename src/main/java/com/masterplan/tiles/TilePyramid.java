package com.masterplan.tiles;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.masterplan.file.FileStorage;
import com.masterplan.file.FileStorageKey;
import com.masterplan.file.StorageException;
import com.masterplan.progress.ProgressListener;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Metadata about a generated tile pyramid and the scratch directory holding its tiles. Levels are ordered from lowest
 * resolution (index 0) to full resolution. The tiles themselves stay on disk under {@link #outputDirectory}.
 */
public class TilePyramid {

    public final int width;
    public final int height;
    public final int tileSize;
    public final int overlap;
    public final TileFormat format;
    public final int quality;
    public final List<TileLevel> levels;
    public final File outputDirectory;

    public TilePyramid (int width, int height, TileOptions options, List<TileLevel> levels, File outputDirectory) {
        this.width = width;
        this.height = height;
        this.tileSize = options.tileSize;
        this.overlap = options.overlap;
        this.format = options.format;
        this.quality = options.quality;
        this.levels = ImmutableList.copyOf(levels);
        this.outputDirectory = outputDirectory;
    }

    /**
     * Compute the levels of a pyramid over an image of the given size. The larger dimension is halved (rounding up)
     * until it fits in one tile, so there are ceil(log2(max(w, h) / tileSize)) + 1 levels. Each level is
     * ceil(size / 2^k) pixels in each dimension, never less than one.
     */
    public static List<TileLevel> computeLevels (int width, int height, int tileSize, int overlap) {
        Preconditions.checkArgument(width >= 1 && height >= 1, "Image dimensions must be positive.");
        Preconditions.checkArgument(tileSize >= 1, "Tile size must be at least 1.");
        int levelCount = levelCount(width, height, tileSize);
        ImmutableList.Builder<TileLevel> builder = ImmutableList.builder();
        for (int level = 0; level < levelCount; level++) {
            int shift = levelCount - level - 1;
            builder.add(new TileLevel(level, scaledDimension(width, shift), scaledDimension(height, shift), tileSize, overlap));
        }
        return builder.build();
    }

    public static int levelCount (int width, int height, int tileSize) {
        int levels = 1;
        int dimension = Math.max(width, height);
        while (dimension > tileSize) {
            dimension = (dimension + 1) / 2;
            levels++;
        }
        return levels;
    }

    /** ceil(size / 2^shift), at least 1. Repeated ceiling halving gives the same result as one ceiling division. */
    static int scaledDimension (int size, int shift) {
        if (shift >= 31) return 1;
        long divisor = 1L << shift;
        return (int) Math.max(1, (size + divisor - 1) / divisor);
    }

    public int tileCount () {
        return levels.stream().mapToInt(TileLevel::tileCount).sum();
    }

    public TileLevel finestLevel () {
        return levels.get(levels.size() - 1);
    }

    public File tileFile (TileCoord coord) {
        return new File(outputDirectory, coord.relativePath(format));
    }

    /**
     * Move every tile into storage below tilesKey, reporting one unit of progress per tile and checking for
     * cancellation between levels. Afterward storage must hold exactly the tiles of this pyramid under that key.
     * The tiles leave the output directory, so a pyramid can only be stored once.
     */
    public void moveIntoStorage (FileStorage fileStorage, FileStorageKey tilesKey, ProgressListener progress) {
        Set<String> expectedPaths = new HashSet<>();
        for (TileLevel level : levels) {
            progress.checkCancelled();
            for (TileCoord coord : level.tiles()) {
                File tileFile = tileFile(coord);
                if (!tileFile.exists()) {
                    throw new StorageException("Tile missing from pyramid output: " + coord);
                }
                FileStorageKey tileKey = tilesKey.resolve(coord.relativePath(format));
                fileStorage.moveIntoStorage(tileKey, tileFile);
                expectedPaths.add(tileKey.path);
                progress.increment();
            }
        }
        List<FileStorageKey> stored = fileStorage.list(tilesKey);
        Set<String> storedPaths = stored.stream().map(key -> key.path).collect(Collectors.toSet());
        if (stored.size() != expectedPaths.size() || !storedPaths.equals(expectedPaths)) {
            throw new StorageException(String.format(
                "%s holds %d tiles, expected %d.", tilesKey.fullPath(), stored.size(), expectedPaths.size()));
        }
    }

    /**
     * Write a Deep Zoom descriptor describing this pyramid. Viewers that don't read release.json can use it to open
     * the tiles directly.
     */
    public void writeDziDescriptor (File file) {
        String xml = String.format(
            "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
            "<Image xmlns=\"http://schemas.microsoft.com/deepzoom/2008\"\n" +
            "    Format=\"%s\"\n" +
            "    Overlap=\"%d\"\n" +
            "    TileSize=\"%d\">\n" +
            "    <Size Width=\"%d\" Height=\"%d\"/>\n" +
            "</Image>\n",
            format.extension, overlap, tileSize, width, height
        );
        try {
            Files.write(file.toPath(), xml.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StorageException("Could not write DZI descriptor " + file, e);
        }
    }

    @Override
    public String toString () {
        return String.format("[pyramid %dx%d, %d levels, %d tiles of %d px %s]",
                width, height, levels.size(), tileCount(), tileSize, format);
    }

}
