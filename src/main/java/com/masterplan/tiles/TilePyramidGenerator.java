package com.masterplan.tiles;

import com.masterplan.file.FileUtils;
import com.masterplan.file.SourceAssetException;
import com.masterplan.file.StorageException;
import com.masterplan.progress.CancelledException;
import com.masterplan.progress.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Builds a deep-zoom tile pyramid from a single source raster.
 *
 * Levels are produced from full resolution downward: each coarser level is a box-filtered half of the one above it,
 * so at most two resolutions of the image are in memory at any time. Levels are handled strictly one after another,
 * while the tiles within a level are encoded in parallel on the supplied executor. One unit of progress is reported
 * per completed level, and cancellation is only honored between levels.
 *
 * If anything goes wrong the output directory is deleted, so a failed or cancelled run never leaves a partial pyramid.
 */
public class TilePyramidGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TilePyramidGenerator.class);

    private final ExecutorService tileExecutor;

    public TilePyramidGenerator (ExecutorService tileExecutor) {
        this.tileExecutor = tileExecutor;
    }

    /**
     * @param outputDirectory must not exist yet, or be an empty directory. Tiles are written below it as
     *                        {level}/{col}_{row}.{ext}
     */
    public TilePyramid generate (
            SourceImage source, TileOptions options, File outputDirectory, ProgressListener progress
    ) {
        String[] existing = outputDirectory.list();
        if (existing != null && existing.length > 0) {
            throw new StorageException("Pyramid output directory is not empty: " + outputDirectory);
        }
        List<TileLevel> levels = TilePyramid.computeLevels(source.width, source.height, options.tileSize, options.overlap);
        TilePyramid pyramid = new TilePyramid(source.width, source.height, options, levels, outputDirectory);
        LOG.info("Generating {} from {} ({}).", pyramid, source, options);
        progress.beginTask("Generating " + levels.size() + " pyramid levels", levels.size());
        try {
            outputDirectory.mkdirs();
            BufferedImage levelImage = source.image;
            for (int level = levels.size() - 1; level >= 0; level--) {
                progress.checkCancelled();
                TileLevel tileLevel = levels.get(level);
                if (level < levels.size() - 1) {
                    levelImage = BoxFilter.halve(levelImage);
                }
                if (levelImage.getWidth() != tileLevel.width || levelImage.getHeight() != tileLevel.height) {
                    throw new IllegalStateException(String.format("Resampled image is %dx%d, expected %s.",
                            levelImage.getWidth(), levelImage.getHeight(), tileLevel));
                }
                encodeLevel(levelImage, tileLevel, pyramid, options);
                LOG.debug("Finished {}.", tileLevel);
                progress.increment();
            }
        } catch (OutOfMemoryError e) {
            SourceAssetException failure = new SourceAssetException(
                String.format("Not enough memory to tile %dx%d source image.", source.width, source.height), e);
            deleteOutput(outputDirectory, failure);
            throw failure;
        } catch (RuntimeException e) {
            deleteOutput(outputDirectory, e);
            throw e;
        }
        LOG.info("Wrote {} tiles to {}.", pyramid.tileCount(), outputDirectory);
        return pyramid;
    }

    private void encodeLevel (BufferedImage levelImage, TileLevel tileLevel, TilePyramid pyramid, TileOptions options) {
        new File(pyramid.outputDirectory, Integer.toString(tileLevel.level)).mkdirs();
        List<Future<Void>> futures = new ArrayList<>(tileLevel.tileCount());
        for (TileCoord coord : tileLevel.tiles()) {
            Rectangle region = tileLevel.region(coord.col, coord.row);
            File tileFile = pyramid.tileFile(coord);
            futures.add(tileExecutor.submit(() -> {
                TileEncoder.writeTile(levelImage, region, options, tileFile);
                return null;
            }));
        }
        // Wait for every task, even after one fails, so nothing is still writing when the caller cleans up.
        Throwable failure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                for (Future<Void> future : futures.subList(i, futures.size())) {
                    future.cancel(false);
                }
                Thread.currentThread().interrupt();
                throw new CancelledException("Interrupted while encoding " + tileLevel);
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause();
                } else {
                    failure.addSuppressed(e.getCause());
                }
            }
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        if (failure != null) {
            throw new StorageException("Could not write tiles for " + tileLevel, failure);
        }
    }

    private static void deleteOutput (File outputDirectory, RuntimeException cause) {
        LOG.warn("Tile generation did not complete, deleting {}: {}", outputDirectory, cause.getMessage());
        try {
            FileUtils.deleteRecursively(outputDirectory);
        } catch (StorageException e) {
            cause.addSuppressed(e);
        }
    }

}
