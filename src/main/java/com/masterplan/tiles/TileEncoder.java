package com.masterplan.tiles;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;

/**
 * Cuts one tile out of a level image and writes it to a file. The level image is only read, so many tiles of the same
 * level can be encoded at once on different threads.
 */
public abstract class TileEncoder {

    public static void writeTile (BufferedImage levelImage, Rectangle region, TileOptions options, File file)
            throws IOException {
        BufferedImage tile = cropTile(levelImage, region, options.format);
        if (options.format.lossless) {
            if (!ImageIO.write(tile, options.format.imageIoName, file)) {
                throw new IOException("No ImageIO writer available for " + options.format.imageIoName);
            }
        } else {
            writeLossy(tile, options.format, options.quality, file);
        }
    }

    /**
     * Copy the region into a standalone image so the encoder doesn't see the rest of the level's raster. Lossy formats
     * get an opaque RGB copy with any transparency flattened onto white.
     */
    static BufferedImage cropTile (BufferedImage levelImage, Rectangle region, TileFormat format) {
        BufferedImage source = levelImage.getSubimage(region.x, region.y, region.width, region.height);
        int type = format.lossless ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage tile = new BufferedImage(region.width, region.height, type);
        Graphics2D graphics = tile.createGraphics();
        try {
            if (format.lossless) {
                graphics.setComposite(AlphaComposite.Src);
            } else {
                graphics.setColor(Color.WHITE);
                graphics.fillRect(0, 0, region.width, region.height);
            }
            graphics.drawImage(source, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return tile;
    }

    private static void writeLossy (BufferedImage tile, TileFormat format, int quality, File file) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.imageIoName);
        if (!writers.hasNext()) {
            throw new IOException("No ImageIO writer available for " + format.imageIoName);
        }
        ImageWriter writer = writers.next();
        ImageWriteParam writeParam = writer.getDefaultWriteParam();
        writeParam.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        writeParam.setCompressionQuality(quality / 100f);
        try (ImageOutputStream out = ImageIO.createImageOutputStream(file)) {
            writer.setOutput(out);
            writer.write(null, new IIOImage(tile, null, null), writeParam);
        } finally {
            writer.dispose();
        }
    }

}
