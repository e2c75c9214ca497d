package com.masterplan.tiles;

import com.masterplan.file.SourceAssetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;

/**
 * A decoded base image. Pixels are held in a BufferedImage that is never modified once loaded.
 */
public class SourceImage {

    private static final Logger LOG = LoggerFactory.getLogger(SourceImage.class);

    public final BufferedImage image;
    public final int width;
    public final int height;

    /** Name of the decoder format (png, jpeg...), or "memory" for images created in-process. */
    public final String formatName;

    public SourceImage (BufferedImage image, String formatName) {
        this.image = image;
        this.width = image.getWidth();
        this.height = image.getHeight();
        this.formatName = formatName;
    }

    public static SourceImage of (BufferedImage image) {
        return new SourceImage(image, "memory");
    }

    public static SourceImage read (File file, long maxPixels) {
        try (ImageInputStream stream = ImageIO.createImageInputStream(file)) {
            if (stream == null) {
                throw new SourceAssetException("Source image could not be opened: " + file);
            }
            return read(stream, maxPixels, file.getName());
        } catch (IOException e) {
            throw new SourceAssetException("Source image could not be read: " + file.getName(), e);
        }
    }

    public static SourceImage read (InputStream inputStream, long maxPixels) {
        try (ImageInputStream stream = ImageIO.createImageInputStream(inputStream)) {
            if (stream == null) {
                throw new SourceAssetException("Source image stream could not be opened.");
            }
            return read(stream, maxPixels, "stream");
        } catch (IOException e) {
            throw new SourceAssetException("Source image could not be read.", e);
        }
    }

    /**
     * The image header is read first so oversized sources are rejected before any pixel memory is allocated.
     */
    private static SourceImage read (ImageInputStream stream, long maxPixels, String name) throws IOException {
        Iterator<ImageReader> readers = ImageIO.getImageReaders(stream);
        if (!readers.hasNext()) {
            throw new SourceAssetException("Source image " + name + " is not in a recognized raster format.");
        }
        ImageReader reader = readers.next();
        try {
            reader.setInput(stream, true, true);
            int width;
            int height;
            try {
                width = reader.getWidth(0);
                height = reader.getHeight(0);
            } catch (IOException | RuntimeException e) {
                throw new SourceAssetException("Source image " + name + " has an unreadable header.", e);
            }
            if (width < 1 || height < 1) {
                throw new SourceAssetException("Source image " + name + " has no pixels.");
            }
            if ((long) width * height > maxPixels) {
                throw new SourceAssetException(String.format(
                    "Source image %s is %dx%d, which exceeds the limit of %d pixels.", name, width, height, maxPixels));
            }
            LOG.info("Decoding {} source image {} ({}x{}).", reader.getFormatName(), name, width, height);
            BufferedImage image;
            try {
                image = reader.read(0);
            } catch (IOException | RuntimeException e) {
                throw new SourceAssetException("Source image " + name + " is corrupt.", e);
            } catch (OutOfMemoryError e) {
                throw new SourceAssetException(String.format(
                    "Not enough memory to decode %dx%d source image %s.", width, height, name), e);
            }
            return new SourceImage(image, reader.getFormatName().toLowerCase());
        } finally {
            reader.dispose();
        }
    }

    @Override
    public String toString () {
        return String.format("[%s source %dx%d]", formatName, width, height);
    }

}
