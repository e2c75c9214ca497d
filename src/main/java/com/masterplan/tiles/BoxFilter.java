package com.masterplan.tiles;

import java.awt.image.BufferedImage;

/**
 * Halves images with a 2x2 area-average filter. Each output pixel is the mean of the source pixels it covers. On the
 * last row or column of an odd-sized image that is fewer than four pixels, and only those present are averaged.
 * Colour channels are weighted by alpha so fully transparent pixels don't darken the edges of opaque regions.
 */
public abstract class BoxFilter {

    /**
     * @return a new ARGB image of ceil(width / 2) x ceil(height / 2) pixels.
     */
    public static BufferedImage halve (BufferedImage source) {
        int sourceWidth = source.getWidth();
        int sourceHeight = source.getHeight();
        int width = (sourceWidth + 1) / 2;
        int height = (sourceHeight + 1) / 2;
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] upper = new int[sourceWidth];
        int[] lower = new int[sourceWidth];
        int[] out = new int[width];
        for (int y = 0; y < height; y++) {
            int sy = y * 2;
            boolean hasLower = sy + 1 < sourceHeight;
            source.getRGB(0, sy, sourceWidth, 1, upper, 0, sourceWidth);
            if (hasLower) {
                source.getRGB(0, sy + 1, sourceWidth, 1, lower, 0, sourceWidth);
            }
            for (int x = 0; x < width; x++) {
                int sx = x * 2;
                boolean hasRight = sx + 1 < sourceWidth;
                Accumulator acc = new Accumulator();
                acc.add(upper[sx]);
                if (hasRight) acc.add(upper[sx + 1]);
                if (hasLower) {
                    acc.add(lower[sx]);
                    if (hasRight) acc.add(lower[sx + 1]);
                }
                out[x] = acc.average();
            }
            result.setRGB(0, y, width, 1, out, 0, width);
        }
        return result;
    }

    private static class Accumulator {
        int n;
        long alpha;
        // Alpha-weighted channel sums
        long red, green, blue;
        // Unweighted sums, used when every pixel is fully transparent
        long plainRed, plainGreen, plainBlue;

        void add (int argb) {
            int a = (argb >>> 24) & 0xFF;
            int r = (argb >>> 16) & 0xFF;
            int g = (argb >>> 8) & 0xFF;
            int b = argb & 0xFF;
            n += 1;
            alpha += a;
            red += (long) r * a;
            green += (long) g * a;
            blue += (long) b * a;
            plainRed += r;
            plainGreen += g;
            plainBlue += b;
        }

        int average () {
            int a = (int) roundedDivide(alpha, n);
            int r, g, b;
            if (alpha > 0) {
                r = (int) roundedDivide(red, alpha);
                g = (int) roundedDivide(green, alpha);
                b = (int) roundedDivide(blue, alpha);
            } else {
                r = (int) roundedDivide(plainRed, n);
                g = (int) roundedDivide(plainGreen, n);
                b = (int) roundedDivide(plainBlue, n);
            }
            return (a << 24) | (r << 16) | (g << 8) | b;
        }

        private static long roundedDivide (long sum, long count) {
            return (sum + count / 2) / count;
        }
    }

}
