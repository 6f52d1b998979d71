package com.lucsartech.tint.transform;

import java.awt.image.BufferedImage;

/**
 * Stateless colour filters operating on the full pixel buffer.
 *
 * <p>Every filter reads the source through {@link BufferedImage#getRGB(int, int, int, int, int[], int, int)}
 * and writes a fresh {@code TYPE_INT_RGB} image, so the source buffer is never aliased or modified.
 * Output images are opaque: the pipeline encodes to formats without an alpha channel.
 */
public final class ImageFilters {

    // ITU-R BT.601 luma weights, applied on 16-bit channel values and scaled back to 8 bits
    private static final double LUMA_R = 0.299;
    private static final double LUMA_G = 0.587;
    private static final double LUMA_B = 0.114;

    private static final double[][] SEPIA = {
            {0.393, 0.769, 0.189},
            {0.349, 0.686, 0.168},
            {0.272, 0.534, 0.131}
    };

    private ImageFilters() {}

    public static BufferedImage grayscale(BufferedImage source) throws TransformException {
        int[] pixels = readPixels(source);

        for (int i = 0; i < pixels.length; i++) {
            int rgb = pixels[i];
            double luma = (LUMA_R * widen(red(rgb)) + LUMA_G * widen(green(rgb)) + LUMA_B * widen(blue(rgb))) / 256;
            int gray = clamp((int) luma);
            pixels[i] = pack(gray, gray, gray);
        }

        return toImage(source.getWidth(), source.getHeight(), pixels);
    }

    public static BufferedImage sepia(BufferedImage source) throws TransformException {
        int[] pixels = readPixels(source);

        for (int i = 0; i < pixels.length; i++) {
            int rgb = pixels[i];
            int r = red(rgb);
            int g = green(rgb);
            int b = blue(rgb);

            pixels[i] = pack(
                    clamp((int) (r * SEPIA[0][0] + g * SEPIA[0][1] + b * SEPIA[0][2])),
                    clamp((int) (r * SEPIA[1][0] + g * SEPIA[1][1] + b * SEPIA[1][2])),
                    clamp((int) (r * SEPIA[2][0] + g * SEPIA[2][1] + b * SEPIA[2][2])));
        }

        return toImage(source.getWidth(), source.getHeight(), pixels);
    }

    /**
     * Copy the pixels of {@code source} as packed RGB ints, rejecting malformed buffers.
     */
    static int[] readPixels(BufferedImage source) throws TransformException {
        if (source == null) {
            throw new TransformException("Image buffer is missing");
        }

        int width = source.getWidth();
        int height = source.getHeight();
        if (width <= 0 || height <= 0) {
            throw new TransformException("Image has no pixels: " + width + "x" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new TransformException("Image too large: " + width + "x" + height);
        }

        try {
            return source.getRGB(0, 0, width, height, null, 0, width);
        } catch (RuntimeException e) {
            throw new TransformException("Unreadable raster: " + e.getMessage(), e);
        }
    }

    private static BufferedImage toImage(int width, int height, int[] pixels) {
        var target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        target.setRGB(0, 0, width, height, pixels, 0, width);
        return target;
    }

    private static int widen(int channel) {
        return channel * 257;
    }

    private static int red(int rgb) { return (rgb >> 16) & 0xFF; }
    private static int green(int rgb) { return (rgb >> 8) & 0xFF; }
    private static int blue(int rgb) { return rgb & 0xFF; }

    private static int pack(int r, int g, int b) {
        return (r << 16) | (g << 8) | b;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }
}
