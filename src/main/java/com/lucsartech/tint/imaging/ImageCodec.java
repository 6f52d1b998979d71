package com.lucsartech.tint.imaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 * ImageIO based decoder/encoder.
 * Thread-safe: a fresh reader/writer is obtained for every call.
 */
public final class ImageCodec {

    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    private static final String TEMP_SUFFIX = ".part";

    private final float jpegQuality;

    public ImageCodec(float jpegQuality) {
        if (jpegQuality <= 0f || jpegQuality > 1f) {
            throw new IllegalArgumentException("JPEG quality must be in (0, 1]: " + jpegQuality);
        }
        this.jpegQuality = jpegQuality;
    }

    /**
     * Decode an image file into memory.
     *
     * @throws DecodeException if the file cannot be read or holds no supported image
     */
    public BufferedImage decode(Path source) throws DecodeException {
        byte[] data;
        try {
            data = Files.readAllBytes(source);
        } catch (IOException e) {
            throw new DecodeException("Cannot read " + source.getFileName() + ": " + e.getMessage(), e);
        }

        BufferedImage image;
        try (var input = new ByteArrayInputStream(data)) {
            image = ImageIO.read(input);
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Cannot decode " + source.getFileName() + ": " + e.getMessage(), e);
        }

        if (image == null) {
            throw new DecodeException("Unsupported or corrupt image: " + source.getFileName());
        }

        log.trace("Decoded {} ({}x{})", source.getFileName(), image.getWidth(), image.getHeight());
        return image;
    }

    /**
     * Encode {@code image} in the format implied by the target's extension and replace the target atomically.
     * A failed write never leaves a partial file at {@code target}.
     *
     * @throws PersistException if encoding or writing fails
     */
    public void write(BufferedImage image, Path target) throws PersistException {
        byte[] encoded = encode(image, formatOf(target));

        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, target.getFileName().toString(), TEMP_SUFFIX);
            Files.write(temp, encoded);
            move(temp, target);
            log.trace("Wrote {} ({} bytes)", target, encoded.length);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistException("Cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    byte[] encode(BufferedImage image, String format) throws PersistException {
        var writers = ImageIO.getImageWritersBySuffix(format);
        if (!writers.hasNext()) {
            throw new PersistException("No encoder available for ." + format);
        }

        ImageWriter writer = writers.next();

        try (var outputStream = new ByteArrayOutputStream();
             var imageOutputStream = new MemoryCacheImageOutputStream(outputStream)) {

            ImageWriteParam params = writer.getDefaultWriteParam();
            if (isJpeg(format)) {
                params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                params.setCompressionQuality(jpegQuality);
            }

            writer.setOutput(imageOutputStream);
            writer.write(null, new IIOImage(image, null, null), params);
            imageOutputStream.flush();

            return outputStream.toByteArray();
        } catch (IOException | RuntimeException e) {
            throw new PersistException("Cannot encode image as " + format + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    public float jpegQuality() {
        return jpegQuality;
    }

    static String formatOf(Path target) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 || dot == name.length() - 1 ? "jpg" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static boolean isJpeg(String format) {
        return format.equals("jpg") || format.equals("jpeg");
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
