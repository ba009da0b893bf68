package io.gridsweep.store;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/** JPEG thumbnails fitted inside a square box, never enlarged. */
public final class ImageIoThumbnailGenerator implements ThumbnailGenerator {
    public static final int DEFAULT_SIZE = 256;
    public static final float DEFAULT_QUALITY = 0.85f;

    private final int maxSize;
    private final float quality;

    public ImageIoThumbnailGenerator() {
        this(DEFAULT_SIZE, DEFAULT_QUALITY);
    }

    public ImageIoThumbnailGenerator(int maxSize, float quality) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("thumbnail size must be positive");
        }
        this.maxSize = maxSize;
        this.quality = quality;
    }

    @Override
    public boolean generate(Path source, Path target) throws IOException {
        BufferedImage original = ImageIO.read(source.toFile());
        if (original == null) {
            return false;
        }
        double scale = Math.min(1.0, Math.min(
                (double) maxSize / original.getWidth(),
                (double) maxSize / original.getHeight()));
        int width = Math.max(1, (int) Math.round(original.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(original.getHeight() * scale));

        BufferedImage thumb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = thumb.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(original, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("no JPEG writer available");
        }
        ImageWriter writer = writers.next();
        Files.createDirectories(target.getParent());
        Files.deleteIfExists(target);
        try (ImageOutputStream out = ImageIO.createImageOutputStream(target.toFile())) {
            writer.setOutput(out);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(thumb, null, null), param);
        } finally {
            writer.dispose();
        }
        return true;
    }
}
