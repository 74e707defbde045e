package com.helpdesk.remoteservice.capture;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * 缩放 + 压缩：把原始截图变成可下发的字节流
 */
public class FrameEncoder {

    private final int maxWidth;
    private final int quality;
    private final String format;

    public FrameEncoder(int maxWidth, int quality, String format) {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be positive");
        }
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("quality must be within 1..100");
        }
        this.maxWidth = maxWidth;
        this.quality = quality;
        this.format = format;
    }

    public EncodedImage encode(BufferedImage source) throws IOException {
        BufferedImage image = toRgb(downscale(source));
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
        if (!writers.hasNext()) {
            throw new IOException("no ImageIO writer for format " + format);
        }
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        if (param.canWriteCompressed()) {
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            if (param.getCompressionType() == null) {
                param.setCompressionType(param.getCompressionTypes()[0]);
            }
            param.setCompressionQuality(quality / 100f);
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(64 * 1024);
        try (ImageOutputStream out = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return new EncodedImage(bytes.toByteArray(), image.getWidth(), image.getHeight());
    }

    /**
     * 宽度超过 maxWidth 时等比缩小（双线性插值），否则原样返回
     */
    BufferedImage downscale(BufferedImage source) {
        int width = source.getWidth();
        if (width <= maxWidth) {
            return source;
        }
        double ratio = (double) maxWidth / width;
        int height = Math.max(1, (int) Math.round(source.getHeight() * ratio));
        BufferedImage scaled = new BufferedImage(maxWidth, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_SPEED);
            g.drawImage(source, 0, 0, maxWidth, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    /** JPEG 写入器不接受带 alpha 的图像 */
    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    public record EncodedImage(byte[] bytes, int width, int height) {
    }
}
