package com.texturecritter.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Decodes image files into {@link DecodedImage} buffers and encodes them back,
 * on top of {@link ImageIO}.
 */
public class ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageCodec.class);

    public static final String DEFAULT_FORMAT = "png";

    // Writers that cannot store an alpha channel
    private static final Set<String> OPAQUE_FORMATS = Set.of("jpg", "jpeg", "bmp", "wbmp");

    public static DecodedImage decode(Path path) throws ImageCodecException {
        BufferedImage bi;
        try {
            bi = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new ImageCodecException("Could not read image file " + path, e);
        }
        if (bi == null) {
            throw new ImageCodecException("Unsupported or unreadable image file " + path);
        }
        DecodedImage decoded = fromBufferedImage(bi);
        logger.debug("Decoded {} as {}x{} {}", path, decoded.getWidth(), decoded.getHeight(),
                decoded.getChannelMode());
        return decoded;
    }

    public static DecodedImage decode(byte[] data) throws ImageCodecException {
        if (data == null || data.length == 0) {
            throw new ImageCodecException("Empty image data");
        }
        BufferedImage bi;
        try {
            bi = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException e) {
            throw new ImageCodecException("Could not decode image data (" + data.length + " bytes)", e);
        }
        if (bi == null) {
            throw new ImageCodecException("Unsupported image data (" + data.length + " bytes)");
        }
        return fromBufferedImage(bi);
    }

    /**
     * Encodes to the format named by the file extension (png when there is
     * none). The file is only written once encoding has fully succeeded.
     */
    public static void encode(DecodedImage image, Path path) throws ImageCodecException {
        byte[] bytes = encode(image, formatFor(path));
        try {
            Files.write(path, bytes);
        } catch (IOException e) {
            throw new ImageCodecException("Could not write image file " + path, e);
        }
        logger.debug("Wrote {} bytes to {}", bytes.length, path);
    }

    public static byte[] encode(DecodedImage image, String formatName) throws ImageCodecException {
        String format = formatName.toLowerCase(Locale.ROOT);
        BufferedImage bi = toBufferedImage(image, !OPAQUE_FORMATS.contains(format));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        boolean written;
        try {
            written = ImageIO.write(bi, format, out);
        } catch (IOException e) {
            throw new ImageCodecException("Could not encode image as '" + format + "'", e);
        }
        if (!written) {
            throw new ImageCodecException("No image writer available for format '" + format + "'");
        }
        return out.toByteArray();
    }

    static String formatFor(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return DEFAULT_FORMAT;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static ChannelMode classify(BufferedImage bi) {
        ColorModel cm = bi.getColorModel();
        if (cm instanceof IndexColorModel) {
            return ChannelMode.INDEXED;
        }
        if (cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY) {
            return cm.hasAlpha() ? ChannelMode.GRAY_ALPHA : ChannelMode.GRAY;
        }
        return cm.hasAlpha() ? ChannelMode.RGBA : ChannelMode.RGB;
    }

    static DecodedImage fromBufferedImage(BufferedImage bi) throws ImageCodecException {
        int width = bi.getWidth();
        int height = bi.getHeight();
        ChannelMode mode = classify(bi);
        int bpp = mode.bytesPerPixel();
        byte[] raw;
        try {
            raw = new byte[Math.multiplyExact(Math.multiplyExact(width, height), bpp)];
        } catch (ArithmeticException e) {
            throw new ImageCodecException("Image too large to decode: " + width + "x" + height + " " + mode, e);
        }

        if (mode == ChannelMode.GRAY || mode == ChannelMode.GRAY_ALPHA) {
            // Read grey samples directly; getRGB would apply a colour space conversion
            Raster raster = bi.getRaster();
            int shift = Math.max(0, bi.getColorModel().getComponentSize(0) - 8);
            int alphaShift = mode == ChannelMode.GRAY_ALPHA
                    ? Math.max(0, bi.getColorModel().getComponentSize(1) - 8)
                    : 0;
            int i = 0;
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    raw[i++] = (byte) (raster.getSample(x, y, 0) >> shift);
                    if (mode == ChannelMode.GRAY_ALPHA) {
                        raw[i++] = (byte) (raster.getSample(x, y, 1) >> alphaShift);
                    }
                }
            }
            return new DecodedImage(width, height, mode, raw);
        }

        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = bi.getRGB(x, y);
                raw[i++] = (byte) ((argb >> 16) & 0xff);
                raw[i++] = (byte) ((argb >> 8) & 0xff);
                raw[i++] = (byte) (argb & 0xff);
                if (bpp == 4) {
                    raw[i++] = (byte) ((argb >>> 24) & 0xff);
                }
            }
        }
        return new DecodedImage(width, height, mode, raw);
    }

    static BufferedImage toBufferedImage(DecodedImage image, boolean keepAlpha) {
        int width = image.getWidth();
        int height = image.getHeight();
        ChannelMode mode = image.getChannelMode();
        byte[] raw = image.getRawBytes();

        if (mode == ChannelMode.GRAY) {
            BufferedImage bi = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            WritableRaster raster = bi.getRaster();
            int i = 0;
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    raster.setSample(x, y, 0, raw[i++] & 0xff);
                }
            }
            return bi;
        }

        boolean alpha = keepAlpha && mode.isAlphaCapable();
        BufferedImage bi = new BufferedImage(width, height,
                alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        int bpp = mode.bytesPerPixel();
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r, g, b, a;
                if (mode == ChannelMode.GRAY_ALPHA) {
                    r = g = b = raw[i] & 0xff;
                    a = raw[i + 1] & 0xff;
                } else {
                    r = raw[i] & 0xff;
                    g = raw[i + 1] & 0xff;
                    b = raw[i + 2] & 0xff;
                    a = bpp == 4 ? raw[i + 3] & 0xff : 0xff;
                }
                i += bpp;
                int argb = (alpha ? a << 24 : 0xff000000) | (r << 16) | (g << 8) | b;
                bi.setRGB(x, y, argb);
            }
        }
        return bi;
    }
}
