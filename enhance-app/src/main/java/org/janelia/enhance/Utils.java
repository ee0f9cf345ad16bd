package org.janelia.enhance;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;
import javax.imageio.stream.ImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Image loading and saving utilities.
 */
public class Utils {

    public static final String JPEG_FORMAT = "jpg";
    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    public static final float DEFAULT_JPEG_QUALITY = 0.95f;

    // luma weights used for RGB to gray conversion
    private static final double RED_WEIGHT = 0.299;
    private static final double GREEN_WEIGHT = 0.587;
    private static final double BLUE_WEIGHT = 0.114;

    private static final Logger LOG = LoggerFactory.getLogger(Utils.class);

    private Utils() {
    }

    /**
     * Opens an image file as 8-bit gray pixels.  Try ImageIO first, then ImageJ.
     *
     * @param  path  path of the image file.
     *
     * @return 8-bit processor for the image.
     *
     * @throws IOException
     *   if the file does not exist or cannot be decoded.
     */
    public static ByteProcessor openGrayscaleImage(final String path)
            throws IOException {

        final File file = new File(path);
        if (! file.isFile()) {
            throw new IOException("input image " + file.getAbsolutePath() + " not found");
        }

        ByteProcessor processor = null;

        BufferedImage image = null;
        try {
            image = ImageIO.read(file);
        } catch (final IOException e) {
            LOG.warn("openGrayscaleImage: ImageIO failed to read {}, trying ImageJ", file, e);
        }

        if (image != null) {
            processor = toByteProcessor(image);
        } else {
            final ImagePlus imagePlus = new Opener().openImage(file.getAbsolutePath());
            if (imagePlus != null) {
                processor = toByteProcessor(imagePlus.getProcessor());
            }
        }

        if (processor == null) {
            throw new IOException("failed to decode image " + file.getAbsolutePath());
        }

        LOG.debug("openGrayscaleImage: loaded {}x{} image from {}",
                  processor.getWidth(), processor.getHeight(), file);

        return processor;
    }

    /**
     * @return 8-bit gray pixels for the specified image.
     *         Gray rasters are copied as is, palette and color images are converted with luma weights.
     */
    public static ByteProcessor toByteProcessor(final BufferedImage image) {

        final int width = image.getWidth();
        final int height = image.getHeight();
        final Raster raster = image.getRaster();

        final ByteProcessor processor;
        if (isGray8(image)) {
            final int[] samples = raster.getSamples(0, 0, width, height, 0, (int[]) null);
            final byte[] pixels = new byte[samples.length];
            for (int i = 0; i < samples.length; i++) {
                pixels[i] = (byte) samples[i];
            }
            processor = new ByteProcessor(width, height, pixels);
        } else {
            processor = toByteProcessor(new ColorProcessor(image));
        }

        return processor;
    }

    /**
     * @return 8-bit version of the specified processor (RGB and color table data is converted with luma weights).
     */
    public static ByteProcessor toByteProcessor(final ImageProcessor ip) {
        final ByteProcessor processor;
        if (ip instanceof ByteProcessor) {
            if (ip.isColorLut() || ip.isInvertedLut()) {
                // pixels are lookup table indexes, apply the table before taking gray values
                processor = toByteProcessor(ip.convertToRGB());
            } else {
                processor = (ByteProcessor) ip;
            }
        } else if (ip instanceof ColorProcessor) {
            final ColorProcessor colorProcessor = (ColorProcessor) ip;
            colorProcessor.setRGBWeights(RED_WEIGHT, GREEN_WEIGHT, BLUE_WEIGHT);
            processor = (ByteProcessor) colorProcessor.convertToByteProcessor(false);
        } else {
            processor = (ByteProcessor) ip.convertToByteProcessor(true);
        }
        return processor;
    }

    /**
     * @return gray buffered image backed by a copy of the specified pixels.
     */
    public static BufferedImage toGrayImage(final ByteProcessor ip) {
        final BufferedImage image = new BufferedImage(ip.getWidth(), ip.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        image.getRaster().setDataElements(0, 0, ip.getWidth(), ip.getHeight(), ip.getPixelsCopy());
        return image;
    }

    /**
     * Writes the specified image using ImageIO.
     */
    public static void writeImage(final BufferedImage image,
                                  final String format,
                                  final float quality,
                                  final ImageOutputStream outputStream)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format);

        if ((writersForFormat != null) && writersForFormat.hasNext()) {
            final ImageWriter writer = writersForFormat.next();
            try {
                writer.setOutput(outputStream);

                if (isJpegFormat(format)) {
                    final ImageWriteParam param = writer.getDefaultWriteParam();
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    param.setCompressionQuality(quality);

                    BufferedImage convertedImage = image;
                    if (image.getColorModel().hasAlpha()) {
                        // JPEG writers cannot handle alpha, draw into an RGB image instead
                        convertedImage = new BufferedImage(image.getWidth(),
                                                           image.getHeight(),
                                                           BufferedImage.TYPE_INT_RGB);
                        final Graphics2D g2d = convertedImage.createGraphics();
                        g2d.drawImage(image, 0, 0, null);
                        g2d.dispose();
                    }

                    writer.write(null, new IIOImage(convertedImage, null, null), param);

                } else {
                    writer.write(image);
                }
            } finally {
                writer.dispose();
            }
        } else {
            throw new IOException("no ImageIO writers exist for the '" + format + "' format");
        }
    }

    /**
     * @return file for the specified path after creating any missing parent directories.
     *
     * @throws IllegalArgumentException
     *   if a parent directory cannot be created.
     */
    public static File prepareFileForWrite(final String path)
            throws IllegalArgumentException {

        final File file = new File(path).getAbsoluteFile();

        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (!parentDirectory.exists())) {
            if (!parentDirectory.mkdirs()) {
                // check for existence again in case another parallel process already created the directory
                if (! parentDirectory.exists()) {
                    throw new IllegalArgumentException("failed to create directory " +
                                                       parentDirectory.getAbsolutePath());
                }
            }
        }

        return file;
    }

    /**
     * Saves the specified image to a file using ImageIO (or ImageJ for tiff files).
     */
    public static void saveImage(final BufferedImage image,
                                 final String path,
                                 final String format,
                                 final float quality)
            throws IOException {

        final File file = prepareFileForWrite(path);

        if (isTiffFormat(format)) {

            saveTiff(new ImagePlus("", image), file);

        } else {

            try (final FileImageOutputStream outputStream = new FileImageOutputStream(file)) {
                writeImage(image, format, quality, outputStream);
            } catch (final IOException e) {
                throw new IOException("failed to save " + file.getAbsolutePath(), e);
            }

        }

        LOG.info("saveImage: exit, saved {}", file.getAbsolutePath());
    }

    /**
     * Saves the specified image using the format implied by the path's extension (png if there is none).
     */
    public static void saveImage(final BufferedImage image,
                                 final String path)
            throws IOException {
        saveImage(image, path, getFormat(path), DEFAULT_JPEG_QUALITY);
    }

    /**
     * Saves 8-bit pixels using the format implied by the path's extension (png if there is none).
     */
    public static void saveImage(final ByteProcessor ip,
                                 final String path)
            throws IOException {
        final String format = getFormat(path);
        if (isTiffFormat(format)) {
            // ImageJ writes the gray pixels directly, without a color model round trip
            final File file = prepareFileForWrite(path);
            saveTiff(new ImagePlus("", ip), file);
            LOG.info("saveImage: exit, saved {}", file.getAbsolutePath());
        } else {
            saveImage(toGrayImage(ip), path, format, DEFAULT_JPEG_QUALITY);
        }
    }

    /**
     * @return lower case extension of the specified path or png if the path has no extension.
     */
    public static String getFormat(final String path) {
        final String name = new File(path).getName();
        final int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(dotIndex + 1).toLowerCase(Locale.ROOT) : PNG_FORMAT;
    }

    /**
     * @return file name without its extension.
     */
    public static String getBaseName(final String path) {
        final String name = new File(path).getName();
        final int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }

    // palette rasters are also single band 8-bit but hold color table indexes
    private static boolean isGray8(final BufferedImage image) {
        final Raster raster = image.getRaster();
        return (image.getType() == BufferedImage.TYPE_BYTE_GRAY) ||
               ((raster.getNumBands() == 1) &&
                (raster.getSampleModel().getSampleSize(0) == 8) &&
                (! (image.getColorModel() instanceof IndexColorModel)));
    }

    private static void saveTiff(final ImagePlus imagePlus,
                                 final File file)
            throws IOException {
        final FileSaver fileSaver = new FileSaver(imagePlus);
        if (! fileSaver.saveAsTiff(file.getAbsolutePath())) {
            throw new IOException("failed to save " + file.getAbsolutePath());
        }
    }

    private static boolean isTiffFormat(final String format) {
        return TIFF_FORMAT.equalsIgnoreCase(format) || TIF_FORMAT.equalsIgnoreCase(format);
    }

    private static boolean isJpegFormat(final String format) {
        return JPEG_FORMAT.equalsIgnoreCase(format) || "jpeg".equalsIgnoreCase(format);
    }

}
