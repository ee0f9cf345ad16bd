package org.janelia.enhance.histogram;

import ij.process.ImageProcessor;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

import org.janelia.enhance.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes intensity histograms and writes them as chart images.
 */
public class HistogramReporter {

    /** Y-axis limit fraction that shows the complete distribution. */
    public static final double FULL_SCALE = 1.0;

    /** Y-axis limit fraction that reveals small bins in distributions dominated by a few large ones. */
    public static final double DETAIL_SCALE = 0.025;

    private final HistogramChartRenderer renderer;

    public HistogramReporter() {
        this(new JFreeHistogramChartRenderer());
    }

    public HistogramReporter(final HistogramChartRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Writes a chart with a {@link #DETAIL_SCALE} y-axis limit.
     *
     * @see #report(ImageProcessor, String, String, double)
     */
    public IntensityHistogram report(final ImageProcessor ip,
                                     final String title,
                                     final String outputPath)
            throws IOException {
        return report(ip, title, outputPath, DETAIL_SCALE);
    }

    /**
     * Computes the histogram of the specified pixels and writes a chart of it.
     *
     * @param  ip             pixels to chart.
     * @param  title          chart title.
     * @param  outputPath     path of the chart file (format is derived from the extension).
     * @param  yAxisFraction  portion of the maximum count used as the upper y-axis limit.
     *
     * @return the charted histogram.
     *
     * @throws IOException
     *   if the chart cannot be written.
     *
     * @throws IllegalArgumentException
     *   if the output directory cannot be created.
     */
    public IntensityHistogram report(final ImageProcessor ip,
                                     final String title,
                                     final String outputPath,
                                     final double yAxisFraction)
            throws IOException, IllegalArgumentException {

        final File file = Utils.prepareFileForWrite(outputPath);

        final IntensityHistogram histogram = IntensityHistogram.fromImage(ip);
        final BufferedImage chart = renderer.render(histogram, title, yAxisFraction);

        Utils.saveImage(chart, file.getAbsolutePath());

        LOG.info("report: wrote '{}' chart for {} to {}", title, histogram, file);

        return histogram;
    }

    private static final Logger LOG = LoggerFactory.getLogger(HistogramReporter.class);
}
