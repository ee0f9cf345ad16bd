package org.janelia.enhance.histogram;

import ij.process.ByteProcessor;

import java.awt.image.BufferedImage;
import java.io.File;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import javax.imageio.ImageIO;

import org.janelia.enhance.util.FileUtil;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.XYPlot;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link HistogramReporter} and {@link JFreeHistogramChartRenderer} classes.
 */
public class HistogramReporterTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = Files.createTempDirectory("test_histogram_reporter").toFile();
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory);
    }

    @Test
    public void testReportCreatesMissingDirectories() throws Exception {

        final RecordingRenderer renderer = new RecordingRenderer();
        final HistogramReporter reporter = new HistogramReporter(renderer);

        final File chartFile = new File(testDirectory, "nested/histograms/original_hist.png");
        final IntensityHistogram histogram = reporter.report(buildRamp(), "Original Histogram", chartFile.getPath());

        Assert.assertTrue("chart file " + chartFile + " not written", chartFile.exists());
        Assert.assertEquals("invalid number of render calls", 1, renderer.titles.size());
        Assert.assertEquals("invalid title rendered", "Original Histogram", renderer.titles.get(0));
        Assert.assertEquals("default fraction should be used",
                            HistogramReporter.DETAIL_SCALE, renderer.fractions.get(0), 0.0);
        Assert.assertEquals("invalid histogram total", 256 * 4, histogram.getTotalCount());
    }

    @Test
    public void testJFreeChartRendering() throws Exception {

        final HistogramReporter reporter = new HistogramReporter(new JFreeHistogramChartRenderer());

        final File chartFile = new File(testDirectory, "ramp_hist.png");
        reporter.report(buildRamp(), "Ramp Histogram", chartFile.getPath(), HistogramReporter.FULL_SCALE);

        final BufferedImage chart = ImageIO.read(chartFile);
        Assert.assertNotNull("chart " + chartFile + " could not be read", chart);
        Assert.assertEquals("invalid chart width", JFreeHistogramChartRenderer.DEFAULT_WIDTH, chart.getWidth());
        Assert.assertEquals("invalid chart height", JFreeHistogramChartRenderer.DEFAULT_HEIGHT, chart.getHeight());
    }

    @Test
    public void testChartAxesAndGrid() {

        // mostly black scan, 39,745 black pixels dominate the counts
        final ByteProcessor ip = new ByteProcessor(200, 200);
        for (int x = 0; x < 256; x++) {
            ip.set(x % 200, 199 - (x / 200), x);
        }
        final IntensityHistogram histogram = IntensityHistogram.fromImage(ip);

        final JFreeChart chart = new JFreeHistogramChartRenderer().buildChart(histogram,
                                                                              "Original Histogram",
                                                                              HistogramReporter.DETAIL_SCALE);
        final XYPlot plot = chart.getXYPlot();

        Assert.assertEquals("invalid title", "Original Histogram", chart.getTitle().getText());
        Assert.assertEquals("y-axis should be capped at a fraction of the maximum count",
                            (double) histogram.getYAxisLimit(HistogramReporter.DETAIL_SCALE),
                            plot.getRangeAxis().getUpperBound(), 0.0);
        Assert.assertTrue("y-axis cap should be well below the maximum count",
                          plot.getRangeAxis().getUpperBound() < histogram.getMaxCount());
        Assert.assertEquals("y-axis should start at zero", 0.0, plot.getRangeAxis().getLowerBound(), 0.0);
        Assert.assertEquals("x-axis should start at 0", 0.0, plot.getDomainAxis().getLowerBound(), 0.0);
        Assert.assertEquals("x-axis should end at 255", 255.0, plot.getDomainAxis().getUpperBound(), 0.0);
        Assert.assertTrue("range gridlines should be visible", plot.isRangeGridlinesVisible());
        Assert.assertTrue("domain gridlines should be visible", plot.isDomainGridlinesVisible());
        Assert.assertEquals("one bar per intensity expected",
                            IntensityHistogram.NUMBER_OF_BINS, plot.getDataset().getItemCount(0));
    }

    private static ByteProcessor buildRamp() {
        final ByteProcessor ip = new ByteProcessor(256, 4);
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 256; x++) {
                ip.set(x, y, x);
            }
        }
        return ip;
    }

    private static class RecordingRenderer implements HistogramChartRenderer {

        private final List<String> titles = new ArrayList<>();
        private final List<Double> fractions = new ArrayList<>();

        @Override
        public BufferedImage render(final IntensityHistogram histogram,
                                    final String title,
                                    final double yAxisFraction) {
            titles.add(title);
            fractions.add(yAxisFraction);
            return new BufferedImage(8, 4, BufferedImage.TYPE_INT_RGB);
        }
    }

}
