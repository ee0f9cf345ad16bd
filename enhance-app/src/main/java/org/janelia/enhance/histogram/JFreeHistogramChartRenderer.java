package org.janelia.enhance.histogram;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.image.BufferedImage;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.StandardXYBarPainter;
import org.jfree.chart.renderer.xy.XYBarRenderer;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Draws histograms as JFreeChart XY bar charts with one bar per intensity.
 */
public class JFreeHistogramChartRenderer
        implements HistogramChartRenderer {

    public static final String X_AXIS_LABEL = "Intensity (0-255)";
    public static final String Y_AXIS_LABEL = "Frequency";

    // 5 x 3 inches at 150 dpi
    public static final int DEFAULT_WIDTH = 750;
    public static final int DEFAULT_HEIGHT = 450;

    private static final Color BAR_COLOR = new Color(0, 0, 0, 179);
    private static final Color GRID_COLOR = new Color(128, 128, 128, 128);
    private static final BasicStroke GRID_STROKE = new BasicStroke(0.8f,
                                                                   BasicStroke.CAP_BUTT,
                                                                   BasicStroke.JOIN_MITER,
                                                                   10.0f,
                                                                   new float[] { 4.0f, 4.0f },
                                                                   0.0f);

    private final int width;
    private final int height;

    public JFreeHistogramChartRenderer() {
        this(DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    public JFreeHistogramChartRenderer(final int width,
                                       final int height) {
        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("chart dimensions must be positive but are " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    @Override
    public BufferedImage render(final IntensityHistogram histogram,
                                final String title,
                                final double yAxisFraction) {

        final JFreeChart chart = buildChart(histogram, title, yAxisFraction);
        return chart.createBufferedImage(width, height);
    }

    public JFreeChart buildChart(final IntensityHistogram histogram,
                                 final String title,
                                 final double yAxisFraction) {

        final XYSeries series = new XYSeries("counts");
        for (int i = 0; i < IntensityHistogram.NUMBER_OF_BINS; i++) {
            series.add(i, histogram.getCount(i));
        }
        final XYSeriesCollection dataset = new XYSeriesCollection(series);
        dataset.setIntervalWidth(1.0);

        final JFreeChart chart = ChartFactory.createXYBarChart(title,
                                                               X_AXIS_LABEL,
                                                               false,
                                                               Y_AXIS_LABEL,
                                                               dataset,
                                                               PlotOrientation.VERTICAL,
                                                               false,
                                                               false,
                                                               false);
        chart.setBackgroundPaint(Color.WHITE);

        final XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinesVisible(true);
        plot.setRangeGridlinesVisible(true);
        plot.setDomainGridlinePaint(GRID_COLOR);
        plot.setRangeGridlinePaint(GRID_COLOR);
        plot.setDomainGridlineStroke(GRID_STROKE);
        plot.setRangeGridlineStroke(GRID_STROKE);

        plot.getDomainAxis().setRange(0, IntensityHistogram.NUMBER_OF_BINS - 1);

        final NumberAxis rangeAxis = (NumberAxis) plot.getRangeAxis();
        rangeAxis.setStandardTickUnits(NumberAxis.createIntegerTickUnits());
        rangeAxis.setRange(0, histogram.getYAxisLimit(yAxisFraction));

        final XYBarRenderer renderer = (XYBarRenderer) plot.getRenderer();
        renderer.setBarPainter(new StandardXYBarPainter());
        renderer.setShadowVisible(false);
        renderer.setDrawBarOutline(false);
        renderer.setSeriesPaint(0, BAR_COLOR);

        return chart;
    }

}
