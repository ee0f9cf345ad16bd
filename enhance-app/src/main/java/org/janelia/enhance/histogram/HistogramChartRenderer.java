package org.janelia.enhance.histogram;

import java.awt.image.BufferedImage;

/**
 * Renders histogram bar charts.
 */
public interface HistogramChartRenderer {

    /**
     * @param  histogram      counts to chart.
     * @param  title          chart title.
     * @param  yAxisFraction  portion of the maximum count used as the upper y-axis limit.
     *
     * @return rendered chart.
     */
    BufferedImage render(final IntensityHistogram histogram,
                         final String title,
                         final double yAxisFraction);
}
