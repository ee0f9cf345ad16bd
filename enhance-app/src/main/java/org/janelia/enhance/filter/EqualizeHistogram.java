package org.janelia.enhance.filter;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.janelia.enhance.filter.RoundingPolicy.MAX_INTENSITY;

/**
 * Classic cumulative distribution histogram equalization.
 *
 * The lowest occupied intensity is mapped to 0 and the highest to 255.
 * Images with a single intensity level are returned unchanged.
 */
public class EqualizeHistogram implements Filter {

    // empty constructor required to create instances from specifications
    public EqualizeHistogram() {
    }

    @Override
    public void init(final Map<String, String> params) {
    }

    @Override
    public Map<String, String> toParametersMap() {
        return new LinkedHashMap<>();
    }

    @Override
    public ByteProcessor process(final ImageProcessor ip) {
        final ByteProcessor equalized = Filter.copyAsBytes(ip);
        final int[] table = buildTable(equalized.getHistogram());
        if (table != null) {
            equalized.applyTable(table);
        }
        return equalized;
    }

    /**
     * @param  histogram  256 bin intensity histogram.
     *
     * @return equalization table for the histogram or null if it holds fewer than two distinct levels.
     */
    public static int[] buildTable(final int[] histogram) {

        final long[] cdf = new long[histogram.length];
        long cumulativeCount = 0;
        long cdfMin = 0;
        for (int i = 0; i < histogram.length; i++) {
            cumulativeCount += histogram[i];
            cdf[i] = cumulativeCount;
            if ((cdfMin == 0) && (cumulativeCount > 0)) {
                cdfMin = cumulativeCount;
            }
        }

        final long range = cumulativeCount - cdfMin;
        if (range == 0) {
            return null;
        }

        final int[] table = new int[histogram.length];
        for (int i = 0; i < table.length; i++) {
            final double normalized = (double) (cdf[i] - cdfMin) / range;
            table[i] = RoundingPolicy.ROUND.toIntensity(normalized * MAX_INTENSITY);
        }
        return table;
    }

    @Override
    public String toString() {
        return "EqualizeHistogram{}";
    }

}
