package org.janelia.enhance.histogram;

import ij.process.ImageProcessor;

import java.util.Arrays;

import org.janelia.enhance.filter.Filter;

/**
 * Pixel counts for each of the 256 possible 8-bit intensities.
 */
public class IntensityHistogram {

    public static final int NUMBER_OF_BINS = 256;

    private final long[] counts;

    public IntensityHistogram(final long[] counts)
            throws IllegalArgumentException {
        if (counts.length != NUMBER_OF_BINS) {
            throw new IllegalArgumentException("histogram must have " + NUMBER_OF_BINS + " bins but has " +
                                               counts.length);
        }
        this.counts = Arrays.copyOf(counts, counts.length);
    }

    /**
     * @return histogram of all pixels in the specified processor (8-bit data is assumed).
     */
    public static IntensityHistogram fromImage(final ImageProcessor ip) {
        final int[] pixelHistogram = Filter.copyAsBytes(ip).getHistogram();
        final long[] counts = new long[NUMBER_OF_BINS];
        for (int i = 0; i < NUMBER_OF_BINS; i++) {
            counts[i] = pixelHistogram[i];
        }
        return new IntensityHistogram(counts);
    }

    public long getCount(final int intensity) {
        return counts[intensity];
    }

    public long[] getCounts() {
        return Arrays.copyOf(counts, counts.length);
    }

    public long getMaxCount() {
        long max = 0;
        for (final long count : counts) {
            max = Math.max(max, count);
        }
        return max;
    }

    public long getTotalCount() {
        long total = 0;
        for (final long count : counts) {
            total += count;
        }
        return total;
    }

    /**
     * @param  fraction  portion of the maximum count to display (e.g. 0.025 to reveal small bins).
     *
     * @return upper y-axis limit for charts of this histogram (never less than 1).
     */
    public long getYAxisLimit(final double fraction) {
        if (! (fraction > 0)) {
            throw new IllegalArgumentException("y-axis fraction must be positive but is " + fraction);
        }
        return Math.max(1, (long) (getMaxCount() * fraction));
    }

    @Override
    public String toString() {
        return "IntensityHistogram{total=" + getTotalCount() + ", max=" + getMaxCount() + '}';
    }
}
