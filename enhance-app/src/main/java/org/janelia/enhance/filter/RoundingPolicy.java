package org.janelia.enhance.filter;

/**
 * Conversions from a computed (double) intensity to an 8-bit table entry.
 *
 * Gamma correction and equalization round to the nearest level while contrast stretching
 * truncates, so the two conventions produce visibly different pixel values and must not be mixed.
 */
public enum RoundingPolicy {

    /** Round half up to the nearest integer and clamp to [0, 255]. */
    ROUND {
        @Override
        public int toIntensity(final double value) {
            return clamp(Math.round(value));
        }
    },

    /** Truncate toward zero without clamping (callers guarantee the range). */
    TRUNCATE {
        @Override
        public int toIntensity(final double value) {
            return (int) value;
        }
    };

    public static final int MAX_INTENSITY = 255;

    public abstract int toIntensity(final double value);

    private static int clamp(final long value) {
        return (int) Math.max(0, Math.min(MAX_INTENSITY, value));
    }
}
