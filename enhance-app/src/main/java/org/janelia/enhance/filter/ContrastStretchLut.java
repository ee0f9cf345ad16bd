package org.janelia.enhance.filter;

import java.util.Arrays;

import static org.janelia.enhance.filter.RoundingPolicy.MAX_INTENSITY;

/**
 * Immutable 256 entry lookup table for piecewise-linear contrast stretching.
 *
 * The table maps (0,0) to (r1,s1), (r1,s1) to (r2,s2) and (r2,s2) to (255,255) with straight lines.
 * Computed values are truncated toward zero ({@link RoundingPolicy#TRUNCATE}).
 */
public class ContrastStretchLut {

    public static final int TABLE_SIZE = MAX_INTENSITY + 1;

    private final int[] table;

    private ContrastStretchLut(final int[] table) {
        this.table = table;
    }

    /**
     * @return lookup table for the specified breakpoints.
     *
     * @throws IllegalArgumentException
     *   if the breakpoints are outside [0, 255] or r1 is not less than r2.
     */
    public static ContrastStretchLut build(final int r1,
                                           final int s1,
                                           final int r2,
                                           final int s2)
            throws IllegalArgumentException {

        validateBreakpoints(r1, s1, r2, s2);

        final RoundingPolicy policy = RoundingPolicy.TRUNCATE;
        final int[] table = new int[TABLE_SIZE];

        for (int r = 0; r < TABLE_SIZE; r++) {
            if (r < r1) {
                table[r] = policy.toIntensity(((double) s1 / r1) * r);
            } else if (r < r2) {
                table[r] = policy.toIntensity(((double) (s2 - s1) / (r2 - r1)) * (r - r1) + s1);
            } else if (r == r2) {
                // avoids the 0/0 slope when r2 is 255
                table[r] = s2;
            } else {
                table[r] = policy.toIntensity(((double) (MAX_INTENSITY - s2) / (MAX_INTENSITY - r2)) * (r - r2) + s2);
            }
        }

        return new ContrastStretchLut(table);
    }

    public static void validateBreakpoints(final int r1,
                                           final int s1,
                                           final int r2,
                                           final int s2)
            throws IllegalArgumentException {

        if (isOutOfRange(r1) || isOutOfRange(s1) || isOutOfRange(r2) || isOutOfRange(s2)) {
            throw new IllegalArgumentException("breakpoints must be within [0, " + MAX_INTENSITY + "] but r1=" + r1 +
                                               ", s1=" + s1 + ", r2=" + r2 + ", s2=" + s2);
        }
        if (r1 >= r2) {
            throw new IllegalArgumentException("r1 (" + r1 + ") must be less than r2 (" + r2 + ")");
        }
    }

    public int get(final int intensity) {
        return table[intensity];
    }

    /**
     * @return copy of the table values.
     */
    public int[] toArray() {
        return Arrays.copyOf(table, table.length);
    }

    /**
     * @return true if no table entry is less than its predecessor.
     */
    public boolean isMonotonic() {
        for (int r = 1; r < table.length; r++) {
            if (table[r] < table[r - 1]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return Arrays.toString(table);
    }

    private static boolean isOutOfRange(final int value) {
        return (value < 0) || (value > MAX_INTENSITY);
    }
}
