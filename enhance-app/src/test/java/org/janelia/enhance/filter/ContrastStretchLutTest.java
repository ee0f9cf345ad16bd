package org.janelia.enhance.filter;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ContrastStretchLut} class.
 */
public class ContrastStretchLutTest {

    @Test
    public void testDefaultBreakpoints() {

        final ContrastStretchLut lut = ContrastStretchLut.build(70, 0, 140, 255);

        Assert.assertEquals("invalid value for r1", 0, lut.get(70));
        Assert.assertEquals("invalid value for r2", 255, lut.get(140));
        Assert.assertEquals("invalid value for 0", 0, lut.get(0));
        Assert.assertEquals("invalid value for 255", 255, lut.get(255));
        Assert.assertEquals("values below r1 should map to s1", 0, lut.get(35));
        Assert.assertEquals("values above r2 should map to s2", 255, lut.get(200));
    }

    @Test
    public void testTruncation() {

        final ContrastStretchLut lut = ContrastStretchLut.build(70, 0, 140, 255);

        // 255/70 * 1 = 3.64 and 255/70 * 30 = 109.29
        Assert.assertEquals("value for 71 should be truncated", 3, lut.get(71));
        Assert.assertEquals("value for 100 should be truncated", 109, lut.get(100));

        // 50/100 * 3 = 1.5
        final ContrastStretchLut lowLut = ContrastStretchLut.build(100, 50, 200, 250);
        Assert.assertEquals("value below r1 should be truncated", 1, lowLut.get(3));
    }

    @Test
    public void testEdgeBreakpoints() {

        final ContrastStretchLut zeroR1Lut = ContrastStretchLut.build(0, 10, 100, 200);
        Assert.assertEquals("r1 of 0 should start at s1", 10, zeroR1Lut.get(0));

        final ContrastStretchLut maxR2Lut = ContrastStretchLut.build(50, 20, 255, 240);
        Assert.assertEquals("r2 of 255 should map 255 to s2", 240, maxR2Lut.get(255));
        Assert.assertEquals("invalid value for r1", 20, maxR2Lut.get(50));
    }

    @Test
    public void testMonotonicWhenOutputsAreOrdered() {
        for (int r1 = 0; r1 < 255; r1 += 17) {
            for (int r2 = r1 + 1; r2 <= 255; r2 += 23) {
                for (int s1 = 0; s1 <= 255; s1 += 51) {
                    for (int s2 = s1; s2 <= 255; s2 += 51) {
                        final ContrastStretchLut lut = ContrastStretchLut.build(r1, s1, r2, s2);
                        Assert.assertTrue("table should be monotonic for " + r1 + "," + s1 + "," + r2 + "," + s2,
                                          lut.isMonotonic());
                        for (final int value : lut.toArray()) {
                            Assert.assertTrue("value " + value + " out of range for " + lut,
                                              (value >= 0) && (value <= 255));
                        }
                    }
                }
            }
        }
    }

    @Test
    public void testToArrayReturnsCopy() {
        final ContrastStretchLut lut = ContrastStretchLut.build(70, 0, 140, 255);
        final int[] values = lut.toArray();
        Assert.assertEquals("invalid table size", 256, values.length);
        values[200] = 0;
        Assert.assertEquals("table should not change when copy is modified", 255, lut.get(200));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEqualInputBreakpoints() {
        ContrastStretchLut.build(100, 50, 100, 200);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutOfOrderInputBreakpoints() {
        ContrastStretchLut.build(140, 0, 70, 255);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutOfRangeOutputBreakpoint() {
        ContrastStretchLut.build(70, 0, 140, 256);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeInputBreakpoint() {
        ContrastStretchLut.build(-1, 0, 140, 255);
    }

}
