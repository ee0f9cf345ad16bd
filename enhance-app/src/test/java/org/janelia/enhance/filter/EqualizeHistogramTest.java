package org.janelia.enhance.filter;

import ij.process.ByteProcessor;

import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link EqualizeHistogram} class.
 */
public class EqualizeHistogramTest {

    @Test
    public void testTwoLevelImage() {

        final ByteProcessor ip = new ByteProcessor(2, 2, new byte[] { 0, 0, (byte) 255, (byte) 255 });

        final ByteProcessor equalized = new EqualizeHistogram().process(ip);

        Assert.assertEquals("invalid value for dark pixel", 0, equalized.get(0, 0));
        Assert.assertEquals("invalid value for dark pixel", 0, equalized.get(1, 0));
        Assert.assertEquals("invalid value for bright pixel", 255, equalized.get(0, 1));
        Assert.assertEquals("invalid value for bright pixel", 255, equalized.get(1, 1));
    }

    @Test
    public void testUniformHistogramIsUnchanged() {

        final ByteProcessor ip = new ByteProcessor(16, 16);
        for (int i = 0; i < 256; i++) {
            ip.set(i, i);
        }

        final ByteProcessor equalized = new EqualizeHistogram().process(ip);

        for (int i = 0; i < 256; i++) {
            Assert.assertEquals("value " + i + " should not change", i, equalized.get(i));
        }
    }

    @Test
    public void testRounding() {

        final ByteProcessor ip = new ByteProcessor(4, 1, new byte[] { 10, 10, 20, 30 });

        final ByteProcessor equalized = new EqualizeHistogram().process(ip);

        Assert.assertEquals("lowest level should map to 0", 0, equalized.get(0));
        Assert.assertEquals("middle level should round 127.5 up", 128, equalized.get(2));
        Assert.assertEquals("highest level should map to 255", 255, equalized.get(3));
        Assert.assertEquals("source pixels were modified", 20, ip.get(2));
    }

    @Test
    public void testSingleLevelImage() {

        final ByteProcessor ip = new ByteProcessor(3, 3);
        ip.setValue(77);
        ip.fill();

        final ByteProcessor equalized = new EqualizeHistogram().process(ip);

        Assert.assertNotSame("a copy should be returned", ip, equalized);
        Assert.assertArrayEquals("single level image should not change",
                                 (byte[]) ip.getPixels(), (byte[]) equalized.getPixels());
    }

    @Test
    public void testRandomImageIsMonotonic() {

        final Random random = new Random(42);
        final int[] histogram = new int[256];
        for (int i = 60; i < 180; i++) {
            histogram[i] = random.nextInt(1000);
        }
        histogram[60] = 5;
        histogram[179] = 5;

        final int[] table = EqualizeHistogram.buildTable(histogram);

        Assert.assertNotNull("table should be built", table);
        Assert.assertEquals("lowest occupied level should map to 0", 0, table[60]);
        Assert.assertEquals("highest occupied level should map to 255", 255, table[179]);
        for (int i = 1; i < table.length; i++) {
            Assert.assertTrue("table decreases at " + i, table[i] >= table[i - 1]);
        }
    }

    @Test
    public void testEmptyHistogram() {
        Assert.assertNull("no table should be built for empty histogram", EqualizeHistogram.buildTable(new int[256]));
    }

}
