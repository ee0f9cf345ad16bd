package org.janelia.enhance.filter;

import ij.process.ByteProcessor;

import java.util.HashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link GammaCorrection} class.
 */
public class GammaCorrectionTest {

    @Test
    public void testUniformImage() {

        final ByteProcessor ip = new ByteProcessor(4, 4);
        ip.setValue(128);
        ip.fill();

        final ByteProcessor corrected = new GammaCorrection(0.5, 1.0).process(ip);

        Assert.assertEquals("invalid width", 4, corrected.getWidth());
        Assert.assertEquals("invalid height", 4, corrected.getHeight());
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                Assert.assertEquals("invalid value for pixel (" + x + "," + y + ")", 181, corrected.get(x, y));
                Assert.assertEquals("source pixel (" + x + "," + y + ") was modified", 128, ip.get(x, y));
            }
        }
    }

    @Test
    public void testEndPoints() {
        Assert.assertEquals("black should stay black", 0, GammaCorrection.correct(0, 0.5, 1.0));
        Assert.assertEquals("white should stay white", 255, GammaCorrection.correct(255, 0.5, 1.0));
        Assert.assertEquals("white should stay white", 255, GammaCorrection.correct(255, 2.2, 1.0));
    }

    @Test
    public void testGainIsClamped() {
        Assert.assertEquals("large gain should clamp to white", 255, GammaCorrection.correct(200, 0.5, 2.0));
        Assert.assertEquals("small gain should darken", 91, GammaCorrection.correct(255, 0.5, 0.357));
    }

    @Test
    public void testRoundTrip() {
        for (final double gamma : new double[] { 0.5, 0.8 }) {
            for (int p = 0; p < 256; p++) {
                final int corrected = GammaCorrection.correct(p, gamma, 1.0);
                final int restored = GammaCorrection.correct(corrected, 1.0 / gamma, 1.0);
                Assert.assertTrue("round trip of " + p + " with gamma " + gamma + " returned " + restored,
                                  Math.abs(restored - p) <= 1);
            }
        }
    }

    @Test
    public void testTableIsMonotonic() {
        for (final double gamma : new double[] { 0.1, 0.5, 1.0, 2.2, 3.0 }) {
            final int[] table = GammaCorrection.buildTable(gamma, 1.0);
            for (int p = 1; p < table.length; p++) {
                Assert.assertTrue("table for gamma " + gamma + " decreases at " + p, table[p] >= table[p - 1]);
            }
        }
    }

    @Test
    public void testInit() {
        final Map<String, String> params = new HashMap<>();
        params.put("gamma", "2.0");

        final GammaCorrection gammaCorrection = new GammaCorrection();
        gammaCorrection.init(params);

        Assert.assertEquals("invalid gamma", 2.0, gammaCorrection.getGamma(), 0.0);
        Assert.assertEquals("gain should default to 1", 1.0, gammaCorrection.getGain(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroGamma() {
        new GammaCorrection(0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNGain() {
        new GammaCorrection(0.5, Double.NaN);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingGammaParameter() {
        new GammaCorrection().init(new HashMap<>());
    }

}
