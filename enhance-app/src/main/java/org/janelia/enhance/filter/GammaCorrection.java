package org.janelia.enhance.filter;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.janelia.enhance.filter.RoundingPolicy.MAX_INTENSITY;

/**
 * Power-law intensity mapping: s = gain * r^gamma with r and s normalized to [0, 1].
 * Results above 1.0 are clamped to white.
 */
public class GammaCorrection implements Filter {

    public static final double DEFAULT_GAMMA = 0.5;
    public static final double DEFAULT_GAIN = 1.0;

    private double gamma;
    private double gain;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public GammaCorrection() {
        this(DEFAULT_GAMMA, DEFAULT_GAIN);
    }

    public GammaCorrection(final double gamma) {
        this(gamma, DEFAULT_GAIN);
    }

    public GammaCorrection(final double gamma,
                           final double gain) {
        validate(gamma, gain);
        this.gamma = gamma;
        this.gain = gain;
    }

    public double getGamma() {
        return gamma;
    }

    public double getGain() {
        return gain;
    }

    @Override
    public void init(final Map<String, String> params) {
        final double gamma = Filter.getDoubleParameter("gamma", params);
        final double gain = Filter.getDoubleParameter("gain", params, DEFAULT_GAIN);
        validate(gamma, gain);
        this.gamma = gamma;
        this.gain = gain;
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("gamma", String.valueOf(gamma));
        map.put("gain", String.valueOf(gain));
        return map;
    }

    @Override
    public ByteProcessor process(final ImageProcessor ip) {
        final ByteProcessor corrected = Filter.copyAsBytes(ip);
        corrected.applyTable(buildTable(gamma, gain));
        return corrected;
    }

    /**
     * @return corrected value for every possible 8-bit intensity.
     */
    public static int[] buildTable(final double gamma,
                                   final double gain) {
        final int[] table = new int[MAX_INTENSITY + 1];
        for (int p = 0; p < table.length; p++) {
            table[p] = correct(p, gamma, gain);
        }
        return table;
    }

    /**
     * @return corrected value for a single 8-bit intensity.
     */
    public static int correct(final int intensity,
                              final double gamma,
                              final double gain) {
        final double r = intensity / (double) MAX_INTENSITY;
        final double s = gain * Math.pow(r, gamma);
        return RoundingPolicy.ROUND.toIntensity(s * MAX_INTENSITY);
    }

    @Override
    public String toString() {
        return "GammaCorrection{gamma=" + gamma + ", gain=" + gain + '}';
    }

    private static void validate(final double gamma,
                                 final double gain)
            throws IllegalArgumentException {
        if ((! (gamma > 0)) || Double.isInfinite(gamma)) {
            throw new IllegalArgumentException("gamma must be a positive number but is " + gamma);
        }
        if ((! (gain > 0)) || Double.isInfinite(gain)) {
            throw new IllegalArgumentException("gain must be a positive number but is " + gain);
        }
    }

}
