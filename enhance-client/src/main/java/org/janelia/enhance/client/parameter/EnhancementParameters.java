package org.janelia.enhance.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.enhance.filter.ContrastStretch;
import org.janelia.enhance.filter.EnhancementMethod;
import org.janelia.enhance.filter.Filter;
import org.janelia.enhance.filter.GammaCorrection;

/**
 * Parameters for gamma correction and piecewise-linear contrast stretching.
 */
public class EnhancementParameters implements Serializable {

    @Parameter(
            names = "--gamma",
            description = "Gamma exponent applied to normalized intensities")
    public Double gamma = GammaCorrection.DEFAULT_GAMMA;

    @Parameter(
            names = "--gain",
            description = "Multiplier (c) applied after the gamma power")
    public Double gain = GammaCorrection.DEFAULT_GAIN;

    @Parameter(
            names = "--r1",
            description = "Contrast stretch input low breakpoint")
    public Integer r1 = ContrastStretch.DEFAULT_R1;

    @Parameter(
            names = "--s1",
            description = "Contrast stretch output value at r1")
    public Integer s1 = ContrastStretch.DEFAULT_S1;

    @Parameter(
            names = "--r2",
            description = "Contrast stretch input high breakpoint")
    public Integer r2 = ContrastStretch.DEFAULT_R2;

    @Parameter(
            names = "--s2",
            description = "Contrast stretch output value at r2")
    public Integer s2 = ContrastStretch.DEFAULT_S2;

    public GammaCorrection buildGammaCorrection() {
        return new GammaCorrection(gamma, gain);
    }

    public ContrastStretch buildContrastStretch() {
        return new ContrastStretch(r1, s1, r2, s2);
    }

    /**
     * @throws IllegalArgumentException
     *   if the gamma or contrast parameters are invalid.
     */
    public Filter buildFilter(final EnhancementMethod method)
            throws IllegalArgumentException {
        return method.buildFilter(buildGammaCorrection(), buildContrastStretch());
    }

    public String getHistogramTitle(final EnhancementMethod method) {
        final String title;
        switch (method) {
            case GAMMA:
                title = "Histogram After Gamma (gamma=" + gamma + ")";
                break;
            case CONTRAST:
                title = "Histogram After Contrast Stretching";
                break;
            case HIST_EQ:
                title = "Histogram After Histogram Equalization";
                break;
            case COMBINED:
                title = "Histogram After Contrast -> Gamma (gamma=" + gamma + ")";
                break;
            case EQUALIZE_THEN_GAMMA:
                title = "Histogram After Equalization -> Gamma (gamma=" + gamma + ")";
                break;
            default:
                title = "Histogram After " + method;
        }
        return title;
    }

}
