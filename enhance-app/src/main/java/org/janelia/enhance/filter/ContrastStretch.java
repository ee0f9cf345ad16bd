package org.janelia.enhance.filter;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Piecewise-linear contrast stretching through the breakpoints (r1,s1) and (r2,s2).
 */
public class ContrastStretch implements Filter {

    public static final int DEFAULT_R1 = 70;
    public static final int DEFAULT_S1 = 0;
    public static final int DEFAULT_R2 = 140;
    public static final int DEFAULT_S2 = 255;

    private int r1;
    private int s1;
    private int r2;
    private int s2;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public ContrastStretch() {
        this(DEFAULT_R1, DEFAULT_S1, DEFAULT_R2, DEFAULT_S2);
    }

    public ContrastStretch(final int r1,
                           final int s1,
                           final int r2,
                           final int s2) {
        ContrastStretchLut.validateBreakpoints(r1, s1, r2, s2);
        this.r1 = r1;
        this.s1 = s1;
        this.r2 = r2;
        this.s2 = s2;
    }

    @Override
    public void init(final Map<String, String> params) {
        final int r1 = Filter.getIntegerParameter("r1", params);
        final int s1 = Filter.getIntegerParameter("s1", params);
        final int r2 = Filter.getIntegerParameter("r2", params);
        final int s2 = Filter.getIntegerParameter("s2", params);
        ContrastStretchLut.validateBreakpoints(r1, s1, r2, s2);
        this.r1 = r1;
        this.s1 = s1;
        this.r2 = r2;
        this.s2 = s2;
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("r1", String.valueOf(r1));
        map.put("s1", String.valueOf(s1));
        map.put("r2", String.valueOf(r2));
        map.put("s2", String.valueOf(s2));
        return map;
    }

    public ContrastStretchLut buildLut() {
        return ContrastStretchLut.build(r1, s1, r2, s2);
    }

    @Override
    public ByteProcessor process(final ImageProcessor ip) {
        final ByteProcessor stretched = Filter.copyAsBytes(ip);
        stretched.applyTable(buildLut().toArray());
        return stretched;
    }

    @Override
    public String toString() {
        return "ContrastStretch{r1=" + r1 + ", s1=" + s1 + ", r2=" + r2 + ", s2=" + s2 + '}';
    }

}
