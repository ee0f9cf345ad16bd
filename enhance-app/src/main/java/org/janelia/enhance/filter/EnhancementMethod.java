package org.janelia.enhance.filter;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Enhancement methods offered to callers.  The two-stage methods always apply their stages in the listed order.
 */
public enum EnhancementMethod {

    GAMMA("gamma"),
    CONTRAST("contrast"),
    HIST_EQ("hist_eq"),
    COMBINED("combined", "contrast_then_gamma"),
    EQUALIZE_THEN_GAMMA("equalize_then_gamma");

    private final String methodName;
    private final String alias;

    EnhancementMethod(final String name) {
        this(name, null);
    }

    EnhancementMethod(final String name,
                      final String alias) {
        this.methodName = name;
        this.alias = alias;
    }

    /**
     * @return command line and file name form of this method (e.g. 'hist_eq').
     */
    public String getName() {
        return methodName;
    }

    /**
     * @param  gammaCorrection  gamma stage to use (ignored by methods without one).
     * @param  contrastStretch  contrast stage to use (ignored by methods without one).
     *
     * @return filter implementing this method.
     */
    public Filter buildFilter(final GammaCorrection gammaCorrection,
                              final ContrastStretch contrastStretch) {
        final Filter filter;
        switch (this) {
            case GAMMA:
                filter = gammaCorrection;
                break;
            case CONTRAST:
                filter = contrastStretch;
                break;
            case HIST_EQ:
                filter = new EqualizeHistogram();
                break;
            case COMBINED:
                filter = new CompositeFilter(contrastStretch, gammaCorrection);
                break;
            case EQUALIZE_THEN_GAMMA:
                filter = new CompositeFilter(new EqualizeHistogram(), gammaCorrection);
                break;
            default:
                throw new IllegalStateException("no filter defined for " + this);
        }
        return filter;
    }

    /**
     * @param  value  method name or alias, case and '-' vs. '_' are ignored.
     *
     * @return the corresponding method.
     *
     * @throws IllegalArgumentException
     *   if the value does not identify a method.
     */
    public static EnhancementMethod fromName(final String value)
            throws IllegalArgumentException {
        if (value != null) {
            final String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (final EnhancementMethod method : values()) {
                if (method.methodName.equals(normalized) || normalized.equals(method.alias)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("unknown enhancement method '" + value + "', valid values are " +
                                           Arrays.stream(values())
                                                   .map(EnhancementMethod::getName)
                                                   .collect(Collectors.toList()));
    }

    @Override
    public String toString() {
        return methodName;
    }
}
