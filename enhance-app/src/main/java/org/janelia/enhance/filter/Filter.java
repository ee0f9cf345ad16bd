package org.janelia.enhance.filter;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.io.Serializable;
import java.util.Map;

import org.slf4j.LoggerFactory;

/**
 * Common interface for all intensity filter implementations.
 * Filters never modify the pixels they are given.
 */
public interface Filter extends Serializable {

    /**
     * Initialize this filter's parameters.
     *
     * @param  params  parameters to use.
     *
     * @throws IllegalArgumentException
     *   if any parameter is missing or invalid.
     */
    void init(final Map<String, String> params)
            throws IllegalArgumentException;

    /**
     * @return map of this filter's parameters (suitable for specification serialization).
     */
    Map<String, String> toParametersMap();

    /**
     * Apply this filter.
     *
     * @param  ip  8-bit pixels to process (left unchanged).
     *
     * @return new 8-bit processor with the same dimensions containing the filtered pixels.
     */
    ByteProcessor process(final ImageProcessor ip);


    // Utility methods for pixel and parameter handling ...

    /**
     * @return an 8-bit copy of the specified processor that can be modified freely.
     */
    static ByteProcessor copyAsBytes(final ImageProcessor ip) {
        final ByteProcessor copy;
        if (ip instanceof ByteProcessor) {
            copy = (ByteProcessor) ip.duplicate();
        } else {
            LoggerFactory.getLogger(Filter.class).warn(
                    "copyAsBytes: converting {}-bit processor to 8-bit without scaling", ip.getBitDepth());
            copy = (ByteProcessor) ip.convertToByteProcessor(false);
        }
        return copy;
    }

    static String getStringParameter(final String parameterName,
                                     final Map<String, String> params)
            throws IllegalArgumentException {
        final String valueString = params.get(parameterName);
        if (valueString == null) {
            throw new IllegalArgumentException("'" + parameterName + "' is not defined");
        }
        return valueString;
    }

    static Integer getIntegerParameter(final String parameterName,
                                       final Map<String, String> params) {
        final String valueString = getStringParameter(parameterName, params);
        try {
            return Integer.parseInt(valueString);
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    static Double getDoubleParameter(final String parameterName,
                                     final Map<String, String> params) {
        final String valueString = getStringParameter(parameterName, params);
        try {
            return Double.parseDouble(valueString);
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    /**
     * @return the named parameter value or the default if the parameter is not defined.
     */
    static Double getDoubleParameter(final String parameterName,
                                     final Map<String, String> params,
                                     final double defaultValue) {
        return params.containsKey(parameterName) ? getDoubleParameter(parameterName, params) : defaultValue;
    }

}
