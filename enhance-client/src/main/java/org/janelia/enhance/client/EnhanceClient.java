package org.janelia.enhance.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.process.ByteProcessor;

import java.io.File;
import java.io.IOException;

import org.janelia.enhance.Utils;
import org.janelia.enhance.client.parameter.CommandLineParameters;
import org.janelia.enhance.client.parameter.EnhancementParameters;
import org.janelia.enhance.filter.EnhancementMethod;
import org.janelia.enhance.filter.Filter;
import org.janelia.enhance.filter.FilterFactory;
import org.janelia.enhance.histogram.HistogramReporter;
import org.janelia.enhance.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line tool that applies one enhancement method to a grayscale scan and
 * saves the result along with before and after histogram charts.
 */
public class EnhanceClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Path to input image",
                required = true)
        public String input;

        @Parameter(
                names = "--output",
                description = "Path to save enhanced image",
                required = true)
        public String output;

        @Parameter(
                names = "--method",
                description = "Enhancement method to apply (gamma, contrast, hist_eq, combined, equalize_then_gamma)")
        public String method = EnhancementMethod.COMBINED.getName();

        @ParametersDelegate
        public EnhancementParameters enhancement = new EnhancementParameters();

        @Parameter(
                names = "--imagesDir",
                description = "Where to save intermediate images")
        public String imagesDir = "images";

        @Parameter(
                names = "--histDir",
                description = "Where to save histograms")
        public String histDir = "images" + File.separator + "histograms";

        @Parameter(
                names = "--histogramScale",
                description = "Fraction of the maximum histogram count to use as y-axis limit")
        public Double histogramScale = HistogramReporter.DETAIL_SCALE;

        @Parameter(
                names = "--filterConfig",
                description = "JSON file with named filter lists (use with --filterListName instead of --method)")
        public String filterConfig;

        @Parameter(
                names = "--filterListName",
                description = "Name of the configured filter list to apply")
        public String filterListName;

        public boolean useFilterList() {
            return filterListName != null;
        }

        public void validate()
                throws IllegalArgumentException {
            if (useFilterList() && (filterConfig == null)) {
                throw new IllegalArgumentException("--filterConfig must be specified with --filterListName");
            }
            if ((filterConfig != null) && (! useFilterList())) {
                throw new IllegalArgumentException("--filterListName must be specified with --filterConfig");
            }
            if (! useFilterList()) {
                EnhancementMethod.fromName(method);
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(EnhanceClient.class.getSimpleName(), args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                if (parameters.parse(args)) {

                    LOG.info("runClient: entry, parameters={}", parameters);

                    final EnhanceClient client = new EnhanceClient(parameters, new HistogramReporter());
                    client.enhance();
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final HistogramReporter histogramReporter;

    public EnhanceClient(final Parameters parameters,
                         final HistogramReporter histogramReporter)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
        this.histogramReporter = histogramReporter;
    }

    /**
     * Loads the input image, applies the configured enhancement, and writes all output files.
     *
     * @return the enhanced pixels.
     *
     * @throws IOException
     *   if the input cannot be read or any output cannot be written.
     */
    public ByteProcessor enhance()
            throws IOException {

        final File imagesDir = new File(parameters.imagesDir).getAbsoluteFile();
        final File histDir = new File(parameters.histDir).getAbsoluteFile();
        FileUtil.ensureWritableDirectory(imagesDir);
        FileUtil.ensureWritableDirectory(histDir);

        final String label;
        final String histogramTitle;
        final Filter filter;
        if (parameters.useFilterList()) {
            final FilterFactory filterFactory = FilterFactory.loadConfiguredInstance(new File(parameters.filterConfig));
            filter = filterFactory.buildPipeline(parameters.filterListName);
            label = parameters.filterListName;
            histogramTitle = "Histogram After " + parameters.filterListName;
        } else {
            final EnhancementMethod method = EnhancementMethod.fromName(parameters.method);
            filter = parameters.enhancement.buildFilter(method);
            label = method.getName();
            histogramTitle = parameters.enhancement.getHistogramTitle(method);
        }

        LOG.info("enhance: applying {} to {}", filter, parameters.input);

        final ByteProcessor original = Utils.openGrayscaleImage(parameters.input);

        histogramReporter.report(original,
                                 "Original Histogram",
                                 new File(histDir, "original_hist.png").getPath(),
                                 parameters.histogramScale);

        final ByteProcessor enhanced = filter.process(original);

        Utils.saveImage(enhanced, new File(imagesDir, label + "_result.jpg").getPath());
        histogramReporter.report(enhanced,
                                 histogramTitle,
                                 new File(histDir, label + "_hist.png").getPath(),
                                 parameters.histogramScale);

        final File outputFile = Utils.prepareFileForWrite(parameters.output);
        Utils.saveImage(enhanced, outputFile.getPath());

        LOG.info("enhance: Enhanced image saved to: {}", outputFile);

        return enhanced;
    }

    private static final Logger LOG = LoggerFactory.getLogger(EnhanceClient.class);
}
