package org.janelia.enhance.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.process.ByteProcessor;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.enhance.Utils;
import org.janelia.enhance.client.parameter.CommandLineParameters;
import org.janelia.enhance.client.parameter.EnhancementParameters;
import org.janelia.enhance.filter.EnhancementMethod;
import org.janelia.enhance.filter.Filter;
import org.janelia.enhance.histogram.HistogramReporter;
import org.janelia.enhance.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line tool that applies every enhancement method to a grayscale scan and
 * saves each result with its histogram chart for side by side comparison.
 */
public class EnhanceAllClient {

    public static final String ORIGINAL_HISTOGRAM_KEY = "original_hist";

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Path to input image",
                required = true)
        public String input;

        @ParametersDelegate
        public EnhancementParameters enhancement = new EnhancementParameters();

        @Parameter(
                names = "--imagesDir",
                description = "Where to save enhanced images")
        public String imagesDir = "output_images";

        @Parameter(
                names = "--histDir",
                description = "Where to save histograms")
        public String histDir = "output_histograms";

        @Parameter(
                names = "--histogramScale",
                description = "Fraction of the maximum histogram count to use as y-axis limit")
        public Double histogramScale = HistogramReporter.DETAIL_SCALE;

    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(EnhanceAllClient.class.getSimpleName(), args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                if (parameters.parse(args)) {

                    LOG.info("runClient: entry, parameters={}", parameters);

                    final EnhanceAllClient client = new EnhanceAllClient(parameters, new HistogramReporter());
                    client.processAndSaveAll();
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final HistogramReporter histogramReporter;

    public EnhanceAllClient(final Parameters parameters,
                            final HistogramReporter histogramReporter) {
        this.parameters = parameters;
        this.histogramReporter = histogramReporter;
    }

    /**
     * Applies each {@link EnhancementMethod} to the input image and saves every result and histogram.
     * A JSON file mapping output keys to paths is written to the images directory.
     *
     * @return ordered map of output keys (e.g. 'gamma_img', 'gamma_hist') to absolute file paths.
     *
     * @throws IOException
     *   if the input cannot be read or any output cannot be written.
     *
     * @throws IllegalArgumentException
     *   if any enhancement parameter is invalid.
     */
    public Map<String, String> processAndSaveAll()
            throws IOException, IllegalArgumentException {

        final File imagesDir = new File(parameters.imagesDir).getAbsoluteFile();
        final File histDir = new File(parameters.histDir).getAbsoluteFile();
        FileUtil.ensureWritableDirectory(imagesDir);
        FileUtil.ensureWritableDirectory(histDir);

        final EnhancementParameters enhancement = parameters.enhancement;

        // build every filter before writing anything so that bad parameters fail fast
        final Map<EnhancementMethod, Filter> methodToFilter = new LinkedHashMap<>();
        for (final EnhancementMethod method : EnhancementMethod.values()) {
            methodToFilter.put(method, enhancement.buildFilter(method));
        }

        final String baseName = Utils.getBaseName(parameters.input);
        final ByteProcessor original = Utils.openGrayscaleImage(parameters.input);

        final Map<String, String> outputPaths = new LinkedHashMap<>();

        final File originalHistogramFile = new File(histDir, baseName + "_original_hist.png");
        histogramReporter.report(original,
                                 "Original Histogram",
                                 originalHistogramFile.getPath(),
                                 parameters.histogramScale);
        outputPaths.put(ORIGINAL_HISTOGRAM_KEY, originalHistogramFile.getPath());

        for (final Map.Entry<EnhancementMethod, Filter> entry : methodToFilter.entrySet()) {

            final EnhancementMethod method = entry.getKey();
            final ByteProcessor enhanced = entry.getValue().process(original);

            final File imageFile = new File(imagesDir, baseName + "_" + method.getName() + ".jpg");
            Utils.saveImage(enhanced, imageFile.getPath());
            outputPaths.put(getImageKey(method), imageFile.getPath());

            final File histogramFile = new File(histDir, baseName + "_" + method.getName() + "_hist.png");
            histogramReporter.report(enhanced,
                                     enhancement.getHistogramTitle(method),
                                     histogramFile.getPath(),
                                     parameters.histogramScale);
            outputPaths.put(getHistogramKey(method), histogramFile.getPath());
        }

        final File summaryFile = new File(imagesDir, baseName + "_outputs.json");
        FileUtil.saveJsonFile(summaryFile.getPath(), outputPaths);

        LOG.info("processAndSaveAll: exit, saved {} files for {}", outputPaths.size(), parameters.input);

        return outputPaths;
    }

    public static String getImageKey(final EnhancementMethod method) {
        return method.getName() + "_img";
    }

    public static String getHistogramKey(final EnhancementMethod method) {
        return method.getName() + "_hist";
    }

    private static final Logger LOG = LoggerFactory.getLogger(EnhanceAllClient.class);
}
