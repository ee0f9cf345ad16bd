package org.janelia.enhance.filter;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.janelia.enhance.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains a mapping of configured filter list names to specifications and
 * facilitates constructing the corresponding pipelines.
 */
public class FilterFactory implements Serializable {

    private final Map<String, List<FilterSpec>> namedFilterSpecLists;

    /**
     * Constructs an empty factory.
     */
    public FilterFactory() {
        this.namedFilterSpecLists = new TreeMap<>();
    }

    /**
     * @param  name  name of the desired filter list.
     *
     * @return list of filter specifications associated with the specified name.
     *
     * @throws IllegalArgumentException
     *   if no list with the specified name exists.
     */
    public List<FilterSpec> getFilterList(final String name)
            throws IllegalArgumentException {

        final List<FilterSpec> filterSpecs = namedFilterSpecLists.get(name);

        if (filterSpecs == null) {
            throw new IllegalArgumentException("Filter list with name '" + name + "' not found.  " +
                                               "Configured names are " + namedFilterSpecLists.keySet() + ".");
        }

        return filterSpecs;
    }

    /**
     * @return pipeline that applies the named list's filters in order.
     */
    public CompositeFilter buildPipeline(final String name)
            throws IllegalArgumentException {
        return new CompositeFilter(buildInstanceList(getFilterList(name)));
    }

    /**
     * Adds the specified list to this factory.
     *
     * @param  name      name of the list.
     * @param  specList  specifications in the list.
     */
    public void addFilterList(final String name,
                              final List<FilterSpec> specList) {
        namedFilterSpecLists.put(name, specList);
    }

    public int size() {
        return namedFilterSpecLists.size();
    }

    /**
     * @return a JSON representation of this factory.
     */
    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    /**
     * @param  configFile  JSON file containing named filter lists.
     *
     * @return a factory instance parsed from the specified file.
     *
     * @throws IOException
     *   if the file cannot be read.
     */
    public static FilterFactory loadConfiguredInstance(final File configFile)
            throws IOException {

        if (! configFile.exists()) {
            throw new IOException("filter configuration file " + configFile.getAbsolutePath() + " not found");
        }

        final FilterFactory factory;
        try (final Reader reader = new FileReader(configFile)) {
            factory = fromJson(reader);
        }

        LOG.info("loadConfiguredInstance: loaded {} named filter lists from {}",
                 factory.namedFilterSpecLists.size(), configFile);

        return factory;
    }

    /**
     * @param  reader  reader to parse.
     *
     * @return a factory instance populated by parsing the specified json reader's stream.
     */
    public static FilterFactory fromJson(final Reader reader) {
        return JSON_HELPER.fromJson(reader);
    }

    /**
     * @param  specList  list of filter specifications.
     *
     * @return list of filter instances built from the specifications.
     */
    public static List<Filter> buildInstanceList(final List<FilterSpec> specList) {
        final List<Filter> filterInstanceList = new ArrayList<>(specList.size());
        //noinspection Convert2streamapi
        for (final FilterSpec spec : specList) {
            filterInstanceList.add(spec.buildInstance());
        }
        return filterInstanceList;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FilterFactory.class);

    private static final JsonUtils.Helper<FilterFactory> JSON_HELPER =
            new JsonUtils.Helper<>(FilterFactory.class);
}
