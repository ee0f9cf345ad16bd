package org.janelia.enhance.filter;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds a list of {@link Filter}s to be applied in sequence (first to last).
 * The output of each filter is the input of the next one.
 */
public class CompositeFilter implements Filter {

    private List<Filter> filters;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public CompositeFilter() {
        this(new ArrayList<>());
    }

    public CompositeFilter(final Filter... filters) {
        this(List.of(filters));
    }

    public CompositeFilter(final List<Filter> filters) {
        this.filters = new ArrayList<>(filters);
    }

    public List<Filter> getFilters() {
        return new ArrayList<>(filters);
    }

    @Override
    public void init(final Map<String, String> params) {
        filters = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            final String serializedFilter = Filter.getStringParameter(filterKey(i), params);
            final FilterSpec filterSpec = FilterSpec.fromJson(serializedFilter);
            filters.add(filterSpec.buildInstance());
        }
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < filters.size(); i++) {
            final FilterSpec filterSpec = FilterSpec.forFilter(filters.get(i));
            map.put(filterKey(i), filterSpec.toJson());
        }
        return map;
    }

    private static String filterKey(final int i) {
        return "filter" + i;
    }

    @Override
    public ByteProcessor process(final ImageProcessor ip) {
        ByteProcessor result = Filter.copyAsBytes(ip);
        for (final Filter filter : filters) {
            result = filter.process(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return "CompositeFilter" + filters;
    }
}
