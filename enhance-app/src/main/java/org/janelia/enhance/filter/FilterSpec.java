package org.janelia.enhance.filter;

import java.lang.reflect.Constructor;
import java.util.Map;

import org.janelia.enhance.json.JsonUtils;

/**
 * JSON description of one enhancement step: the {@link Filter} class to build and the
 * string parameters passed to its {@link Filter#init} method.
 *
 * Filters in this package may be named by simple class name (e.g. "GammaCorrection"),
 * any other filter needs its fully qualified name.
 */
public class FilterSpec {

    private static final String FILTER_PACKAGE = Filter.class.getPackage().getName();

    private final String className;
    private final Map<String, String> parameters;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FilterSpec() {
        this.className = null;
        this.parameters = null;
    }

    /**
     * @param  className   simple name of a filter in this package or fully qualified name of any filter.
     * @param  parameters  parameters for the filter (null to use its defaults).
     */
    public FilterSpec(final String className,
                      final Map<String, String> parameters) {
        this.className = className;
        this.parameters = parameters;
    }

    public String getClassName() {
        return className;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    /**
     * @return the filter class named by this spec.
     *
     * @throws IllegalArgumentException
     *   if the class cannot be found or does not implement {@link Filter}.
     */
    public Class<? extends Filter> getFilterClass()
            throws IllegalArgumentException {

        if ((className == null) || className.trim().isEmpty()) {
            throw new IllegalArgumentException("no className defined for filter spec");
        }

        final String qualifiedName = className.indexOf('.') < 0 ? FILTER_PACKAGE + "." + className : className;

        final Class<?> loadedClass;
        try {
            loadedClass = Class.forName(qualifiedName);
        } catch (final ClassNotFoundException e) {
            throw new IllegalArgumentException("filter class '" + className + "' cannot be found", e);
        }

        if (! Filter.class.isAssignableFrom(loadedClass)) {
            throw new IllegalArgumentException("class '" + qualifiedName + "' does not implement the '" +
                                               Filter.class.getName() + "' interface");
        }

        return loadedClass.asSubclass(Filter.class);
    }

    /**
     * @return new filter initialized with this spec's parameters.
     *
     * @throws IllegalArgumentException
     *   if the class is invalid, cannot be instantiated, or rejects the parameters.
     */
    public Filter buildInstance()
            throws IllegalArgumentException {

        final Class<? extends Filter> filterClass = getFilterClass();

        final Filter filter;
        try {
            final Constructor<? extends Filter> constructor = filterClass.getDeclaredConstructor();
            filter = constructor.newInstance();
        } catch (final ReflectiveOperationException e) {
            throw new IllegalArgumentException("filter class '" + filterClass.getName() +
                                               "' needs a public no-argument constructor", e);
        }

        if (parameters != null) {
            filter.init(parameters);
        }

        return filter;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static FilterSpec fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * @return spec that rebuilds the specified filter, using the simple name for filters in this package.
     */
    public static FilterSpec forFilter(final Filter filter) {
        final Class<?> filterClass = filter.getClass();
        final String name = FILTER_PACKAGE.equals(filterClass.getPackage().getName()) ?
                            filterClass.getSimpleName() : filterClass.getName();
        return new FilterSpec(name, filter.toParametersMap());
    }

    private static final JsonUtils.Helper<FilterSpec> JSON_HELPER =
            new JsonUtils.Helper<>(FilterSpec.class);
}
