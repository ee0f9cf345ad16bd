package org.janelia.enhance.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.enhance.json.JsonUtils;

/**
 * Base parameters for the enhancement command line tools.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    private static final String STANDALONE_JAR = "enhance-client-standalone.jar";

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    public CommandLineParameters() {
        this.help = false;
    }

    /**
     * Parses arguments for the tool class that encloses these parameters.
     *
     * @see #parse(String[], Class)
     */
    public boolean parse(final String[] args)
            throws IllegalArgumentException {
        return parse(args, getClass().getEnclosingClass());
    }

    /**
     * Parses the specified arguments into this instance.
     * Usage is printed when help is requested or when the arguments are invalid.
     *
     * @param  args          command line arguments.
     * @param  programClass  tool class named in the usage note (null to use this class).
     *
     * @return true if the tool should run, false if only help was requested.
     *
     * @throws IllegalArgumentException
     *   if the arguments cannot be parsed.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass)
            throws IllegalArgumentException {

        final Class<?> namedClass = programClass == null ? getClass() : programClass;
        final JCommander jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp " + STANDALONE_JAR + " " + namedClass.getName());

        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            printUsage(jCommander);
            throw new IllegalArgumentException("failed to parse command line arguments: " + pe.getMessage(), pe);
        }

        if (help) {
            printUsage(jCommander);
        }

        return ! help;
    }

    /**
     * @return JSON representation of these parameters (for logging).
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Requests help for the specified parameters, printing their usage note.
     *
     * @return the parse result, always false for valid parameter classes.
     */
    public static boolean parseHelp(final CommandLineParameters parameters) {
        return parameters.parse(new String[] { "--help" });
    }

    private static void printUsage(final JCommander jCommander) {
        JCommander.getConsole().println("");
        jCommander.usage();
    }

}
