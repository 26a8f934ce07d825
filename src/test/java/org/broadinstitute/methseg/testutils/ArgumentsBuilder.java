package org.broadinstitute.methseg.testutils;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.methseg.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.methseg.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for command line argument lists with convenience methods for the standard input and output arguments.
 *
 * Use this only in test code.
 */
public final class ArgumentsBuilder {
    private final List<String> args= new ArrayList<>();

    public ArgumentsBuilder(){}

    /**
     * Add a string to the arguments list, split on whitespace.
     *
     * NOTE: In general this method should be avoided in favor of other methods that handle adding dashes.
     */
    public ArgumentsBuilder addRaw(String arg){
        args.addAll(Arrays.asList(StringUtils.split(arg.trim())));
        return this;
    }

    /**
     * add an argument with a given value to this builder.
     *
     * This is the fundamental add method that others invoke.  It adds dashes to the argument name.
     */
    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        Utils.nonNull(argumentValue);
        Utils.nonNull(argumentName);
        addRaw("--" + argumentName);
        addRaw(argumentValue);
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final File file){
        Utils.nonNull(file);
        return add(argumentName, file.getAbsolutePath());
    }

    public ArgumentsBuilder add(final String argumentName, final Number value){
        Utils.nonNull(value);
        return add(argumentName, value.toString());
    }

    public ArgumentsBuilder addInput(final File input) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, input);
    }

    public ArgumentsBuilder addOutput(final File output) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    /**
     * @return the arguments as List
     */
    public List<String> getArgsList(){
        return args;
    }

    public String[] getArgsArray(){
        return args.toArray(new String[this.args.size()]);
    }

    @Override
    public String toString(){
        return String.join(" ", args);
    }
}
