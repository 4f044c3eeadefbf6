package org.broadinstitute.pairasm.testutils;

import org.broadinstitute.pairasm.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pairasm.utils.Utils;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Fluent builder of tool arguments for tests. Names are given without dashes.
 */
public final class ArgumentsBuilder {

    private final List<String> args = new ArrayList<>();

    /**
     * Adds {@code --name value}. The value is kept whole even if it holds whitespace.
     */
    public ArgumentsBuilder add( final String argumentName, final String argumentValue ) {
        Utils.nonNull(argumentValue);
        args.add("--" + Utils.nonNull(argumentName));
        args.add(argumentValue);
        return this;
    }

    public ArgumentsBuilder add( final String argumentName, final File file ) {
        return add(argumentName, Utils.nonNull(file).getAbsolutePath());
    }

    public ArgumentsBuilder add( final String argumentName, final Number value ) {
        return add(argumentName, Utils.nonNull(value).toString());
    }

    public ArgumentsBuilder addFlag( final String argumentName ) {
        args.add("--" + Utils.nonNull(argumentName));
        return this;
    }

    public ArgumentsBuilder addInput( final File input ) {
        return add(StandardArgumentDefinitions.INPUT_LONG_NAME, input);
    }

    public ArgumentsBuilder addOutput( final File output ) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    public ArgumentsBuilder addKmerSize( final int kmerSize ) {
        return add(StandardArgumentDefinitions.KMER_SIZE_LONG_NAME, kmerSize);
    }

    public ArgumentsBuilder addGap( final int gap ) {
        return add(StandardArgumentDefinitions.GAP_LONG_NAME, gap);
    }

    /**
     * Appends every argument of {@code other}.
     */
    public ArgumentsBuilder addAll( final ArgumentsBuilder other ) {
        args.addAll(other.args);
        return this;
    }

    /**
     * @return the live argument list
     */
    public List<String> getArgsList() {
        return args;
    }

    @Override
    public String toString() {
        return String.join(" ", args);
    }
}
