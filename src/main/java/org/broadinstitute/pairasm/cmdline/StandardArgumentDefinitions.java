package org.broadinstitute.pairasm.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String OUTPUT_LONG_NAME = "output";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String KMER_SIZE_LONG_NAME = "kmer-size";
    public static final String GAP_LONG_NAME = "gap";
    public static final String DELIMITER_LONG_NAME = "delimiter";
    public static final String SEQUENCE_NAME_LONG_NAME = "sequence-name";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String KMER_SIZE_SHORT_NAME = "k";
    public static final String GAP_SHORT_NAME = "d";

    public static final String TMP_DIR_NAME = "tmp-dir";
    public static final String QUIET_NAME = "QUIET";
    public static final String PAIRASM_CONFIG_FILE_OPTION = "pairasm-config-file";
}
