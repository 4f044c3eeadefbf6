package org.broadinstitute.pairasm.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Mutable;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Settings shared by the pairasm tools.
 *
 * Sources are merged, so a key missing from the first is looked up in the next:
 * <ol>
 *     <li>{@code PairasmConfig.properties} in the working directory</li>
 *     <li>the copy bundled on the class path</li>
 *     <li>the {@code @DefaultValue} of the getter</li>
 * </ol>
 * A file named with {@code --pairasm-config-file} is loaded on top of all of these by {@link ConfigFactory}.
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:PairasmConfig.properties",
        "classpath:org/broadinstitute/pairasm/utils/config/PairasmConfig.properties"
})
public interface PairasmConfig extends Mutable, Accessible {

    /**
     * Print the stack trace of a {@link org.broadinstitute.pairasm.exceptions.UserException} along with its message.
     */
    @Key("pairasm_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean pairasm_stacktrace_on_user_exception();

    // Traversal

    /**
     * Whether to reject k-mer pair graphs whose degree imbalances rule out an Eulerian path before traversing them.
     */
    @Key("validate_degrees_before_traversal")
    @DefaultValue("false")
    boolean validate_degrees_before_traversal();

    @Key("traversal_progress_interval")
    @DefaultValue("1000000")
    int traversal_progress_interval();

    @Key("traversal_abort_check_interval")
    @DefaultValue("4096")
    int traversal_abort_check_interval();

    /**
     * Largest graph, in edges, a traversal will attempt. 0 means no limit.
     */
    @Key("traversal_max_edges")
    @DefaultValue("0")
    long traversal_max_edges();

    // I/O

    /**
     * Column delimiter of k-mer pair files. Empty means any run of whitespace.
     */
    @Key("kmer_pair_delimiter")
    @DefaultValue("")
    String kmer_pair_delimiter();
}
