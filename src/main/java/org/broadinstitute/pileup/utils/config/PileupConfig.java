package org.broadinstitute.pileup.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Mutable;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Configuration file for pileup track options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + PileupConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + PileupConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:PileupConfig.properties",
 *        4)   "classpath:org/broadinstitute/pileup/utils/config/PileupConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + PileupConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                // Variable for file loading
        "classpath:${" + PileupConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",          // Variable for class path loading
        "file:PileupConfig.properties",                                               // Default path
        "classpath:org/broadinstitute/pileup/utils/config/PileupConfig.properties"    // Class path
})
public interface PileupConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link PileupConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "PileupConfig.pathToPileupConfig";

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link PileupConfig}
     * as a place to find the configuration file on the class path.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "PileupConfig.classPathToPileupConfig";

    // ----------------------------------------------------------
    // Fetch Options:
    // ----------------------------------------------------------

    /**
     * Reference requests are widened to multiples of this many bases before they reach the source.
     */
    @Key("reference.fetch.block.size")
    @DefaultValue("1000")
    int referenceFetchBlockSize();

    /**
     * Extra bases fetched past the end of each alignment request.
     */
    @Key("alignment.fetch.lookahead.bases")
    @DefaultValue("0")
    int alignmentFetchLookaheadBases();

    /**
     * Whether alignment fetches ask only for alignments fully contained in the requested interval.
     */
    @Key("alignment.fetch.contained.only")
    @DefaultValue("false")
    boolean alignmentFetchContainedOnly();

    // ----------------------------------------------------------
    // Diagnostics:
    // ----------------------------------------------------------

    /**
     * Log a summary line (at INFO) every time a track emits a new render set.
     */
    @Key("pileup.log.emissions")
    @DefaultValue("false")
    boolean logEmissions();
}
