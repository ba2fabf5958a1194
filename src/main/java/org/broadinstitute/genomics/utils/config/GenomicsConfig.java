package org.broadinstitute.genomics.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Mutable;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Configuration file for genotype column options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * In this case, the load order is:
 *        1)   "file:${" + GenomicsConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:GenomicsConfig.properties",
 *        3)   "classpath:org/broadinstitute/genomics/utils/config/GenomicsConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + GenomicsConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                   // Variable for file loading
        "file:GenomicsConfig.properties",                                                  // Default path
        "classpath:org/broadinstitute/genomics/utils/config/GenomicsConfig.properties"     // Class path
})
public interface GenomicsConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link GenomicsConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "GenomicsConfig.pathToConfig";

    // ----------------------------------------------------------
    // Genotype Options:
    // ----------------------------------------------------------

    @Key("genotype_allele_separator")
    @DefaultValue("/")
    String genotype_allele_separator();

    // ----------------------------------------------------------
    // Statistics Options:
    // ----------------------------------------------------------

    /** Smallest expected genotype count for which the HWE chi-square test is reported. */
    @Key("hwe_min_expected_count")
    @DefaultValue("5")
    int hwe_min_expected_count();

    @Key("maf_filter_min_freq")
    @DefaultValue("0.01")
    double maf_filter_min_freq();

    @Key("hwe_filter_cutoff")
    @DefaultValue("0.05")
    double hwe_filter_cutoff();

    // ----------------------------------------------------------
    // PLINK Options:
    // ----------------------------------------------------------

    @Key("plink_categorical_phenotype")
    @DefaultValue("true")
    boolean plink_categorical_phenotype();

    // ----------------------------------------------------------
    // Simulation Options:
    // ----------------------------------------------------------

    @Key("random_genotype_seed")
    @DefaultValue("1855")
    long random_genotype_seed();
}
