package org.broadinstitute.genomics.utils.config;

import org.broadinstitute.genomics.GenomicsBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.List;

public final class ConfigFactoryUnitTest extends GenomicsBaseTest {

    @Test
    public void testDefaultConfigValues() {
        final GenomicsConfig config = ConfigFactory.getInstance().getGenomicsConfig();
        Assert.assertEquals(config.genotype_allele_separator(), "/");
        Assert.assertEquals(config.hwe_min_expected_count(), 5);
        Assert.assertEquals(config.maf_filter_min_freq(), 0.01);
        Assert.assertEquals(config.hwe_filter_cutoff(), 0.05);
        Assert.assertTrue(config.plink_categorical_phenotype());
        Assert.assertEquals(config.random_genotype_seed(), 1855L);
    }

    @Test
    public void testConfigIsCached() {
        Assert.assertSame(ConfigFactory.getInstance().getGenomicsConfig(), ConfigFactory.getInstance().getGenomicsConfig());
    }

    @Test
    public void testGetSourcesAnnotationPathVariables() {
        final List<String> variables = ConfigFactory.getInstance().getSourcesAnnotationPathVariables(GenomicsConfig.class);
        Assert.assertEquals(variables, Collections.singletonList(GenomicsConfig.CONFIG_FILE_VARIABLE_FILE_NAME));
    }

    @Test
    public void testUnsetPathVariableIsSetToEmptyPath() {
        final String property = "ConfigFactoryUnitTest.unsetPathVariable";
        ConfigFactory.getInstance().checkFileNamePropertyExistenceAndSetConfigFactoryProperties(Collections.singletonList(property));
        Assert.assertEquals(org.aeonbits.owner.ConfigFactory.getProperty(property), ConfigFactory.NO_PATH_VARIABLE_VALUE);
    }

    @Test
    public void testSystemPropertyPathVariableIsKept() {
        final String property = "ConfigFactoryUnitTest.systemPathVariable";
        System.setProperty(property, "/some/config.properties");
        try {
            ConfigFactory.getInstance().checkFileNamePropertyExistenceAndSetConfigFactoryProperties(Collections.singletonList(property));
            Assert.assertNull(org.aeonbits.owner.ConfigFactory.getProperty(property));
        } finally {
            System.clearProperty(property);
        }
    }
}
