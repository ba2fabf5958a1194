package org.broadinstitute.genomics.arrays;

import org.broadinstitute.genomics.GenomicsBaseTest;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.variant.Variant;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Collections;

public final class GenotypeStatsUtilsUnitTest extends GenomicsBaseTest {

    private static final byte MISSING = (byte) Variant.MISSING_IDX;

    /**
     * Builds a diploid column from {allele1, allele2, count} triples.
     */
    private static GenotypeArray diploid(final Variant variant, final int[]... groups) {
        final ByteArrayOutputStream records = new ByteArrayOutputStream();
        for (final int[] group : groups) {
            for (int i = 0; i < group[2]; i++) {
                records.write(group[0]);
                records.write(group[1]);
                records.write(MISSING);
            }
        }
        return GenotypeArray.fromRawRecords(variant, records.toByteArray());
    }

    private static Variant snp() {
        return new Variant("1", 100, "rs1", "A", Collections.singletonList("T"));
    }

    private static Variant triallelic() {
        return new Variant("1", 100, "rs3", "A", Arrays.asList("C", "G"));
    }

    @Test
    public void testMaf() {
        final GenotypeArray array = GenotypeArray.fromStrings(snp(), Arrays.asList("A/A", "A/T", "T/T", "./.", "A/."));
        Assert.assertEquals(array.getMaf(), 3.0 / 7.0, 1e-12);
    }

    @Test
    public void testMafUsesMostCommonAlt() {
        final GenotypeArray array = diploid(triallelic(), new int[]{0, 1, 2}, new int[]{2, 2, 3});
        Assert.assertEquals(array.getMaf(), 6.0 / 10.0, 1e-12);
    }

    @Test
    public void testMafEdgeCases() {
        Assert.assertTrue(Double.isNaN(GenotypeArray.missing(snp(), 4).getMaf()));
        Assert.assertTrue(Double.isNaN(GenotypeArray.empty(snp()).getMaf()));
        Assert.assertEquals(diploid(snp(), new int[]{0, 0, 5}).getMaf(), 0.0);
    }

    @DataProvider(name = "hweData")
    public Object[][] hweData() {
        return new Object[][]{
                // in equilibrium
                {diploid(snp(), new int[]{0, 0, 640}, new int[]{0, 1, 320}, new int[]{1, 1, 40}), 5, 1.0},
                {diploid(snp(), new int[]{0, 0, 500}, new int[]{0, 1, 400}, new int[]{1, 1, 100}), 5, 0.31491015182749926},
                {diploid(snp(), new int[]{0, 0, 30}, new int[]{0, 1, 40}, new int[]{1, 1, 30}), 5, 0.1353352832366127},
                // no heterozygotes at all
                {diploid(snp(), new int[]{0, 0, 800}, new int[]{1, 1, 200}), 5, 7.124576406741286e-218},
                // an expected count below the minimum
                {diploid(snp(), new int[]{0, 0, 10}, new int[]{0, 1, 5}, new int[]{1, 1, 2}), 5, Double.NaN},
                {diploid(snp(), new int[]{0, 0, 10}, new int[]{0, 1, 5}, new int[]{1, 1, 2}), 1, 0.5278786301239432},
                // missing calls are ignored
                {diploid(snp(), new int[]{0, 0, 30}, new int[]{0, 1, 40}, new int[]{1, 1, 30}, new int[]{0, Variant.MISSING_IDX, 7},
                        new int[]{Variant.MISSING_IDX, Variant.MISSING_IDX, 9}), 5, 0.1353352832366127},
                {diploid(triallelic(), new int[]{0, 0, 300}, new int[]{0, 1, 200}, new int[]{0, 2, 100},
                        new int[]{1, 1, 100}, new int[]{1, 2, 100}, new int[]{2, 2, 200}), 5, 1.4758241793701377e-69},
                // reference only
                {diploid(snp(), new int[]{0, 0, 50}), 5, 1.0},
                {diploid(snp(), new int[]{0, 1, 1}), 5, Double.NaN},
        };
    }

    @Test(dataProvider = "hweData")
    public void testHwePval(final GenotypeArray array, final int minExpected, final double expected) {
        final double actual = GenotypeStatsUtils.calculateHwePval(array, minExpected);
        if (Double.isNaN(expected)) {
            Assert.assertTrue(Double.isNaN(actual), "expected NaN but got " + actual);
        } else {
            Assert.assertEquals(actual / expected, 1.0, 1e-6, "expected " + expected + " but got " + actual);
        }
    }

    @Test
    public void testHweUsesConfiguredMinimum() {
        final GenotypeArray array = diploid(snp(), new int[]{0, 0, 10}, new int[]{0, 1, 5}, new int[]{1, 1, 2});
        Assert.assertTrue(Double.isNaN(array.getHwePval()));
    }

    @Test
    public void testHweNonDiploid() {
        final Variant haploid = new Variant("1", 1, "hap", "A", Collections.singletonList("T"), 1, null);
        final GenotypeArray array = GenotypeArray.fromStrings(haploid, Arrays.asList("A", "T", "A", "T"));
        Assert.assertTrue(Double.isNaN(array.getHwePval()));
    }

    @Test
    public void testChiSquare() {
        Assert.assertEquals(GenotypeStatsUtils.chiSquareStatistic(new long[]{800, 0, 200}, new long[]{640, 320, 40}), 1000.0, 1e-9);
        Assert.assertEquals(GenotypeStatsUtils.chiSquareUpperTail(0.0, 2), 1.0, 1e-12);
        Assert.assertEquals(GenotypeStatsUtils.chiSquareUpperTail(3.841458820694124, 1), 0.05, 1e-9);
    }

    @Test
    public void testCountGenotypes() {
        final GenotypeCounts counts = diploid(snp(), new int[]{0, 0, 3}, new int[]{0, 1, 2}, new int[]{1, 1, 1},
                new int[]{1, Variant.MISSING_IDX, 4}).getGenotypeCounts();
        Assert.assertEquals(counts.getRefs(), 3);
        Assert.assertEquals(counts.getHets(), 2);
        Assert.assertEquals(counts.getHoms(), 1);
        Assert.assertEquals(counts.getMissing(), 4);
        Assert.assertEquals(counts.getCalled(), 6);
    }

    @Test(expectedExceptions = UserException.UnsupportedPloidy.class)
    public void testCountGenotypesNonDiploid() {
        final Variant triploid = new Variant("1", 1, "tri", "A", Collections.singletonList("T"), 3, null);
        GenotypeArray.missing(triploid, 2).getGenotypeCounts();
    }
}
