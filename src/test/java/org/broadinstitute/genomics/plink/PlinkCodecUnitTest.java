package org.broadinstitute.genomics.plink;

import org.broadinstitute.genomics.GenomicsBaseTest;
import org.broadinstitute.genomics.arrays.GenotypeArray;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.table.GenotypeTable;
import org.broadinstitute.genomics.table.SampleInfo;
import org.broadinstitute.genomics.variant.Variant;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class PlinkCodecUnitTest extends GenomicsBaseTest {

    private static final String M = Variant.MISSING_GENOTYPE;

    private Path prefix(final String name) {
        return getTestPath(name);
    }

    @Test
    public void testReadPlink() {
        final GenotypeTable table = PlinkCodec.readPlink(prefix("small"));
        Assert.assertEquals(table.getSampleIds(), Arrays.asList("IND1", "IND2", "IND3", "IND4", "IND5", "IND6"));
        Assert.assertTrue(table.hasSampleInfo());
        Assert.assertEquals(table.getSampleInfo().get(1).phenotype(), SampleInfo.CASE);
        Assert.assertEquals(table.getColumnNames(), Arrays.asList("0_rs1", "1_rs2", "2_rs3"));

        final GenotypeArray rs1 = table.getColumn("0_rs1");
        Assert.assertEquals(rs1.getVariant().getAlleles(), Arrays.asList("A", "G"));
        Assert.assertEquals(rs1.toStrings(), Arrays.asList("A/A", "A/G", "G/G", M, "A/A", "A/G"));
        Assert.assertEquals(table.getColumn("1_rs2").toStrings(), Arrays.asList("T/T", "T/T", "C/T", "C/C", "C/C", M));
        Assert.assertEquals(table.getColumn("2_rs3").toStrings(), Arrays.asList("A/A", "A/A", M, "A/A", "A/A", "A/A"));
        Assert.assertTrue(Double.isNaN(rs1.getGenotypeScores()[0]));
    }

    @Test
    public void testReadPlinkSwapAlleles() {
        final GenotypeTable table = PlinkCodec.readPlink(prefix("small"), true, Integer.MAX_VALUE, true);
        final GenotypeArray rs1 = table.getColumn("0_rs1");
        Assert.assertEquals(rs1.getVariant().getAlleles(), Arrays.asList("G", "A"));
        Assert.assertEquals(rs1.toStrings(), Arrays.asList("A/A", "G/A", "G/G", M, "A/A", "G/A"));
        Assert.assertEquals(table.getColumn("2_rs3").getVariant().getAlleles(), Collections.singletonList("A"));
    }

    @Test
    public void testReadPlinkMaxVariantsAndRawPhenotype() {
        final GenotypeTable table = PlinkCodec.readPlink(prefix("small"), false, 1, false);
        Assert.assertEquals(table.getColumnNames(), Collections.singletonList("0_rs1"));
        Assert.assertEquals(table.getSampleInfo().get(2).phenotype(), "-9");
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testReadPlinkZeroVariants() {
        PlinkCodec.readPlink(prefix("small"), false, 0, true);
    }

    @DataProvider(name = "corruptFilesets")
    public Object[][] corruptFilesets() {
        return new Object[][]{{"badmagic"}, {"truncated"}, {"monoalt"}, {"short"}};
    }

    @Test(dataProvider = "corruptFilesets", expectedExceptions = UserException.CorruptFile.class)
    public void testReadCorrupt(final String name) {
        PlinkCodec.readPlink(prefix(name));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testReadMissingFileset() {
        PlinkCodec.readPlink(prefix("does_not_exist"));
    }

    @Test
    public void testRoundTripIsBitExact() throws IOException {
        final GenotypeTable table = PlinkCodec.readPlink(prefix("small"), false, 2, false);
        final Path out = createTempDir("plinkRoundTrip").resolve("out");
        PlinkCodec.writePlink(table, out, null);
        for (final String extension : Arrays.asList(".bed", ".bim", ".fam")) {
            deleteOnExit(PlinkCodec.withExtension(out, extension));
        }

        final byte[] expectedBed = Arrays.copyOf(Files.readAllBytes(prefix("small.bed")), 3 + 2 * 2);
        Assert.assertEquals(Files.readAllBytes(PlinkCodec.withExtension(out, ".bed")), expectedBed);
        Assert.assertEquals(Files.readAllLines(PlinkCodec.withExtension(out, ".bim")),
                Arrays.asList("1\trs1\t0\t1000\tG\tA", "1\trs2\t0\t2000\tT\tC"));
        Assert.assertEquals(Files.readAllLines(PlinkCodec.withExtension(out, ".fam")).get(3), "FAM2 IND4 0 0 1 0");

        final GenotypeTable reread = PlinkCodec.readPlink(out, false, Integer.MAX_VALUE, false);
        Assert.assertEquals(reread.getSampleInfo(), table.getSampleInfo());
        for (final String column : table.getColumnNames()) {
            Assert.assertEquals(reread.getColumn(column).toStrings(), table.getColumn(column).toStrings());
        }
    }

    @DataProvider(name = "sampleCounts")
    public Object[][] sampleCounts() {
        return new Object[][]{{1}, {3}, {4}, {5}, {10}};
    }

    @Test(dataProvider = "sampleCounts")
    public void testWriteFromSampleIds(final int numSamples) throws IOException {
        final Variant variant = new Variant("7", 55, "rs7", "C", Collections.singletonList("G"));
        final List<String> sampleIds = new ArrayList<>();
        final List<String> genotypes = new ArrayList<>();
        final String[] cycle = {"C/C", "C/G", "G/G", "./.", "C/."};
        for (int i = 0; i < numSamples; i++) {
            sampleIds.add("s" + i);
            genotypes.add(cycle[i % cycle.length]);
        }
        final GenotypeTable table = GenotypeTable.fromSampleIds(sampleIds)
                .addColumn("rs7", GenotypeArray.fromStrings(variant, genotypes));
        final Path out = createTempDir("plinkIds").resolve("ids");
        final double[] phenotypes = new double[numSamples];
        Arrays.fill(phenotypes, 2.0);
        phenotypes[0] = Double.NaN;
        PlinkCodec.writePlink(table, out, phenotypes);
        for (final String extension : Arrays.asList(".bed", ".bim", ".fam")) {
            deleteOnExit(PlinkCodec.withExtension(out, extension));
        }

        Assert.assertEquals(Files.size(PlinkCodec.withExtension(out, ".bed")), 3 + (numSamples + 3) / 4);
        Assert.assertEquals(Files.readAllLines(PlinkCodec.withExtension(out, ".fam")).get(0), "s0 s0 0 0 0 -9");

        final GenotypeTable reread = PlinkCodec.readPlink(out, false, Integer.MAX_VALUE, true);
        Assert.assertEquals(reread.getSampleIds(), sampleIds);
        if (numSamples > 1) {
            Assert.assertEquals(reread.getSampleInfo().get(1).phenotype(), SampleInfo.CASE);
        }
        // a partially missing call is written as missing
        final List<String> expected = new ArrayList<>();
        for (final String genotype : genotypes) {
            expected.add(genotype.contains(".") ? Variant.MISSING_GENOTYPE : genotype);
        }
        Assert.assertEquals(reread.getColumn("0_rs7").toStrings(), expected);
    }

    @DataProvider(name = "unwritableVariants")
    public Object[][] unwritableVariants() {
        return new Object[][]{
                {new Variant("1", 1, "tri", "A", Arrays.asList("C", "G")), "A/G", UserException.UnsupportedMultiAllelic.class},
                {new Variant("1", 1, "haploid", "A", Collections.singletonList("C"), 1, null), "C", UserException.UnsupportedPloidy.class},
        };
    }

    @Test(dataProvider = "unwritableVariants")
    public void testWriteUnwritableColumnLeavesNoFiles(final Variant variant, final String genotype,
                                                       final Class<? extends UserException> expected) {
        final GenotypeTable table = GenotypeTable.fromSampleIds(Collections.singletonList("s0"))
                .addColumn("ok", GenotypeArray.fromStrings(new Variant("1", 1, "snp", "A", Collections.singletonList("T")),
                        Collections.singletonList("A/T")))
                .addColumn("bad", GenotypeArray.fromStrings(variant, Collections.singletonList(genotype)));
        final Path out = createTempDir("plinkUnwritable").resolve("out");
        try {
            PlinkCodec.writePlink(table, out, null);
            Assert.fail("expected " + expected.getSimpleName());
        } catch (final UserException e) {
            Assert.assertEquals(e.getClass(), expected);
        }
        for (final String extension : Arrays.asList(".bed", ".bim", ".fam")) {
            Assert.assertFalse(Files.exists(PlinkCodec.withExtension(out, extension)), extension);
        }
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testWriteSampleIdZero() {
        PlinkCodec.writePlink(GenotypeTable.fromSampleIds(Collections.singletonList("0")),
                createTempDir("plinkZero").resolve("zero"), null);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testWritePhenotypeLengthMismatch() {
        PlinkCodec.writePlink(GenotypeTable.fromSampleIds(Arrays.asList("a", "b")),
                createTempDir("plinkPheno").resolve("pheno"), new double[]{1.0});
    }
}
