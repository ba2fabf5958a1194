package org.broadinstitute.genomics.plink;

import org.broadinstitute.genomics.GenomicsBaseTest;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.table.SampleInfo;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class FamCodecUnitTest extends GenomicsBaseTest {

    @Test
    public void testReadCategorical() {
        final List<SampleInfo> samples = FamCodec.readFam(getTestPath("small.fam"), true);
        Assert.assertEquals(samples.size(), 6);
        Assert.assertEquals(samples.get(2), new SampleInfo("FAM2", "IND3", "IND1", "IND2", SampleInfo.Sex.UNKNOWN, null));
        Assert.assertEquals(samples.stream().map(SampleInfo::phenotype).collect(Collectors.toList()),
                Arrays.asList(SampleInfo.CONTROL, SampleInfo.CASE, null, null, SampleInfo.CASE, SampleInfo.CONTROL));
        Assert.assertEquals(samples.get(0).sex(), SampleInfo.Sex.MALE);
        Assert.assertEquals(samples.get(1).sex(), SampleInfo.Sex.FEMALE);
    }

    @Test
    public void testReadRaw() {
        final List<SampleInfo> samples = FamCodec.readFam(getTestPath("small.fam"), false);
        Assert.assertEquals(samples.stream().map(SampleInfo::phenotype).collect(Collectors.toList()),
                Arrays.asList("1", "2", "-9", "0", "2", "1"));
    }

    @Test(expectedExceptions = UserException.CorruptFile.class)
    public void testWrongColumnCount() {
        FamCodec.readFam(getTestPath("short.fam"), true);
    }

    @Test
    public void testWriteFam() throws IOException {
        final Path fam = createTempPath("written", ".fam");
        FamCodec.writeFam(fam, Arrays.asList(
                new SampleInfo("F", "I", "0", "0", SampleInfo.Sex.FEMALE, SampleInfo.CASE),
                SampleInfo.fromId("sample2"),
                new SampleInfo("F", "J", "I", "0", SampleInfo.Sex.MALE, "3.5")));
        Assert.assertEquals(Files.readAllLines(fam), Arrays.asList(
                "F I 0 0 2 2",
                "sample2 sample2 0 0 0 -9",
                "F J I 0 1 3.5"));
    }
}
