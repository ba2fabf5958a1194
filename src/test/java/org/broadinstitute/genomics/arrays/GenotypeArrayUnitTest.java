package org.broadinstitute.genomics.arrays;

import org.broadinstitute.genomics.GenomicsBaseTest;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.variant.Genotype;
import org.broadinstitute.genomics.variant.Variant;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class GenotypeArrayUnitTest extends GenomicsBaseTest {

    private static Variant snp() {
        return new Variant("1", 123456, "rs1", "A", Collections.singletonList("T"));
    }

    private static GenotypeArray fromStrings(final Variant variant, final String... genotypes) {
        return GenotypeArray.fromStrings(variant, Arrays.asList(genotypes));
    }

    @Test
    public void testFromStringsRoundTrip() {
        final GenotypeArray array = fromStrings(snp(), "A/A", "T/A", "T/T", "./.", "A/.", null);
        Assert.assertEquals(array.length(), 6);
        Assert.assertEquals(array.toStrings(),
                Arrays.asList("A/A", "A/T", "T/T", Variant.MISSING_GENOTYPE, "A/.", Variant.MISSING_GENOTYPE));
        Assert.assertEquals(array.isNa(), new boolean[]{false, false, false, true, false, true});
        Assert.assertEquals(array.getColumnType(), "genotype(2n)[1; 123456; rs1; A; T]");
    }

    @Test
    public void testFromStringsAddsAlleles() {
        final Variant variant = snp();
        final GenotypeArray array = GenotypeArray.fromStrings(variant, Arrays.asList("A/G", "C|C"), "/", true);
        Assert.assertEquals(variant.getAlleles(), Arrays.asList("A", "T", "G", "C|C"));
        Assert.assertEquals(array.get(0).getAlleleIdxs(), new int[]{0, 2});
    }

    @Test(expectedExceptions = UserException.UnknownAllele.class)
    public void testFromStringsUnknownAllele() {
        fromStrings(snp(), "A/G");
    }

    @Test
    public void testFromRawRecordsSortsUnsigned() {
        final Variant variant = snp();
        final byte[] records = {(byte) 255, 1, 7, 1, 0, (byte) 255};
        final GenotypeArray array = GenotypeArray.fromRawRecords(variant, records);
        Assert.assertEquals(array.get(0).getAlleleIdxs(), new int[]{1, Variant.MISSING_IDX});
        Assert.assertEquals(array.get(0).getScore(), Integer.valueOf(7));
        Assert.assertEquals(array.get(1).getAlleleIdxs(), new int[]{0, 1});
        Assert.assertNull(array.get(1).getScore());
    }

    @Test(expectedExceptions = UserException.InvalidAlleleIndex.class)
    public void testFromRawRecordsInvalidIndex() {
        GenotypeArray.fromRawRecords(snp(), new byte[]{0, 2, 0});
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testFromRawRecordsPartialRecord() {
        GenotypeArray.fromRawRecords(snp(), new byte[]{0, 0, 0, 0});
    }

    @Test
    public void testFromGenotypes() {
        final Variant variant = snp();
        final List<Genotype> genotypes = Arrays.asList(variant.makeGenotype("A", "T"), null, variant.makeMissingGenotype());
        final GenotypeArray array = GenotypeArray.fromGenotypes(genotypes);
        Assert.assertSame(array.getVariant(), variant);
        Assert.assertEquals(array.toStrings(), Arrays.asList("A/T", Variant.MISSING_GENOTYPE, Variant.MISSING_GENOTYPE));
    }

    @Test(expectedExceptions = UserException.IncompatibleVariant.class)
    public void testFromGenotypesDifferentPosition() {
        final Variant other = new Variant("1", 999, "rs1", "A", Collections.singletonList("T"));
        GenotypeArray.fromGenotypes(snp(), Collections.singletonList(other.makeGenotype("A", "A")));
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testFromGenotypesWithoutVariant() {
        GenotypeArray.fromGenotypes(Arrays.asList(null, null));
    }

    @Test
    public void testMissingAndEmpty() {
        final GenotypeArray missing = GenotypeArray.missing(snp(), 3);
        Assert.assertEquals(missing.isNa(), new boolean[]{true, true, true});
        Assert.assertTrue(GenotypeArray.empty(snp()).isEmpty());
    }

    @Test
    public void testGetAndSet() {
        final Variant variant = snp();
        final GenotypeArray array = fromStrings(variant, "A/A", "A/A");
        array.set(1, variant.makeGenotype(Arrays.asList("T", "T"), 40, false));
        Assert.assertEquals(array.get(1).toString(), "T/T");
        Assert.assertEquals(array.getGenotypeScores()[1], 40.0);
        Assert.assertTrue(Double.isNaN(array.getGenotypeScores()[0]));
        array.set(0, null);
        Assert.assertTrue(array.get(0).isMissing());
    }

    @Test(expectedExceptions = UserException.IncompatibleVariant.class)
    public void testSetOtherVariant() {
        final Variant other = new Variant("2", 5, "rs2", "A", Collections.singletonList("T"));
        fromStrings(snp(), "A/A").set(0, other.makeGenotype("A", "A"));
    }

    @Test(expectedExceptions = UserException.IndexOutOfBounds.class)
    public void testGetOutOfBounds() {
        fromStrings(snp(), "A/A").get(1);
    }

    @Test
    public void testSliceFilterTake() {
        final GenotypeArray array = fromStrings(snp(), "A/A", "A/T", "T/T", "./.", "A/T");
        Assert.assertEquals(array.slice(1, 3).toStrings(), Arrays.asList("A/T", "T/T"));
        Assert.assertEquals(array.slice(0, 5, 2).toStrings(), Arrays.asList("A/A", "T/T", "A/T"));
        Assert.assertEquals(array.slice(2, 2).length(), 0);
        Assert.assertEquals(array.filter(new boolean[]{true, false, false, true, false}).toStrings(),
                Arrays.asList("A/A", Variant.MISSING_GENOTYPE));
        Assert.assertEquals(array.take(new int[]{4, 0, 0}).toStrings(), Arrays.asList("A/T", "A/A", "A/A"));

        final Genotype fill = array.getVariant().makeGenotype("T", "T");
        Assert.assertEquals(array.take(new int[]{-1, 1}, true, fill).toStrings(), Arrays.asList("T/T", "A/T"));
        Assert.assertEquals(array.take(new int[]{-1}, true, null).toStrings(), Collections.singletonList(Variant.MISSING_GENOTYPE));
        Assert.assertSame(array.slice(0, 1).getVariant(), array.getVariant());
    }

    @Test(expectedExceptions = UserException.IndexOutOfBounds.class)
    public void testTakeWithoutFill() {
        fromStrings(snp(), "A/A").take(new int[]{-1});
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testFilterWrongLength() {
        fromStrings(snp(), "A/A").filter(new boolean[]{true, true});
    }

    @Test
    public void testConcat() {
        final Variant variant = snp();
        final GenotypeArray first = fromStrings(variant, "A/A", "A/T");
        final GenotypeArray second = fromStrings(variant, "T/T");
        final GenotypeArray concat = GenotypeArray.concat(Arrays.asList(first, second, GenotypeArray.empty(variant)));
        Assert.assertEquals(concat.toStrings(), Arrays.asList("A/A", "A/T", "T/T"));
    }

    @Test(expectedExceptions = UserException.IncompatibleVariant.class)
    public void testConcatDifferentVariants() {
        GenotypeArray.concat(Arrays.asList(fromStrings(snp(), "A/A"),
                fromStrings(new Variant("1", 1, "rs9", "A", Collections.singletonList("T")), "A/A")));
    }

    @Test
    public void testCopyIsIndependent() {
        final GenotypeArray array = fromStrings(snp(), "A/A", "A/T");
        final GenotypeArray copy = array.copy();
        Assert.assertEquals(copy, array);
        Assert.assertNotSame(copy.getVariant(), array.getVariant());
        copy.set(0, null);
        Assert.assertEquals(array.get(0).toString(), "A/A");
        Assert.assertNotEquals(copy, array);
        Assert.assertEquals(GenotypeArray.fromGenotypeArray(array, array.getVariant()), array);
    }

    @Test
    public void testFactorize() {
        final GenotypeArray array = fromStrings(snp(), "A/T", "A/A", "T/A", null, "T/T", "A/A");
        final Factorization factorization = array.factorize();
        Assert.assertEquals(factorization.codes(), new int[]{0, 1, 0, Factorization.NA_CODE, 2, 1});
        Assert.assertEquals(factorization.uniques().toStrings(), Arrays.asList("A/T", "A/A", "T/T"));
        Assert.assertEquals(array.unique().length(), 3);
    }

    @Test
    public void testValueCounts() {
        final GenotypeArray array = fromStrings(snp(), "A/T", "A/A", "T/A", null, "T/T", "A/A");
        final Map<Genotype, Integer> counts = array.valueCounts();
        Assert.assertEquals(counts.keySet().stream().map(Genotype::toString).collect(Collectors.toList()),
                Arrays.asList("A/A", "A/T", "T/T"));
        Assert.assertEquals(new ArrayList<>(counts.values()), Arrays.asList(2, 2, 1));

        final Map<Genotype, Integer> withNa = array.valueCounts(false);
        Assert.assertEquals(withNa.size(), 4);
        Assert.assertEquals(withNa.get(array.getVariant().makeMissingGenotype()), Integer.valueOf(1));
    }

    @Test
    public void testSetReference() {
        final Variant variant = snp();
        final GenotypeArray array = fromStrings(variant, "A/A", "A/T", "T/T", "A/.");
        final GenotypeArray view = array.slice(0, 4);
        array.setReference("T");

        Assert.assertEquals(array.getVariant().getAlleles(), Arrays.asList("T", "A"));
        Assert.assertEquals(array.toStrings(), Arrays.asList("A/A", "T/A", "T/T", "A/."));
        Assert.assertEquals(array.get(3).getAlleleIdxs(), new int[]{1, Variant.MISSING_IDX});
        assertEqualsDoubleArray(array.encodeAdditive(), new double[]{2, 1, 0, Double.NaN}, 0);

        // the original variant and arrays sharing it are untouched
        Assert.assertEquals(variant.getAlleles(), Arrays.asList("A", "T"));
        Assert.assertSame(view.getVariant(), variant);
        Assert.assertEquals(view.toStrings(), Arrays.asList("A/A", "A/T", "T/T", "A/."));
    }

    @Test
    public void testSetReferenceIsIdempotentRelabeling() {
        final Variant variant = new Variant("1", 10, "tri", "A", Arrays.asList("C", "T"));
        final GenotypeArray original = fromStrings(variant, "A/A", "A/C", "A/T", "C/T", "T/T", "T/.", "./.", "C/C");
        final GenotypeArray array = original.copy();
        final int newRef = 2;

        array.setReference("T");
        final GenotypeArray afterFirst = array.copy();
        array.setReference("T");
        Assert.assertEquals(array, afterFirst);
        Assert.assertEquals(array.getVariant().getAlleles(), Arrays.asList("T", "C", "A"));

        for (int i = 0; i < original.length(); i++) {
            final int[] expected = Arrays.stream(original.get(i).getAlleleIdxs())
                    .map(idx -> idx == 0 ? newRef : (idx == newRef ? 0 : idx))
                    .sorted()
                    .toArray();
            Assert.assertEquals(array.get(i).getAlleleIdxs(), expected, "row " + i);
        }
        Assert.assertEquals(array.toStrings(),
                Arrays.asList("A/A", "C/A", "T/A", "T/C", "T/T", "T/.", Variant.MISSING_GENOTYPE, "C/C"));
    }

    @Test
    public void testSetReferenceToCurrentReference() {
        final Variant variant = snp();
        final GenotypeArray array = fromStrings(variant, "A/T");
        array.setReference(0);
        Assert.assertSame(array.getVariant(), variant);
    }

    @Test(expectedExceptions = UserException.InvalidAlleleIndex.class)
    public void testSetReferenceInvalidIndex() {
        fromStrings(snp(), "A/T").setReference(2);
    }

    @Test
    public void testZygosity() {
        final Variant variant = new Variant("1", 1, "tri", "A", Arrays.asList("C", "G"));
        final GenotypeArray array = fromStrings(variant, "A/A", "A/C", "C/C", "C/G", "G/.", "./.");
        Assert.assertEquals(array.isHomozygous(), new boolean[]{true, false, true, false, false, false});
        Assert.assertEquals(array.isHeterozygous(), new boolean[]{false, true, false, true, false, false});
        Assert.assertEquals(array.isHomozygousRef(), new boolean[]{true, false, false, false, false, false});
        Assert.assertEquals(array.isHomozygousAlt(), new boolean[]{false, false, true, false, false, false});
    }

    @Test
    public void testIterationAndEquality() {
        final GenotypeArray array = fromStrings(snp(), "A/A", "A/T");
        final List<String> iterated = new ArrayList<>();
        for (final Genotype genotype : array) {
            iterated.add(genotype.toString());
        }
        Assert.assertEquals(iterated, array.toStrings());
        Assert.assertEquals(array.stream().count(), 2);
        Assert.assertEquals(array.hashCode(), array.copy().hashCode());
        Assert.assertEquals(array.getGenotypeCounts().getHets(), 1);
    }
}
