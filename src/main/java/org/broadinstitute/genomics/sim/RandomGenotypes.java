package org.broadinstitute.genomics.sim;

import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.broadinstitute.genomics.arrays.GenotypeArray;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.utils.config.ConfigFactory;
import org.broadinstitute.genomics.utils.param.ParamUtils;
import org.broadinstitute.genomics.variant.Variant;

import java.util.stream.IntStream;

/**
 * Simulates genotypes by drawing every allele independently from given allele frequencies.
 */
public final class RandomGenotypes {

    private static final double FREQUENCY_SUM_TOLERANCE = 1e-6;

    private RandomGenotypes() {}

    public static GenotypeArray generate(final Variant variant, final double[] alleleFreqs, final int n) {
        return generate(variant, alleleFreqs, n, ConfigFactory.getInstance().getGenomicsConfig().random_genotype_seed());
    }

    /**
     * @param alleleFreqs one frequency per allele of {@code variant}, in palette order, summing to 1
     * @param n number of genotypes
     * @return {@code n} genotypes without missing alleles or scores; the same seed gives the same array
     */
    public static GenotypeArray generate(final Variant variant, final double[] alleleFreqs, final int n, final long seed) {
        Utils.nonNull(variant);
        Utils.nonNull(alleleFreqs);
        ParamUtils.isPositiveOrZero(n, "the number of genotypes cannot be negative");
        if (alleleFreqs.length != variant.getNumAlleles()) {
            throw new UserException.BadInput(String.format(
                    "The number of provided frequencies (%d) doesn't match the number of alleles in the variant (%d)",
                    alleleFreqs.length, variant.getNumAlleles()));
        }
        double sum = 0;
        for (final double freq : alleleFreqs) {
            if (!(freq >= 0)) {
                throw new UserException.BadInput(String.format("Allele frequencies cannot be negative or NaN: %s", freq));
            }
            sum += freq;
        }
        if (Math.abs(sum - 1.0) > FREQUENCY_SUM_TOLERANCE) {
            throw new UserException.BadInput(String.format("The provided frequencies must add up to 1.0 (sum was %.3f)", sum));
        }

        final RandomGenerator rng = new Well19937c(seed);
        final EnumeratedIntegerDistribution distribution = new EnumeratedIntegerDistribution(rng,
                IntStream.range(0, alleleFreqs.length).toArray(), alleleFreqs.clone());

        final int ploidy = variant.getPloidy();
        final int stride = ploidy + 1;
        final byte[] records = new byte[n * stride];
        for (int i = 0; i < n; i++) {
            for (int p = 0; p < ploidy; p++) {
                records[i * stride + p] = (byte) distribution.sample();
            }
            records[i * stride + ploidy] = (byte) Variant.MISSING_IDX;
        }
        return GenotypeArray.fromRawRecords(variant, records);
    }
}
