package org.broadinstitute.genomics.arrays;

import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.math3.special.Gamma;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.utils.config.ConfigFactory;
import org.broadinstitute.genomics.variant.Variant;

/**
 * Per-column statistics.  Underpowered or degenerate columns give {@link Double#NaN} rather than an error.
 */
public final class GenotypeStatsUtils {

    private GenotypeStatsUtils() {}

    /**
     * Frequency of the most common alternate allele among all non-missing allele observations.
     *
     * @return NaN when no allele was observed, 0.0 when only the reference was observed
     */
    public static double calculateMaf(final GenotypeArray array) {
        Utils.nonNull(array);
        final int[] counts = new int[array.getVariant().getNumAlleles()];
        long total = 0;
        for (int i = 0; i < array.length(); i++) {
            for (int k = 0; k < array.getPloidy(); k++) {
                final int idx = array.alleleAt(i, k);
                if (idx != Variant.MISSING_IDX) {
                    counts[idx]++;
                    total++;
                }
            }
        }
        if (total == 0) {
            return Double.NaN;
        }
        int maxAlt = 0;
        for (int idx = 1; idx < counts.length; idx++) {
            maxAlt = Math.max(maxAlt, counts[idx]);
        }
        return maxAlt / (double) total;
    }

    public static double calculateHwePval(final GenotypeArray array) {
        return calculateHwePval(array, ConfigFactory.getInstance().getGenomicsConfig().hwe_min_expected_count());
    }

    /**
     * Hardy-Weinberg equilibrium p-value of a diploid column from a Pearson chi-square goodness-of-fit test.
     * <p>
     *     Rows with any missing allele are ignored.  Allele frequencies cover indices 0 through the largest observed
     *     index; every unordered pair (i, j) of them is a category with expected count {@code 2 * fi * fj * N}
     *     (heterozygous) or {@code fi * fi * N} (homozygous), truncated to an integer.  The degrees of freedom are the
     *     number of categories minus one.
     * </p>
     *
     * @return NaN for a non-diploid variant, fewer than 2 called rows, or any expected count below {@code minExpectedCount};
     *         1.0 when only the reference allele is observed
     */
    public static double calculateHwePval(final GenotypeArray array, final int minExpectedCount) {
        Utils.nonNull(array);
        if (array.getPloidy() != 2) {
            return Double.NaN;
        }
        int called = 0;
        int maxIdx = 0;
        for (int i = 0; i < array.length(); i++) {
            if (!array.rowHasMissingAllele(i)) {
                called++;
                maxIdx = Math.max(maxIdx, array.alleleAt(i, 1));
            }
        }
        if (called < 2) {
            return Double.NaN;
        }
        if (maxIdx == 0) {
            return 1.0;
        }

        final int numAlleles = maxIdx + 1;
        final long[] alleleCounts = new long[numAlleles];
        final long[][] observedPairs = new long[numAlleles][numAlleles];
        for (int i = 0; i < array.length(); i++) {
            if (!array.rowHasMissingAllele(i)) {
                final int a1 = array.alleleAt(i, 0);
                final int a2 = array.alleleAt(i, 1);
                alleleCounts[a1]++;
                alleleCounts[a2]++;
                observedPairs[a1][a2]++;
            }
        }
        final double totalAlleles = called * 2.0;
        final double[] freqs = new double[numAlleles];
        for (int a = 0; a < numAlleles; a++) {
            freqs[a] = alleleCounts[a] / totalAlleles;
        }

        final int numCategories = numAlleles * (numAlleles + 1) / 2;
        final long[] expected = new long[numCategories];
        final long[] observed = new long[numCategories];
        int c = 0;
        for (int a1 = 0; a1 < numAlleles; a1++) {
            for (int a2 = a1; a2 < numAlleles; a2++) {
                expected[c] = a1 != a2 ? (long) (freqs[a1] * freqs[a2] * called * 2)
                                       : (long) (freqs[a1] * freqs[a2] * called);
                observed[c] = observedPairs[a1][a2];
                c++;
            }
        }
        for (final long e : expected) {
            if (e < minExpectedCount) {
                return Double.NaN;
            }
        }
        return chiSquareUpperTail(chiSquareStatistic(observed, expected), numCategories - 1);
    }

    @VisibleForTesting
    static double chiSquareStatistic(final long[] observed, final long[] expected) {
        Utils.validateArg(observed.length == expected.length, "observed and expected counts must have the same length");
        double chi = 0;
        for (int i = 0; i < observed.length; i++) {
            final double diff = observed[i] - expected[i];
            chi += diff * diff / expected[i];
        }
        return chi;
    }

    /**
     * P(X >= chi) for a chi-square variable with {@code degreesOfFreedom}, computed directly from the upper regularized
     * gamma function so that tiny p-values are not rounded to zero.
     */
    @VisibleForTesting
    static double chiSquareUpperTail(final double chi, final int degreesOfFreedom) {
        Utils.validateArg(degreesOfFreedom > 0, "degrees of freedom must be positive");
        return Gamma.regularizedGammaQ(degreesOfFreedom / 2.0, chi / 2.0);
    }

    /**
     * @throws UserException.UnsupportedPloidy for a non-diploid variant
     */
    public static GenotypeCounts countGenotypes(final GenotypeArray array) {
        Utils.nonNull(array);
        if (array.getPloidy() != 2) {
            throw new UserException.UnsupportedPloidy("Genotype counts", 2, array.getPloidy());
        }
        int ref = 0;
        int het = 0;
        int hom = 0;
        int missing = 0;
        for (int i = 0; i < array.length(); i++) {
            if (array.rowHasMissingAllele(i)) {
                missing++;
            } else if (array.alleleAt(i, 0) != array.alleleAt(i, 1)) {
                het++;
            } else if (array.alleleAt(i, 0) == 0) {
                ref++;
            } else {
                hom++;
            }
        }
        return new GenotypeCounts(ref, het, hom, missing);
    }
}
