package org.broadinstitute.genomics.arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.utils.param.ParamUtils;
import org.broadinstitute.genomics.variant.Variant;

import java.util.Arrays;

/**
 * Numeric and categorical encodings of a genotype column for association testing.
 * Rows with any missing allele encode as {@link Double#NaN} (or null for categories).
 */
public final class GenotypeEncodingUtils {
    private static final Logger logger = LogManager.getLogger(GenotypeEncodingUtils.class);

    private GenotypeEncodingUtils() {}

    private static void requireBiallelic(final GenotypeArray array, final String operation) {
        final Variant variant = array.getVariant();
        if (!variant.isBiallelic()) {
            throw new UserException.UnsupportedMultiAllelic(operation, variant, variant.getNumAlleles());
        }
    }

    /**
     * @return number of alternate alleles in each row
     */
    public static double[] encodeAdditive(final GenotypeArray array) {
        Utils.nonNull(array);
        requireBiallelic(array, "Additive encoding");
        final double[] result = new double[array.length()];
        for (int i = 0; i < result.length; i++) {
            result[i] = array.rowHasMissingAllele(i) ? Double.NaN : array.rowAltCount(i);
        }
        return result;
    }

    /**
     * @return 1 for rows with any alternate allele, otherwise 0
     */
    public static double[] encodeDominant(final GenotypeArray array) {
        Utils.nonNull(array);
        requireBiallelic(array, "Dominant encoding");
        final double[] result = new double[array.length()];
        for (int i = 0; i < result.length; i++) {
            result[i] = array.rowHasMissingAllele(i) ? Double.NaN : (array.rowAltCount(i) > 0 ? 1.0 : 0.0);
        }
        return result;
    }

    /**
     * @return 1 for rows made only of alternate alleles, otherwise 0
     */
    public static double[] encodeRecessive(final GenotypeArray array) {
        Utils.nonNull(array);
        requireBiallelic(array, "Recessive encoding");
        final double[] result = new double[array.length()];
        for (int i = 0; i < result.length; i++) {
            result[i] = array.rowHasMissingAllele(i) ? Double.NaN : (array.rowAltCount(i) == array.getPloidy() ? 1.0 : 0.0);
        }
        return result;
    }

    public static CodominantCategory[] encodeCodominant(final GenotypeArray array) {
        Utils.nonNull(array);
        if (array.getPloidy() != 2) {
            throw new UserException.UnsupportedPloidy("Codominant encoding", 2, array.getPloidy());
        }
        requireBiallelic(array, "Codominant encoding");
        final CodominantCategory[] result = new CodominantCategory[array.length()];
        for (int i = 0; i < result.length; i++) {
            result[i] = array.rowHasMissingAllele(i) ? null : CodominantCategory.fromAltCount(array.rowAltCount(i));
        }
        return result;
    }

    /**
     * EDGE encoding: homozygous {@code refAllele} is 0, homozygous {@code altAllele} is 1 and the heterozygous pair of
     * the two is {@code alpha}.  Any other call, including calls with other alleles or missing alleles, is NaN.
     *
     * @param alpha heterozygote weight estimated for this variant
     * @param minorAlleleFreq frequency the alpha was estimated at, or NaN when unknown
     * @throws UserException.UnknownAllele if either allele is not in the palette
     */
    public static double[] encodeWeighted(final GenotypeArray array, final double alpha,
                                          final String refAllele, final String altAllele, final double minorAlleleFreq) {
        Utils.nonNull(array);
        Utils.nonNull(refAllele, "refAllele cannot be null");
        Utils.nonNull(altAllele, "altAllele cannot be null");
        if (!Double.isNaN(minorAlleleFreq)) {
            ParamUtils.inRange(minorAlleleFreq, 0.0, 1.0, "minor allele frequency must be between 0 and 1");
        }
        final Variant variant = array.getVariant();
        final int refIdx = variant.getIdxFromAllele(refAllele, false);
        final int altIdx = variant.getIdxFromAllele(altAllele, false);
        if (refIdx == Variant.MISSING_IDX || altIdx == Variant.MISSING_IDX) {
            throw new UserException.BadInput("Weighted encoding requires non-missing ref and alt alleles");
        }
        if (refIdx == altIdx) {
            throw new UserException.BadInput(String.format("The ref and alt alleles are both '%s'", refAllele));
        }
        final int low = Math.min(refIdx, altIdx);
        final int high = Math.max(refIdx, altIdx);
        logger.debug("Weighted encoding of {} with alpha={}, ref={}, alt={}, maf={}", variant.getId(), alpha, refAllele, altAllele, minorAlleleFreq);

        final double[] result = new double[array.length()];
        Arrays.fill(result, Double.NaN);
        for (int i = 0; i < result.length; i++) {
            if (array.rowHasMissingAllele(i)) {
                continue;
            }
            final int first = array.alleleAt(i, 0);
            final int last = array.alleleAt(i, array.getPloidy() - 1);
            if (first == last && first == refIdx) {
                result[i] = 0.0;
            } else if (first == last && first == altIdx) {
                result[i] = 1.0;
            } else if (first == low && last == high && onlyAlleles(array, i, low, high)) {
                result[i] = alpha;
            }
        }
        return result;
    }

    private static boolean onlyAlleles(final GenotypeArray array, final int row, final int a, final int b) {
        for (int k = 0; k < array.getPloidy(); k++) {
            final int idx = array.alleleAt(row, k);
            if (idx != a && idx != b) {
                return false;
            }
        }
        return true;
    }
}
