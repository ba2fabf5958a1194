package org.broadinstitute.genomics.variant;

import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One sample's call at a {@link Variant}.
 * <p>
 *     The allele indices are stored sorted ascending, so {@code A/T} and {@code T/A} are the same genotype.
 *     Equality, ordering and hashing use the sorted indices only; the score is ignored.  Genotypes of different
 *     variants are never equal and cannot be ordered.
 * </p>
 * Usually created with the factory methods on {@link Variant}.
 */
public final class Genotype implements Comparable<Genotype> {

    private final Variant variant;
    private final int[] alleleIdxs;
    private final Integer score;

    /**
     * @param variant the site this call belongs to
     * @param alleleIdxs exactly {@code variant.getPloidy()} palette indices or {@link Variant#MISSING_IDX}, in any order
     * @param score genotype quality between 0 and {@link Variant#MAX_SCORE}, or null (255 is read as null)
     */
    public Genotype(final Variant variant, final int[] alleleIdxs, @Nullable final Integer score) {
        this.variant = Utils.nonNull(variant, "variant cannot be null");
        Utils.nonNull(alleleIdxs, "allele indices cannot be null");
        if (alleleIdxs.length > variant.getPloidy()) {
            throw new UserException.TooManyAlleles(String.format("%d alleles were given for %s, which has ploidy %d",
                    alleleIdxs.length, variant, variant.getPloidy()));
        }
        Utils.validateArg(alleleIdxs.length == variant.getPloidy(),
                () -> String.format("expected %d allele indices but got %d", variant.getPloidy(), alleleIdxs.length));
        for (final int idx : alleleIdxs) {
            if (!variant.isValidAlleleIdx(idx)) {
                throw new UserException.InvalidAlleleIndex(idx, variant, variant.getNumAlleles());
            }
        }
        this.alleleIdxs = alleleIdxs.clone();
        Arrays.sort(this.alleleIdxs);
        this.score = Variant.normalizeScore(score);
    }

    public Variant getVariant() {
        return variant;
    }

    /**
     * @return a copy of the sorted allele indices
     */
    public int[] getAlleleIdxs() {
        return alleleIdxs.clone();
    }

    public List<AlleleIndex> getAlleleIndices() {
        final List<AlleleIndex> result = new ArrayList<>(alleleIdxs.length);
        for (final int idx : alleleIdxs) {
            result.add(AlleleIndex.of(idx));
        }
        return Collections.unmodifiableList(result);
    }

    public Integer getScore() {
        return score;
    }

    public List<String> getAlleles() {
        final List<String> result = new ArrayList<>(alleleIdxs.length);
        for (final int idx : alleleIdxs) {
            result.add(variant.getAlleleFromIdx(idx));
        }
        return result;
    }

    /**
     * @return true when every allele is missing
     */
    public boolean isMissing() {
        for (final int idx : alleleIdxs) {
            if (idx != Variant.MISSING_IDX) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true when at least one allele is missing
     */
    public boolean hasMissingAllele() {
        // sorted, so a missing allele is always last
        return alleleIdxs[alleleIdxs.length - 1] == Variant.MISSING_IDX;
    }

    public String toString(final String sep) {
        if (isMissing()) {
            return Variant.MISSING_GENOTYPE;
        }
        return String.join(sep, getAlleles());
    }

    @Override
    public String toString() {
        return toString("/");
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Genotype that = (Genotype) o;
        return variant.equals(that.variant) && Arrays.equals(alleleIdxs, that.alleleIdxs);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(alleleIdxs);
    }

    /**
     * Lexicographic comparison of the sorted allele indices.
     * @throws UserException.IncompatibleVariant if {@code other} belongs to a different variant
     */
    @Override
    public int compareTo(final Genotype other) {
        Utils.nonNull(other);
        if (!variant.equals(other.variant)) {
            throw new UserException.IncompatibleVariant(variant, other.variant);
        }
        return Arrays.compare(alleleIdxs, other.alleleIdxs);
    }
}
