package org.broadinstitute.genomics.arrays;

/**
 * Codominant encoding of a diploid biallelic genotype, ordered {@code REF < HET < HOM}.
 */
public enum CodominantCategory {
    REF("Ref"),
    HET("Het"),
    HOM("Hom");

    private final String label;

    CodominantCategory(final String label) {
        this.label = label;
    }

    /**
     * @param altCount number of alternate alleles in the call, 0 to 2
     */
    public static CodominantCategory fromAltCount(final int altCount) {
        return switch (altCount) {
            case 0 -> REF;
            case 1 -> HET;
            case 2 -> HOM;
            default -> throw new IllegalArgumentException("a diploid genotype has at most 2 alternate alleles, not " + altCount);
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
