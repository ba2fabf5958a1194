package org.broadinstitute.genomics.arrays;

/**
 * Result of {@link GenotypeArray#factorize()}.
 *
 * @param codes one code per row indexing into {@code uniques}, or {@link #NA_CODE} for a missing row
 * @param uniques distinct non-missing genotypes in order of first appearance
 */
public record Factorization(int[] codes, GenotypeArray uniques) {
    public static final int NA_CODE = -1;
}
