package org.broadinstitute.genomics.arrays;

/**
 * Diploid genotype counts of a column.  Rows with any missing allele are counted only as missing.
 */
public final class GenotypeCounts {

    private final int ref;
    private final int het;
    private final int hom;
    private final int missing;

    public GenotypeCounts(final int ref, final int het, final int hom, final int missing) {
        this.ref = ref;
        this.het = het;
        this.hom = hom;
        this.missing = missing;
    }

    public int getRefs() {
        return ref;
    }

    public int getHets() {
        return het;
    }

    /** Homozygous alternate calls. */
    public int getHoms() {
        return hom;
    }

    public int getMissing() {
        return missing;
    }

    public int getCalled() {
        return ref + het + hom;
    }

    @Override
    public String toString() {
        return String.format("GenotypeCounts{ref=%d, het=%d, hom=%d, missing=%d}", ref, het, hom, missing);
    }
}
