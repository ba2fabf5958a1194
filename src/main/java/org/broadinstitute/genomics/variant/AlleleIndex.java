package org.broadinstitute.genomics.variant;

import org.broadinstitute.genomics.utils.Utils;

/**
 * An index into a {@link Variant}'s allele palette, or the missing allele.
 * <p>
 *     On disk and in packed records the missing allele is the byte {@link Variant#MISSING_IDX}; this type keeps
 *     callers from comparing against that sentinel directly.
 * </p>
 */
public record AlleleIndex(int value) implements Comparable<AlleleIndex> {

    public static final AlleleIndex MISSING = new AlleleIndex(Variant.MISSING_IDX);

    private static final AlleleIndex[] CACHE = new AlleleIndex[Variant.MISSING_IDX + 1];
    static {
        for (int i = 0; i < Variant.MISSING_IDX; i++) {
            CACHE[i] = new AlleleIndex(i);
        }
        CACHE[Variant.MISSING_IDX] = MISSING;
    }

    public AlleleIndex {
        Utils.validateArg(value >= 0 && value <= Variant.MISSING_IDX,
                () -> "allele index must be between 0 and " + Variant.MISSING_IDX + " but was " + value);
    }

    /**
     * @param value a palette index or {@link Variant#MISSING_IDX}
     */
    public static AlleleIndex of(final int value) {
        Utils.validateArg(value >= 0 && value <= Variant.MISSING_IDX,
                () -> "allele index must be between 0 and " + Variant.MISSING_IDX + " but was " + value);
        return CACHE[value];
    }

    /**
     * Reads an unsigned packed allele byte.
     */
    public static AlleleIndex fromByte(final byte b) {
        return CACHE[b & 0xFF];
    }

    public boolean isMissing() {
        return value == Variant.MISSING_IDX;
    }

    public boolean isReference() {
        return value == 0;
    }

    /**
     * @return the palette index
     * @throws IllegalStateException if this is the missing allele
     */
    public int getIndex() {
        Utils.validate(!isMissing(), "the missing allele has no palette index");
        return value;
    }

    public byte toByte() {
        return (byte) value;
    }

    @Override
    public int compareTo(final AlleleIndex other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return isMissing() ? "." : Integer.toString(value);
    }
}
