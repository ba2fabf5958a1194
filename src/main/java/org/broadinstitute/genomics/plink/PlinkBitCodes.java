package org.broadinstitute.genomics.plink;

import org.broadinstitute.genomics.exceptions.GenomicsException;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.utils.param.ParamUtils;
import org.broadinstitute.genomics.variant.Variant;

import java.util.Arrays;

/**
 * Packing of diploid biallelic calls into PLINK BED records.
 * <p>
 *     A record holds two bits per sample, four samples per byte.  Sample {@code s} lives in byte {@code s / 4} at bit
 *     shift {@code 2 * (s % 4)}, so the first sample of each byte occupies its lowest two bits.  Read as a number
 *     {@code hi * 2 + lo}, the code is {@link #HOM_REF}, {@link #MISSING}, {@link #HET} or {@link #HOM_ALT}.
 *     Bits past the last sample are ignored when reading and zero when writing.
 * </p>
 */
public final class PlinkBitCodes {

    /** First bytes of every variant-major BED file. */
    static final byte[] MAGIC = {0x6C, 0x1B, 0x01};

    public static final int HOM_REF = 0;
    public static final int MISSING = 1;
    public static final int HET = 2;
    public static final int HOM_ALT = 3;

    private static final int SAMPLES_PER_BYTE = 4;
    private static final byte MISSING_BYTE = (byte) Variant.MISSING_IDX;

    private PlinkBitCodes() {}

    /**
     * @return number of bytes in one variant record, {@code ceil(numSamples / 4)}
     */
    public static int recordLength(final int numSamples) {
        ParamUtils.isPositiveOrZero(numSamples, "the number of samples cannot be negative");
        return (numSamples + SAMPLES_PER_BYTE - 1) / SAMPLES_PER_BYTE;
    }

    public static int codeAt(final byte[] record, final int sample) {
        return (record[sample / SAMPLES_PER_BYTE] >> (2 * (sample % SAMPLES_PER_BYTE))) & 0b11;
    }

    /**
     * @return the code as a two character bit string such as {@code "10"}
     */
    public static String toBitString(final int code) {
        ParamUtils.inRange(code, 0, 3, "PLINK genotype codes are between 0 and 3");
        return "" + ((code >> 1) & 1) + (code & 1);
    }

    /**
     * @return the code of a diploid call given its sorted allele indices
     */
    public static int codeFor(final int allele1, final int allele2) {
        if (allele1 == Variant.MISSING_IDX || allele2 == Variant.MISSING_IDX) {
            return MISSING;
        }
        if (allele1 == 0 && allele2 == 0) {
            return HOM_REF;
        }
        if (allele1 == 0 && allele2 == 1) {
            return HET;
        }
        if (allele1 == 1 && allele2 == 1) {
            return HOM_ALT;
        }
        throw new GenomicsException(String.format("(%d, %d) is not a biallelic diploid genotype", allele1, allele2));
    }

    /**
     * Unpacks one BED record into packed genotype records of a diploid variant, with missing scores.
     *
     * @param record at least {@link #recordLength(int)} bytes
     * @return {@code 3 * numSamples} bytes: two sorted allele indices and a score per sample
     */
    public static byte[] decodeRecord(final byte[] record, final int numSamples) {
        Utils.nonNull(record);
        Utils.validateArg(record.length >= recordLength(numSamples), "the record is too short for the number of samples");
        final byte[] genotypes = new byte[numSamples * 3];
        for (int s = 0; s < numSamples; s++) {
            final int offset = s * 3;
            switch (codeAt(record, s)) {
                case HOM_REF -> {
                    genotypes[offset] = 0;
                    genotypes[offset + 1] = 0;
                }
                case MISSING -> {
                    genotypes[offset] = MISSING_BYTE;
                    genotypes[offset + 1] = MISSING_BYTE;
                }
                case HET -> {
                    genotypes[offset] = 0;
                    genotypes[offset + 1] = 1;
                }
                case HOM_ALT -> {
                    genotypes[offset] = 1;
                    genotypes[offset + 1] = 1;
                }
                default -> throw new GenomicsException.ShouldNeverReachHereException("two bits cannot hold " + codeAt(record, s));
            }
            genotypes[offset + 2] = MISSING_BYTE;
        }
        return genotypes;
    }

    /**
     * Packs the calls of a diploid biallelic variant into one BED record.
     *
     * @param genotypes packed genotype records, 3 bytes per sample
     */
    public static byte[] encodeRecord(final byte[] genotypes) {
        Utils.nonNull(genotypes);
        Utils.validateArg(genotypes.length % 3 == 0, "diploid genotype records are 3 bytes each");
        final int numSamples = genotypes.length / 3;
        final byte[] record = new byte[recordLength(numSamples)];
        for (int s = 0; s < numSamples; s++) {
            final int code = codeFor(genotypes[s * 3] & 0xFF, genotypes[s * 3 + 1] & 0xFF);
            record[s / SAMPLES_PER_BYTE] |= (byte) (code << (2 * (s % SAMPLES_PER_BYTE)));
        }
        return record;
    }

    static void checkMagic(final byte[] header, final String source) {
        if (!Arrays.equals(header, MAGIC)) {
            throw new UserException.CorruptFile(source,
                    String.format("the first 3 bytes were %s instead of 0x6C 0x1B 0x01", toHex(header)));
        }
    }

    private static String toHex(final byte[] bytes) {
        final StringBuilder builder = new StringBuilder();
        for (final byte b : bytes) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(String.format("0x%02X", b & 0xFF));
        }
        return builder.toString();
    }
}
