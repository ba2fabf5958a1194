package org.broadinstitute.genomics.plink;

import org.broadinstitute.genomics.arrays.GenotypeArray;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.BinaryTableReader;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.variant.Variant;

import java.io.DataInput;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Streams the variant records of a BED file, one {@link GenotypeArray} per variant, in BIM order.
 * The magic number is checked on construction.
 */
public final class BedFileReader extends BinaryTableReader<GenotypeArray> {

    private final List<Variant> variants;
    private final int numSamples;
    private final byte[] buffer;
    private int variantIdx;

    public BedFileReader(final InputStream in, final String source, final List<Variant> variants, final int numSamples) {
        super(in, source);
        this.variants = new ArrayList<>(Utils.nonNull(variants));
        this.numSamples = numSamples;
        this.buffer = new byte[PlinkBitCodes.recordLength(numSamples)];
        final byte[] header = new byte[PlinkBitCodes.MAGIC.length];
        try {
            getDataInput().readFully(header);
        } catch (final EOFException e) {
            throw new UserException.CorruptFile(source, "the file is shorter than its 3 byte header", e);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(source);
        }
        PlinkBitCodes.checkMagic(header, source);
    }

    @Override
    protected GenotypeArray readRecord(final DataInput input) throws IOException {
        if (variantIdx >= variants.size()) {
            throw new EOFException("all variants have been read");
        }
        final Variant variant = variants.get(variantIdx);
        try {
            input.readFully(buffer);
        } catch (final EOFException e) {
            throw new UserException.CorruptFile(getSource(),
                    String.format("expected %d variant records of %d bytes but the file ends in record %d (%s)",
                            variants.size(), buffer.length, variantIdx, variant.getId()), e);
        }
        variantIdx++;
        final byte[] genotypes = PlinkBitCodes.decodeRecord(buffer, numSamples);
        if (variant.getNumAlleles() < 2) {
            for (int s = 0; s < numSamples; s++) {
                final int code = PlinkBitCodes.codeAt(buffer, s);
                if (code == PlinkBitCodes.HET || code == PlinkBitCodes.HOM_ALT) {
                    throw new UserException.CorruptFile(getSource(),
                            String.format("sample %d of %s has an alternate allele but the .bim file lists none", s, variant.getId()));
                }
            }
        }
        return GenotypeArray.fromRawRecords(variant, genotypes);
    }

    /**
     * @return number of variant records returned so far
     */
    public int getNumRead() {
        return variantIdx;
    }
}
