package org.broadinstitute.genomics.plink;

import org.broadinstitute.genomics.arrays.GenotypeArray;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.BinaryTableWriter;
import org.broadinstitute.genomics.variant.Variant;

import java.io.DataOutput;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes variant-major BED files: the magic number, then one record per {@link GenotypeArray}.
 * Every column must have the same number of samples and a diploid biallelic variant.
 */
public final class BedFileWriter extends BinaryTableWriter<GenotypeArray> {

    private final int numSamples;

    public BedFileWriter(final OutputStream out, final String path, final int numSamples) throws IOException {
        super(out, path);
        this.numSamples = numSamples;
        dataOut.write(PlinkBitCodes.MAGIC);
    }

    @Override
    protected void writeRecord(final GenotypeArray array, final DataOutput output) throws IOException {
        final Variant variant = array.getVariant();
        if (!variant.isBiallelic()) {
            throw new UserException.UnsupportedMultiAllelic("Writing a .bed file", variant, variant.getNumAlleles());
        }
        if (variant.getPloidy() != 2) {
            throw new UserException.UnsupportedPloidy("Writing a .bed file", 2, variant.getPloidy());
        }
        if (array.length() != numSamples) {
            throw new UserException.BadInput(String.format("%s has %d genotypes but %s has %d samples",
                    variant.getId(), array.length(), getPath(), numSamples));
        }
        output.write(PlinkBitCodes.encodeRecord(array.getRecords()));
    }
}
