package org.broadinstitute.genomics.utils;

import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Abstract file writing class for record tables stored in binary format.
 * @param <R> record type.
 */
public abstract class BinaryTableWriter<R> implements AutoCloseable {

    protected final DataOutputStream dataOut;

    private final String path;

    protected BinaryTableWriter(final OutputStream out, final String path) {
        Utils.nonNull(out);
        dataOut = new DataOutputStream(out);
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    protected abstract void writeRecord(final R record, final DataOutput output)
            throws IOException;

    public void write(final R record) throws IOException {
        writeRecord(Utils.nonNull(record), dataOut);
    }

    public void writeAll(final Iterable<? extends R> records) throws IOException {
        for (final R record : Utils.nonNull(records)) {
            write(record);
        }
    }

    @Override
    public void close() throws IOException {
        dataOut.close();
    }
}
