package org.broadinstitute.genomics.utils;

import org.broadinstitute.genomics.exceptions.UserException;

import java.io.DataInput;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Abstract base class for readers of table with records stored in binary.
 * <p>
 *     The first record is fetched on the first call to {@link #hasNext()} or {@link #next()}, so subclasses may
 *     consume a header from {@link #getDataInput()} in their constructor.
 * </p>
 * @param <R> record type.
 */
public abstract class BinaryTableReader<R> implements AutoCloseable, Iterator<R> {

    private final DataInputStream dtInput;
    private final String source;
    private R next;
    private boolean fetched;

    protected BinaryTableReader(final InputStream in, final String source) {
        Utils.nonNull(in);
        this.dtInput = new DataInputStream(in);
        this.source = source != null ? source : "unknown source";
    }

    protected final DataInput getDataInput() {
        return dtInput;
    }

    public final String getSource() {
        return source;
    }

    private void fetch() {
        if (!fetched) {
            next = readNextRecord();
            fetched = true;
        }
    }

    private R readNextRecord() {
        try {
            return readRecord(dtInput);
        } catch (final EOFException ex) {
            return null;
        } catch (final IOException ex) {
            throw new UserException.CouldNotReadInputFile(source, ex);
        }
    }

    /**
     * Reads the next record.
     * @throws EOFException when there are no more records.
     */
    protected abstract R readRecord(final DataInput input)
        throws IOException;

    @Override
    public final void close() {
        try {
            dtInput.close();
        } catch (final IOException ex) {
            throw new UserException.CouldNotReadInputFile(source, ex);
        }
    }

    @Override
    public final boolean hasNext() {
        fetch();
        return next != null;
    }

    @Override
    public final R next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final R result = next;
        fetched = false;
        next = null;
        return result;
    }
}
