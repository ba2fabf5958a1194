package org.broadinstitute.genomics.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as unknown alleles, incompatible variants
 * or malformed PLINK files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(final Path path, final Exception e) {
            this(path, getMessage(e), e);
        }

        public CouldNotReadInputFile(final String source) {
            super(String.format("Couldn't read %s", source));
        }

        public CouldNotReadInputFile(final String source, final Exception e) {
            super(String.format("Couldn't read %s. Error was: %s", source, getMessage(e)), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final Path file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotCreateOutputFile(final Path file, final Exception e) {
            super(String.format("Couldn't write file %s because exception %s", file.toAbsolutePath().toUri(), getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message, final Throwable cause) {
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(final String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * An allele string was looked up in a variant's palette without permission to add it.
     */
    public static class UnknownAllele extends UserException {
        private static final long serialVersionUID = 0L;

        public UnknownAllele(final String allele, final Object variant) {
            super(String.format("'%s' is not an allele in %s", allele, variant));
        }
    }

    /**
     * Raised when a palette would grow past its maximum size, or when a genotype lists more alleles than the ploidy.
     */
    public static class TooManyAlleles extends UserException {
        private static final long serialVersionUID = 0L;

        public TooManyAlleles(final String message) {
            super(message);
        }
    }

    public static class InvalidAlleleIndex extends UserException {
        private static final long serialVersionUID = 0L;

        public InvalidAlleleIndex(final int index, final Object variant, final int numAlleles) {
            super(String.format("%d is not a valid allele index for %s, which has %d alleles", index, variant, numAlleles));
        }
    }

    public static class IncompatibleVariant extends UserException {
        private static final long serialVersionUID = 0L;

        public IncompatibleVariant(final String message) {
            super(message);
        }

        public IncompatibleVariant(final Object first, final Object second) {
            super(String.format("Variant %s is not compatible with variant %s", first, second));
        }
    }

    public static class UnsupportedPloidy extends UserException {
        private static final long serialVersionUID = 0L;

        public UnsupportedPloidy(final String operation, final int expected, final int actual) {
            super(String.format("%s requires ploidy %d but the variant has ploidy %d", operation, expected, actual));
        }
    }

    public static class UnsupportedMultiAllelic extends UserException {
        private static final long serialVersionUID = 0L;

        public UnsupportedMultiAllelic(final String operation, final Object variant, final int numAlleles) {
            super(String.format("%s requires a biallelic variant, but %s has %d alleles", operation, variant, numAlleles));
        }
    }

    /**
     * <p/>
     * Class UserException.CorruptFile
     * <p/>
     * For structurally invalid binary or text inputs (bad magic number, truncated record, wrong column count)
     */
    public static class CorruptFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CorruptFile(final String source, final String message) {
            super(String.format("The file %s appears to be corrupt: %s", source, message));
        }

        public CorruptFile(final String source, final String message, final Throwable cause) {
            super(String.format("The file %s appears to be corrupt: %s", source, message), cause);
        }
    }

    public static class IndexOutOfBounds extends UserException {
        private static final long serialVersionUID = 0L;

        public IndexOutOfBounds(final long index, final int length) {
            super(String.format("Index %d is out of bounds for an array of length %d", index, length));
        }
    }
}
