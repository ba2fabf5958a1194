package org.broadinstitute.genomics.arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.utils.config.ConfigFactory;
import org.broadinstitute.genomics.variant.Genotype;
import org.broadinstitute.genomics.variant.GenotypeColumnType;
import org.broadinstitute.genomics.variant.Variant;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.TreeMap;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A column of genotype calls for many samples at one {@link Variant}.
 * <p>
 *     Calls are packed into a single byte array of fixed-size records: {@code ploidy} allele bytes followed by one
 *     score byte.  Allele bytes are palette indices or {@link Variant#MISSING_IDX}, kept sorted ascending within each
 *     record; a score byte of {@link Variant#MISSING_IDX} means no score.  The number of rows is fixed when the
 *     array is built.
 * </p>
 * <p>
 *     Arrays derived from this one (slices, masks, takes) share its variant.  {@link #setReference(int)} never
 *     modifies the shared variant: the array switches to a reordered copy of it.
 * </p>
 */
public final class GenotypeArray implements Iterable<Genotype> {
    private static final Logger logger = LogManager.getLogger(GenotypeArray.class);

    private static final byte MISSING_BYTE = (byte) Variant.MISSING_IDX;

    private Variant variant;
    private final byte[] records;
    private final int stride;
    private final int length;

    private GenotypeArray(final Variant variant, final byte[] records) {
        this.variant = variant;
        this.records = records;
        this.stride = variant.getPloidy() + 1;
        this.length = records.length / stride;
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Builders

    public static GenotypeArray empty(final Variant variant) {
        return new GenotypeArray(Utils.nonNull(variant), new byte[0]);
    }

    /**
     * @return an array of {@code length} fully missing calls
     */
    public static GenotypeArray missing(final Variant variant, final int length) {
        Utils.nonNull(variant);
        Utils.validateArg(length >= 0, "length cannot be negative");
        final byte[] records = new byte[length * (variant.getPloidy() + 1)];
        Arrays.fill(records, MISSING_BYTE);
        return new GenotypeArray(variant, records);
    }

    /**
     * Wraps packed records without copying them.  Each record is validated against the variant and its alleles are
     * sorted in place.
     *
     * @param records {@code ploidy + 1} bytes per row
     */
    public static GenotypeArray fromRawRecords(final Variant variant, final byte[] records) {
        Utils.nonNull(variant, "variant cannot be null");
        Utils.nonNull(records, "records cannot be null");
        final int stride = variant.getPloidy() + 1;
        if (records.length % stride != 0) {
            throw new UserException.BadInput(String.format("%d bytes is not a whole number of %d byte records", records.length, stride));
        }
        for (int offset = 0; offset < records.length; offset += stride) {
            for (int k = 0; k < stride - 1; k++) {
                final int idx = records[offset + k] & 0xFF;
                if (!variant.isValidAlleleIdx(idx)) {
                    throw new UserException.InvalidAlleleIndex(idx, variant, variant.getNumAlleles());
                }
            }
            sortUnsigned(records, offset, stride - 1);
        }
        return new GenotypeArray(variant, records);
    }

    /**
     * Copies another array's records.
     *
     * @param variant expected variant of {@code array}, or null to accept any
     */
    public static GenotypeArray fromGenotypeArray(final GenotypeArray array, @Nullable final Variant variant) {
        Utils.nonNull(array);
        if (variant != null && !variant.equals(array.variant)) {
            throw new UserException.IncompatibleVariant(variant, array.variant);
        }
        return new GenotypeArray(array.variant, array.records.clone());
    }

    /**
     * Builds an array using the variant of the first genotype.
     */
    public static GenotypeArray fromGenotypes(final List<Genotype> genotypes) {
        Utils.nonNull(genotypes);
        final Genotype first = genotypes.stream().filter(Objects::nonNull).findFirst()
                .orElseThrow(() -> new UserException.BadInput("A variant is required to build an array without any genotypes"));
        return fromGenotypes(first.getVariant(), genotypes);
    }

    /**
     * Builds an array of {@code variant} from genotypes.  Null entries become missing calls.
     *
     * @throws UserException.IncompatibleVariant if a genotype's variant is at a different position or has a different score
     */
    public static GenotypeArray fromGenotypes(final Variant variant, final List<Genotype> genotypes) {
        Utils.nonNull(variant, "variant cannot be null");
        Utils.nonNull(genotypes, "genotypes cannot be null");
        final GenotypeArray result = missing(variant, genotypes.size());
        for (int i = 0; i < genotypes.size(); i++) {
            final Genotype genotype = genotypes.get(i);
            if (genotype == null) {
                continue;
            }
            final Variant other = genotype.getVariant();
            if (other != variant && (!variant.isSamePosition(other) || !Objects.equals(variant.getScore(), other.getScore()))) {
                throw new UserException.IncompatibleVariant(variant, other);
            }
            final int[] idxs = genotype.getAlleleIdxs();
            for (final int idx : idxs) {
                if (!variant.isValidAlleleIdx(idx)) {
                    throw new UserException.InvalidAlleleIndex(idx, variant, variant.getNumAlleles());
                }
            }
            result.writeRow(i, idxs, genotype.getScore());
        }
        return result;
    }

    public static GenotypeArray fromStrings(final Variant variant, final List<String> genotypes) {
        return fromStrings(variant, genotypes, ConfigFactory.getInstance().getGenomicsConfig().genotype_allele_separator(), false);
    }

    /**
     * Parses genotype strings such as {@code A/T}; null entries become missing calls.
     *
     * @param add whether unknown alleles are appended to the variant's palette
     */
    public static GenotypeArray fromStrings(final Variant variant, final List<String> genotypes, final String sep, final boolean add) {
        Utils.nonNull(variant, "variant cannot be null");
        Utils.nonNull(genotypes, "genotypes cannot be null");
        final GenotypeArray result = missing(variant, genotypes.size());
        for (int i = 0; i < genotypes.size(); i++) {
            final String genotype = genotypes.get(i);
            if (genotype != null) {
                final Genotype parsed = variant.makeGenotypeFromStr(genotype, sep, add);
                result.writeRow(i, parsed.getAlleleIdxs(), parsed.getScore());
            }
        }
        return result;
    }

    /**
     * Concatenates arrays of the same variant.
     *
     * @throws UserException.IncompatibleVariant unless every array's variant is equal to the first one's
     */
    public static GenotypeArray concat(final List<GenotypeArray> arrays) {
        Utils.nonNull(arrays);
        Utils.validateArg(!arrays.isEmpty(), "at least one array is required");
        final Variant first = arrays.get(0).variant;
        int total = 0;
        for (final GenotypeArray array : arrays) {
            if (!first.equals(array.variant)) {
                throw new UserException.IncompatibleVariant(first, array.variant);
            }
            total += array.records.length;
        }
        final byte[] records = new byte[total];
        int offset = 0;
        for (final GenotypeArray array : arrays) {
            System.arraycopy(array.records, 0, records, offset, array.records.length);
            offset += array.records.length;
        }
        return new GenotypeArray(first, records);
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Record access

    private static void sortUnsigned(final byte[] records, final int offset, final int count) {
        // insertion sort on unsigned values: the ploidy is tiny
        for (int i = offset + 1; i < offset + count; i++) {
            final byte value = records[i];
            int j = i - 1;
            while (j >= offset && (records[j] & 0xFF) > (value & 0xFF)) {
                records[j + 1] = records[j];
                j--;
            }
            records[j + 1] = value;
        }
    }

    private void writeRow(final int row, final int[] sortedIdxs, @Nullable final Integer score) {
        final int offset = row * stride;
        for (int k = 0; k < sortedIdxs.length; k++) {
            records[offset + k] = (byte) sortedIdxs[k];
        }
        records[offset + stride - 1] = score == null ? MISSING_BYTE : (byte) score.intValue();
    }

    /**
     * @return the allele index at position {@code k} of row {@code row}
     */
    int alleleAt(final int row, final int k) {
        return records[row * stride + k] & 0xFF;
    }

    int scoreAt(final int row) {
        return records[row * stride + stride - 1] & 0xFF;
    }

    boolean rowHasMissingAllele(final int row) {
        // alleles are sorted so a missing allele is always last
        return alleleAt(row, stride - 2) == Variant.MISSING_IDX;
    }

    boolean rowIsMissing(final int row) {
        return alleleAt(row, 0) == Variant.MISSING_IDX;
    }

    int rowAltCount(final int row) {
        int count = 0;
        for (int k = 0; k < stride - 1; k++) {
            if (alleleAt(row, k) != 0) {
                count++;
            }
        }
        return count;
    }

    private void checkIndex(final long i) {
        if (i < 0 || i >= length) {
            throw new UserException.IndexOutOfBounds(i, length);
        }
    }

    public Variant getVariant() {
        return variant;
    }

    public int getPloidy() {
        return variant.getPloidy();
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * @return a copy of the packed records
     */
    public byte[] getRecords() {
        return records.clone();
    }

    public Genotype get(final int i) {
        checkIndex(i);
        final int[] idxs = new int[stride - 1];
        for (int k = 0; k < idxs.length; k++) {
            idxs[k] = alleleAt(i, k);
        }
        return new Genotype(variant, idxs, scoreAt(i));
    }

    /**
     * Replaces row {@code i}; a null genotype stores a missing call.
     *
     * @throws UserException.IncompatibleVariant if the genotype belongs to a different variant
     */
    public void set(final int i, @Nullable final Genotype genotype) {
        checkIndex(i);
        if (genotype == null) {
            final int offset = i * stride;
            Arrays.fill(records, offset, offset + stride, MISSING_BYTE);
            return;
        }
        if (!variant.equals(genotype.getVariant())) {
            throw new UserException.IncompatibleVariant(variant, genotype.getVariant());
        }
        writeRow(i, genotype.getAlleleIdxs(), genotype.getScore());
    }

    public GenotypeArray slice(final int start, final int stop) {
        return slice(start, stop, 1);
    }

    /**
     * Rows {@code start, start + step, ...} below {@code stop}.
     */
    public GenotypeArray slice(final int start, final int stop, final int step) {
        Utils.validateArg(step > 0, "step must be positive");
        if (start < 0 || start > length) {
            throw new UserException.IndexOutOfBounds(start, length);
        }
        if (stop < start || stop > length) {
            throw new UserException.IndexOutOfBounds(stop, length);
        }
        final int n = (stop - start + step - 1) / step;
        final byte[] result = new byte[n * stride];
        for (int j = 0; j < n; j++) {
            System.arraycopy(records, (start + j * step) * stride, result, j * stride, stride);
        }
        return new GenotypeArray(variant, result);
    }

    /**
     * @param mask one entry per row, rows with {@code true} are kept
     */
    public GenotypeArray filter(final boolean[] mask) {
        Utils.nonNull(mask);
        if (mask.length != length) {
            throw new UserException.BadInput(String.format("The mask has %d entries but the array has %d rows", mask.length, length));
        }
        int n = 0;
        for (final boolean keep : mask) {
            if (keep) {
                n++;
            }
        }
        final byte[] result = new byte[n * stride];
        int j = 0;
        for (int i = 0; i < length; i++) {
            if (mask[i]) {
                System.arraycopy(records, i * stride, result, j * stride, stride);
                j++;
            }
        }
        return new GenotypeArray(variant, result);
    }

    public GenotypeArray take(final int[] indices) {
        return take(indices, false, null);
    }

    /**
     * Gathers rows by index.
     *
     * @param allowFill when true, an index of -1 produces {@code fill}
     * @param fill genotype used for -1 indices, a missing call when null
     */
    public GenotypeArray take(final int[] indices, final boolean allowFill, @Nullable final Genotype fill) {
        Utils.nonNull(indices);
        if (fill != null && !variant.equals(fill.getVariant())) {
            throw new UserException.IncompatibleVariant(variant, fill.getVariant());
        }
        final GenotypeArray result = missing(variant, indices.length);
        for (int j = 0; j < indices.length; j++) {
            final int i = indices[j];
            if (allowFill && i == -1) {
                if (fill != null) {
                    result.writeRow(j, fill.getAlleleIdxs(), fill.getScore());
                }
            } else {
                checkIndex(i);
                System.arraycopy(records, i * stride, result.records, j * stride, stride);
            }
        }
        return result;
    }

    /**
     * @return a deep copy with its own records and its own copy of the variant
     */
    public GenotypeArray copy() {
        return new GenotypeArray(variant.copy(), records.clone());
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Missing values and grouping

    /**
     * @return per row, true when every allele is missing
     */
    public boolean[] isNa() {
        final boolean[] result = new boolean[length];
        for (int i = 0; i < length; i++) {
            result[i] = rowIsMissing(i);
        }
        return result;
    }

    /**
     * Groups rows by allele pattern (scores are ignored) in order of first appearance.
     * Missing rows get {@link Factorization#NA_CODE} and are left out of the uniques.
     */
    public Factorization factorize() {
        final int[] codes = new int[length];
        final Map<AlleleKey, Integer> seen = new LinkedHashMap<>();
        final List<Integer> firstRows = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            if (rowIsMissing(i)) {
                codes[i] = Factorization.NA_CODE;
                continue;
            }
            final AlleleKey key = alleleKey(i);
            Integer code = seen.get(key);
            if (code == null) {
                code = seen.size();
                seen.put(key, code);
                firstRows.add(i);
            }
            codes[i] = code;
        }
        return new Factorization(codes, take(firstRows.stream().mapToInt(Integer::intValue).toArray()));
    }

    /**
     * @return distinct non-missing genotypes in order of first appearance
     */
    public GenotypeArray unique() {
        return factorize().uniques();
    }

    public Map<Genotype, Integer> valueCounts() {
        return valueCounts(true);
    }

    /**
     * Counts rows per allele pattern, in ascending genotype order (a fully missing call sorts last).
     *
     * @param dropNa whether missing calls are left out
     */
    public Map<Genotype, Integer> valueCounts(final boolean dropNa) {
        final TreeMap<AlleleKey, int[]> counts = new TreeMap<>();
        for (int i = 0; i < length; i++) {
            if (dropNa && rowIsMissing(i)) {
                continue;
            }
            counts.computeIfAbsent(alleleKey(i), k -> new int[1])[0]++;
        }
        final Map<Genotype, Integer> result = new LinkedHashMap<>();
        for (final Map.Entry<AlleleKey, int[]> entry : counts.entrySet()) {
            result.put(new Genotype(variant, entry.getKey().idxs, null), entry.getValue()[0]);
        }
        return result;
    }

    private AlleleKey alleleKey(final int row) {
        final int[] idxs = new int[stride - 1];
        for (int k = 0; k < idxs.length; k++) {
            idxs[k] = alleleAt(row, k);
        }
        return new AlleleKey(idxs);
    }

    private static final class AlleleKey implements Comparable<AlleleKey> {
        private final int[] idxs;

        private AlleleKey(final int[] idxs) {
            this.idxs = idxs;
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof AlleleKey && Arrays.equals(idxs, ((AlleleKey) o).idxs);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(idxs);
        }

        @Override
        public int compareTo(final AlleleKey other) {
            return Arrays.compare(idxs, other.idxs);
        }
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Reference allele

    public void setReference(final String allele) {
        Utils.nonNull(allele);
        setReference(variant.getIdxFromAllele(allele, false));
    }

    /**
     * Makes the allele at {@code alleleIdx} the reference: that index and 0 swap places in every record and in the
     * palette.  Nothing changes when the allele already is the reference.
     *
     * @throws UserException.InvalidAlleleIndex if {@code alleleIdx} is not a palette index
     */
    public void setReference(final int alleleIdx) {
        if (alleleIdx == Variant.MISSING_IDX || !variant.isValidAlleleIdx(alleleIdx)) {
            throw new UserException.InvalidAlleleIndex(alleleIdx, variant, variant.getNumAlleles());
        }
        if (alleleIdx == 0) {
            return;
        }
        final Variant swapped = variant.copyWithReference(alleleIdx);
        final byte newRef = (byte) alleleIdx;
        for (int offset = 0; offset < records.length; offset += stride) {
            for (int k = 0; k < stride - 1; k++) {
                if (records[offset + k] == 0) {
                    records[offset + k] = newRef;
                } else if (records[offset + k] == newRef) {
                    records[offset + k] = 0;
                }
            }
            sortUnsigned(records, offset, stride - 1);
        }
        logger.debug("Set the reference allele of {} to {}", swapped.getId(), swapped.getRef());
        variant = swapped;
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Encodings

    public double[] encodeAdditive() {
        return GenotypeEncodingUtils.encodeAdditive(this);
    }

    public double[] encodeDominant() {
        return GenotypeEncodingUtils.encodeDominant(this);
    }

    public double[] encodeRecessive() {
        return GenotypeEncodingUtils.encodeRecessive(this);
    }

    public CodominantCategory[] encodeCodominant() {
        return GenotypeEncodingUtils.encodeCodominant(this);
    }

    public double[] encodeWeighted(final double alpha, final String refAllele, final String altAllele, final double minorAlleleFreq) {
        return GenotypeEncodingUtils.encodeWeighted(this, alpha, refAllele, altAllele, minorAlleleFreq);
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Statistics and info

    public double getMaf() {
        return GenotypeStatsUtils.calculateMaf(this);
    }

    public double getHwePval() {
        return GenotypeStatsUtils.calculateHwePval(this);
    }

    public GenotypeCounts getGenotypeCounts() {
        return GenotypeStatsUtils.countGenotypes(this);
    }

    /**
     * @return per row, true for a fully called genotype whose alleles are all the same
     */
    public boolean[] isHomozygous() {
        final boolean[] result = new boolean[length];
        for (int i = 0; i < length; i++) {
            result[i] = !rowHasMissingAllele(i) && alleleAt(i, 0) == alleleAt(i, stride - 2);
        }
        return result;
    }

    /**
     * @return per row, true for a fully called genotype with at least two different alleles
     */
    public boolean[] isHeterozygous() {
        final boolean[] result = new boolean[length];
        for (int i = 0; i < length; i++) {
            result[i] = !rowHasMissingAllele(i) && alleleAt(i, 0) != alleleAt(i, stride - 2);
        }
        return result;
    }

    public boolean[] isHomozygousRef() {
        final boolean[] result = new boolean[length];
        for (int i = 0; i < length; i++) {
            result[i] = alleleAt(i, stride - 2) == 0;
        }
        return result;
    }

    public boolean[] isHomozygousAlt() {
        final boolean[] result = new boolean[length];
        for (int i = 0; i < length; i++) {
            final int first = alleleAt(i, 0);
            result[i] = first != 0 && !rowHasMissingAllele(i) && first == alleleAt(i, stride - 2);
        }
        return result;
    }

    /**
     * @return per row score, NaN where the score is missing
     */
    public double[] getGenotypeScores() {
        final double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            final int score = scoreAt(i);
            result[i] = score == Variant.MISSING_IDX ? Double.NaN : score;
        }
        return result;
    }

    public List<String> toStrings() {
        return toStrings(ConfigFactory.getInstance().getGenomicsConfig().genotype_allele_separator());
    }

    public List<String> toStrings(final String sep) {
        final List<String> result = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            result.add(get(i).toString(sep));
        }
        return result;
    }

    public String getColumnType() {
        return GenotypeColumnType.format(variant);
    }

    // -----------------------------------------------------------------------------------------------------------------

    @Override
    public Iterator<Genotype> iterator() {
        return new Iterator<Genotype>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < length;
            }

            @Override
            public Genotype next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(next++);
            }
        };
    }

    public Stream<Genotype> stream() {
        return StreamSupport.stream(Spliterators.spliterator(iterator(), length, Spliterator.ORDERED | Spliterator.SIZED), false);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final GenotypeArray that = (GenotypeArray) o;
        return variant.equals(that.variant) && Arrays.equals(records, that.records);
    }

    @Override
    public int hashCode() {
        return 31 * variant.hashCode() + Arrays.hashCode(records);
    }

    @Override
    public String toString() {
        return String.format("GenotypeArray{%s, length=%d}", getColumnType(), length);
    }
}
