package org.broadinstitute.genomics.variant;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.utils.config.ConfigFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity and allele palette of a single genomic site.
 * <p>
 *     The palette is an ordered list of distinct allele strings with the reference allele at index 0.  It may
 *     only grow by appending ({@link #addAllele(String)}), so every index that was valid for a variant stays valid.
 *     The only reordering is {@link #copyWithReference(int)}, which returns a new variant and leaves this one untouched.
 * </p>
 * <p>
 *     A variant is shared by reference among all {@link Genotype}s and genotype arrays of the same site.
 * </p>
 */
public final class Variant {
    private static final Logger logger = LogManager.getLogger(Variant.class);

    /** Allele index (and score) byte denoting a missing value. */
    public static final int MISSING_IDX = 255;
    public static final int MAX_ALLELES = 254;
    public static final int MAX_SCORE = 254;
    public static final int MAX_POSITION = Integer.MAX_VALUE - 1;
    public static final int DEFAULT_PLOIDY = 2;
    public static final String DEFAULT_REF = "N";
    public static final String MISSING_ALLELE = ".";
    public static final String MISSING_GENOTYPE = "<Missing>";

    private final String chromosome;
    private final int position;
    private final String id;
    private final int ploidy;
    private final Integer score;
    private final List<String> alleles;

    /**
     * An anonymous variant: unknown location, a generated id, reference {@code N} and no alternate alleles.
     */
    public Variant() {
        this(null, 0, null, null, null);
    }

    public Variant(@Nullable final String chromosome, final int position, @Nullable final String id,
                   @Nullable final String ref, @Nullable final List<String> alt) {
        this(chromosome, position, id, ref, alt, DEFAULT_PLOIDY, null);
    }

    /**
     * @param chromosome may be null, must not contain ';' or ','
     * @param position 1-based position, 0 when unknown
     * @param id variant id; a random unique id is generated when null
     * @param ref reference allele, {@link #DEFAULT_REF} when null
     * @param alt alternate alleles, none when null
     * @param ploidy number of alleles in each genotype call
     * @param score quality score between 0 and {@link #MAX_SCORE}, or null (255 is read as null)
     */
    public Variant(@Nullable final String chromosome, final int position, @Nullable final String id,
                   @Nullable final String ref, @Nullable final List<String> alt,
                   final int ploidy, @Nullable final Integer score) {
        if (chromosome != null && (chromosome.contains(";") || chromosome.contains(","))) {
            throw new UserException.BadInput(String.format("The chromosome cannot contain ';' or ',': '%s'", chromosome));
        }
        if (position < 0 || position > MAX_POSITION) {
            throw new UserException.BadInput(String.format("The position must be between 0 and 2^31-2, %d was specified", position));
        }
        if (id != null && (id.contains(";") || id.contains(","))) {
            throw new UserException.BadInput(String.format("The variant id cannot contain ';' or ',': '%s'", id));
        }
        if (ploidy < 1 || ploidy > MAX_ALLELES) {
            throw new UserException.BadInput(String.format("The ploidy must be between 1 and %d, %d was specified", MAX_ALLELES, ploidy));
        }
        this.chromosome = chromosome;
        this.position = position;
        this.id = id != null ? id : UUID.randomUUID().toString();
        this.ploidy = ploidy;
        this.score = normalizeScore(score);

        final String refAllele = ref != null ? ref : DEFAULT_REF;
        validateAllele(refAllele);
        this.alleles = new ArrayList<>();
        this.alleles.add(refAllele);
        if (alt != null) {
            if (alt.contains(refAllele)) {
                throw new UserException.BadInput(String.format("The ref allele (%s) was also listed as an alt allele", refAllele));
            }
            if (alt.size() + 1 > MAX_ALLELES) {
                throw new UserException.TooManyAlleles(String.format("%d alleles were provided, the maximum supported number is %d",
                        alt.size() + 1, MAX_ALLELES));
            }
            for (final String allele : alt) {
                addAllele(allele);
            }
        }
    }

    private Variant(final Variant other, final List<String> alleles) {
        this.chromosome = other.chromosome;
        this.position = other.position;
        this.id = other.id;
        this.ploidy = other.ploidy;
        this.score = other.score;
        this.alleles = alleles;
    }

    /**
     * Converts a raw score to the stored form; {@link #MISSING_IDX} and null both mean "no score".
     */
    static Integer normalizeScore(@Nullable final Integer score) {
        if (score == null || score == MISSING_IDX) {
            return null;
        }
        if (score < 0 || score > MAX_SCORE) {
            throw new UserException.BadInput(String.format("Scores must be between 0 and %d, %d was specified", MAX_SCORE, score));
        }
        return score;
    }

    private static void validateAllele(final String allele) {
        if (allele == null || allele.isEmpty()) {
            throw new UserException.BadInput("Alleles cannot be null or empty");
        }
        if (MISSING_ALLELE.equals(allele) || allele.contains(",") || allele.contains(";")) {
            throw new UserException.BadInput(String.format("'%s' is not a valid allele", allele));
        }
    }

    public String getChromosome() {
        return chromosome;
    }

    public int getPosition() {
        return position;
    }

    public String getId() {
        return id;
    }

    public int getPloidy() {
        return ploidy;
    }

    public Integer getScore() {
        return score;
    }

    public String getRef() {
        return alleles.get(0);
    }

    public List<String> getAlt() {
        return Collections.unmodifiableList(alleles.subList(1, alleles.size()));
    }

    /**
     * @return a read-only view of the palette, reference first
     */
    public List<String> getAlleles() {
        return Collections.unmodifiableList(alleles);
    }

    public int getNumAlleles() {
        return alleles.size();
    }

    /**
     * Appends an allele to the palette.
     * @return the index of the new allele
     */
    public int addAllele(final String allele) {
        validateAllele(allele);
        if (alleles.contains(allele)) {
            throw new UserException.BadInput(String.format("'%s' is already an allele in %s", allele, this));
        }
        if (alleles.size() >= MAX_ALLELES) {
            throw new UserException.TooManyAlleles(String.format("Couldn't add new allele to %s, %d alleles max", this, MAX_ALLELES));
        }
        alleles.add(allele);
        logger.debug("Added allele {} to {}", allele, id);
        return alleles.size() - 1;
    }

    public int getIdxFromAllele(@Nullable final String allele) {
        return getIdxFromAllele(allele, false);
    }

    /**
     * @param allele allele string; null or "." mean the missing allele
     * @param add whether an unknown allele is appended to the palette
     * @return the palette index of {@code allele}, or {@link #MISSING_IDX}
     */
    public int getIdxFromAllele(@Nullable final String allele, final boolean add) {
        if (allele == null || MISSING_ALLELE.equals(allele)) {
            return MISSING_IDX;
        }
        final int idx = alleles.indexOf(allele);
        if (idx >= 0) {
            return idx;
        }
        if (add) {
            return addAllele(allele);
        }
        throw new UserException.UnknownAllele(allele, this);
    }

    public String getAlleleFromIdx(final int idx) {
        if (idx == MISSING_IDX) {
            return MISSING_ALLELE;
        }
        if (!isValidAlleleIdx(idx)) {
            throw new UserException.InvalidAlleleIndex(idx, this, alleles.size());
        }
        return alleles.get(idx);
    }

    public boolean isValidAlleleIdx(final int idx) {
        return idx == MISSING_IDX || (idx >= 0 && idx < alleles.size());
    }

    /**
     * Merge compatibility: same id, chromosome, position, reference allele and ploidy.  Alternate alleles are not compared.
     */
    public boolean isSamePosition(@Nullable final Variant other) {
        return other != null
                && id.equals(other.id)
                && Objects.equals(chromosome, other.chromosome)
                && position == other.position
                && getRef().equals(other.getRef())
                && ploidy == other.ploidy;
    }

    public boolean isBiallelic() {
        return alleles.size() == 2;
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Genotype factories

    public Genotype makeMissingGenotype() {
        return new Genotype(this, missingIdxs(), null);
    }

    public Genotype makeGenotype(final String... alleles) {
        return makeGenotype(Arrays.asList(alleles), null, false);
    }

    public Genotype makeGenotype(final List<String> alleles, final boolean add) {
        return makeGenotype(alleles, null, add);
    }

    /**
     * Builds a genotype from allele strings.  Fewer alleles than the ploidy are padded with the missing allele.
     *
     * @param alleles allele strings; null or "." for a missing allele
     * @param score genotype score, may be null
     * @param add whether unknown alleles are appended to the palette
     */
    public Genotype makeGenotype(final List<String> alleles, @Nullable final Integer score, final boolean add) {
        Utils.nonNull(alleles, "alleles cannot be null");
        if (alleles.size() > ploidy) {
            throw new UserException.TooManyAlleles(String.format("%d alleles were given for %s, which has ploidy %d",
                    alleles.size(), this, ploidy));
        }
        final int[] idxs = missingIdxs();
        for (int i = 0; i < alleles.size(); i++) {
            idxs[i] = getIdxFromAllele(alleles.get(i), add);
        }
        return new Genotype(this, idxs, score);
    }

    public Genotype makeGenotypeFromStr(final String genotype) {
        return makeGenotypeFromStr(genotype, ConfigFactory.getInstance().getGenomicsConfig().genotype_allele_separator(), false);
    }

    /**
     * Parses a genotype string such as {@code A/T}.  An empty string or {@link #MISSING_GENOTYPE} is a fully missing
     * genotype and a "." (or empty) token is a missing allele.
     */
    public Genotype makeGenotypeFromStr(final String genotype, final String sep, final boolean add) {
        Utils.nonNull(genotype, "genotype string cannot be null");
        if (genotype.isEmpty() || MISSING_GENOTYPE.equals(genotype)) {
            return makeMissingGenotype();
        }
        final List<String> tokens = new ArrayList<>(Utils.split(genotype, sep));
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isEmpty()) {
                tokens.set(i, null);
            }
        }
        return makeGenotype(tokens, null, add);
    }

    /**
     * Builds a genotype from a two character PLINK bit code.
     * {@code 00} is homozygous reference, {@code 01} missing, {@code 10} heterozygous and {@code 11} homozygous alternate.
     */
    public Genotype makeGenotypeFromPlinkBits(final String code) {
        Utils.nonNull(code);
        if (!isBiallelic()) {
            throw new UserException.UnsupportedMultiAllelic("PLINK genotype codes", this, alleles.size());
        }
        if (ploidy != 2) {
            throw new UserException.UnsupportedPloidy("PLINK genotype codes", 2, ploidy);
        }
        final int[] idxs = switch (code) {
            case "00" -> new int[]{0, 0};
            case "01" -> new int[]{MISSING_IDX, MISSING_IDX};
            case "10" -> new int[]{0, 1};
            case "11" -> new int[]{1, 1};
            default -> throw new UserException.BadInput(String.format("Invalid PLINK genotype code: '%s'", code));
        };
        return new Genotype(this, idxs, null);
    }

    /**
     * Builds a genotype from VCF allele indices, where -1 is a no-call.
     */
    public Genotype makeGenotypeFromVcfRecord(final int[] alleleIdxs, @Nullable final Integer score) {
        Utils.nonNull(alleleIdxs);
        if (alleleIdxs.length > ploidy) {
            throw new UserException.TooManyAlleles(String.format("%d alleles were given for %s, which has ploidy %d",
                    alleleIdxs.length, this, ploidy));
        }
        final int[] idxs = missingIdxs();
        for (int i = 0; i < alleleIdxs.length; i++) {
            final int idx = alleleIdxs[i] == -1 ? MISSING_IDX : alleleIdxs[i];
            if (!isValidAlleleIdx(idx)) {
                throw new UserException.InvalidAlleleIndex(alleleIdxs[i], this, alleles.size());
            }
            idxs[i] = idx;
        }
        return new Genotype(this, idxs, score);
    }

    private int[] missingIdxs() {
        final int[] idxs = new int[ploidy];
        Arrays.fill(idxs, MISSING_IDX);
        return idxs;
    }

    // -----------------------------------------------------------------------------------------------------------------

    /**
     * @return an equal variant with its own palette
     */
    public Variant copy() {
        return new Variant(this, new ArrayList<>(alleles));
    }

    /**
     * @return a copy of this variant whose palette has the allele at {@code idx} and the reference swapped
     */
    public Variant copyWithReference(final int idx) {
        if (idx == MISSING_IDX || !isValidAlleleIdx(idx)) {
            throw new UserException.InvalidAlleleIndex(idx, this, alleles.size());
        }
        final List<String> swapped = new ArrayList<>(alleles);
        Collections.swap(swapped, 0, idx);
        return new Variant(this, swapped);
    }

    /**
     * @return the variant's fields keyed by name, in a stable order
     */
    public Map<String, Object> asMap() {
        final Map<String, Object> info = new LinkedHashMap<>();
        info.put("chromosome", chromosome);
        info.put("position", position);
        info.put("id", id);
        info.put("ref", getRef());
        info.put("alt", String.join(",", getAlt()));
        info.put("ploidy", ploidy);
        info.put("score", score);
        return info;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Variant that = (Variant) o;
        return position == that.position
                && ploidy == that.ploidy
                && Objects.equals(chromosome, that.chromosome)
                && id.equals(that.id)
                && Objects.equals(score, that.score)
                && alleles.equals(that.alleles);
    }

    // the palette is mutable, so it is left out of the hash
    @Override
    public int hashCode() {
        return Objects.hash(chromosome, position, id, ploidy);
    }

    @Override
    public String toString() {
        return String.format("%s[chr=%s;pos=%d;ref=%s;alt=%s]", id, chromosome, position, getRef(), String.join(",", getAlt()));
    }
}
