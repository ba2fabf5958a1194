package org.broadinstitute.genomics.plink;

import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.variant.Variant;

import java.util.Collections;
import java.util.List;

/**
 * One line of a PLINK BIM file.  An allele of {@code "0"} is absent; a chromosome of {@code "0"} is unknown.
 *
 * @param allele1 the alternate allele, usually the minor one
 * @param allele2 the reference allele, usually the major one
 */
public record BimRecord(
        String chromosome,
        String variantId,
        double centimorgans,
        int coordinate,
        String allele1,
        String allele2
) {
    public static final String ABSENT = "0";

    public BimRecord {
        Utils.nonNull(chromosome, "chromosome cannot be null");
        Utils.nonNull(variantId, "variantId cannot be null");
        Utils.nonNull(allele1, "allele1 cannot be null");
        Utils.nonNull(allele2, "allele2 cannot be null");
    }

    /**
     * @return a diploid variant with {@code allele2} as reference ({@code N} when absent) and {@code allele1} as the
     *         only alternate allele (none when absent)
     */
    public Variant toVariant() {
        final String ref = ABSENT.equals(allele2) ? null : allele2;
        final List<String> alt = ABSENT.equals(allele1) ? Collections.emptyList() : Collections.singletonList(allele1);
        final String chrom = ABSENT.equals(chromosome) ? null : chromosome;
        return new Variant(chrom, coordinate, variantId, ref, alt, 2, null);
    }

    /**
     * @throws UserException.UnsupportedMultiAllelic unless the variant has exactly one alternate allele
     * @throws UserException.UnsupportedPloidy unless the variant is diploid
     */
    public static BimRecord fromVariant(final Variant variant) {
        Utils.nonNull(variant);
        if (!variant.isBiallelic()) {
            throw new UserException.UnsupportedMultiAllelic("Writing a .bim file", variant, variant.getNumAlleles());
        }
        if (variant.getPloidy() != 2) {
            throw new UserException.UnsupportedPloidy("Writing a .bim file", 2, variant.getPloidy());
        }
        return new BimRecord(
                variant.getChromosome() == null ? ABSENT : variant.getChromosome(),
                variant.getId(),
                0,
                variant.getPosition(),
                variant.getAlleles().get(1),
                variant.getRef());
    }

    /**
     * @return the tab separated BIM line
     */
    public String toLine() {
        final String cm = centimorgans == Math.rint(centimorgans) && !Double.isInfinite(centimorgans)
                ? Long.toString((long) centimorgans)
                : Double.toString(centimorgans);
        return String.join("\t", chromosome, variantId, cm, Integer.toString(coordinate), allele1, allele2);
    }
}
