package org.broadinstitute.genomics.variant;

import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text form of a genotype column's type, for example {@code genotype(2n)[12; 112161652; rs12462; T; C]Q25}.
 * <p>
 *     The fields are ploidy, chromosome ({@code None} when unknown), position, id, reference and comma separated
 *     alternate alleles, optionally followed by {@code Q} and the variant score.
 * </p>
 */
public final class GenotypeColumnType {

    private static final Pattern COLUMN_TYPE_PATTERN = Pattern.compile(
            "genotype\\((?<ploidy>[0-9]+)n\\)\\[" +
            "(?<chromosome>[^;]+); " +
            "(?<position>[0-9]+); " +
            "(?<id>[^;]+); " +
            "(?<ref>[^;]+); " +
            "(?<alt>[^;]*)]" +
            "(Q(?<score>[0-9]+))?");

    static final String NO_CHROMOSOME = "None";

    private GenotypeColumnType() {}

    public static String format(final Variant variant) {
        Utils.nonNull(variant);
        final String scoreString = variant.getScore() == null ? "" : "Q" + variant.getScore();
        return String.format("genotype(%dn)[%s; %d; %s; %s; %s]%s",
                variant.getPloidy(),
                variant.getChromosome() == null ? NO_CHROMOSOME : variant.getChromosome(),
                variant.getPosition(),
                variant.getId(),
                variant.getRef(),
                String.join(",", variant.getAlt()),
                scoreString);
    }

    /**
     * @return a new variant equal to the one {@code columnType} was formatted from
     * @throws UserException.BadInput if the string is not a genotype column type
     */
    public static Variant parse(final String columnType) {
        Utils.nonNull(columnType);
        final Matcher m = COLUMN_TYPE_PATTERN.matcher(columnType);
        if (!m.matches()) {
            throw new UserException.BadInput(String.format("Cannot construct a genotype column type from '%s'", columnType));
        }
        try {
            final String chromosome = NO_CHROMOSOME.equals(m.group("chromosome")) ? null : m.group("chromosome");
            final List<String> alt = new ArrayList<>();
            if (!m.group("alt").isEmpty()) {
                alt.addAll(Utils.split(m.group("alt"), ','));
            }
            final Integer score = m.group("score") == null ? null : Integer.valueOf(m.group("score"));
            return new Variant(chromosome,
                    Integer.parseInt(m.group("position")),
                    m.group("id"),
                    m.group("ref"),
                    alt,
                    Integer.parseInt(m.group("ploidy")),
                    score);
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput(String.format("Cannot construct a genotype column type from '%s'", columnType), e);
        }
    }

    public static boolean isColumnType(final String columnType) {
        return columnType != null && COLUMN_TYPE_PATTERN.matcher(columnType).matches();
    }
}
