package org.broadinstitute.genomics.table;

import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;

import javax.annotation.Nullable;

/**
 * One sample row of a PLINK FAM file.
 *
 * @param phenotype {@link #CONTROL}, {@link #CASE} or null when read categorically; otherwise the raw FAM value
 */
public record SampleInfo(
        String familyId,
        String individualId,
        String fatherId,
        String motherId,
        Sex sex,
        @Nullable String phenotype
) {
    public static final String CONTROL = "Control";
    public static final String CASE = "Case";
    public static final String NO_PARENT = "0";
    public static final String MISSING_PHENOTYPE = "-9";

    public enum Sex {
        UNKNOWN("0", "unknown"), MALE("1", "male"), FEMALE("2", "female");

        /// FAM code and display label
        private final String famEncode;
        private final String label;
        Sex(final String code, final String label) {
            this.famEncode = code;
            this.label = label;
        }

        public static Sex fromString(final String sex) {
            return switch (sex) {
                case "1" -> MALE;
                case "2" -> FEMALE;
                default -> UNKNOWN;
            };
        }

        public String getFamEncode() {
            return famEncode;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    public SampleInfo {
        Utils.nonNull(familyId, "familyId cannot be null");
        Utils.nonNull(individualId, "individualId cannot be null");
        Utils.nonNull(fatherId, "fatherId cannot be null");
        Utils.nonNull(motherId, "motherId cannot be null");
        Utils.nonNull(sex, "sex cannot be null");
    }

    /**
     * Default FAM information for a bare sample id: the id is both family and individual id, parents and sex are
     * unknown and the phenotype is missing.
     */
    public static SampleInfo fromId(final String id) {
        Utils.nonNull(id);
        if (NO_PARENT.equals(id)) {
            throw new UserException.BadInput("'0' cannot be used as a sample id in a .fam file");
        }
        return new SampleInfo(id, id, NO_PARENT, NO_PARENT, Sex.UNKNOWN, null);
    }

    /**
     * Reads a FAM phenotype value.  Categorically, 1 is {@link #CONTROL}, 2 is {@link #CASE} and anything else is missing.
     */
    public static String parsePhenotype(final String value, final boolean categorical) {
        if (!categorical) {
            return value;
        }
        return switch (value) {
            case "1" -> CONTROL;
            case "2" -> CASE;
            default -> null;
        };
    }

    /**
     * @return the FAM column value for this sample's phenotype
     */
    public String getPhenotypeCode() {
        if (phenotype == null) {
            return MISSING_PHENOTYPE;
        }
        return switch (phenotype) {
            case CONTROL -> "1";
            case CASE -> "2";
            default -> phenotype;
        };
    }

    public SampleInfo withPhenotype(@Nullable final String newPhenotype) {
        return new SampleInfo(familyId, individualId, fatherId, motherId, sex, newPhenotype);
    }

    @Override
    public String toString() {
        return toString(" ");
    }

    public String toString(final String delimiter) {
        return String.join(delimiter,
                familyId,
                individualId,
                fatherId,
                motherId,
                sex.getFamEncode(),
                getPhenotypeCode()
        );
    }
}
