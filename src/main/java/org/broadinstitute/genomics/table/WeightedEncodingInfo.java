package org.broadinstitute.genomics.table;

import org.broadinstitute.genomics.utils.Utils;

/**
 * Heterozygote weight for one variant, as estimated by an external regression.
 *
 * @param variantId id of the variant the weight applies to
 * @param alpha value given to heterozygous calls
 * @param refAllele allele treated as reference when the weight was estimated
 * @param altAllele allele treated as alternate when the weight was estimated
 * @param minorAlleleFreq minor allele frequency of the data the weight was estimated from
 */
public record WeightedEncodingInfo(
        String variantId,
        double alpha,
        String refAllele,
        String altAllele,
        double minorAlleleFreq
) {
    public WeightedEncodingInfo {
        Utils.nonNull(variantId, "variantId cannot be null");
        Utils.nonNull(refAllele, "refAllele cannot be null");
        Utils.nonNull(altAllele, "altAllele cannot be null");
    }
}
