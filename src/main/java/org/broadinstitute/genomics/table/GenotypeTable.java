package org.broadinstitute.genomics.table;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomics.arrays.CodominantCategory;
import org.broadinstitute.genomics.arrays.GenotypeArray;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.utils.config.ConfigFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Samples and their genotype columns, one {@link GenotypeArray} per variant.
 * <p>
 *     Samples carry either full FAM information ({@link SampleInfo}) or a bare id.  Every column has one row per
 *     sample, and columns keep their insertion order.
 * </p>
 */
public final class GenotypeTable {
    private static final Logger logger = LogManager.getLogger(GenotypeTable.class);

    private final List<String> sampleIds;
    private final List<SampleInfo> sampleInfo;
    private final Map<String, GenotypeArray> columns = new LinkedHashMap<>();

    private GenotypeTable(final List<String> sampleIds, final List<SampleInfo> sampleInfo) {
        this.sampleIds = Collections.unmodifiableList(new ArrayList<>(sampleIds));
        this.sampleInfo = sampleInfo == null ? null : Collections.unmodifiableList(new ArrayList<>(sampleInfo));
    }

    public static GenotypeTable fromSampleInfo(final List<SampleInfo> samples) {
        Utils.nonNull(samples);
        Utils.containsNoNull(samples, "samples cannot contain null");
        return new GenotypeTable(samples.stream().map(SampleInfo::individualId).collect(Collectors.toList()), samples);
    }

    public static GenotypeTable fromSampleIds(final List<String> sampleIds) {
        Utils.nonNull(sampleIds);
        Utils.containsNoNull(sampleIds, "sample ids cannot contain null");
        return new GenotypeTable(sampleIds, null);
    }

    public int getNumSamples() {
        return sampleIds.size();
    }

    public List<String> getSampleIds() {
        return sampleIds;
    }

    public boolean hasSampleInfo() {
        return sampleInfo != null;
    }

    /**
     * @return the FAM information of every sample, synthesized from the sample ids when the table has none
     */
    public List<SampleInfo> getSampleInfo() {
        if (sampleInfo != null) {
            return sampleInfo;
        }
        return sampleIds.stream().map(SampleInfo::fromId).collect(Collectors.toList());
    }

    /**
     * Appends a column.
     *
     * @throws UserException.BadInput if the name is taken or the column length differs from the number of samples
     */
    public GenotypeTable addColumn(final String name, final GenotypeArray column) {
        Utils.nonNull(name, "column name cannot be null");
        Utils.nonNull(column, "column cannot be null");
        if (columns.containsKey(name)) {
            throw new UserException.BadInput(String.format("There is already a column named '%s'", name));
        }
        if (column.length() != sampleIds.size()) {
            throw new UserException.BadInput(String.format("Column '%s' has %d genotypes but the table has %d samples",
                    name, column.length(), sampleIds.size()));
        }
        columns.put(name, column);
        return this;
    }

    public GenotypeArray getColumn(final String name) {
        final GenotypeArray column = columns.get(name);
        if (column == null) {
            throw new UserException.BadInput(String.format("There is no column named '%s'", name));
        }
        return column;
    }

    public boolean hasColumn(final String name) {
        return columns.containsKey(name);
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public Map<String, GenotypeArray> getColumns() {
        return Collections.unmodifiableMap(columns);
    }

    public int getNumColumns() {
        return columns.size();
    }

    // -----------------------------------------------------------------------------------------------------------------

    /**
     * @return {@link org.broadinstitute.genomics.variant.Variant#asMap()} of each column's variant, by column name
     */
    public Map<String, Map<String, Object>> getVariantInfo() {
        return perColumn(column -> column.getVariant().asMap());
    }

    public Map<String, Double> getMaf() {
        return perColumn(GenotypeArray::getMaf);
    }

    public Map<String, Double> getHwePval() {
        return perColumn(GenotypeArray::getHwePval);
    }

    public Map<String, double[]> encodeAdditive() {
        return perColumn(GenotypeArray::encodeAdditive);
    }

    public Map<String, double[]> encodeDominant() {
        return perColumn(GenotypeArray::encodeDominant);
    }

    public Map<String, double[]> encodeRecessive() {
        return perColumn(GenotypeArray::encodeRecessive);
    }

    public Map<String, CodominantCategory[]> encodeCodominant() {
        return perColumn(GenotypeArray::encodeCodominant);
    }

    private <T> Map<String, T> perColumn(final Function<GenotypeArray, T> function) {
        final Map<String, T> result = new LinkedHashMap<>();
        for (final Map.Entry<String, GenotypeArray> entry : columns.entrySet()) {
            result.put(entry.getKey(), function.apply(entry.getValue()));
        }
        return result;
    }

    /**
     * Weighted (EDGE) encoding of every column with a matching entry in {@code encodingInfo}, matched by variant id.
     * Columns without an entry, or whose encoding fails, are left out of the result and reported in a warning.
     *
     * @throws UserException.BadInput if a variant id appears more than once in {@code encodingInfo}
     */
    public Map<String, double[]> encodeWeighted(final List<WeightedEncodingInfo> encodingInfo) {
        Utils.nonNull(encodingInfo);
        final Map<String, WeightedEncodingInfo> byId = new HashMap<>();
        final Set<String> duplicates = new TreeSet<>();
        for (final WeightedEncodingInfo info : encodingInfo) {
            if (byId.put(info.variantId(), info) != null) {
                duplicates.add(info.variantId());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new UserException.BadInput("Duplicate variant ids in the encoding info: " + String.join(", ", duplicates));
        }

        final Map<String, double[]> result = new LinkedHashMap<>();
        final Map<String, String> warnings = new LinkedHashMap<>();
        for (final Map.Entry<String, GenotypeArray> entry : columns.entrySet()) {
            final String variantId = entry.getValue().getVariant().getId();
            final WeightedEncodingInfo info = byId.get(variantId);
            if (info == null) {
                warnings.put(variantId, "No matching information found in the encoding data");
                continue;
            }
            try {
                result.put(entry.getKey(), entry.getValue().encodeWeighted(info.alpha(), info.refAllele(), info.altAllele(), info.minorAlleleFreq()));
            } catch (final UserException | IllegalArgumentException e) {
                warnings.put(variantId, e.getMessage());
            }
        }
        if (!warnings.isEmpty()) {
            final StringBuilder message = new StringBuilder(String.format("%d variants failed weighted encoding", warnings.size()));
            warnings.forEach((id, warning) -> message.append(String.format("%n\t%s: %s", id, warning)));
            Utils.warnUser(logger, message.toString());
        }
        return result;
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Filters

    public GenotypeTable filterVariantsMaf() {
        return filterVariantsMaf(ConfigFactory.getInstance().getGenomicsConfig().maf_filter_min_freq());
    }

    /**
     * @return a table without the columns whose minor allele frequency is below {@code keepMinFreq}; NaN is kept
     */
    public GenotypeTable filterVariantsMaf(final double keepMinFreq) {
        return filterColumns(column -> !(column.getMaf() < keepMinFreq), "MAF");
    }

    public GenotypeTable filterVariantsHwe() {
        return filterVariantsHwe(ConfigFactory.getInstance().getGenomicsConfig().hwe_filter_cutoff());
    }

    /**
     * @return a table without the columns whose HWE p-value is below {@code cutoff}; NaN (non-diploid or too little
     *         data) is kept
     */
    public GenotypeTable filterVariantsHwe(final double cutoff) {
        return filterColumns(column -> !(column.getHwePval() < cutoff), "HWE");
    }

    private GenotypeTable filterColumns(final Predicate<GenotypeArray> keep, final String filterName) {
        final GenotypeTable result = new GenotypeTable(sampleIds, sampleInfo);
        for (final Map.Entry<String, GenotypeArray> entry : columns.entrySet()) {
            if (keep.test(entry.getValue())) {
                result.columns.put(entry.getKey(), entry.getValue());
            }
        }
        logger.info(String.format("The %s filter removed %d of %d variants", filterName,
                columns.size() - result.columns.size(), columns.size()));
        return result;
    }
}
