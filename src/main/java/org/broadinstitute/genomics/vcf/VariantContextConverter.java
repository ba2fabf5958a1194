package org.broadinstitute.genomics.vcf;

import htsjdk.samtools.util.CloseableIterator;
import htsjdk.tribble.TribbleException;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFFileReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomics.arrays.GenotypeArray;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.table.GenotypeTable;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.variant.Genotype;
import org.broadinstitute.genomics.variant.Variant;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts htsjdk {@link VariantContext}s into variants, genotype arrays and tables.
 */
public final class VariantContextConverter {
    private static final Logger logger = LogManager.getLogger(VariantContextConverter.class);

    private VariantContextConverter() {}

    /**
     * @return a variant with the context's location, first id, alleles and QUAL (capped at {@link Variant#MAX_SCORE});
     *         the ploidy is the largest ploidy among the context's calls, or {@link Variant#DEFAULT_PLOIDY} without calls
     */
    public static Variant toVariant(final VariantContext vc) {
        Utils.nonNull(vc);
        final String id = vc.hasID() ? Utils.split(vc.getID(), ';').get(0) : null;
        final List<String> alt = vc.getAlternateAlleles().stream().map(Allele::getDisplayString).collect(Collectors.toList());
        final Integer score = vc.hasLog10PError() ? toScore(vc.getPhredScaledQual()) : null;
        return new Variant(vc.getContig(), vc.getStart(), id, vc.getReference().getDisplayString(), alt,
                vc.getMaxPloidy(Variant.DEFAULT_PLOIDY), score);
    }

    public static GenotypeArray toGenotypeArray(final VariantContext vc) {
        return toGenotypeArray(vc, new ArrayList<>(vc.getSampleNamesOrderedByName()));
    }

    /**
     * @param sampleNames row order of the result; samples without a call in {@code vc} are missing
     */
    public static GenotypeArray toGenotypeArray(final VariantContext vc, final List<String> sampleNames) {
        Utils.nonNull(vc);
        Utils.nonNull(sampleNames);
        final Variant variant = toVariant(vc);
        final List<Genotype> genotypes = new ArrayList<>(sampleNames.size());
        for (final String sample : sampleNames) {
            final htsjdk.variant.variantcontext.Genotype call = vc.getGenotype(sample);
            if (call == null) {
                genotypes.add(variant.makeMissingGenotype());
                continue;
            }
            final List<Allele> alleles = call.getAlleles();
            final int[] alleleIdxs = new int[alleles.size()];
            for (int i = 0; i < alleles.size(); i++) {
                alleleIdxs[i] = alleles.get(i).isNoCall() ? -1 : vc.getAlleleIndex(alleles.get(i));
            }
            final Integer score = call.hasGQ() ? toScore(call.getGQ()) : null;
            genotypes.add(variant.makeGenotypeFromVcfRecord(alleleIdxs, score));
        }
        return GenotypeArray.fromGenotypes(variant, genotypes);
    }

    /**
     * Samples are taken from the first context.
     *
     * @see #toGenotypeTable(Iterable, List, double, boolean)
     */
    public static GenotypeTable toGenotypeTable(final Iterable<VariantContext> contexts, final double minQual,
                                                final boolean dropFiltered) {
        Utils.nonNull(contexts);
        final Iterator<VariantContext> it = contexts.iterator();
        final List<String> sampleNames = it.hasNext()
                ? new ArrayList<>(it.next().getSampleNamesOrderedByName())
                : new ArrayList<>();
        return toGenotypeTable(contexts, sampleNames, minQual, dropFiltered);
    }

    /**
     * @param minQual skip contexts whose QUAL is below this value; contexts without a QUAL are kept
     * @param dropFiltered skip contexts with a FILTER other than PASS
     * @return a table with one column per kept context, named {@code <index>_<variant id>}
     */
    public static GenotypeTable toGenotypeTable(final Iterable<VariantContext> contexts, final List<String> sampleNames,
                                                final double minQual, final boolean dropFiltered) {
        Utils.nonNull(contexts);
        Utils.nonNull(sampleNames);
        final GenotypeTable table = GenotypeTable.fromSampleIds(sampleNames);
        int idx = 0;
        int skipped = 0;
        for (final VariantContext vc : contexts) {
            if ((dropFiltered && vc.isFiltered()) || (vc.hasLog10PError() && vc.getPhredScaledQual() < minQual)) {
                skipped++;
                continue;
            }
            final GenotypeArray column = toGenotypeArray(vc, sampleNames);
            table.addColumn(idx + "_" + column.getVariant().getId(), column);
            idx++;
        }
        logger.info(String.format("Converted %d variants for %d samples, skipped %d", idx, sampleNames.size(), skipped));
        return table;
    }

    /**
     * Reads a VCF (plain or block compressed) without requiring an index.
     */
    public static GenotypeTable readVcf(final Path vcf, final double minQual, final boolean dropFiltered) {
        Utils.nonNull(vcf);
        if (!Files.isRegularFile(vcf)) {
            throw new UserException.CouldNotReadInputFile(vcf, "the file does not exist");
        }
        try (final VCFFileReader reader = new VCFFileReader(vcf, false);
             final CloseableIterator<VariantContext> iterator = reader.iterator()) {
            final List<String> sampleNames = reader.getFileHeader().getGenotypeSamples();
            final GenotypeTable table = toGenotypeTable(() -> iterator, sampleNames, minQual, dropFiltered);
            logger.info(String.format("Loaded %d variants from '%s'", table.getNumColumns(), vcf.getFileName()));
            return table;
        } catch (final TribbleException e) {
            throw new UserException.CouldNotReadInputFile(vcf, e);
        }
    }

    private static Integer toScore(final double quality) {
        return (int) Math.max(0, Math.min(Variant.MAX_SCORE, Math.round(quality)));
    }
}
