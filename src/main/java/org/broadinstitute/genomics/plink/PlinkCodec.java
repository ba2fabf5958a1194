package org.broadinstitute.genomics.plink;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomics.arrays.GenotypeArray;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.table.GenotypeTable;
import org.broadinstitute.genomics.table.SampleInfo;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.utils.config.ConfigFactory;
import org.broadinstitute.genomics.variant.Variant;

import javax.annotation.Nullable;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads and writes PLINK 1 binary filesets ({@code prefix.bed}, {@code prefix.bim}, {@code prefix.fam}) as
 * {@link GenotypeTable}s.
 * <p>
 *     PLINK lists the minor allele first in the .bim file and the major allele second.  The second allele becomes
 *     the reference of each column and the first its alternate.  Reading with {@code swapAlleles} makes the first
 *     allele the reference instead.
 * </p>
 */
public final class PlinkCodec {
    private static final Logger logger = LogManager.getLogger(PlinkCodec.class);

    public static final String BED_EXTENSION = ".bed";
    public static final String BIM_EXTENSION = ".bim";
    public static final String FAM_EXTENSION = ".fam";

    private PlinkCodec() {}

    public static GenotypeTable readPlink(final String prefix) {
        return readPlink(Paths.get(Utils.nonNull(prefix)));
    }

    public static GenotypeTable readPlink(final Path prefix) {
        return readPlink(prefix, false, Integer.MAX_VALUE,
                ConfigFactory.getInstance().getGenomicsConfig().plink_categorical_phenotype());
    }

    /**
     * @param prefix path of the three files without their extension
     * @param swapAlleles make the first .bim allele the reference of each column
     * @param maxVariants read at most this many variants
     * @param categoricalPhenotype read the .fam phenotype as case/control instead of its raw value
     * @return a table with one column per variant, named {@code <index>_<variant id>}
     */
    public static GenotypeTable readPlink(final Path prefix, final boolean swapAlleles, final int maxVariants,
                                          final boolean categoricalPhenotype) {
        Utils.nonNull(prefix);
        if (maxVariants < 1) {
            throw new UserException.BadInput(String.format("maxVariants must be at least 1, not %d", maxVariants));
        }
        final Path bedFile = withExtension(prefix, BED_EXTENSION);
        final Path bimFile = withExtension(prefix, BIM_EXTENSION);
        final Path famFile = withExtension(prefix, FAM_EXTENSION);
        for (final Path file : List.of(bedFile, bimFile, famFile)) {
            if (!Files.isRegularFile(file)) {
                throw new UserException.CouldNotReadInputFile(file, "the file does not exist");
            }
        }

        final List<SampleInfo> samples = FamCodec.readFam(famFile, categoricalPhenotype);
        final List<BimRecord> bimRecords = BimCodec.readBim(bimFile, maxVariants);

        final GenotypeTable table = GenotypeTable.fromSampleInfo(samples);
        final List<Variant> variants = bimRecords.stream().map(BimRecord::toVariant).collect(Collectors.toList());
        try (final BedFileReader reader = new BedFileReader(
                new BufferedInputStream(Files.newInputStream(bedFile)), bedFile.toString(), variants, samples.size())) {
            int idx = 0;
            while (reader.hasNext()) {
                final GenotypeArray column = reader.next();
                if (swapAlleles && column.getVariant().getNumAlleles() > 1) {
                    column.setReference(1);
                }
                table.addColumn(idx + "_" + column.getVariant().getId(), column);
                idx++;
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(bedFile, e);
        }
        logger.info(String.format("Loaded genotypes from '%s' for %d samples and %d variants",
                bedFile.getFileName(), samples.size(), table.getNumColumns()));
        return table;
    }

    public static void writePlink(final GenotypeTable table, final String prefix) {
        writePlink(table, Paths.get(Utils.nonNull(prefix)), null);
    }

    /**
     * Writes every column of {@code table}.  Each column must hold a diploid biallelic variant; no file is written
     * when one does not.
     *
     * @param phenotypes replaces the phenotype of every sample when not null, one value per sample
     * @throws UserException.UnsupportedMultiAllelic if a column's variant does not have exactly two alleles
     * @throws UserException.UnsupportedPloidy if a column's variant is not diploid
     */
    public static void writePlink(final GenotypeTable table, final Path prefix, @Nullable final double[] phenotypes) {
        Utils.nonNull(table);
        Utils.nonNull(prefix);
        List<SampleInfo> samples = table.getSampleInfo();
        if (phenotypes != null) {
            if (phenotypes.length != samples.size()) {
                throw new UserException.BadInput(String.format("%d phenotype values were given for %d samples",
                        phenotypes.length, samples.size()));
            }
            final List<SampleInfo> withPhenotypes = new ArrayList<>(samples.size());
            for (int i = 0; i < samples.size(); i++) {
                withPhenotypes.add(samples.get(i).withPhenotype(formatPhenotype(phenotypes[i])));
            }
            samples = withPhenotypes;
        }

        final List<GenotypeArray> columns = new ArrayList<>(table.getColumns().values());
        final Path famFile = withExtension(prefix, FAM_EXTENSION);
        final Path bimFile = withExtension(prefix, BIM_EXTENSION);
        final Path bedFile = withExtension(prefix, BED_EXTENSION);

        // validates every column before anything is written
        final List<BimRecord> bimRecords = BimCodec.toRecords(
                columns.stream().map(GenotypeArray::getVariant).collect(Collectors.toList()));
        FamCodec.writeFam(famFile, samples);
        BimCodec.writeRecords(bimFile, bimRecords);
        try (final BedFileWriter writer = new BedFileWriter(
                new BufferedOutputStream(Files.newOutputStream(bedFile)), bedFile.toString(), samples.size())) {
            writer.writeAll(columns);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(bedFile, e);
        }
        logger.info(String.format("Saved genotypes for %d samples and %d variants to '%s'",
                samples.size(), columns.size(), bedFile.getFileName()));
    }

    private static String formatPhenotype(final double value) {
        if (Double.isNaN(value)) {
            return null;
        }
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static Path withExtension(final Path prefix, final String extension) {
        return prefix.resolveSibling(prefix.getFileName() + extension);
    }
}
