package org.broadinstitute.genomics.plink;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.utils.Utils;
import org.broadinstitute.genomics.variant.Variant;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes PLINK BIM (extended variant map) files: {@code chromosome id cM coordinate allele1 allele2}.
 */
public final class BimCodec {
    private static final Logger logger = LogManager.getLogger(BimCodec.class);

    private static final int NUM_COLUMNS = 6;

    private BimCodec() {}

    /**
     * @param maxRecords stop after this many records, or read all when {@code Integer.MAX_VALUE}
     */
    public static List<BimRecord> readBim(final Path bimFile, final int maxRecords) {
        Utils.nonNull(bimFile);
        final List<BimRecord> records = new ArrayList<>();
        try (final BufferedReader reader = Files.newBufferedReader(bimFile)) {
            String line;
            int lineNumber = 0;
            while (records.size() < maxRecords && (line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                records.add(parseLine(line, lineNumber, bimFile));
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(bimFile, e);
        }
        logger.info(String.format("Loaded information for %d variants from '%s'", records.size(), bimFile.getFileName()));
        return records;
    }

    static BimRecord parseLine(final String line, final int lineNumber, final Path source) {
        final String[] fields = line.trim().split("\\s+");
        if (fields.length != NUM_COLUMNS) {
            throw new UserException.CorruptFile(source.toString(),
                    String.format("line %d has %d columns instead of %d", lineNumber, fields.length, NUM_COLUMNS));
        }
        try {
            final int coordinate = Integer.parseInt(fields[3]);
            if (coordinate < 0) {
                throw new UserException.CorruptFile(source.toString(),
                        String.format("line %d has a negative coordinate: %d", lineNumber, coordinate));
            }
            return new BimRecord(fields[0], fields[1], Double.parseDouble(fields[2]), coordinate, fields[4], fields[5]);
        } catch (final NumberFormatException e) {
            throw new UserException.CorruptFile(source.toString(),
                    String.format("line %d has a non-numeric position: %s", lineNumber, line), e);
        }
    }

    /**
     * @throws UserException.UnsupportedMultiAllelic if any variant does not have exactly two alleles
     * @throws UserException.UnsupportedPloidy if any variant is not diploid
     */
    public static void writeBim(final Path bimFile, final List<Variant> variants) {
        writeRecords(bimFile, toRecords(variants));
    }

    /**
     * @throws UserException.UnsupportedMultiAllelic if any variant does not have exactly two alleles
     * @throws UserException.UnsupportedPloidy if any variant is not diploid
     */
    public static List<BimRecord> toRecords(final List<Variant> variants) {
        Utils.nonNull(variants);
        final List<BimRecord> records = new ArrayList<>(variants.size());
        for (final Variant variant : variants) {
            records.add(BimRecord.fromVariant(variant));
        }
        return records;
    }

    public static void writeRecords(final Path bimFile, final List<BimRecord> records) {
        Utils.nonNull(bimFile);
        Utils.nonNull(records);
        try (final BufferedWriter writer = Files.newBufferedWriter(bimFile)) {
            for (final BimRecord record : records) {
                writer.write(record.toLine());
                writer.newLine();
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(bimFile, e);
        }
        logger.info(String.format("Saved %d variants to '%s'", records.size(), bimFile.getFileName()));
    }
}
