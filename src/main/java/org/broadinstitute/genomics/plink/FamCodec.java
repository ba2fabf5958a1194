package org.broadinstitute.genomics.plink;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomics.exceptions.UserException;
import org.broadinstitute.genomics.table.SampleInfo;
import org.broadinstitute.genomics.utils.Utils;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes PLINK FAM (sample information) files: {@code FID IID IID_father IID_mother sex phenotype}.
 */
public final class FamCodec {
    private static final Logger logger = LogManager.getLogger(FamCodec.class);

    private static final int NUM_COLUMNS = 6;

    private FamCodec() {}

    /**
     * @param categoricalPhenotype read phenotype 1 as {@link SampleInfo#CONTROL}, 2 as {@link SampleInfo#CASE} and
     *                             anything else as missing, instead of keeping the raw value
     */
    public static List<SampleInfo> readFam(final Path famFile, final boolean categoricalPhenotype) {
        Utils.nonNull(famFile);
        final List<SampleInfo> samples = new ArrayList<>();
        try (final BufferedReader reader = Files.newBufferedReader(famFile)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                final String[] fields = line.trim().split("\\s+");
                if (fields.length != NUM_COLUMNS) {
                    throw new UserException.CorruptFile(famFile.toString(),
                            String.format("line %d has %d columns instead of %d", lineNumber, fields.length, NUM_COLUMNS));
                }
                samples.add(new SampleInfo(fields[0], fields[1], fields[2], fields[3],
                        SampleInfo.Sex.fromString(fields[4]),
                        SampleInfo.parsePhenotype(fields[5], categoricalPhenotype)));
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(famFile, e);
        }
        logger.info(String.format("Loaded information for %d samples from '%s'", samples.size(), famFile.getFileName()));
        return samples;
    }

    /**
     * Writes one space separated line per sample.
     */
    public static void writeFam(final Path famFile, final List<SampleInfo> samples) {
        Utils.nonNull(famFile);
        Utils.nonNull(samples);
        try (final BufferedWriter writer = Files.newBufferedWriter(famFile)) {
            for (final SampleInfo sample : samples) {
                writer.write(sample.toString(" "));
                writer.newLine();
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(famFile, e);
        }
        logger.info(String.format("Saved %d samples to '%s'", samples.size(), famFile.getFileName()));
    }
}
