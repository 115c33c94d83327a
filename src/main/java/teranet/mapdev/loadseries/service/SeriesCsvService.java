package teranet.mapdev.loadseries.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.loadseries.config.CleaningConfig;
import teranet.mapdev.loadseries.config.PipelineConfig;
import teranet.mapdev.loadseries.exception.MalformedSeriesException;
import teranet.mapdev.loadseries.model.DayRecord;
import teranet.mapdev.loadseries.model.MetricSeries;
import teranet.mapdev.loadseries.model.SeriesReadResult;
import teranet.mapdev.loadseries.util.DateNormalizer;
import teranet.mapdev.loadseries.util.SeriesValues;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes metric files.
 *
 * Layout: a header row, then one row per day with the date in the first column followed
 * by exactly one value per slot. Example with 96 slots:
 *   Date,Value_1,Value_2,...,Value_96
 *   2023/05/01,12.5,,13.1,...,0
 *
 * The header is checked before any row is read; a file whose column count does not match
 * the slot count is rejected as a whole. Individual rows with a bad date, a wrong cell
 * count or a non-numeric value are skipped and reported.
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class SeriesCsvService {

    private static final Logger logger = LoggerFactory.getLogger(SeriesCsvService.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CleaningConfig cleaningConfig;
    private final PipelineConfig pipelineConfig;

    public SeriesCsvService(CleaningConfig cleaningConfig, PipelineConfig pipelineConfig) {
        this.cleaningConfig = cleaningConfig;
        this.pipelineConfig = pipelineConfig;
    }

    /**
     * Read a metric file.
     *
     * @param file        the CSV file
     * @param zeroMissing whether literal zeros are read as missing
     * @return parsed series plus skipped-row reasons
     * @throws IOException              if the file cannot be read
     * @throws MalformedSeriesException if the file is empty or its header has the wrong width
     */
    public SeriesReadResult read(Path file, boolean zeroMissing) throws IOException {
        String label = file.getFileName().toString();
        int slotCount = cleaningConfig.getImputation().getSlotCount();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine != null && !headerLine.isEmpty() && headerLine.charAt(0) == BYTE_ORDER_MARK) {
                headerLine = headerLine.substring(1);
            }
            if (headerLine == null || headerLine.trim().isEmpty()) {
                throw new MalformedSeriesException(label + ": file is empty or has no header");
            }

            List<String> header = parseCsvRow(headerLine);
            if (header.size() != slotCount + 1) {
                throw MalformedSeriesException.wrongColumnCount(label, slotCount, header.size());
            }

            List<DayRecord> days = new ArrayList<>();
            List<String> skipped = new ArrayList<>();
            String line;
            long lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                List<String> cells = parseCsvRow(line);
                Optional<String> problem = parseRow(cells, header, zeroMissing, days);
                if (problem.isPresent()) {
                    String reason = String.format("%s line %d: %s", label, lineNumber, problem.get());
                    logger.warn("Skipping row - {}", reason);
                    skipped.add(reason);
                }
            }

            MetricSeries series = new MetricSeries(label, header.get(0), header.subList(1, header.size()), days);
            logger.debug("Read {} days from {} ({} rows skipped)", days.size(), file, skipped.size());
            return new SeriesReadResult(series, skipped);
        }
    }

    /**
     * Parse one data row into a day record.
     *
     * @return the reason the row was rejected, or empty if it was added
     */
    private Optional<String> parseRow(List<String> cells, List<String> header, boolean zeroMissing,
            List<DayRecord> days) {
        if (cells.size() != header.size()) {
            return Optional.of(String.format("expected %d cells but found %d", header.size(), cells.size()));
        }

        Optional<LocalDate> date = DateNormalizer.parse(cells.get(0));
        if (date.isEmpty()) {
            return Optional.of(String.format("unparseable date '%s'", cells.get(0)));
        }

        double[] values = new double[cells.size() - 1];
        for (int i = 1; i < cells.size(); i++) {
            try {
                values[i - 1] = SeriesValues.parse(cells.get(i), zeroMissing);
            } catch (NumberFormatException e) {
                return Optional.of(String.format("non-numeric value '%s' in column %s", cells.get(i), header.get(i)));
            }
        }
        days.add(new DayRecord(date.get(), values));
        return Optional.empty();
    }

    /**
     * Write a series with its original header; dates as yyyy/MM/dd, missing cells empty.
     * Parent directories are created as needed.
     */
    public void write(MetricSeries series, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            if (pipelineConfig.isWriteByteOrderMark()) {
                writer.write(BYTE_ORDER_MARK);
            }
            List<String> header = new ArrayList<>();
            header.add(series.getDateColumn());
            header.addAll(series.getSlotColumns());
            writer.write(toCsvRow(header));
            writer.write('\n');

            for (DayRecord day : series.getDays()) {
                StringBuilder row = new StringBuilder(DateNormalizer.format(day.getDate()));
                for (double value : day.getValues()) {
                    row.append(',').append(SeriesValues.format(value));
                }
                writer.write(row.toString());
                writer.write('\n');
            }
        }
        logger.debug("Wrote {} days to {}", series.dayCount(), file);
    }

    /**
     * Parse CSV row handling quoted fields and commas within quotes (RFC 4180).
     *
     * Examples:
     *   "2023/05/01,1.5,2" -> ["2023/05/01", "1.5", "2"]
     *   "\"Date\",\"Value_1\"" -> ["Date", "Value_1"]
     */
    public List<String> parseCsvRow(String csvLine) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < csvLine.length(); i++) {
            char c = csvLine.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < csvLine.length() && csvLine.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                values.add(currentValue.toString().trim());
                currentValue = new StringBuilder();
            } else {
                currentValue.append(c);
            }
        }

        values.add(currentValue.toString().trim());
        return values;
    }

    private static String toCsvRow(List<String> cells) {
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                row.append(',');
            }
            String cell = cells.get(i);
            if (cell.contains(",") || cell.contains("\"")) {
                row.append('"').append(cell.replace("\"", "\"\"")).append('"');
            } else {
                row.append(cell);
            }
        }
        return row.toString();
    }
}
