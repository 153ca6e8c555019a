package com.finboard.ledger.imports;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.finboard.ledger.error.ValidationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Splits CSV text into header-keyed rows. Cells past the last header are folded back into the last
 * column, so an unquoted comma-separated {@code tags} tail survives.
 */
@Component
public class CsvRowReader {

    private final ObjectReader reader;

    public CsvRowReader() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .build();
        this.reader = mapper.readerFor(String[].class);
    }

    public List<CsvRow> read(String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("CSV file is empty");
        }
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> iterator = reader.readValues(stripBom(content))) {
            while (iterator.hasNextValue()) {
                lines.add(iterator.nextValue());
            }
        } catch (IOException | RuntimeException ex) {
            throw new ValidationException("CSV file could not be parsed: " + ex.getMessage());
        }
        if (lines.isEmpty()) {
            throw new ValidationException("CSV file is empty");
        }

        String[] header = Arrays.stream(lines.get(0))
                .map(name -> name == null ? "" : name.trim().toLowerCase(Locale.ROOT))
                .toArray(String[]::new);
        List<CsvRow> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            rows.add(new CsvRow(i, toCells(header, lines.get(i))));
        }
        return rows;
    }

    private static Map<String, String> toCells(String[] header, String[] line) {
        Map<String, String> cells = new LinkedHashMap<>();
        for (int col = 0; col < header.length && col < line.length; col++) {
            cells.put(header[col], line[col]);
        }
        if (line.length > header.length && header.length > 0) {
            String last = header[header.length - 1];
            String tail = String.join(",", Arrays.copyOfRange(line, header.length - 1, line.length));
            cells.put(last, tail);
        }
        return cells;
    }

    private static String stripBom(String content) {
        return content.charAt(0) == '\uFEFF' ? content.substring(1) : content;
    }
}
