package com.crimedata.api.output;

import com.crimedata.api.model.AggregateRow;
import com.crimedata.api.query.CountField;
import com.crimedata.api.query.CountQuery;
import com.crimedata.api.query.Dimension;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes aggregate rows for the wire.
 *
 * Column order is always: grouping keys in `by` order, then the requested
 * fields in `fields` order. Grouping keys are emitted even when `fields` is
 * given so every row stays interpretable.
 */
@Component
@Slf4j
public class ResponseAssembler {

    public List<Map<String, Object>> toMaps(CountQuery query, List<AggregateRow> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (AggregateRow row : rows) {
            Map<String, Object> map = new LinkedHashMap<>();
            List<Dimension> dimensions = query.dimensions();
            for (int i = 0; i < dimensions.size(); i++) {
                map.put(dimensions.get(i).token(), row.getKeys().get(i));
            }
            for (CountField field : query.fields()) {
                map.put(field.fieldName(), row.getValues().getOrDefault(field, 0L));
            }
            out.add(map);
        }
        return out;
    }

    /**
     * Render the rows as CSV with a header line. Null keys become empty cells.
     */
    public String toCsv(CountQuery query, List<AggregateRow> rows) {
        String[] header = columns(query);
        StringWriter buffer = new StringWriter();

        try (CSVWriter writer = new CSVWriter(
                buffer,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(header);
            for (Map<String, Object> row : toMaps(query, rows)) {
                writer.writeNext(row.values().stream().map(this::str).toArray(String[]::new));
            }
        } catch (IOException e) {
            log.error("Failed to render {} rows as CSV: {}", rows.size(), e.getMessage(), e);
            throw new UncheckedIOException("CSV rendering failed", e);
        }
        return buffer.toString();
    }

    private String[] columns(CountQuery query) {
        List<String> columns = new ArrayList<>();
        query.dimensions().forEach(d -> columns.add(d.token()));
        query.fields().forEach(f -> columns.add(f.fieldName()));
        return columns.toArray(String[]::new);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
