package com.tablediff.diff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes diff records as newline-delimited JSON.
 *
 * <p>Line layout: the key columns first, then a {@code diffs} object holding
 * one {@code [value1, value2]} array per differing column followed by
 * {@code _status}:
 * <pre>
 * {"id":2,"diffs":{"value":[200,250],"_status":"value_differences"}}
 * </pre>
 *
 * <p>Temporal values are written as ISO-8601 strings, byte arrays as base64,
 * lists as JSON arrays, maps as JSON objects and any other engine-specific
 * value through {@code toString()}.
 */
public class DiffRecordWriter {

    /** Field holding the per-column differences */
    public static final String DIFFS_FIELD = "diffs";

    /** Field inside {@code diffs} holding the status */
    public static final String STATUS_FIELD = "_status";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Writer out;
    private long written = 0;

    /**
     * Creates a writer. The target is flushed after every record and never closed.
     *
     * @param out the target
     */
    public DiffRecordWriter(Writer out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    /**
     * Writes one record as a single line.
     *
     * @param record the record
     * @throws UncheckedIOException if the target fails
     */
    public void write(DiffRecord record) {
        try {
            out.write(toJson(record));
            out.write('\n');
            out.flush();
            written++;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write diff record", e);
        }
    }

    /**
     * Writes every remaining record.
     *
     * @param records the records
     * @return the number of records written by this call
     */
    public long writeAll(Iterator<DiffRecord> records) {
        long before = written;
        while (records.hasNext()) {
            write(records.next());
        }
        return written - before;
    }

    public long recordsWritten() {
        return written;
    }

    /**
     * Renders one record as a JSON object without a trailing newline.
     *
     * @param record the record
     * @return the JSON text
     */
    public static String toJson(DiffRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        Map<String, Object> line = new LinkedHashMap<>();
        for (Map.Entry<String, Object> key : record.primaryKey().entrySet()) {
            line.put(key.getKey(), toJsonValue(key.getValue()));
        }

        Map<String, Object> diffs = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> diff : record.diffs().entrySet()) {
            List<Object> pair = diff.getValue();
            diffs.put(diff.getKey(), new Object[] {toJsonValue(pair.get(0)), toJsonValue(pair.get(1))});
        }
        diffs.put(STATUS_FIELD, record.status().wireName());
        line.put(DIFFS_FIELD, diffs);

        try {
            return MAPPER.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize diff record " + record.primaryKey(), e);
        }
    }

    /**
     * Keeps values Jackson writes natively and stringifies the rest.
     */
    static Object toJsonValue(Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof byte[]
                || value instanceof TemporalAccessor) {
            return value;
        }
        if (value instanceof List) {
            List<Object> elements = new ArrayList<>();
            for (Object element : (List<?>) value) {
                elements.add(toJsonValue(element));
            }
            return elements;
        }
        if (value instanceof Map) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                fields.put(String.valueOf(entry.getKey()), toJsonValue(entry.getValue()));
            }
            return fields;
        }
        return value.toString();
    }
}
