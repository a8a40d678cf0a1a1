package com.stacker.projector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.io.IOException;
import java.sql.Array;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns projector rows into document bodies by zipping the columns, by position, with the
 * schema's field names.
 *
 * <p>SQL values are converted to JSON-ready values: arrays become lists, dates ISO-8601 strings,
 * {@code jsonb} values parsed structures.</p>
 */
public class RowConverter {

    private final List<String> fields;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RowConverter(List<String> fields) {
        this.fields = List.copyOf(fields);
    }

    /**
     * Fails fast when the query and the field list disagree, before any document is written.
     */
    public void checkColumns(ResultSet resultSet) throws SQLException {
        int columns = resultSet.getMetaData().getColumnCount();
        if (columns != fields.size()) {
            throw new IllegalStateException("Projection returns " + columns
                    + " columns but the schema defines " + fields.size() + " fields");
        }
    }

    /**
     * Converts the current row of the result set.
     */
    public Map<String, Object> toDocument(ResultSet resultSet) throws SQLException {
        Map<String, Object> document = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            document.put(fields.get(i), convert(resultSet.getObject(i + 1)));
        }
        return document;
    }

    Object convert(Object value) throws SQLException {
        if (value == null) {
            return null;
        }
        if (value instanceof Array) {
            Object[] elements = (Object[]) ((Array) value).getArray();
            List<Object> list = new ArrayList<>(elements.length);
            for (Object element : elements) {
                list.add(convert(element));
            }
            return list;
        }
        if (value instanceof Date) {
            return ((Date) value).toLocalDate().toString();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toInstant().toString();
        }
        if (value instanceof PGobject) {
            return parseJson((PGobject) value);
        }
        return value;
    }

    private Object parseJson(PGobject object) throws SQLException {
        if (object.getValue() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(object.getValue(), Object.class);
        } catch (IOException e) {
            throw new SQLException("Unparseable " + object.getType() + " column value", e);
        }
    }
}
