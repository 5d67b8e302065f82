package com.schemata.repositories.rdbms;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemata.core.CatalogReadException;
import com.schemata.core.CatalogRelation;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Converts JDBC rows into catalog records.
 */
public interface Converters {
    ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Reads the current row into a map keyed by lower-cased column label.
     *
     * @param rs ResultSet positioned at the row to convert
     */
    static Map<String, Object> resultSetToRow(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getObject(i));
        }
        return row;
    }

    static <T> T rowToRecord(Map<String, Object> row, CatalogRelation<T> relation) {
        try {
            return OBJECT_MAPPER.convertValue(row, relation.rowType());
        } catch (IllegalArgumentException e) {
            throw new CatalogReadException("Malformed " + relation.name() + " row: " + row, e);
        }
    }
}
