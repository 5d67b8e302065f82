package com.schemata.updates;

import com.schemata.core.ColumnType;
import com.schemata.core.InvalidSchemaChangeException;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

final class Checks {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]{0,127}");

    private Checks() {}

    static void require(boolean condition, String table, String reason) {
        if (!condition) {
            throw new InvalidSchemaChangeException(table, reason);
        }
    }

    static void identifier(String table, String kind, String name) {
        require(name != null && IDENTIFIER.matcher(name).matches(), table, "Invalid " + kind + " name: " + name);
    }

    static void columnType(String table, String column, ColumnType type) {
        require(type != null, table, "Column " + column + " needs a type");
        require(type.wellFormed(), table, "Column " + column + " has unsupported type " + type.ddlType());
    }

    /**
     * @return the first name that appears more than once, or {@code null}
     */
    static String firstDuplicate(Collection<String> names) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                return name;
            }
        }
        return null;
    }
}
