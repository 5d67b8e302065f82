package com.schemata.updates;

import com.schemata.core.ColumnType;
import com.schemata.core.ColumnUpdate;
import com.schemata.core.ModelDescriptor;
import com.schemata.core.TypeKind;

import java.util.List;
import java.util.Map;

import static com.schemata.updates.Checks.columnType;
import static com.schemata.updates.Checks.require;

/**
 * Changes the type or nullability of a column that is not part of the primary key.
 *
 * <p>The base type may only move between {@code STRING} and {@code BYTES}, also as array elements.
 * Length and nullability may change freely. Columns whose current type is not well formed cannot be altered.
 */
public record AlterColumn(String table, String column, ColumnType type) implements ColumnUpdate {

    @Override
    public void validate(ModelDescriptor model) {
        columnType(table, column, type);
        ColumnType current = model.columnType(column).orElse(null);
        require(current != null, table, "Column " + column + " does not exist on " + table);
        require(!model.primaryIndexKeys().contains(column), table,
                "Column " + column + " is part of the primary key of " + table);
        require(convertible(current, type), table,
                "Column " + column + " cannot change from " + current.ddlType() + " to " + type.ddlType());
    }

    @Override
    public List<String> ddl(ModelDescriptor model) {
        return List.of(DdlTemplates.shared().render("alter_column", Map.of(
                "table", table,
                "column", column,
                "type", type.ddl())));
    }

    static boolean convertible(ColumnType from, ColumnType to) {
        if (!from.wellFormed() || !to.wellFormed()) {
            return false;
        }
        TypeKind fromKind = from.kind();
        TypeKind toKind = to.kind();
        if (fromKind == TypeKind.ARRAY || toKind == TypeKind.ARRAY) {
            return fromKind == toKind && convertible(from.elementType(), to.elementType());
        }
        if (fromKind == toKind) {
            return true;
        }
        return isText(fromKind) && isText(toKind);
    }

    private static boolean isText(TypeKind kind) {
        return kind == TypeKind.STRING || kind == TypeKind.BYTES;
    }
}
