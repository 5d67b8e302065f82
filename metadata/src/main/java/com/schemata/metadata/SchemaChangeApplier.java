package com.schemata.metadata;

import com.fasterxml.uuid.Generators;
import com.schemata.core.AdminApi;
import com.schemata.core.ColumnUpdate;
import com.schemata.core.CreateTableUpdate;
import com.schemata.core.IndexUpdate;
import com.schemata.core.InvalidSchemaChangeException;
import com.schemata.core.ModelDescriptor;
import com.schemata.core.SchemaChangeTypeMismatchException;
import com.schemata.core.SchemaUpdate;
import com.schemata.core.TableAlreadyExistsException;
import com.schemata.core.Transaction;
import com.schemata.core.UnknownTableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Validates schema changes against freshly read models and submits their DDL.
 *
 * <p>Each call reads the catalog again and keeps nothing afterwards. A change that fails validation never
 * reaches the admin API. Concurrent changes to the same table are not coordinated here.
 */
public class SchemaChangeApplier {
    private static final Logger logger = LoggerFactory.getLogger(SchemaChangeApplier.class);

    private final ModelSource models;
    private final AdminApi adminApi;

    public SchemaChangeApplier(ModelSource models, AdminApi adminApi) {
        this.models = models;
        this.adminApi = adminApi;
    }

    public SchemaChangeResult applyColumnUpdate(SchemaUpdate update) {
        return applyColumnUpdate(update, null);
    }

    /**
     * @throws SchemaChangeTypeMismatchException if {@code update} is not a {@link ColumnUpdate}
     * @throws UnknownTableException             if the table does not exist
     * @throws InvalidSchemaChangeException      if the change does not fit the table
     */
    public SchemaChangeResult applyColumnUpdate(SchemaUpdate update, Transaction transaction) {
        ColumnUpdate columnUpdate = expect(ColumnUpdate.class, update);
        ModelDescriptor model = existing(columnUpdate, transaction);
        validated(columnUpdate, () -> columnUpdate.validate(model));
        return submit(columnUpdate.table(), columnUpdate.ddl(model));
    }

    public SchemaChangeResult applyCreateTableUpdate(SchemaUpdate update) {
        return applyCreateTableUpdate(update, null);
    }

    /**
     * @throws SchemaChangeTypeMismatchException if {@code update} is not a {@link CreateTableUpdate}
     * @throws TableAlreadyExistsException       if the table already exists
     * @throws InvalidSchemaChangeException      if the table definition is inconsistent
     */
    public SchemaChangeResult applyCreateTableUpdate(SchemaUpdate update, Transaction transaction) {
        CreateTableUpdate createTable = expect(CreateTableUpdate.class, update);
        Map<String, ModelDescriptor> current = models.models(transaction);
        if (current.containsKey(createTable.table())) {
            logger.warn("Rejected create of existing table {}", createTable.table());
            throw new TableAlreadyExistsException(createTable.table());
        }
        validated(createTable, () -> createTable.validate());
        return submit(createTable.table(), createTable.ddl());
    }

    public SchemaChangeResult applyIndexUpdate(SchemaUpdate update) {
        return applyIndexUpdate(update, null);
    }

    /**
     * @throws SchemaChangeTypeMismatchException if {@code update} is not an {@link IndexUpdate}
     * @throws UnknownTableException             if the table does not exist
     * @throws InvalidSchemaChangeException      if the index does not fit the table
     */
    public SchemaChangeResult applyIndexUpdate(SchemaUpdate update, Transaction transaction) {
        IndexUpdate indexUpdate = expect(IndexUpdate.class, update);
        ModelDescriptor model = existing(indexUpdate, transaction);
        validated(indexUpdate, () -> indexUpdate.validate(model));
        return submit(indexUpdate.table(), indexUpdate.ddl(model));
    }

    public SchemaChangeResult apply(SchemaUpdate update) {
        return apply(update, null);
    }

    /**
     * Dispatches {@code update} to the apply operation for its kind.
     */
    public SchemaChangeResult apply(SchemaUpdate update, Transaction transaction) {
        if (update instanceof ColumnUpdate) {
            return applyColumnUpdate(update, transaction);
        } else if (update instanceof CreateTableUpdate) {
            return applyCreateTableUpdate(update, transaction);
        } else if (update instanceof IndexUpdate) {
            return applyIndexUpdate(update, transaction);
        }
        throw new SchemaChangeTypeMismatchException(SchemaUpdate.class, update);
    }

    private static <T extends SchemaUpdate> T expect(Class<T> kind, SchemaUpdate update) {
        if (!kind.isInstance(update)) {
            throw new SchemaChangeTypeMismatchException(kind, update);
        }
        return kind.cast(update);
    }

    private ModelDescriptor existing(SchemaUpdate update, Transaction transaction) {
        ModelDescriptor model = models.models(transaction).get(update.table());
        if (model == null) {
            logger.warn("Rejected {} for unknown table {}", update.getClass().getSimpleName(), update.table());
            throw new UnknownTableException(update.table());
        }
        return model;
    }

    private static void validated(SchemaUpdate update, Runnable validation) {
        try {
            validation.run();
        } catch (InvalidSchemaChangeException e) {
            logger.warn("Rejected {} on {}: {}", update.getClass().getSimpleName(), update.table(), e.getMessage());
            throw e;
        }
    }

    private SchemaChangeResult submit(String table, List<String> ddl) {
        String operationId = Generators.timeBasedGenerator().generate().toString();
        logger.info("Submitting schema update {} for {}: {}", operationId, table, ddl);
        adminApi.updateSchema(ddl, operationId);
        return new SchemaChangeResult(table, ddl, operationId);
    }
}
