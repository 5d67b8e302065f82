package com.schemata.metadata;

import com.schemata.core.ModelDescriptor;
import com.schemata.core.Transaction;

import java.util.Map;

@FunctionalInterface
public interface ModelSource {
    /**
     * @param transaction snapshot to read under, or {@code null}
     * @return table name to freshly synthesized descriptor
     */
    Map<String, ModelDescriptor> models(Transaction transaction);
}
