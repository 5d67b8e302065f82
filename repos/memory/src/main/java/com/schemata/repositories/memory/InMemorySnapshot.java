package com.schemata.repositories.memory;

import com.schemata.core.Transaction;

import java.util.List;
import java.util.Map;

/**
 * A frozen copy of an {@link InMemoryStore}.
 */
public class InMemorySnapshot implements Transaction {
    private final Map<String, List<Map<String, Object>>> rows;
    private volatile boolean open = true;

    InMemorySnapshot(Map<String, List<Map<String, Object>>> rows) {
        this.rows = rows;
    }

    List<Map<String, Object>> rows(String relation) {
        return rows.getOrDefault(relation, List.of());
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }
}
