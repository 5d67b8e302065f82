package com.schemata.repositories.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raw catalog rows, keyed by relation name. Rows keep insertion order.
 */
public class InMemoryStore {
    private final Map<String, List<Map<String, Object>>> db = new ConcurrentHashMap<>();

    public void add(String relation, Map<String, Object> row) {
        List<Map<String, Object>> rows = db.computeIfAbsent(relation, r -> new ArrayList<>());
        synchronized (rows) {
            rows.add(new LinkedHashMap<>(row));
        }
    }

    public List<Map<String, Object>> rows(String relation) {
        List<Map<String, Object>> rows = db.get(relation);
        if (rows == null) {
            return List.of();
        }
        synchronized (rows) {
            return new ArrayList<>(rows);
        }
    }

    public void clear(String relation) {
        db.remove(relation);
    }

    /**
     * @return a deep copy of every relation; later changes to this store do not show up in it
     */
    public Map<String, List<Map<String, Object>>> copy() {
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        for (String relation : db.keySet()) {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (Map<String, Object> row : rows(relation)) {
                rows.add(new LinkedHashMap<>(row));
            }
            copy.put(relation, rows);
        }
        return copy;
    }
}
