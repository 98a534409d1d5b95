package com.auditsentinel.core;

import com.auditsentinel.core.config.EngineConfig;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.feature.FeatureBuilder;
import com.auditsentinel.core.model.Record;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test batches.
 */
public final class SampleRecords {

    private SampleRecords() {
    }

    /**
     * Five ledger lines: #2 is far above the ceiling, #4 is zero and #5 is a
     * negative receivable.
     */
    public static List<Record> ledger() {
        return List.of(
                record(1, 50_000, "1001", "2024-01-01"),
                record(2, 15_000_000, "1002", "2024-01-02"),
                record(3, 20_000, "1003", "2024-01-03"),
                record(4, 0, "1001", "2024-01-04"),
                record(5, -5_000, "应收账款", "2024-01-05"));
    }

    /**
     * {@code size} records with a single numeric field {@code quantity}
     * between 100 and 109, followed by one record at {@code outlier}.
     */
    public static List<Record> quantities(int size, double outlier) {
        List<Record> records = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            records.add(Record.of(Map.of("id", i, "quantity", 100 + (i % 10))));
        }
        records.add(Record.of(Map.of("id", size, "quantity", outlier)));
        return records;
    }

    public static FeatureBatch build(List<Record> records) {
        return new FeatureBuilder(new EngineConfig()).build(records);
    }

    public static Record record(int id, double amount, String account, String date) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", id);
        fields.put("amount", amount);
        fields.put("account", account);
        fields.put("date", date);
        return Record.of(fields);
    }
}
