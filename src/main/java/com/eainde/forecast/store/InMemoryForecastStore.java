package com.eainde.forecast.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryForecastStore implements ForecastStore {

    private final Map<String, ForecastRecord> storage = new ConcurrentHashMap<>();

    @Override
    public void save(ForecastRecord record) {
        if (record.runId() == null || record.runId().isBlank()) {
            throw new IllegalArgumentException("Run ID is required");
        }
        storage.put(record.runId(), record);
    }

    @Override
    public Optional<ForecastRecord> findById(String runId) {
        if (runId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storage.get(runId));
    }

    @Override
    public List<ForecastRecord> findAll() {
        List<ForecastRecord> records = new ArrayList<>(storage.values());
        records.sort(Comparator.comparing(ForecastRecord::completedAt));
        return records;
    }
}
