package com.eainde.forecast.store;

import java.util.List;
import java.util.Optional;

public interface ForecastStore {

    void save(ForecastRecord record);

    Optional<ForecastRecord> findById(String runId);

    List<ForecastRecord> findAll();
}
