package com.capacityforecast.store;

import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Storage collaborator for forecasts, keyed by planning area.
 */
public interface ForecastStore {

    /** Base forecast staged for the transformation wizard, if any. */
    Optional<ForecastResult> loadStaged(String area);

    void saveStaged(String area, ForecastResult forecast);

    /** Most recently exported forecast run, if any. */
    Optional<ForecastRun> loadLatest(String area);

    Path exportRun(String area, ForecastRun run);

    Path exportDirectory();
}
