package com.capacityforecast.forecast;

import com.capacityforecast.config.Hyperparameters;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ModelId;
import com.capacityforecast.model.Series;

/**
 * One forecasting technique. Implementations never throw: a fit that cannot be completed is
 * reported as a {@code FAILED} result carrying the reason.
 */
public interface ForecastModel {

    ModelId id();

    ForecastResult fitAndForecast(Series history, int horizon, Hyperparameters hyperparameters);
}
