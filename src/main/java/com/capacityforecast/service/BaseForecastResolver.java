package com.capacityforecast.service;

import com.capacityforecast.exception.InputException;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;
import com.capacityforecast.store.ForecastStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Picks the base forecast for a transformation session. A staged forecast wins over the
 * latest exported run; the latest run is reduced to one forecast with the given policy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaseForecastResolver {

    private final ForecastStore forecastStore;
    private final ForecastOrchestrator orchestrator;

    public ForecastResult resolve(String area, SelectionPolicy policy) {
        Optional<ForecastResult> staged = forecastStore.loadStaged(area);
        if (staged.isPresent()) {
            log.info("Base forecast resolved | area={} | source=staged | model={}", area, staged.get().getModelId().key());
            return staged.get();
        }
        Optional<ForecastRun> latest = forecastStore.loadLatest(area);
        if (latest.isPresent()) {
            ForecastResult chosen = orchestrator.choose(latest.get(), policy);
            log.info("Base forecast resolved | area={} | source=latest | model={}", area, chosen.getModelId().key());
            return chosen;
        }
        throw new InputException("No staged or exported forecast for area '" + area + "'");
    }
}
