package com.capacityforecast.controller;

import com.capacityforecast.config.RequestIdFilter;
import com.capacityforecast.dto.AsyncJobResponse;
import com.capacityforecast.dto.ForecastRunRequest;
import com.capacityforecast.dto.ForecastRunResponse;
import com.capacityforecast.dto.ForecastTablesResponse;
import com.capacityforecast.dto.PrepareSeriesRequest;
import com.capacityforecast.dto.PrepareSeriesResponse;
import com.capacityforecast.dto.StageBaseRequest;
import com.capacityforecast.model.ForecastResult;
import com.capacityforecast.model.ForecastRun;
import com.capacityforecast.service.CapacityPlanningService;
import com.capacityforecast.service.ForecastJobService;
import com.capacityforecast.store.SmoothedSeriesDocument;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final CapacityPlanningService planningService;
    private final ForecastJobService jobService;

    @PostMapping("/series/prepare")
    public ResponseEntity<PrepareSeriesResponse> prepare(@Valid @RequestBody PrepareSeriesRequest request) {
        log.info("POST /series/prepare | records={} | granularity={}", request.getRecords().size(), request.getGranularity());
        return ResponseEntity.ok(planningService.prepare(request));
    }

    @PostMapping("/forecasts")
    public Mono<ResponseEntity<ForecastRunResponse>> forecast(
            @Valid @RequestBody ForecastRunRequest request, HttpServletRequest httpRequest) {
        String requestId = requestId(httpRequest);
        log.info("POST /forecasts | models={} | horizon={} | requestId={}", request.getModels(), request.getHorizon(), requestId);
        return planningService.runForecast(request, requestId)
            .map(r -> ResponseEntity.status(HttpStatus.CREATED).body(r));
    }

    @PostMapping("/forecasts/async")
    public ResponseEntity<AsyncJobResponse> forecastAsync(
            @Valid @RequestBody ForecastRunRequest request, HttpServletRequest httpRequest) {
        String requestId = requestId(httpRequest);
        UUID jobId = planningService.submitForecast(request, requestId);
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(jobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(jobService.getJob(jobId));
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> cancelJob(@PathVariable UUID jobId) {
        log.info("DELETE /jobs/{}", jobId);
        return ResponseEntity.ok(jobService.cancel(jobId));
    }

    @GetMapping("/forecasts/{forecastRunId}")
    public ResponseEntity<ForecastRun> forecastRun(@PathVariable UUID forecastRunId) {
        return ResponseEntity.ok(planningService.getForecastRun(forecastRunId));
    }

    /** The optional body is the smoothed baseline used for the Final_smoothed_values row. */
    @PostMapping("/forecasts/{forecastRunId}/tables")
    public ResponseEntity<ForecastTablesResponse> tables(
            @PathVariable UUID forecastRunId,
            @RequestBody(required = false) SmoothedSeriesDocument baseline) {
        return ResponseEntity.ok(planningService.tables(forecastRunId, baseline));
    }

    @PostMapping("/areas/{area}/staged-forecast")
    public ResponseEntity<ForecastResult> stageBase(
            @PathVariable @Pattern(regexp = "[A-Za-z0-9_-]{1,64}") String area,
            @Valid @RequestBody StageBaseRequest request) {
        log.info("POST /areas/{}/staged-forecast | forecastRunId={} | policy={}", area, request.getForecastRunId(), request.getPolicy());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(planningService.stageBase(area, request.getForecastRunId(), request.getPolicy()));
    }

    static String requestId(HttpServletRequest request) {
        Object id = request.getAttribute(RequestIdFilter.ATTRIBUTE);
        return id != null ? id.toString() : UUID.randomUUID().toString();
    }
}
