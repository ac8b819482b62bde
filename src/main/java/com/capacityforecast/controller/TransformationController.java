package com.capacityforecast.controller;

import com.capacityforecast.dto.StageRequest;
import com.capacityforecast.dto.TransformationRequest;
import com.capacityforecast.model.TransformationRun;
import com.capacityforecast.service.CapacityPlanningService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/transformations")
@RequiredArgsConstructor
public class TransformationController {

    private final CapacityPlanningService planningService;

    @PostMapping
    public ResponseEntity<TransformationRun> transform(@Valid @RequestBody TransformationRequest request) {
        log.info("POST /transformations | forecastRunId={} | area={} | stages={}",
                 request.getForecastRunId(), request.getArea(), request.getStages().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(planningService.transform(request));
    }

    @PostMapping("/{runId}/rerun")
    public ResponseEntity<TransformationRun> rerun(
            @PathVariable UUID runId, @RequestBody List<@Valid StageRequest> stages) {
        log.info("POST /transformations/{}/rerun | stages={}", runId, stages.size());
        return ResponseEntity.status(HttpStatus.CREATED).body(planningService.rerun(runId, stages));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<TransformationRun> get(@PathVariable UUID runId) {
        return ResponseEntity.ok(planningService.getTransformation(runId));
    }

    @GetMapping("/{runId}/transposed")
    public ResponseEntity<Map<LocalDate, Map<String, Double>>> transposed(@PathVariable UUID runId) {
        return ResponseEntity.ok(planningService.getTransformation(runId).getTransposedView());
    }
}
