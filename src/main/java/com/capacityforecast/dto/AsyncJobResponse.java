package com.capacityforecast.dto;

import com.capacityforecast.model.ModelId;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Status of an asynchronous forecast run. {@code result} is only set once the job completes.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AsyncJobResponse {
    UUID jobId;
    String area;
    List<ModelId> models;
    AsyncJobStatus status;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;
    Integer progressPercent;
    String message;
    ForecastRunResponse result;
    String requestId;
}
