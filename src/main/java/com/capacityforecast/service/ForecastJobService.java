package com.capacityforecast.service;

import com.capacityforecast.dto.AsyncJobResponse;
import com.capacityforecast.dto.AsyncJobStatus;
import com.capacityforecast.dto.ForecastRunResponse;
import com.capacityforecast.exception.JobNotFoundException;
import com.capacityforecast.model.ModelId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks forecast runs started in the background. Cancelling a job disposes its subscription,
 * which interrupts the model workers and discards whatever they had produced.
 */
@Slf4j
@Service
public class ForecastJobService {

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    public UUID submit(String area, List<ModelId> models, String requestId, Mono<ForecastRunResponse> work) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, area, List.copyOf(models), requestId, Instant.now());
        jobs.put(jobId, state);
        cleanupIfNeeded();

        Disposable subscription = work
            .doOnSubscribe(s -> state.markRunning("Forecast run started", 5))
            .subscribe(
                run -> state.markCompleted(run, "Forecast run completed", 100),
                ex -> {
                    log.warn("Forecast job failed | jobId={} | error={}", jobId, ex.toString());
                    state.markFailed(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
                });
        state.attach(subscription);
        log.info("Forecast job submitted | jobId={} | area={} | models={} | requestId={}", jobId, area, models, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        return find(jobId).toResponse();
    }

    /**
     * Cancels a queued or running job. Jobs that already finished are returned unchanged.
     */
    public AsyncJobResponse cancel(UUID jobId) {
        JobState state = find(jobId);
        if (state.cancel()) {
            log.info("Forecast job cancelled | jobId={}", jobId);
        }
        return state.toResponse();
    }

    private JobState find(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state;
    }

    private void cleanupIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status.isTerminal())
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .toList()
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String area;
        private final List<ModelId> models;
        private final String requestId;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private volatile Integer progressPercent = 0;
        private volatile String message = "Queued";
        private volatile ForecastRunResponse result;
        private Disposable subscription;

        private JobState(UUID jobId, String area, List<ModelId> models, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.area = area;
            this.models = models;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private synchronized void attach(Disposable subscription) {
            this.subscription = subscription;
            if (status == AsyncJobStatus.CANCELLED) {
                subscription.dispose();
            }
        }

        private synchronized void markRunning(String message, int progress) {
            if (status.isTerminal()) {
                return;
            }
            this.startedAt = Instant.now();
            this.status = AsyncJobStatus.RUNNING;
            this.message = message;
            this.progressPercent = progress;
        }

        private synchronized void markCompleted(ForecastRunResponse result, String message, int progress) {
            if (status.isTerminal()) {
                return;
            }
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.COMPLETED;
            this.result = result;
            this.message = message;
            this.progressPercent = progress;
        }

        private synchronized void markFailed(String message) {
            if (status.isTerminal()) {
                return;
            }
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.FAILED;
            this.message = message;
            this.progressPercent = 100;
        }

        private synchronized boolean cancel() {
            if (status.isTerminal()) {
                return false;
            }
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.CANCELLED;
            this.message = "Cancelled";
            if (subscription != null) {
                subscription.dispose();
            }
            return true;
        }

        private AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .area(area)
                .models(models)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .progressPercent(progressPercent)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
