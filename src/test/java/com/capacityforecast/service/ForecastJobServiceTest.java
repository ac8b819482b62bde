package com.capacityforecast.service;

import com.capacityforecast.dto.AsyncJobResponse;
import com.capacityforecast.dto.AsyncJobStatus;
import com.capacityforecast.dto.ForecastRunResponse;
import com.capacityforecast.exception.JobNotFoundException;
import com.capacityforecast.model.ModelId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.publisher.PublisherProbe;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class ForecastJobServiceTest {

    private ForecastJobService service;

    @BeforeEach
    void setUp() {
        service = new ForecastJobService();
        ReflectionTestUtils.setField(service, "maxRetained", 10);
    }

    @Test
    void completedWork_isReportedWithResult() {
        ForecastRunResponse response = ForecastRunResponse.builder().forecastRunId(UUID.randomUUID()).build();

        UUID jobId = service.submit("north", List.of(ModelId.PROPHET), "req-1", Mono.just(response));

        AsyncJobResponse job = service.getJob(jobId);
        assertThat(job.getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
        assertThat(job.getResult()).isSameAs(response);
        assertThat(job.getProgressPercent()).isEqualTo(100);
        assertThat(job.getStartedAt()).isNotNull();
        assertThat(job.getRequestId()).isEqualTo("req-1");
    }

    @Test
    void failedWork_isReportedWithMessage() {
        UUID jobId = service.submit(null, List.of(ModelId.VAR), "req-2",
                                    Mono.error(new IllegalStateException("Cannot forecast an empty series")));

        AsyncJobResponse job = service.getJob(jobId);
        assertThat(job.getStatus()).isEqualTo(AsyncJobStatus.FAILED);
        assertThat(job.getMessage()).isEqualTo("Cannot forecast an empty series");
        assertThat(job.getResult()).isNull();
    }

    @Test
    void cancel_disposesRunningWork() {
        PublisherProbe<ForecastRunResponse> probe = PublisherProbe.of(Mono.never());
        UUID jobId = service.submit("north", List.of(ModelId.RF), "req-3", probe.mono());
        assertThat(service.getJob(jobId).getStatus()).isEqualTo(AsyncJobStatus.RUNNING);

        AsyncJobResponse cancelled = service.cancel(jobId);

        assertThat(cancelled.getStatus()).isEqualTo(AsyncJobStatus.CANCELLED);
        assertThat(cancelled.getCompletedAt()).isNotNull();
        probe.assertWasCancelled();
        assertThat(service.cancel(jobId).getStatus()).isEqualTo(AsyncJobStatus.CANCELLED);
    }

    @Test
    void cancel_leavesFinishedJobUnchanged() {
        UUID jobId = service.submit("north", List.of(ModelId.RF), "req-4",
                                    Mono.just(ForecastRunResponse.builder().build()));

        assertThat(service.cancel(jobId).getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
    }

    @Test
    void unknownJob_throwsJobNotFound() {
        assertThatThrownBy(() -> service.getJob(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> service.cancel(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void finishedJobsBeyondRetentionLimit_areEvicted() throws InterruptedException {
        UUID first = service.submit("north", List.of(ModelId.RF), "r", Mono.just(ForecastRunResponse.builder().build()));
        Thread.sleep(5);
        for (int i = 0; i < 10; i++) {
            service.submit("north", List.of(ModelId.RF), "r", Mono.just(ForecastRunResponse.builder().build()));
        }

        UUID latest = service.submit("north", List.of(ModelId.RF), "r", Mono.just(ForecastRunResponse.builder().build()));

        assertThat(service.getJob(latest).getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
        assertThatThrownBy(() -> service.getJob(first)).isInstanceOf(JobNotFoundException.class);
    }
}
