package com.capacityforecast.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    @Value("${planner.model-pool-size:4}")
    private int modelPoolSize;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService modelExecutor() {
        return Executors.newFixedThreadPool(Math.max(2, modelPoolSize), namedThreads("forecast-model-"));
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler modelScheduler(ExecutorService modelExecutor) {
        return Schedulers.fromExecutorService(modelExecutor, "forecast-models");
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
