package com.kpiforecast.service;

import com.kpiforecast.dto.AsyncJobResponse;
import com.kpiforecast.dto.AsyncJobStatus;
import com.kpiforecast.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs long operations on a bounded pool and keeps their status in memory. Finished jobs beyond
 * {@code jobs.max-retained} are evicted oldest first.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private ExecutorService executor;
    private final Map<UUID, Job> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void start() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Supplier<Object> task) {
        Job job = new Job(UUID.randomUUID(), jobType, requestId);
        jobs.put(job.id, job);
        evictFinished();
        executor.execute(() -> run(job, task));
        log.info("Job queued | jobId={} | type={} | requestId={}", job.id, jobType, requestId);
        return job.id;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.snapshot();
    }

    private void run(Job job, Supplier<Object> task) {
        job.started();
        try {
            job.completed(task.get());
            log.info("Job completed | jobId={} | type={}", job.id, job.type);
        } catch (RuntimeException ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            job.failed(reason);
            log.warn("Job failed | jobId={} | type={} | reason={}", job.id, job.type, reason, ex);
        }
    }

    private void evictFinished() {
        int excess = jobs.size() - maxRetained;
        if (excess <= 0) {
            return;
        }
        jobs.values().stream()
            .filter(Job::isFinished)
            .sorted(Comparator.comparing(j -> j.createdAt))
            .limit(excess)
            .map(j -> j.id)
            .toList()
            .forEach(jobs::remove);
    }

    private static final class Job {
        private final UUID id;
        private final String type;
        private final String requestId;
        private final Instant createdAt = Instant.now();
        private Instant startedAt;
        private Instant completedAt;
        private AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private String message = "Queued";
        private Object result;

        private Job(UUID id, String type, String requestId) {
            this.id = id;
            this.type = type;
            this.requestId = requestId;
        }

        synchronized void started() {
            startedAt = Instant.now();
            status = AsyncJobStatus.RUNNING;
            message = "Running";
        }

        synchronized void completed(Object value) {
            completedAt = Instant.now();
            status = AsyncJobStatus.COMPLETED;
            message = "Completed";
            result = value;
        }

        synchronized void failed(String reason) {
            completedAt = Instant.now();
            status = AsyncJobStatus.FAILED;
            message = reason;
        }

        synchronized boolean isFinished() {
            return status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED;
        }

        synchronized AsyncJobResponse snapshot() {
            return AsyncJobResponse.builder()
                .jobId(id)
                .jobType(type)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
