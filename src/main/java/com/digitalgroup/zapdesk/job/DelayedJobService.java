package com.digitalgroup.zapdesk.job;

import com.digitalgroup.zapdesk.job.entity.ScheduledJob;
import com.digitalgroup.zapdesk.job.entity.ScheduledJob.JobStatus;
import com.digitalgroup.zapdesk.job.repository.ScheduledJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Delayed Job Service
 * Persists backfill jobs (avatar retries, masked identity resolution) and runs
 * them on an in-memory scheduler. Pending rows are recovered on startup and
 * swept periodically, and each run claims its row first so a job never runs twice.
 */
@Slf4j
@Service
public class DelayedJobService {

    private ScheduledExecutorService scheduler;
    private final ScheduledJobRepository scheduledJobRepository;
    private final ApplicationContext applicationContext;
    private final ObjectMapper objectMapper;

    public DelayedJobService(ScheduledJobRepository scheduledJobRepository,
                             ApplicationContext applicationContext,
                             ObjectMapper objectMapper) {
        this.scheduledJobRepository = scheduledJobRepository;
        this.applicationContext = applicationContext;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        scheduler = Executors.newScheduledThreadPool(4, r -> {
            Thread t = new Thread(r, "backfill-job");
            t.setDaemon(true);
            return t;
        });
        log.info("DelayedJobService initialized with 4 worker threads");
        recoverPendingJobs();
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("DelayedJobService shutdown complete");
    }

    private void recoverPendingJobs() {
        List<ScheduledJob> pendingJobs = scheduledJobRepository.findByStatusOrderByExecuteAtAsc(JobStatus.PENDING);
        if (pendingJobs.isEmpty()) {
            log.info("No pending jobs to recover");
            return;
        }
        log.info("Recovering {} pending jobs from database", pendingJobs.size());
        pendingJobs.forEach(this::schedulePersistedJob);
    }

    private void schedulePersistedJob(ScheduledJob job) {
        long delayMs = Math.max(0, Duration.between(LocalDateTime.now(), job.getExecuteAt()).toMillis());
        Long jobId = job.getId();
        scheduler.schedule(() -> executePersistedJob(jobId), delayMs, TimeUnit.MILLISECONDS);
        log.debug("Scheduled job {} ({}) in {}ms", jobId, job.getJobName(), delayMs);
    }

    /**
     * Jobs enqueued inside a transaction start only once their row is committed.
     */
    private void scheduleAfterCommit(ScheduledJob job) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            schedulePersistedJob(job);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                schedulePersistedJob(job);
            }
        });
    }

    /**
     * Runs a persisted job if it is still pending. Failures are recorded on the row.
     */
    public void executePersistedJob(Long jobId) {
        if (scheduledJobRepository.claim(jobId) == 0) {
            log.debug("Job {} already claimed or not yet visible, skipping", jobId);
            return;
        }
        ScheduledJob job = scheduledJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            return;
        }
        try {
            executeJobByType(job);
            job.setStatus(JobStatus.COMPLETED);
            job.setExecutedAt(LocalDateTime.now());
            scheduledJobRepository.save(job);
            log.debug("Completed job {} ({})", job.getId(), job.getJobName());
        } catch (RuntimeException e) {
            log.error("Error executing job {} ({}): {}", job.getId(), job.getJobName(), e.getMessage(), e);
            job.setStatus(JobStatus.FAILED);
            job.setExecutedAt(LocalDateTime.now());
            job.setErrorMessage(e.getMessage());
            scheduledJobRepository.save(job);
        }
    }

    private void executeJobByType(ScheduledJob job) {
        Map<String, Object> data = parseJobData(job.getJobData());
        Long leadId = getLongValue(data, "leadId");
        Long gatewayConfigId = getLongValue(data, "gatewayConfigId");
        int attempt = job.getAttempt() != null ? job.getAttempt() : 1;

        if (leadId == null || gatewayConfigId == null) {
            log.warn("Job {} ({}) is missing leadId or gatewayConfigId", job.getId(), job.getJobType());
            return;
        }

        switch (job.getJobType()) {
            case ScheduledJob.TYPE_AVATAR_RETRY ->
                    applicationContext.getBean(AvatarRetryJob.class).run(leadId, gatewayConfigId, attempt);
            case ScheduledJob.TYPE_MASKED_IDENTITY_RESOLVE ->
                    applicationContext.getBean(MaskedIdentityResolveJob.class).run(leadId, gatewayConfigId, attempt);
            default -> log.warn("Unknown job type: {}", job.getJobType());
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parseJobData(String jobData) {
        if (jobData == null || jobData.isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(jobData, Map.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse job data: {}", e.getMessage());
            return Map.of();
        }
    }

    private Long getLongValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        return null;
    }

    /**
     * Persist a job and schedule it in memory.
     */
    public ScheduledJob scheduleWithPersistence(String jobType, String jobName, Map<String, Object> data,
                                                int attempt, long delaySeconds) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job data for " + jobName + " is not serializable", e);
        }

        ScheduledJob job = scheduledJobRepository.save(ScheduledJob.builder()
                .jobName(jobName)
                .jobType(jobType)
                .jobData(payload)
                .attempt(attempt)
                .executeAt(LocalDateTime.now().plusSeconds(delaySeconds))
                .status(JobStatus.PENDING)
                .build());

        scheduleAfterCommit(job);
        log.debug("Persisted job {} ({}) attempt {} to run in {}s", job.getId(), jobName, attempt, delaySeconds);
        return job;
    }

    public ScheduledJob scheduleAvatarRetry(Long leadId, Long gatewayConfigId, int attempt, long delaySeconds) {
        return scheduleWithPersistence(
                ScheduledJob.TYPE_AVATAR_RETRY,
                "AvatarRetry-" + leadId,
                Map.of("leadId", leadId, "gatewayConfigId", gatewayConfigId),
                attempt,
                delaySeconds
        );
    }

    public ScheduledJob scheduleMaskedIdentityResolution(Long leadId, Long gatewayConfigId, int attempt,
                                                         long delaySeconds) {
        return scheduleWithPersistence(
                ScheduledJob.TYPE_MASKED_IDENTITY_RESOLVE,
                "MaskedIdentityResolve-" + leadId,
                Map.of("leadId", leadId, "gatewayConfigId", gatewayConfigId),
                attempt,
                delaySeconds
        );
    }

    /**
     * Cleanup old completed/failed jobs (runs daily at 3 AM)
     */
    @Scheduled(cron = "0 0 3 * * *")
    public void cleanupOldJobs() {
        int deleted = scheduledJobRepository.deleteOldJobs(LocalDateTime.now().minusDays(7));
        if (deleted > 0) {
            log.info("Cleaned up {} old scheduled jobs", deleted);
        }
    }

    /**
     * Mark stuck jobs as failed (runs every 30 minutes)
     */
    @Scheduled(fixedDelay = 1800000)
    public void markStuckJobs() {
        int marked = scheduledJobRepository.markStuckJobsAsFailed(LocalDateTime.now().minusHours(1));
        if (marked > 0) {
            log.warn("Marked {} stuck jobs as failed", marked);
        }
    }

    /**
     * Pick up pending jobs whose in-memory schedule was lost (runs every 30 seconds)
     */
    @Scheduled(fixedDelay = 30000, initialDelay = 30000)
    public void processPendingJobs() {
        List<ScheduledJob> ready = scheduledJobRepository.findReadyToExecute();
        if (!ready.isEmpty()) {
            log.debug("Sweeping {} ready jobs", ready.size());
            ready.forEach(job -> scheduler.execute(() -> executePersistedJob(job.getId())));
        }
    }
}
