package com.digitalgroup.zapdesk.job.repository;

import com.digitalgroup.zapdesk.job.entity.ScheduledJob;
import com.digitalgroup.zapdesk.job.entity.ScheduledJob.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, Long> {

    List<ScheduledJob> findByStatusAndExecuteAtBeforeOrderByExecuteAtAsc(
            JobStatus status, LocalDateTime threshold);

    /**
     * Find pending jobs ready to execute now
     */
    default List<ScheduledJob> findReadyToExecute() {
        return findByStatusAndExecuteAtBeforeOrderByExecuteAtAsc(
                JobStatus.PENDING, LocalDateTime.now());
    }

    List<ScheduledJob> findByStatusOrderByExecuteAtAsc(JobStatus status);

    /**
     * Moves a job from PENDING to RUNNING. Returns 0 when another worker got there first.
     */
    @Modifying
    @Transactional
    @Query("UPDATE ScheduledJob j SET j.status = 'RUNNING' WHERE j.id = :id AND j.status = 'PENDING'")
    int claim(@Param("id") Long id);

    @Modifying
    @Transactional
    @Query("DELETE FROM ScheduledJob j WHERE j.status IN ('COMPLETED', 'FAILED') AND j.createdAt < :threshold")
    int deleteOldJobs(@Param("threshold") LocalDateTime threshold);

    /**
     * Mark stuck jobs as failed (running for more than 1 hour)
     */
    @Modifying
    @Transactional
    @Query("UPDATE ScheduledJob j SET j.status = 'FAILED', j.errorMessage = 'Timeout - job stuck' " +
           "WHERE j.status = 'RUNNING' AND j.executeAt < :threshold")
    int markStuckJobsAsFailed(@Param("threshold") LocalDateTime threshold);

    long countByJobTypeAndStatus(String jobType, JobStatus status);
}
