package com.farmvoice.ingest.repository;

import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Query operations for the recording_jobs table.
 *
 * Paging uses native LIMIT/OFFSET so list requests map directly onto
 * the offset/limit the API accepts.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /** Newest first, offset/limit paging across all tenants. */
    @Query(value = """
            SELECT * FROM recording_jobs
            ORDER BY created_at DESC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<Job> findNewestFirst(@Param("offset") int offset, @Param("limit") int limit);

    /** Newest first, offset/limit paging within one tenant. */
    @Query(value = """
            SELECT * FROM recording_jobs
            WHERE tenant_id = :tenantId
            ORDER BY created_at DESC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<Job> findNewestFirstByTenant(@Param("tenantId") UUID tenantId,
                                      @Param("offset") int offset,
                                      @Param("limit") int limit);

    /** Jobs in any of the given statuses, used by the recovery sweep. */
    List<Job> findByStatusIn(Collection<JobStatus> statuses);

    /** Jobs in any of the given statuses that have not been touched since 'cutoff'. */
    List<Job> findByStatusInAndUpdatedAtBefore(Collection<JobStatus> statuses, Instant cutoff);
}
