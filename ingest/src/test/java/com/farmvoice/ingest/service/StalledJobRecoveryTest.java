package com.farmvoice.ingest.service;

import com.farmvoice.ingest.config.PipelineProperties;
import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;
import com.farmvoice.ingest.repository.JobRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StalledJobRecoveryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock JobRepository      jobRepo;
    @Mock PipelineDispatcher dispatcher;

    private final PipelineProperties properties = new PipelineProperties();

    @Test
    void startup_resumesEveryNonTerminalJob() {
        Job a = jobWithId();
        Job b = jobWithId();
        when(jobRepo.findByStatusIn(JobStatus.nonTerminal())).thenReturn(List.of(a, b));

        recovery().recoverOnStartup();

        verify(dispatcher).resume(a.getId());
        verify(dispatcher).resume(b.getId());
    }

    @Test
    void sweep_onlyTouchesStaleJobsNotInFlight() {
        Job idle    = jobWithId();
        Job running = jobWithId();
        Instant cutoff = NOW.minus(15, ChronoUnit.MINUTES);
        when(jobRepo.findByStatusInAndUpdatedAtBefore(JobStatus.nonTerminal(), cutoff))
                .thenReturn(List.of(idle, running));
        when(dispatcher.isInFlight(idle.getId())).thenReturn(false);
        when(dispatcher.isInFlight(running.getId())).thenReturn(true);

        recovery().sweep();

        verify(dispatcher).resume(idle.getId());
        verify(dispatcher, never()).resume(running.getId());
    }

    @Test
    void oneFailingResume_doesNotStopTheRest() {
        Job broken = jobWithId();
        Job fine   = jobWithId();
        when(jobRepo.findByStatusIn(JobStatus.nonTerminal())).thenReturn(List.of(broken, fine));
        when(dispatcher.resume(broken.getId())).thenThrow(new IllegalStateException("Job not found"));

        recovery().recoverOnStartup();

        verify(dispatcher).resume(fine.getId());
    }

    @Test
    void disabled_doesNothing() {
        properties.getRecovery().setEnabled(false);

        recovery().recoverOnStartup();
        recovery().sweep();

        verifyNoInteractions(jobRepo, dispatcher);
    }

    @Test
    void noStaleJobs_noResume() {
        when(jobRepo.findByStatusInAndUpdatedAtBefore(any(), any())).thenReturn(List.of());

        recovery().sweep();

        verify(dispatcher, never()).resume(any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StalledJobRecovery recovery() {
        return new StalledJobRecovery(jobRepo, dispatcher, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Job jobWithId() {
        Job job = new Job(UUID.randomUUID(), "a.m4a");
        try {
            var f = Job.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(job, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return job;
    }
}
