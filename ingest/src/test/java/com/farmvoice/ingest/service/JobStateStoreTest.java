package com.farmvoice.ingest.service;

import com.farmvoice.ingest.model.Confidence;
import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;
import com.farmvoice.ingest.port.Extraction;
import com.farmvoice.ingest.port.Transcription;
import com.farmvoice.ingest.repository.JobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobStateStoreTest {

    @Mock JobRepository jobRepo;

    JobStateStore store;
    Job job;
    UUID id;

    @BeforeEach
    void setUp() {
        store = new JobStateStore(jobRepo);
        job   = new Job(UUID.randomUUID(), "a.m4a");
        id    = UUID.randomUUID();
        lenient().when(jobRepo.findById(id)).thenReturn(Optional.of(job));
    }

    @Test
    void recordTranscript_storesTextAndAdvances() {
        when(jobRepo.save(job)).thenReturn(job);
        job.transitionTo(JobStatus.TRANSCRIBING);

        store.recordTranscript(id, new Transcription("a red heifer", Confidence.HIGH));

        assertThat(job.getStatus()).isEqualTo(JobStatus.TRANSCRIBED);
        assertThat(job.getTranscript()).isEqualTo("a red heifer");
        verify(jobRepo).save(job);
    }

    @Test
    void recordExtraction_keepsStatus() {
        when(jobRepo.save(job)).thenReturn(job);

        store.recordExtraction(id, new Extraction("animal", Confidence.MEDIUM, Map.of("sex", "Female"), null));

        assertThat(job.getStatus()).isEqualTo(JobStatus.UPLOADED);
        assertThat(job.getEntityType()).isEqualTo("animal");
        assertThat(job.getExtractionConfidence()).isEqualTo(Confidence.MEDIUM);
        assertThat(job.getExtractedFields()).containsEntry("sex", "Female");
    }

    @Test
    void markFailed_onTerminalJob_leavesItUntouched() {
        job.fail("Remote sync failed: 500");

        store.markFailed(id, "Unexpected error: late");

        assertThat(job.getError()).isEqualTo("Remote sync failed: 500");
        verify(jobRepo, never()).save(any());
    }

    @Test
    void advance_illegalEdge_throwsAndDoesNotSave() {
        assertThatThrownBy(() -> store.advance(id, JobStatus.PROCESSING))
                .isInstanceOf(IllegalStateException.class);
        verify(jobRepo, never()).save(any());
    }

    @Test
    void unknownJob_throws() {
        UUID other = UUID.randomUUID();
        when(jobRepo.findById(other)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.resetForReprocess(other))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(other.toString());
    }
}
