package com.farmvoice.ingest.pipeline;

import com.farmvoice.ingest.config.PipelineProperties;
import com.farmvoice.ingest.mapping.AnimalRequiredFields;
import com.farmvoice.ingest.mapping.ValidationRule;
import com.farmvoice.ingest.model.Confidence;
import com.farmvoice.ingest.model.Job;
import com.farmvoice.ingest.model.JobStatus;
import com.farmvoice.ingest.port.AudioBlob;
import com.farmvoice.ingest.port.BlobStore;
import com.farmvoice.ingest.port.Extraction;
import com.farmvoice.ingest.port.Extractor;
import com.farmvoice.ingest.port.MappingProvider;
import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.PipelineException.Kind;
import com.farmvoice.ingest.port.RateLimitedException;
import com.farmvoice.ingest.port.RemoteCreator;
import com.farmvoice.ingest.port.RemoteCreatorFactory;
import com.farmvoice.ingest.port.RemoteRecord;
import com.farmvoice.ingest.port.TenantMapping;
import com.farmvoice.ingest.port.Transcriber;
import com.farmvoice.ingest.port.Transcription;
import com.farmvoice.ingest.repository.JobRepository;
import com.farmvoice.ingest.retry.RetryPolicy;
import com.farmvoice.ingest.service.JobStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Pipeline runs against mocked capability ports.
 *
 * The job lives in a mocked JobRepository; every save records the status
 * it was saved with, so the tests can assert the exact sequence a poller
 * would have observed.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RecordingPipelineTest {

    private static final UUID   TENANT    = UUID.randomUUID();
    private static final String AUDIO_REF = "tenant-a/heifer-12345.m4a";
    private static final String HEIFER_TRANSCRIPT =
            "New heifer, ear tag one two three four five, Angus, female, born first of March 2024, "
            + "she's in the north pasture.";

    @Mock JobRepository        jobRepo;
    @Mock BlobStore            blobStore;
    @Mock Transcriber          transcriber;
    @Mock Extractor            extractor;
    @Mock MappingProvider      mappingProvider;
    @Mock RemoteCreatorFactory remoteCreators;
    @Mock RemoteCreator        remoteCreator;

    SimpleMeterRegistry meterRegistry;
    PortCalls           portCalls;
    RecordingPipeline   pipeline;

    Job job;
    final List<JobStatus> savedStatuses = new ArrayList<>();

    @BeforeEach
    void setUp() {
        job = jobWithId(new Job(TENANT, AUDIO_REF));
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(jobRepo.save(any(Job.class))).thenAnswer(inv -> {
            Job saved = inv.getArgument(0);
            savedStatuses.add(saved.getStatus());
            return saved;
        });

        // Happy-path defaults; individual tests override the stage they break.
        when(blobStore.fetch(AUDIO_REF)).thenReturn(new AudioBlob("heifer-12345.m4a", new byte[]{1, 2, 3}));
        when(transcriber.transcribe(any())).thenReturn(new Transcription(HEIFER_TRANSCRIPT, Confidence.HIGH));
        when(mappingProvider.activeMappings(TENANT)).thenReturn(List.of(animalMapping()));
        when(extractor.extract(anyString(), anyList()))
                .thenReturn(new Extraction("animal", Confidence.HIGH, heiferFields(), null));
        when(remoteCreators.forTenant(TENANT)).thenReturn(remoteCreator);
        when(remoteCreator.create(anyString(), anyMap())).thenReturn(new RemoteRecord("crm-001"));

        meterRegistry = new SimpleMeterRegistry();
        portCalls     = new PortCalls(new PipelineProperties());
        pipeline = new RecordingPipeline(
                new JobStateStore(jobRepo),
                blobStore, transcriber, extractor, mappingProvider, remoteCreators,
                new AnimalRequiredFields(),
                new RetryPolicy(3, Duration.ofSeconds(1), d -> { }),
                portCalls,
                meterRegistry);
    }

    @AfterEach
    void tearDown() {
        portCalls.shutdown();
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void heiferRecording_endsSyncedWithEveryOutputStored() {
        pipeline.process(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.SYNCED);
        assertThat(job.getError()).isNull();
        assertThat(job.getTranscript()).isEqualTo(HEIFER_TRANSCRIPT);
        assertThat(job.getTranscriptConfidence()).isEqualTo(Confidence.HIGH);
        assertThat(job.getEntityType()).isEqualTo("animal");
        assertThat(job.getExtractionConfidence()).isEqualTo(Confidence.HIGH);
        assertThat(job.getExtractedFields()).containsEntry("ear_tag", "12345");
        assertThat(job.getRemoteRecordId()).isEqualTo("crm-001");
        assertThat(job.getCompletedAt()).isNotNull();
    }

    @Test
    void heiferRecording_statusSequenceIsExactlyThePipelineOrder() {
        pipeline.process(job.getId());

        assertThat(distinctRuns(savedStatuses)).containsExactly(
                JobStatus.TRANSCRIBING, JobStatus.TRANSCRIBED, JobStatus.PROCESSING, JobStatus.SYNCED);
    }

    @SuppressWarnings("unchecked")
    @Test
    void heiferRecording_sendsOnlyMappedFieldsUnderCrmNames() {
        pipeline.process(job.getId());

        ArgumentCaptor<Map<String, Object>> sent = ArgumentCaptor.forClass(Map.class);
        verify(remoteCreator).create(eq("bt_animals"), sent.capture());
        assertThat(sent.getValue())
                .containsEntry("bt_ear_tag", "12345")
                .containsEntry("bt_species", "Cattle")
                .doesNotContainKey("ear_tag")
                .doesNotContainKey("location");
    }

    @Test
    void entityTypeMatchesMappingIgnoringCase() {
        when(extractor.extract(anyString(), anyList()))
                .thenReturn(new Extraction("Animal", Confidence.MEDIUM, heiferFields(), null));

        pipeline.process(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.SYNCED);
    }

    @Test
    void rateLimitedTwice_thenSucceeds() {
        when(extractor.extract(anyString(), anyList()))
                .thenThrow(new RateLimitedException("429"))
                .thenThrow(new RateLimitedException("429"))
                .thenReturn(new Extraction("animal", Confidence.HIGH, heiferFields(), null));

        pipeline.process(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.SYNCED);
        verify(extractor, times(3)).extract(anyString(), anyList());
    }

    @Test
    void successfulRun_isCountedAsSynced() {
        pipeline.process(job.getId());

        assertThat(meterRegistry.counter("farmvoice.pipeline.runs", "outcome", "synced").count()).isEqualTo(1.0);
        assertThat(meterRegistry.timer("farmvoice.pipeline.duration", "outcome", "synced").count()).isEqualTo(1);
    }

    @Test
    void mdcIsClearedAfterRun() {
        pipeline.process(job.getId());

        assertThat(MDC.get("jobId")).isNull();
        assertThat(MDC.get("tenantId")).isNull();
    }

    // ------------------------------------------------------------------
    // Failures, one per stage
    // ------------------------------------------------------------------

    @Test
    void missingAudio_failsBeforeTranscribing() {
        when(blobStore.fetch(AUDIO_REF))
                .thenThrow(new PipelineException(Kind.STORAGE, "File not found: " + AUDIO_REF));

        pipeline.process(job.getId());

        assertFailed("Audio retrieval failed: File not found: " + AUDIO_REF);
        assertThat(savedStatuses).containsExactly(JobStatus.FAILED);
        verifyNoInteractions(transcriber);
        assertThat(meterRegistry.counter("farmvoice.pipeline.runs", "outcome", "storage").count()).isEqualTo(1.0);
    }

    @Test
    void transcriptionError_failsWithPrefix() {
        when(transcriber.transcribe(any()))
                .thenThrow(new PipelineException(Kind.TRANSCRIPTION, "Whisper API error 500: oops"));

        pipeline.process(job.getId());

        assertFailed("Transcription failed: Whisper API error 500: oops");
        assertThat(savedStatuses).containsExactly(JobStatus.TRANSCRIBING, JobStatus.FAILED);
    }

    @Test
    void stalledTranscriber_failsWhenStageTimeoutElapses() {
        PipelineProperties properties = new PipelineProperties();
        properties.getTimeouts().setTranscription(Duration.ofSeconds(1));
        PortCalls shortCalls = new PortCalls(properties);
        CountDownLatch never = new CountDownLatch(1);
        when(transcriber.transcribe(any())).thenAnswer(inv -> {
            never.await(30, TimeUnit.SECONDS);
            return new Transcription(HEIFER_TRANSCRIPT, Confidence.HIGH);
        });
        RecordingPipeline impatient = new RecordingPipeline(
                new JobStateStore(jobRepo),
                blobStore, transcriber, extractor, mappingProvider, remoteCreators,
                new AnimalRequiredFields(),
                new RetryPolicy(3, Duration.ofSeconds(1), d -> { }),
                shortCalls,
                meterRegistry);

        try {
            impatient.process(job.getId());
        } finally {
            shortCalls.shutdown();
        }

        assertFailed("Transcription failed: timed out after 1s");
        assertThat(savedStatuses).containsExactly(JobStatus.TRANSCRIBING, JobStatus.FAILED);
        verifyNoInteractions(extractor);
        assertThat(meterRegistry.counter("farmvoice.pipeline.runs", "outcome", "transcription").count())
                .isEqualTo(1.0);
    }

    @Test
    void blankTranscript_isATranscriptionFailure() {
        when(transcriber.transcribe(any())).thenReturn(new Transcription("   ", Confidence.LOW));

        pipeline.process(job.getId());

        assertFailed("Transcription failed: no speech recognized");
        verifyNoInteractions(extractor);
    }

    @Test
    void tenantWithoutMappings_failsBeforeExtraction() {
        when(mappingProvider.activeMappings(TENANT)).thenReturn(List.of());

        pipeline.process(job.getId());

        assertFailed("No schema mappings configured for this client");
        assertThat(job.getTranscript()).isEqualTo(HEIFER_TRANSCRIPT);
        verifyNoInteractions(extractor);
    }

    @Test
    void rateLimitedOnEveryAttempt_failsAsExtraction() {
        when(extractor.extract(anyString(), anyList())).thenThrow(new RateLimitedException("429"));

        pipeline.process(job.getId());

        assertFailed("Extraction failed: Max retries exceeded due to rate limiting");
        verify(extractor, times(3)).extract(anyString(), anyList());
    }

    @Test
    void extractionError_isNotRetried() {
        when(extractor.extract(anyString(), anyList()))
                .thenThrow(new PipelineException(Kind.EXTRACTION, "Extraction model returned invalid JSON"));

        pipeline.process(job.getId());

        assertFailed("Extraction failed: Extraction model returned invalid JSON");
        verify(extractor, times(1)).extract(anyString(), anyList());
    }

    @Test
    void unknownEntity_failsButKeepsExtractedFields() {
        when(extractor.extract(anyString(), anyList()))
                .thenReturn(new Extraction(Extraction.UNKNOWN_ENTITY, Confidence.LOW, Map.of("note", "weather"), null));

        pipeline.process(job.getId());

        assertFailed("Could not determine entity type from transcription");
        assertThat(job.getEntityType()).isEqualTo("unknown");
        assertThat(job.getExtractedFields()).containsEntry("note", "weather");
        verifyNoInteractions(remoteCreators);
    }

    @Test
    void missingBirthDate_failsWithReadableListAndKeepsExtraction() {
        Map<String, Object> fields = heiferFields();
        fields.remove("birth_date");
        when(extractor.extract(anyString(), anyList()))
                .thenReturn(new Extraction("animal", Confidence.HIGH, fields, null));

        pipeline.process(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError())
                .startsWith("The following required information is missing from your recording:")
                .contains("birth date");
        assertThat(job.getExtractedFields()).containsEntry("ear_tag", "12345");
        verifyNoInteractions(remoteCreators);
    }

    @Test
    void entityWithoutMapping_fails() {
        when(extractor.extract(anyString(), anyList()))
                .thenReturn(new Extraction("treatment", Confidence.HIGH, heiferFields(), null));

        pipeline.process(job.getId());

        assertFailed("No schema mapping found for entity type: treatment");
    }

    @Test
    void validationErrors_areJoinedIntoOneMessage() {
        TenantMapping strict = new TenantMapping("animal", "bt_animals",
                Map.of("ear_tag", "bt_ear_tag"),
                Map.of("ear_tag", ValidationRule.required("integer")),
                List.of());
        when(mappingProvider.activeMappings(TENANT)).thenReturn(List.of(strict));

        pipeline.process(job.getId());

        assertFailed("Validation errors: Field 'ear_tag' has invalid type. Expected integer");
        verifyNoInteractions(remoteCreators);
    }

    @Test
    void patternWarnings_doNotStopTheSync() {
        Map<String, Object> fields = heiferFields();
        fields.put("rfid", "abc");
        when(extractor.extract(anyString(), anyList()))
                .thenReturn(new Extraction("animal", Confidence.HIGH, fields, null));

        pipeline.process(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.SYNCED);
    }

    @Test
    void remoteError_failsWithPrefix() {
        when(remoteCreator.create(anyString(), anyMap()))
                .thenThrow(new PipelineException(Kind.REMOTE_SYNC, "Dynamics API error 500: boom"));

        pipeline.process(job.getId());

        assertFailed("Remote sync failed: Dynamics API error 500: boom");
        assertThat(job.getRemoteRecordId()).isNull();
    }

    @Test
    void unexpectedException_isRecordedAndNotPropagated() {
        when(mappingProvider.activeMappings(TENANT)).thenThrow(new IllegalStateException("db down"));

        pipeline.process(job.getId());

        assertFailed("Unexpected error: db down");
        assertThat(meterRegistry.counter("farmvoice.pipeline.runs", "outcome", "error").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Guards
    // ------------------------------------------------------------------

    @Test
    void jobNotInUploaded_isLeftAlone() {
        job.transitionTo(JobStatus.TRANSCRIBING);

        pipeline.process(job.getId());

        assertThat(job.getStatus()).isEqualTo(JobStatus.TRANSCRIBING);
        verifyNoInteractions(blobStore, transcriber, extractor);
        verify(jobRepo, never()).save(any());
    }

    @Test
    void unknownJob_isIgnored() {
        UUID missing = UUID.randomUUID();
        when(jobRepo.findById(missing)).thenReturn(Optional.empty());

        pipeline.process(missing);

        verifyNoInteractions(blobStore);
        verify(jobRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void assertFailed(String expectedError) {
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo(expectedError);
    }

    private static List<JobStatus> distinctRuns(List<JobStatus> statuses) {
        List<JobStatus> runs = new ArrayList<>();
        for (JobStatus s : statuses) {
            if (runs.isEmpty() || runs.get(runs.size() - 1) != s) {
                runs.add(s);
            }
        }
        return runs;
    }

    private static Map<String, Object> heiferFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("ear_tag", "12345");
        fields.put("category", "Heifer");
        fields.put("species", "Cattle");
        fields.put("birth_date", "2024-03-01");
        fields.put("sex", "Female");
        fields.put("breed_composition", "Angus 100%");
        fields.put("location", "North pasture");
        return fields;
    }

    private static TenantMapping animalMapping() {
        return new TenantMapping("animal", "bt_animals",
                Map.of("ear_tag",    "bt_ear_tag",
                       "species",    "bt_species",
                       "sex",        "bt_sex",
                       "birth_date", "bt_birth_date",
                       "rfid",       "bt_rfid"),
                Map.of("ear_tag", ValidationRule.required("string"),
                       "rfid",    ValidationRule.optional("string").withPattern("^\\d{15,20}$")),
                List.of("heifer", "calf", "cow"));
    }

    private static Job jobWithId(Job job) {
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
