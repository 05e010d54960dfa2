package com.farmvoice.ingest.transcription;

import com.farmvoice.ingest.model.Confidence;
import com.farmvoice.ingest.port.AudioBlob;
import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.Transcription;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhisperTranscriberTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void parse_verboseJson_takesTextWithHighConfidence() throws Exception {
        Transcription t = WhisperTranscriber.parseTranscription(json, """
                {"task":"transcribe","language":"english","duration":6.2,
                 "text":" New heifer, ear tag 12345. ","segments":[{"id":0,"text":"New heifer"}]}
                """);

        assertThat(t.text()).isEqualTo("New heifer, ear tag 12345.");
        assertThat(t.confidence()).isEqualTo(Confidence.HIGH);
    }

    @Test
    void parse_emptyText_isLowConfidence() throws Exception {
        Transcription t = WhisperTranscriber.parseTranscription(json, "{\"text\":\"\"}");

        assertThat(t.text()).isEmpty();
        assertThat(t.confidence()).isEqualTo(Confidence.LOW);
    }

    @Test
    void multipartBody_carriesModelFormatAndFile() {
        byte[] body = WhisperTranscriber.multipartBody("XYZ", "whisper-1",
                new AudioBlob("cow-17.m4a", "RIFF".getBytes(StandardCharsets.UTF_8)));
        String text = new String(body, StandardCharsets.UTF_8);

        assertThat(text)
                .contains("name=\"model\"\r\n\r\nwhisper-1\r\n")
                .contains("name=\"response_format\"\r\n\r\nverbose_json\r\n")
                .contains("name=\"file\"; filename=\"cow-17.m4a\"")
                .contains("RIFF")
                .endsWith("--XYZ--\r\n");
    }

    @Test
    void missingApiKey_failsAsTranscription() {
        WhisperTranscriber transcriber = new WhisperTranscriber("http://localhost", "", "whisper-1", json);

        assertThatThrownBy(() -> transcriber.transcribe(new AudioBlob("a.wav", new byte[0])))
                .isInstanceOfSatisfying(PipelineException.class, e ->
                        assertThat(e.getKind()).isEqualTo(PipelineException.Kind.TRANSCRIPTION));
    }
}
