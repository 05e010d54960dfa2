package com.farmvoice.ingest.transcription;

import com.farmvoice.ingest.model.Confidence;
import com.farmvoice.ingest.port.AudioBlob;
import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.PipelineException.Kind;
import com.farmvoice.ingest.port.Transcriber;
import com.farmvoice.ingest.port.Transcription;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * Speech-to-text through the OpenAI Whisper API.
 *
 * Sends the audio as multipart/form-data to /audio/transcriptions with
 * response_format=verbose_json. Whisper reports no usable confidence, so
 * any non-blank transcript counts as HIGH.
 */
@Component
public class WhisperTranscriber implements Transcriber {

    private static final Logger log = LoggerFactory.getLogger(WhisperTranscriber.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       model;

    public WhisperTranscriber(@Value("${farmvoice.whisper.base-url:https://api.openai.com/v1}") String baseUrl,
                              @Value("${farmvoice.whisper.api-key:}") String apiKey,
                              @Value("${farmvoice.whisper.model:whisper-1}") String model,
                              ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.apiKey  = apiKey;
        this.model   = model;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public Transcription transcribe(AudioBlob audio) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new PipelineException(Kind.TRANSCRIPTION, "Whisper API key is not configured");
        }
        String boundary = "farmvoice-" + UUID.randomUUID();
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/audio/transcriptions"))
                    .timeout(Duration.ofMinutes(5))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type",  "multipart/form-data; boundary=" + boundary)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(multipartBody(boundary, model, audio)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new PipelineException(Kind.TRANSCRIPTION,
                        "Whisper API error %d: %s".formatted(response.statusCode(), response.body()));
            }

            Transcription result = parseTranscription(json, response.body());
            log.info("Transcribed {} ({} bytes, {} chars)",
                    audio.name(), audio.content().length, result.text().length());
            return result;

        } catch (PipelineException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(Kind.TRANSCRIPTION, "interrupted", e);
        } catch (Exception e) {
            throw new PipelineException(Kind.TRANSCRIPTION, e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Wire format helpers
    // ------------------------------------------------------------------

    /** Response shape: { text, language, duration, segments: [...] } */
    static Transcription parseTranscription(ObjectMapper json, String body) throws JsonProcessingException {
        JsonNode root = json.readTree(body);
        String text = root.path("text").asText("").trim();
        return new Transcription(text, text.isEmpty() ? Confidence.LOW : Confidence.HIGH);
    }

    static byte[] multipartBody(String boundary, String model, AudioBlob audio) {
        String fileName = audio.name() == null || audio.name().isBlank() ? "audio.wav" : audio.name();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeField(out, boundary, "model", model);
        writeField(out, boundary, "response_format", "verbose_json");
        write(out, "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + fileName + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n");
        out.writeBytes(audio.content());
        write(out, "\r\n--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private static void writeField(ByteArrayOutputStream out, String boundary, String name, String value) {
        write(out, "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n"
                + value + "\r\n");
    }

    private static void write(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
    }
}
