package com.farmvoice.ingest.extraction;

import com.farmvoice.ingest.model.Confidence;
import com.farmvoice.ingest.port.Extraction;
import com.farmvoice.ingest.port.Extractor;
import com.farmvoice.ingest.port.PipelineException;
import com.farmvoice.ingest.port.PipelineException.Kind;
import com.farmvoice.ingest.port.RateLimitedException;
import com.farmvoice.ingest.port.TenantMapping;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entity classification and field extraction with a Groq-hosted model.
 *
 * Groq speaks the OpenAI chat-completions protocol. The request asks for
 * a JSON object response at low temperature; the model's JSON is then read
 * into an {@link Extraction}. HTTP 429 is reported as
 * {@link RateLimitedException} so the retry policy can back off.
 */
@Component
public class GroqExtractor implements Extractor {

    private static final Logger log = LoggerFactory.getLogger(GroqExtractor.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatMessage(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatCompletion(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(ChatMessage message) {}

        String firstContent() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                throw new PipelineException(Kind.EXTRACTION, "Empty completion from extraction model");
            }
            return choices.get(0).message().content();
        }
    }

    /** The JSON object the prompt asks the model to return. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractionPayload(
            @JsonProperty("entity_type")    String entityType,
            @JsonProperty("confidence")     String confidence,
            @JsonProperty("extracted_data") Map<String, Object> extractedData,
            @JsonProperty("notes")          String notes) {}

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       apiKey;
    private final String       model;
    private final double       temperature;

    public GroqExtractor(@Value("${farmvoice.groq.api-url:https://api.groq.com/openai/v1/chat/completions}") String apiUrl,
                         @Value("${farmvoice.groq.api-key:}") String apiKey,
                         @Value("${farmvoice.groq.model:llama-3.1-70b-versatile}") String model,
                         @Value("${farmvoice.groq.temperature:0.1}") double temperature,
                         ObjectMapper objectMapper) {
        this.apiUrl      = apiUrl;
        this.apiKey      = apiKey;
        this.model       = model;
        this.temperature = temperature;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Extractor
    // -------------------------------------------------------------------------

    @Override
    public Extraction extract(String transcript, List<TenantMapping> mappings) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new PipelineException(Kind.EXTRACTION, "Groq API key is not configured");
        }
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",           model,
                    "temperature",     temperature,
                    "response_format", Map.of("type", "json_object"),
                    "messages",        List.of(
                            new ChatMessage("system", ExtractionPrompts.system(mappings)),
                            new ChatMessage("user",   ExtractionPrompts.user(transcript)))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(Duration.ofSeconds(90))
                    .header("Content-Type",  "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 429) {
                throw new RateLimitedException("Groq API rate limit: " + response.body());
            }
            if (response.statusCode() != 200) {
                throw new PipelineException(Kind.EXTRACTION,
                        "Groq API error %d: %s".formatted(response.statusCode(), response.body()));
            }

            Extraction extraction = parseCompletion(json, response.body());
            log.info("Extraction classified transcript as '{}' ({})",
                    extraction.entityType(), extraction.confidence());
            return extraction;

        } catch (PipelineException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(Kind.EXTRACTION, "interrupted", e);
        } catch (Exception e) {
            throw new PipelineException(Kind.EXTRACTION, e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Wire format helpers
    // -------------------------------------------------------------------------

    /**
     * Read a chat-completions response whose first message holds the
     * extraction JSON.
     *
     * @throws PipelineException of kind EXTRACTION if either layer is not valid JSON
     */
    static Extraction parseCompletion(ObjectMapper json, String completionBody) {
        String content;
        try {
            content = json.readValue(completionBody, ChatCompletion.class).firstContent();
        } catch (JsonProcessingException e) {
            throw new PipelineException(Kind.EXTRACTION, "Malformed completion response: " + e.getOriginalMessage(), e);
        }
        if (content == null || content.isBlank()) {
            throw new PipelineException(Kind.EXTRACTION, "Extraction model returned no content");
        }
        try {
            ExtractionPayload payload = json.readValue(content, ExtractionPayload.class);
            return new Extraction(
                    payload.entityType(),
                    Confidence.parse(payload.confidence()),
                    payload.extractedData(),
                    payload.notes());
        } catch (JsonProcessingException e) {
            throw new PipelineException(Kind.EXTRACTION, "Extraction model returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
