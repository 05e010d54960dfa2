package com.farmvoice.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Voice-recording ingest service.
 *
 * To run locally:
 *   DB_URL=jdbc:postgresql://localhost:5432/farmvoice \
 *   WHISPER_API_KEY=sk-... GROQ_API_KEY=gsk_... mvn spring-boot:run
 */
@SpringBootApplication
public class IngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestApplication.class, args);
    }
}
