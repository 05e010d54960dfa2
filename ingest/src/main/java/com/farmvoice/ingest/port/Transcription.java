package com.farmvoice.ingest.port;

import com.farmvoice.ingest.model.Confidence;

/** Speech-to-text output. */
public record Transcription(String text, Confidence confidence) {}
