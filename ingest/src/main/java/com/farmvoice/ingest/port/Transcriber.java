package com.farmvoice.ingest.port;

/** Speech-to-text. */
public interface Transcriber {

    /**
     * @throws PipelineException of kind TRANSCRIPTION when the service fails
     */
    Transcription transcribe(AudioBlob audio);
}
