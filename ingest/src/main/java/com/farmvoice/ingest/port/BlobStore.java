package com.farmvoice.ingest.port;

/** Resolves a job's audio reference to the stored recording. */
public interface BlobStore {

    /**
     * @throws PipelineException of kind STORAGE if the blob is missing or unreadable
     */
    AudioBlob fetch(String audioRef);
}
