package com.farmvoice.ingest.port;

/**
 * Raw audio fetched from storage.
 *
 * @param name    file name, used by transcribers to infer the audio format
 * @param content the audio bytes
 */
public record AudioBlob(String name, byte[] content) {}
