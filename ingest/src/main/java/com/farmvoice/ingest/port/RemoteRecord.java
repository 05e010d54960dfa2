package com.farmvoice.ingest.port;

/** Identifier of the record the CRM created. */
public record RemoteRecord(String id) {}
