package com.docingest.ingest;

public record FileIngestionRequest(byte[] fileBytes, String fileName, String metadataJson) {
}
