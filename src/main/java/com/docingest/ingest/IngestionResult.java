package com.docingest.ingest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Caller-facing outcome of one ingestion request. A document either succeeded or failed; chunks persisted
 * before a failure are not reported here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionResult(
        @JsonIgnore Status status,
        boolean success,
        String message,
        Integer chunks,
        String documentId,
        String error) {

    public enum Status {
        OK(200),
        INVALID_REQUEST(400),
        FAILED(500),
        UNAVAILABLE(503);

        private final int httpStatus;

        Status(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    public static IngestionResult ok(String message, int chunks, String documentId) {
        return new IngestionResult(Status.OK, true, message, chunks, documentId, null);
    }

    public static IngestionResult invalid(String error) {
        return new IngestionResult(Status.INVALID_REQUEST, false, null, null, null, error);
    }

    public static IngestionResult unavailable(String error) {
        return new IngestionResult(Status.UNAVAILABLE, false, null, null, null, error);
    }

    public static IngestionResult failed(String documentId, String error, String message) {
        return new IngestionResult(Status.FAILED, false, message, null, documentId, error);
    }

    @JsonIgnore
    public int httpStatus() {
        return status.httpStatus();
    }
}
