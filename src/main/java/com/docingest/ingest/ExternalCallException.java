package com.docingest.ingest;

/**
 * Failure of a call to a collaborator outside the pipeline: the embedding service, the vector index or the
 * relational store. Transient failures (rate limits, timeouts, dropped connections) may be retried;
 * permanent ones (rejected input, bad credentials, malformed responses) may not.
 */
public class ExternalCallException extends RuntimeException {
    private final String service;
    private final boolean transientFailure;

    public ExternalCallException(String service, boolean transientFailure, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
        this.transientFailure = transientFailure;
    }

    public static ExternalCallException transientFailure(String service, String message, Throwable cause) {
        return new ExternalCallException(service, true, message, cause);
    }

    public static ExternalCallException permanent(String service, String message, Throwable cause) {
        return new ExternalCallException(service, false, message, cause);
    }

    /**
     * Classifies an HTTP status the way the embedding and index endpoints use them.
     */
    public static ExternalCallException forHttpStatus(String service, int status, String body) {
        String message = "HTTP " + status + (body == null || body.isBlank() ? "" : " " + abbreviate(body));
        return new ExternalCallException(service, isTransientStatus(status), message, null);
    }

    public static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    public String service() {
        return service;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    private static String abbreviate(String body) {
        String flat = body.strip().replaceAll("\\s+", " ");
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
