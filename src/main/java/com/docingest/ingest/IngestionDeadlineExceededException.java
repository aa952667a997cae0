package com.docingest.ingest;

import java.time.Duration;

public class IngestionDeadlineExceededException extends RuntimeException {
    public IngestionDeadlineExceededException(String step, Duration budget) {
        super("Ingestion deadline of " + budget.toMillis() + " ms exceeded before " + step);
    }
}
