package com.motaz.rfm.training.exception;

public class IngestionException extends SegmentationException {

    public IngestionException(String message) {
        super(ErrorKind.INGESTION_FAILED, message);
    }

    public IngestionException(String message, Throwable cause) {
        super(ErrorKind.INGESTION_FAILED, message);
        initCause(cause);
    }
}
