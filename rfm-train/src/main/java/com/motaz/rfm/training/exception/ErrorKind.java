package com.motaz.rfm.training.exception;

public enum ErrorKind {
    NO_DATA,
    INVALID_PARAMETER,
    DEGENERATE_INPUT,
    INGESTION_FAILED
}
