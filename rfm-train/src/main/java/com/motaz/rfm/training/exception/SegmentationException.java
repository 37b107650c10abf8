package com.motaz.rfm.training.exception;

import lombok.Getter;

@Getter
public abstract class SegmentationException extends RuntimeException {

    private final ErrorKind kind;

    protected SegmentationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
