package com.motaz.rfm.training.exception;

public class InvalidParameterException extends SegmentationException {

    public InvalidParameterException(String parameter, Object value, String constraint) {
        super(ErrorKind.INVALID_PARAMETER, String.format("Invalid %s=%s: %s", parameter, value, constraint));
    }
}
