package com.motaz.rfm.training.exception;

public class NoDataException extends SegmentationException {

    public NoDataException(String message) {
        super(ErrorKind.NO_DATA, message);
    }
}
