package com.wildvision.observations.exception;

public class ObservationValidationException extends RuntimeException {

    public ObservationValidationException(String message) {
        super(message);
    }
}
