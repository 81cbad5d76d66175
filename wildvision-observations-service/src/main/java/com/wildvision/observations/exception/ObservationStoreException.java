package com.wildvision.observations.exception;

public class ObservationStoreException extends RuntimeException {

    public ObservationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
