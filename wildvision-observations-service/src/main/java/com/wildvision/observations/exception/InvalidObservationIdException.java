package com.wildvision.observations.exception;

import lombok.Getter;

/**
 * The message is what the client sees; the offending id is kept for logging only.
 */
@Getter
public class InvalidObservationIdException extends RuntimeException {

    private final String observationId;

    public InvalidObservationIdException(String observationId, String message) {
        super(message);
        this.observationId = observationId;
    }
}
