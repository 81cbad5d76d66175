package com.wildvision.observations.exception;

import lombok.Getter;

@Getter
public class ObservationNotFoundException extends RuntimeException {

    private final String observationId;

    public ObservationNotFoundException(String observationId) {
        super("Observation not found");
        this.observationId = observationId;
    }
}
