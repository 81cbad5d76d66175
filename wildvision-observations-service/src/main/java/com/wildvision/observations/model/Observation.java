package com.wildvision.observations.model;

import java.time.Instant;

public record Observation(
        String id,
        String species,
        Gender gender,
        int quantity,
        double latitude,
        double longitude,
        String userId,
        Instant timestamp
) {

    public static Observation newObservation(ObservationFields fields, Instant timestamp) {
        return new Observation(
                null,
                fields.species(),
                fields.gender(),
                fields.quantity(),
                fields.latitude(),
                fields.longitude(),
                fields.userId(),
                timestamp
        );
    }
}
