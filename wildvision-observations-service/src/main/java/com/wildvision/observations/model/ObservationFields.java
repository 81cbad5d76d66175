package com.wildvision.observations.model;

/**
 * Client-supplied part of an observation, already trimmed and coerced.
 */
public record ObservationFields(
        String species,
        Gender gender,
        int quantity,
        double latitude,
        double longitude,
        String userId
) {}
