package com.wildvision.observations.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wildvision.observations.model.Observation;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

public final class ObservationDto {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public record ObservationView(
            @JsonProperty("_id") String id,
            String species,
            String gender,
            int quantity,
            double latitude,
            double longitude,
            String userId,
            String timestamp     // ISO-8601, UTC, trailing 'Z'
    ) {

        public static ObservationView from(Observation observation) {
            return new ObservationView(
                    observation.id(),
                    observation.species(),
                    observation.gender().label(),
                    observation.quantity(),
                    observation.latitude(),
                    observation.longitude(),
                    observation.userId(),
                    DateTimeFormatter.ISO_INSTANT.format(observation.timestamp())
            );
        }
    }

    public record ObservationCreated(String status, String message, String id) {}

    public record ObservationList(String status, List<ObservationView> observations) {}

    public record SingleObservation(String status, ObservationView observation) {}

    public record StatusMessage(String status, String message) {

        public static StatusMessage success(String message) {
            return new StatusMessage(SUCCESS, message);
        }

        public static StatusMessage error(String message) {
            return new StatusMessage(ERROR, message);
        }
    }

    public record Welcome(String message, Map<String, String> endpoints) {}

    private ObservationDto() {}
}
