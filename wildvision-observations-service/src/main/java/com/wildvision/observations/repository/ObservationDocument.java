package com.wildvision.observations.repository;

import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document("observations")
public record ObservationDocument(
        @Id ObjectId id,
        String species,
        String gender,
        int quantity,
        double latitude,
        double longitude,
        String userId,
        Instant timestamp
) {}
