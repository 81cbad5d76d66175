package com.wildvision.observations.model;

import java.util.Arrays;
import java.util.Optional;

public enum Gender {
    MALE("Male"),
    FEMALE("Female"),
    UNKNOWN("Unknown");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Exact, case-sensitive match against the stored labels.
     */
    public static Optional<Gender> fromLabel(String value) {
        return Arrays.stream(values())
                .filter(g -> g.label.equals(value))
                .findFirst();
    }
}
