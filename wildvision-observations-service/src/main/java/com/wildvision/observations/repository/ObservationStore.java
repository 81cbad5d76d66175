package com.wildvision.observations.repository;

import com.wildvision.observations.model.Observation;

import java.util.List;
import java.util.Optional;

/**
 * Document collection holding observations.
 */
public interface ObservationStore {

    /**
     * @return the generated identifier, in canonical text form
     */
    String insert(Observation observation);

    List<Observation> findAll();

    /**
     * Callers must check {@link #isValidId(String)} first.
     */
    Optional<Observation> findById(String id);

    /**
     * @return the number of removed records, 0 or 1
     */
    long deleteById(String id);

    boolean isValidId(String id);
}
