package com.wildvision.observations.service;

import com.wildvision.observations.dto.ObservationDto.ObservationView;
import com.wildvision.observations.exception.InvalidObservationIdException;
import com.wildvision.observations.exception.ObservationNotFoundException;
import com.wildvision.observations.exception.ObservationStoreException;
import com.wildvision.observations.model.Observation;
import com.wildvision.observations.model.ObservationFields;
import com.wildvision.observations.repository.ObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

@Service
public class ObservationService {

    private static final Logger log = LoggerFactory.getLogger(ObservationService.class);

    static final String FAILED_ADD = "Failed to add observation";
    static final String FAILED_FETCH_ALL = "Failed to fetch observations";
    static final String FAILED_FETCH_ONE = "Failed to fetch observation";
    static final String FAILED_DELETE = "Failed to delete observation";

    private final ObservationStore store;
    private final ObservationPayloadParser parser;
    private final Clock clock;

    public ObservationService(ObservationStore store, ObservationPayloadParser parser, Clock clock) {
        this.store = store;
        this.parser = parser;
        this.clock = clock;
    }

    /**
     * Validates the payload, stamps it with the current UTC time and stores it.
     *
     * @return the generated identifier
     */
    public String add(Map<String, Object> payload) {
        ObservationFields fields = parser.parse(payload);
        // The store keeps millisecond precision; truncate so a read returns the same instant.
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);

        String id;
        try {
            id = store.insert(Observation.newObservation(fields, now));
        } catch (RuntimeException e) {
            log.error("Insert failed for observation of {} by {}", fields.species(), fields.userId(), e);
            throw new ObservationStoreException(FAILED_ADD, e);
        }
        log.info("Observation {} added ({} x{} by {})", id, fields.species(), fields.quantity(), fields.userId());
        return id;
    }

    public List<ObservationView> listAll() {
        try {
            List<ObservationView> observations = store.findAll().stream()
                    .map(ObservationView::from)
                    .toList();
            log.debug("Fetched {} observations", observations.size());
            return observations;
        } catch (RuntimeException e) {
            // Covers driver failures as well as documents that cannot be mapped or rendered.
            log.error("Listing observations failed", e);
            throw new ObservationStoreException(FAILED_FETCH_ALL, e);
        }
    }

    public ObservationView getById(String id) {
        requireValidId(id, FAILED_FETCH_ONE);
        try {
            Observation observation = store.findById(id)
                    .orElseThrow(() -> new ObservationNotFoundException(id));
            return ObservationView.from(observation);
        } catch (ObservationNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Fetching observation {} failed", id, e);
            throw new ObservationStoreException(FAILED_FETCH_ONE, e);
        }
    }

    public void deleteById(String id) {
        requireValidId(id, FAILED_DELETE);
        long deleted;
        try {
            deleted = store.deleteById(id);
        } catch (RuntimeException e) {
            log.error("Deleting observation {} failed", id, e);
            throw new ObservationStoreException(FAILED_DELETE, e);
        }
        if (deleted == 0) {
            throw new ObservationNotFoundException(id);
        }
        log.info("Observation {} deleted", id);
    }

    private void requireValidId(String id, String failureMessage) {
        if (!store.isValidId(id)) {
            throw new InvalidObservationIdException(id, failureMessage);
        }
    }
}
