package com.wildvision.observations.controller;

import com.wildvision.observations.dto.ObservationDto.ObservationCreated;
import com.wildvision.observations.dto.ObservationDto.ObservationList;
import com.wildvision.observations.dto.ObservationDto.SingleObservation;
import com.wildvision.observations.dto.ObservationDto.StatusMessage;
import com.wildvision.observations.service.ObservationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

import static com.wildvision.observations.dto.ObservationDto.SUCCESS;

@RestController
@RequestMapping("/api")
public class ObservationsController {

    private final ObservationService service;

    public ObservationsController(ObservationService service) {
        this.service = service;
    }

    @PostMapping("/add_observation")
    public ResponseEntity<ObservationCreated> add(@RequestBody(required = false) Map<String, Object> payload) {
        String id = service.add(payload);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ObservationCreated(SUCCESS, "Observation added successfully", id));
    }

    @GetMapping("/get_observations")
    public ObservationList list() {
        return new ObservationList(SUCCESS, service.listAll());
    }

    @GetMapping("/get_observation/{id}")
    public SingleObservation get(@PathVariable String id) {
        return new SingleObservation(SUCCESS, service.getById(id));
    }

    @DeleteMapping("/delete_observation/{id}")
    public StatusMessage delete(@PathVariable String id) {
        service.deleteById(id);
        return StatusMessage.success("Observation deleted successfully");
    }
}
