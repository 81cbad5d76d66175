package com.wildvision.observations.controller;

import com.wildvision.observations.dto.ObservationDto.Welcome;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HomeController {

    private static final Welcome WELCOME = new Welcome(
            "Welcome to the WildVision Observations Backend!",
            endpoints()
    );

    @GetMapping("/")
    public Welcome home() {
        return WELCOME;
    }

    private static Map<String, String> endpoints() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("Add Observation", "/api/add_observation (POST)");
        endpoints.put("Get All Observations", "/api/get_observations (GET)");
        endpoints.put("Get Single Observation", "/api/get_observation/<id> (GET)");
        endpoints.put("Delete Observation", "/api/delete_observation/<id> (DELETE)");
        return Collections.unmodifiableMap(endpoints);
    }
}
