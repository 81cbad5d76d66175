package com.wildvision.observations.api;

import com.jayway.jsonpath.JsonPath;
import com.wildvision.observations.controller.ObservationsController;
import com.wildvision.observations.repository.InMemoryObservationStore;
import com.wildvision.observations.service.ObservationPayloadParser;
import com.wildvision.observations.service.ObservationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Drives the real service and payload rules over HTTP, backed by an in-memory collection.
 */
@WebMvcTest(controllers = ObservationsController.class)
@Import({ObservationService.class, ObservationPayloadParser.class, ObservationsApiFlowTest.FlowConfig.class})
class ObservationsApiFlowTest {

    private static final String KEY_HEADER = "x-api-key";
    private static final String KEY = "test-api-key";
    private static final Instant NOW = Instant.parse("2024-05-01T12:34:56.789Z");

    @TestConfiguration
    static class FlowConfig {

        @Bean
        InMemoryObservationStore observationStore() {
            return new InMemoryObservationStore();
        }

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    MockMvc mvc;

    @Autowired
    InMemoryObservationStore store;

    @BeforeEach
    void emptyCollection() {
        store.clear();
    }

    @Test
    void addedDeer_isReturnedByIdWithServerTimestamp() throws Exception {
        String id = add("""
                {"species":"Deer","gender":"Male","quantity":2,"latitude":45.1,"longitude":-70.2,"userId":"u1",
                 "timestamp":"1999-01-01T00:00:00Z"}
                """);

        mvc.perform(get("/api/get_observation/" + id).header(KEY_HEADER, KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.observation._id").value(id))
                .andExpect(jsonPath("$.observation.species").value("Deer"))
                .andExpect(jsonPath("$.observation.gender").value("Male"))
                .andExpect(jsonPath("$.observation.quantity").value(2))
                .andExpect(jsonPath("$.observation.latitude").value(45.1))
                .andExpect(jsonPath("$.observation.longitude").value(-70.2))
                .andExpect(jsonPath("$.observation.userId").value("u1"))
                .andExpect(jsonPath("$.observation.timestamp").value("2024-05-01T12:34:56.789Z"));
    }

    @Test
    void numericStrings_andPaddedText_areCoerced() throws Exception {
        String id = add("""
                {"species":"  Moose ","gender":"Female","quantity":"3","latitude":"44.5","longitude":"-69.75","userId":" u2 "}
                """);

        mvc.perform(get("/api/get_observation/" + id).header(KEY_HEADER, KEY))
                .andExpect(jsonPath("$.observation.species").value("Moose"))
                .andExpect(jsonPath("$.observation.quantity").value(3))
                .andExpect(jsonPath("$.observation.latitude").value(44.5))
                .andExpect(jsonPath("$.observation.userId").value("u2"));
    }

    @Test
    void unknownGender_isRejected() throws Exception {
        mvc.perform(post("/api/add_observation")
                        .header(KEY_HEADER, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"species":"Deer","gender":"Cat","quantity":1,"latitude":1,"longitude":2,"userId":"u1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid gender value"));
    }

    @Test
    void zeroQuantity_isRejected() throws Exception {
        mvc.perform(post("/api/add_observation")
                        .header(KEY_HEADER, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"species":"Deer","gender":"Male","quantity":0,"latitude":1,"longitude":2,"userId":"u1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Quantity must be at least 1"));
    }

    @Test
    void missingFields_areNamedInOrder() throws Exception {
        mvc.perform(post("/api/add_observation")
                        .header(KEY_HEADER, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"species\":\"Deer\",\"gender\":\"Male\",\"latitude\":1,\"longitude\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Missing fields: quantity, userId"));
    }

    @Test
    void emptyBody_isRejected() throws Exception {
        mvc.perform(post("/api/add_observation")
                        .header(KEY_HEADER, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No data provided"));
    }

    @Test
    void deleteIsNotIdempotent() throws Exception {
        String id = add("""
                {"species":"Fox","gender":"Unknown","quantity":1,"latitude":10,"longitude":20,"userId":"u3"}
                """);

        mvc.perform(delete("/api/delete_observation/" + id).header(KEY_HEADER, KEY))
                .andExpect(status().isOk());
        mvc.perform(delete("/api/delete_observation/" + id).header(KEY_HEADER, KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Observation not found"));
        mvc.perform(get("/api/get_observation/" + id).header(KEY_HEADER, KEY))
                .andExpect(status().isNotFound());
    }

    @Test
    void malformedId_isAnErrorNotACrash() throws Exception {
        mvc.perform(get("/api/get_observation/xyz").header(KEY_HEADER, KEY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to fetch observation"));
        mvc.perform(delete("/api/delete_observation/xyz").header(KEY_HEADER, KEY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to delete observation"));
    }

    @Test
    void identicalSubmissions_createDistinctRecords() throws Exception {
        String body = """
                {"species":"Hare","gender":"Male","quantity":1,"latitude":1,"longitude":1,"userId":"u4"}
                """;
        String first = add(body);
        String second = add(body);

        assertThat(first).isNotEqualTo(second);
        mvc.perform(get("/api/get_observations").header(KEY_HEADER, KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.observations", hasSize(2)))
                .andExpect(jsonPath("$.observations[0]._id").value(first))
                .andExpect(jsonPath("$.observations[1]._id").value(second));
    }

    private String add(String body) throws Exception {
        MvcResult result = mvc.perform(post("/api/add_observation")
                        .header(KEY_HEADER, KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
    }
}
