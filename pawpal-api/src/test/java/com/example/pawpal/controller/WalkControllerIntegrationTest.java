package com.example.pawpal.controller;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class WalkControllerIntegrationTest {

    @TestConfiguration
    static class TestConfig {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(Instant.parse("2026-03-10T06:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    private String petId;

    @BeforeEach
    void setUp() throws Exception {
        String body = mockMvc.perform(post("/api/pets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Buddy", "breed": "Golden Retriever", "age": 3}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ownerId").value("user_test"))
                .andReturn().getResponse().getContentAsString();
        petId = JsonPath.read(body, "$.petId");
    }

    private String walkRequest(String time, int minutes) {
        return """
                {
                    "petId": "%s",
                    "scheduledTime": "%s",
                    "durationMinutes": %d
                }
                """.formatted(petId, time, minutes);
    }

    @Test
    void scheduleWalk_overlapIsRejectedWithReasons() throws Exception {
        mockMvc.perform(post("/api/walks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(walkRequest("2026-03-10T08:00:00", 30)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.description").value("Walk Buddy"))
                .andExpect(jsonPath("$.priority").value("high"))
                .andExpect(jsonPath("$.walk.status").value("SCHEDULED"))
                .andExpect(jsonPath("$.walk.durationMinutes").value(30));

        mockMvc.perform(post("/api/walks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(walkRequest("2026-03-10T08:15:00", 30)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Walk Conflict"))
                .andExpect(jsonPath("$.reasons", hasSize(1)))
                .andExpect(jsonPath("$.reasons[0]", containsString("Buddy")));

        mockMvc.perform(post("/api/walks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(walkRequest("2026-03-10T08:30:00", 20)))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/conflicts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        mockMvc.perform(get("/api/pets/{id}/walks", petId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    void scheduleWalk_invalidDurationIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/walks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(walkRequest("2026-03-10T08:00:00", 0)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Error"));
    }

    @Test
    void scheduleWalk_unknownPetIsNotFound() throws Exception {
        mockMvc.perform(post("/api/walks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"petId": "PET-404", "scheduledTime": "2026-03-10T08:00:00", "durationMinutes": 30}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Pet Not Found"));
    }

    @Test
    void conflictCheck_isAdvisory() throws Exception {
        mockMvc.perform(post("/api/walks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(walkRequest("2026-03-10T08:00:00", 30)))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/walks/conflict-check")
                        .param("petId", petId)
                        .param("start", "2026-03-10T08:20:00")
                        .param("durationMinutes", "15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conflict").value(true))
                .andExpect(jsonPath("$.conflicts", hasSize(1)));

        mockMvc.perform(get("/api/walks/conflict-check")
                        .param("petId", petId)
                        .param("start", "2026-03-10T08:30:00")
                        .param("durationMinutes", "15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conflict").value(false))
                .andExpect(jsonPath("$.message", containsString("No conflicts")));
    }

    @Test
    void cancelWalk_freesTheSlot() throws Exception {
        String body = mockMvc.perform(post("/api/walks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(walkRequest("2026-03-10T08:00:00", 30)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String walkId = JsonPath.read(body, "$.walk.walkId");

        mockMvc.perform(post("/api/walks/{walkId}/cancel", walkId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post("/api/walks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(walkRequest("2026-03-10T08:15:00", 30)))
                .andExpect(status().isCreated());
    }

    @Test
    void correlationIdIsEchoedOrGenerated() throws Exception {
        mockMvc.perform(get("/api/pets")
                        .header("X-Correlation-Id", "test-corr-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-Id", "test-corr-123"));

        mockMvc.perform(get("/api/pets"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Correlation-Id"));
    }
}
