package com.enterprise.approval.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.enterprise.approval.security.JwtTokenProvider;
import com.fasterxml.jackson.databind.ObjectMapper;

@SpringBootTest
@AutoConfigureMockMvc
class AnalyticsControllerTest {

    private static final String FROM = "2000-01-01T00:00:00";
    private static final String TO = "2100-01-01T00:00:00";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenProvider tokenProvider;

    @Test
    void analyticsAreLimitedToAdmins() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/requests").param("from", FROM).param("to", TO)
                .header("Authorization", bearer("mgr-1", "MANAGER")))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/analytics/activity")
                .header("Authorization", bearer("emp-1", "EMPLOYEE")))
                .andExpect(status().isForbidden());
    }

    @Test
    void invertedRangeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/history").param("from", TO).param("to", FROM)
                .header("Authorization", bearer("adm-1", "ADMIN")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void missingRangeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/requests").param("from", FROM)
                .header("Authorization", bearer("adm-1", "ADMIN")))
                .andExpect(status().isBadRequest());
    }

    @Test
    void submittedRequestShowsUpInRangedReadsAndActivity() throws Exception {
        String flowKey = "flow-" + UUID.randomUUID().toString().substring(0, 8);
        String employeeId = "emp-" + UUID.randomUUID().toString().substring(0, 8);
        mockMvc.perform(post("/api/v1/workflows")
                .header("Authorization", bearer("adm-1", "ADMIN"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(workflowJson(flowKey)))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/v1/requests")
                .header("Authorization", bearer(employeeId, "EMPLOYEE"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("type", flowKey, "payload", Map.of("days", 1)))))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/v1/analytics/requests").param("from", FROM).param("to", TO)
                .header("Authorization", bearer("adm-1", "ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(get("/api/v1/analytics/history").param("from", FROM).param("to", TO)
                .header("Authorization", bearer("adm-1", "ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        mockMvc.perform(get("/api/v1/analytics/activity").param("actorId", employeeId)
                .header("Authorization", bearer("adm-1", "ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].action").value("SUBMIT"))
                .andExpect(jsonPath("$.data[0].actorId").value(employeeId));

        mockMvc.perform(get("/api/v1/analytics/activity").param("limit", "1")
                .header("Authorization", bearer("adm-1", "ADMIN")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)));
    }

    private String bearer(String userId, String role) {
        return "Bearer " + tokenProvider.generateToken(userId, userId + "@corp.test", List.of(role));
    }

    private String workflowJson(String flowKey) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "name", "Workflow " + flowKey,
                "flowKey", flowKey,
                "steps", List.of(Map.of(
                        "stepId", "manager-review",
                        "role", "MANAGER",
                        "actions", List.of("APPROVE", "REJECT"),
                        "slaHours", 24))));
    }
}
