package com.batterysmart.swap_ledger.leave;

import com.batterysmart.swap_ledger.driver.Driver;
import com.batterysmart.swap_ledger.support.LedgerIntegrationTest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class LeaveControllerTest extends LedgerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private Driver driver;

    @BeforeEach
    void setUp() {
        driver = registerDriver();
    }

    private String requestLeave(String start, String end) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/drivers/{id}/leaves", driver.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"start_date\":\"" + start + "\",\"end_date\":\"" + end + "\",\"reason\":\"wedding\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();
    }

    @Test
    @DisplayName("Request, approve and read the summary")
    void requestAndApprove() throws Exception {
        printTestHeader("Leave over HTTP");
        String id = requestLeave("2024-06-24", "2024-06-26");

        mockMvc.perform(post("/api/leaves/{id}/approve", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actor\":\"fleet-lead\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("APPROVED"))
            .andExpect(jsonPath("$.days").value(3))
            .andExpect(jsonPath("$.processed_by").value("fleet-lead"));

        MvcResult summary = mockMvc.perform(get("/api/drivers/{id}/leaves/summary", driver.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.month").value("2024-06"))
            .andExpect(jsonPath("$.total_leaves").value(4))
            .andExpect(jsonPath("$.used_leaves").value(3))
            .andExpect(jsonPath("$.remaining_leaves").value(1))
            .andExpect(jsonPath("$.approved_count").value(1))
            .andReturn();
        printOutput("Summary", summary.getResponse().getContentAsString());
        printSuccess("Approved leave charged to June");
    }

    @Test
    @DisplayName("Approval past the allowance is a 409 with the month's figures")
    void allowanceExceeded() throws Exception {
        String id = requestLeave("2024-06-20", "2024-06-24");

        mockMvc.perform(post("/api/leaves/{id}/approve", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actor\":\"fleet-lead\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("LEAVE_ALLOWANCE_EXCEEDED"))
            .andExpect(jsonPath("$.details.month").value("2024-06"))
            .andExpect(jsonPath("$.details.requested").value("5"))
            .andExpect(jsonPath("$.details.remaining").value("4"));

        mockMvc.perform(get("/api/leaves/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("Deciding twice is a 409 and inverted dates are a 400")
    void invalidTransitions() throws Exception {
        String id = requestLeave("2024-06-20", "2024-06-20");
        mockMvc.perform(post("/api/leaves/{id}/reject", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actor\":\"fleet-lead\"}"))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/leaves/{id}/approve", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actor\":\"fleet-lead\"}"))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/drivers/{id}/leaves", driver.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"start_date\":\"2024-06-28\",\"end_date\":\"2024-06-27\"}"))
            .andExpect(status().isBadRequest());
    }
}
