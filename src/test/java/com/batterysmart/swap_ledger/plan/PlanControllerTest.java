package com.batterysmart.swap_ledger.plan;

import com.batterysmart.swap_ledger.support.LedgerIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Plan menu and plan maintenance over HTTP.
 */
@AutoConfigureMockMvc
class PlanControllerTest extends LedgerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("The menu starts with the cheapest seeded plan")
    void listPlans() throws Exception {
        printTestHeader("List plans");

        mockMvc.perform(get("/api/plans"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].code").value("DAILY"))
            .andExpect(jsonPath("$[0].price").value(49.0))
            .andExpect(jsonPath("$[?(@.code == 'YEARLY')].unlimited").value(true));

        printSuccess("Seeded plans listed by price");
    }

    @Test
    @DisplayName("A plan is found by lower-case code with its GST breakdown")
    void planWithGst() throws Exception {
        printTestHeader("Plan GST breakdown");

        mockMvc.perform(get("/api/plans/{code}", "monthly"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value("MONTHLY"))
            .andExpect(jsonPath("$.gst_amount").value(179.82))
            .andExpect(jsonPath("$.total_price").value(1178.82))
            .andExpect(jsonPath("$.per_swap_cost").value(16.65))
            .andExpect(jsonPath("$.swaps_per_day").value(2));

        mockMvc.perform(get("/api/plans/{code}", "FORTNIGHT"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));

        printSuccess("GST = 18% of 999.00");
    }

    @Test
    @DisplayName("Upserting by code updates the existing plan instead of adding another")
    void upsertByCode() throws Exception {
        printTestHeader("Upsert plan");

        String body = "{\"name\":\"Student Pass\",\"price\":%s,\"validity_days\":7,\"swaps_included\":10," +
            "\"swaps_per_day\":-1,\"extra_swap_price\":30.00,\"gst_percentage\":18.00,\"active\":false}";

        mockMvc.perform(put("/api/plans/{code}", "student")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format(body, "150.00")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value("STUDENT"));

        mockMvc.perform(put("/api/plans/{code}", "STUDENT")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format(body, "120.00")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.price").value(120.0))
            .andExpect(jsonPath("$.per_swap_cost").value(12.0));

        mockMvc.perform(get("/api/plans"))
            .andExpect(jsonPath("$[?(@.code == 'STUDENT')]").isEmpty());

        Integer rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM subscription_plans WHERE code = 'STUDENT'", Integer.class);
        printOutput("Rows for STUDENT", rows);
        assertEquals(1, rows);

        mockMvc.perform(put("/api/plans/{code}", "STUDENT")
                .contentType(MediaType.APPLICATION_JSON)
                .content(String.format(body, "-1.00")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        printSuccess("One row per plan code");
    }
}
