package com.bank.patterns.controller;

import com.bank.patterns.model.PatternFamily;
import com.bank.patterns.model.PredictionReport;
import com.bank.patterns.model.PredictionResult;
import com.bank.patterns.model.Transaction;
import com.bank.patterns.service.PredictionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.bank.patterns.testutil.TestDataFactory.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PredictionController.class)
class PredictionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PredictionService predictionService;

    @Test
    void predict_success() throws Exception {
        Transaction input = createTransaction("T1", LocalDate.of(2026, 3, 14),
                "ALBERT HEIJN 1234 AMSTERDAM", 14.5, null, BANK_ACCOUNT, "GROC");
        Transaction predicted = input.toBuilder()
                .debitAccount("4200")
                .predictionConfidence(new EnumMap<>(Map.of(PatternFamily.DEBIT, 1.0)))
                .build();
        Map<PatternFamily, PredictionReport.FamilyStats> families = new EnumMap<>(PatternFamily.class);
        families.put(PatternFamily.DEBIT, new PredictionReport.FamilyStats(1, 1.0));
        PredictionReport report = PredictionReport.builder()
                .families(families)
                .transactionsProcessed(1)
                .totalPredictions(1)
                .build();
        when(predictionService.apply(eq(TENANT), anyList())).thenReturn(new PredictionResult(List.of(predicted), report));

        mockMvc.perform(post("/api/v1/predictions/" + TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(List.of(input))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactions[0].debitAccount").value("4200"))
                .andExpect(jsonPath("$.transactions[0].predictionConfidence.DEBIT").value(1.0))
                .andExpect(jsonPath("$.report.totalPredictions").value(1))
                .andExpect(jsonPath("$.report.families.DEBIT.averageConfidence").value(1.0))
                .andExpect(jsonPath("$.report.unavailable").value(false));
    }

    @Test
    void predict_patternsUnavailable_returnsReportFlag() throws Exception {
        Transaction input = createTransaction("T1", LocalDate.of(2026, 3, 14),
                "ALBERT HEIJN", 14.5, null, BANK_ACCOUNT, "GROC");
        PredictionReport report = PredictionReport.builder()
                .transactionsProcessed(1)
                .unavailable(true)
                .failureDetail("Patterns unavailable for tenant TENANT-001; failed: durable, ledger")
                .build();
        when(predictionService.apply(eq(TENANT), anyList())).thenReturn(new PredictionResult(List.of(input), report));

        mockMvc.perform(post("/api/v1/predictions/" + TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(List.of(input))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.unavailable").value(true))
                .andExpect(jsonPath("$.transactions[0].debitAccount").doesNotExist());
    }

    @Test
    void predict_nullEntry_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/predictions/" + TENANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[null]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(predictionService);
    }
}
