package com.powerguard.anomaly.controller;

import com.powerguard.anomaly.model.MeterAnalysis;
import com.powerguard.anomaly.model.MeterSummary;
import com.powerguard.anomaly.model.MeterTimeSeries;
import com.powerguard.anomaly.model.ReadingPoint;
import com.powerguard.anomaly.service.MeterService;
import com.powerguard.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MeterController.class)
class MeterControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MeterService meterService;

    @Test
    void listMeterIds_success() throws Exception {
        when(meterService.listMeterIds()).thenReturn(List.of("MTR-0001", "MTR-0002"));

        mockMvc.perform(get("/api/v1/meters/ids"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("MTR-0001"))
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void listMeters_passesLimit() throws Exception {
        when(meterService.listMeters(5)).thenReturn(List.of(MeterSummary.builder()
                .meterId("MTR-0001")
                .registeredAt(Instant.parse("2025-02-01T08:00:00Z"))
                .build()));

        mockMvc.perform(get("/api/v1/meters").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].meter_id").value("MTR-0001"))
                .andExpect(jsonPath("$[0].registered_at").value("2025-02-01T08:00:00Z"));
    }

    @Test
    void listMeters_defaultLimit() throws Exception {
        when(meterService.listMeters(100)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/meters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void listMeters_invalidLimit_returns400() throws Exception {
        when(meterService.listMeters(0)).thenThrow(new IllegalArgumentException("limit must be within 1-1000, got 0"));

        mockMvc.perform(get("/api/v1/meters").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void timeSeries_found() throws Exception {
        when(meterService.getTimeSeries("MTR-0045")).thenReturn(Optional.of(MeterTimeSeries.builder()
                .meterId("MTR-0045")
                .readings(List.of(
                        ReadingPoint.builder()
                                .timestamp(LocalDateTime.of(2025, 1, 6, 2, 0))
                                .consumptionKwh(10.0)
                                .anomaly(true)
                                .build(),
                        ReadingPoint.builder()
                                .timestamp(LocalDateTime.of(2025, 1, 6, 3, 0))
                                .consumptionKwh(0.05)
                                .build()))
                .anomalyResult(TestDataFactory.anomalyResult("MTR-0045", 0.92, true))
                .stats(TestDataFactory.features(0.22, 23.8, 0.83, 0.04, 0.32))
                .build()));

        mockMvc.perform(get("/api/v1/meters/MTR-0045"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meter_id").value("MTR-0045"))
                .andExpect(jsonPath("$.readings.length()").value(2))
                .andExpect(jsonPath("$.readings[0].timestamp").value(startsWith("2025-01-06T02:00")))
                .andExpect(jsonPath("$.readings[0].consumption_kwh").value(10.0))
                .andExpect(jsonPath("$.readings[0].is_anomaly").value(true))
                .andExpect(jsonPath("$.readings[1].is_anomaly").value(false))
                .andExpect(jsonPath("$.anomaly_result.is_suspicious").value(true))
                .andExpect(jsonPath("$.stats.night_ratio").value(0.83));
    }

    @Test
    void timeSeries_notFound() throws Exception {
        when(meterService.getTimeSeries("NOPE")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/meters/NOPE"))
                .andExpect(status().isNotFound());
    }

    @Test
    void analyze_found() throws Exception {
        when(meterService.analyze("MTR-0001")).thenReturn(Optional.of(MeterAnalysis.builder()
                .meterId("MTR-0001")
                .readingsCount(720)
                .features(TestDataFactory.features(1.0, 4.0, 0.15, 0.25, 0.3))
                .build()));

        mockMvc.perform(get("/api/v1/meters/MTR-0001/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.readings_count").value(720))
                .andExpect(jsonPath("$.features.night_ratio").value(0.15))
                .andExpect(jsonPath("$.anomaly_result").doesNotExist());
    }

    @Test
    void analyze_notFound() throws Exception {
        when(meterService.analyze("NOPE")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/meters/NOPE/analysis"))
                .andExpect(status().isNotFound());
    }
}
