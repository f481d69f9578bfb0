package com.farm.anomaly.controller;

import com.farm.anomaly.model.Finding;
import com.farm.anomaly.model.ReadingAnalysis;
import com.farm.anomaly.repository.AnalysisRepository;
import com.farm.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalysisRepository analysisRepository;

    @Test
    void getAnalysesByDevice_returnsList() throws Exception {
        ReadingAnalysis analysis = TestDataFactory.createAnalysis("device_germany",
                Map.of("N", TestDataFactory.createReport("N", 70.0, Finding.changeRate(0.4))), true);
        when(analysisRepository.findByDevice("device_germany", 20)).thenReturn(List.of(analysis));

        mockMvc.perform(get("/api/v1/analysis/device/device_germany"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].deviceId").value("device_germany"))
                .andExpect(jsonPath("$[0].overallSeverity").value("medium"))
                .andExpect(jsonPath("$[0].reports.N.anomalies_detected[0].description").value("Change rate: 40.00%"));
    }

    @Test
    void getAnalysesByDevice_customLimit() throws Exception {
        when(analysisRepository.findByDevice("device_germany", 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/analysis/device/device_germany").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }
}
