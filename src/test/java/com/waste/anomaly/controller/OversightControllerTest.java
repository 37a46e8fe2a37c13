package com.waste.anomaly.controller;

import com.waste.anomaly.config.DetectionConfig;
import com.waste.anomaly.model.HighRiskSubject;
import com.waste.anomaly.model.OversightDashboard;
import com.waste.anomaly.security.OversightAccessGuard;
import com.waste.anomaly.service.OversightAnalyticsService;
import com.waste.anomaly.service.ReportArchiveService;
import com.waste.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(OversightController.class)
@Import({OversightAccessGuard.class, DetectionConfig.class})
class OversightControllerTest {

    private static final String ROLE_HEADER = "X-User-Role";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OversightAnalyticsService analyticsService;

    @MockBean
    private ReportArchiveService reportArchiveService;

    @Test
    void getDashboard_oversightRole_success() throws Exception {
        when(analyticsService.dashboard()).thenReturn(OversightDashboard.builder()
                .anomaliesToday(4)
                .recent(List.of(TestDataFactory.createAnomalyRecord("R1", "FAC-1", 1_760_770_800_000L)))
                .highRiskSubjects(List.of("FAC-7"))
                .build());

        mockMvc.perform(get("/api/v1/oversight/dashboard").header(ROLE_HEADER, "OVERSIGHT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomaliesToday").value(4))
                .andExpect(jsonPath("$.recent[0].subjectId").value("FAC-1"))
                .andExpect(jsonPath("$.recent[0].zScore").value(8.42))
                .andExpect(jsonPath("$.highRiskSubjects[0]").value("FAC-7"));
    }

    @Test
    void getDashboard_noRole_forbidden() throws Exception {
        mockMvc.perform(get("/api/v1/oversight/dashboard"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        verifyNoInteractions(analyticsService);
    }

    @Test
    void getDashboard_facilityRole_forbidden() throws Exception {
        mockMvc.perform(get("/api/v1/oversight/dashboard").header(ROLE_HEADER, "FACILITY"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(analyticsService);
    }

    @Test
    void getTodayCount_success() throws Exception {
        when(analyticsService.countToday()).thenReturn(3L);

        mockMvc.perform(get("/api/v1/oversight/anomalies/today").header(ROLE_HEADER, "OVERSIGHT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomaliesToday").value(3));
    }

    @Test
    void getRecent_passesLimit() throws Exception {
        when(analyticsService.recent(5)).thenReturn(List.of(
                TestDataFactory.createAnomalyRecord("R2", "FAC-2", 2_000L),
                TestDataFactory.createAnomalyRecord("R1", "FAC-1", 1_000L)));

        mockMvc.perform(get("/api/v1/oversight/anomalies/recent")
                        .header(ROLE_HEADER, "OVERSIGHT")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].recordId").value("R2"));
    }

    @Test
    void getHighRisk_usesDefaults() throws Exception {
        when(analyticsService.highRiskDetails(7, 3)).thenReturn(List.of(new HighRiskSubject("FAC-7", 4)));

        mockMvc.perform(get("/api/v1/oversight/subjects/high-risk").header(ROLE_HEADER, "OVERSIGHT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].subjectId").value("FAC-7"))
                .andExpect(jsonPath("$[0].anomalyCount").value(4));
    }

    @Test
    void getReport_found() throws Exception {
        when(reportArchiveService.findReport("FAC-1:1000"))
                .thenReturn(Optional.of("{\"subjectId\":\"FAC-1\",\"zScore\":8.42}"));

        mockMvc.perform(get("/api/v1/oversight/reports/FAC-1:1000").header(ROLE_HEADER, "OVERSIGHT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subjectId").value("FAC-1"));
    }

    @Test
    void getReport_unknownKey_notFound() throws Exception {
        when(reportArchiveService.findReport("FAC-9:1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/oversight/reports/FAC-9:1").header(ROLE_HEADER, "OVERSIGHT"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getReport_noRole_forbiddenBeforeLookup() throws Exception {
        mockMvc.perform(get("/api/v1/oversight/reports/FAC-1:1000"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(reportArchiveService);
    }
}
