package net.seanstash.controller;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import net.seanstash.application.ai.CommandAnalysisService;
import net.seanstash.application.enhancement.PassSummary;
import net.seanstash.domain.ai.AnalysisHealth;
import net.seanstash.domain.ai.AnalysisRecord;
import net.seanstash.domain.ai.AnalysisStatus;
import net.seanstash.domain.ai.UsagePeriod;
import net.seanstash.domain.ai.UsageReport;
import net.seanstash.domain.ai.UsageSummary;
import net.seanstash.scheduler.CommandEnhancementScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class CommandEnhancementControllerTest {

    @Mock
    private CommandEnhancementScheduler scheduler;

    @Mock
    private CommandAnalysisService analysisService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CommandEnhancementController(scheduler, analysisService)).build();
    }

    @Test
    @DisplayName("GET /processor/status reports worker configuration")
    void should_ReturnProcessorStatus_When_Requested() throws Exception {
        when(scheduler.getStatus()).thenReturn(new CommandEnhancementScheduler.ProcessorStatus(
            true, true, false, 30000L, 10, null, null, null));

        mockMvc.perform(get("/api/v2/ai/processor/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.processor.running").value(true))
            .andExpect(jsonPath("$.processor.intervalMillis").value(30000))
            .andExpect(jsonPath("$.processor.batchSize").value(10));
    }

    @Test
    @DisplayName("POST /processor/run returns the pass summary")
    void should_ReturnSummary_When_ManualPassCompletes() throws Exception {
        Instant now = Instant.parse("2026-01-05T10:00:00Z");
        when(scheduler.triggerPass()).thenReturn(new PassSummary(false, now, now, 4, 2, 0, 3, 1, 2, List.of()));

        mockMvc.perform(post("/api/v2/ai/processor/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.snippetsCreated").value(3))
            .andExpect(jsonPath("$.summary.rawRecordsDeleted").value(2));
    }

    @Test
    @DisplayName("POST /processor/run conflicts while a pass is running")
    void should_ReturnConflict_When_PassAlreadyRunning() throws Exception {
        when(scheduler.triggerPass()).thenReturn(PassSummary.skipped(Instant.now()));

        mockMvc.perform(post("/api/v2/ai/processor/run"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("PASS_RUNNING"));
    }

    @Test
    @DisplayName("GET /health exposes provider readiness")
    void should_ReturnAiHealth_When_Requested() throws Exception {
        when(analysisService.healthStatus()).thenReturn(
            new AnalysisHealth(false, "claude-3-5-sonnet-20241022", 0.1, 4000, AnalysisHealth.NOT_CONFIGURED));

        mockMvc.perform(get("/api/v2/ai/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ai.configured").value(false))
            .andExpect(jsonPath("$.ai.status").value("not_configured"));
    }

    @Test
    @DisplayName("GET /analysis/{id} returns the owner's analysis")
    void should_ReturnAnalysis_When_OwnedByCaller() throws Exception {
        AnalysisRecord record = new AnalysisRecord("a-1", 7L, List.of("ls"), AnalysisStatus.COMPLETED, 1,
            120L, 0.002, null, null, null);
        when(analysisService.findAnalysis("a-1", 7L)).thenReturn(Optional.of(record));

        mockMvc.perform(get("/api/v2/ai/analysis/a-1").param("ownerId", "7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.analysis.id").value("a-1"))
            .andExpect(jsonPath("$.analysis.tokensUsed").value(120));
    }

    @Test
    @DisplayName("GET /analysis/{id} is 404 for another owner's analysis")
    void should_ReturnNotFound_When_AnalysisMissing() throws Exception {
        when(analysisService.findAnalysis("a-1", 8L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v2/ai/analysis/a-1").param("ownerId", "8"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("ANALYSIS_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /usage/{ownerId} defaults to the monthly window")
    void should_DefaultToMonth_When_PeriodOmitted() throws Exception {
        when(analysisService.usageReport(7L, UsagePeriod.MONTH))
            .thenReturn(new UsageReport(UsagePeriod.MONTH, UsageSummary.empty(), List.of()));

        mockMvc.perform(get("/api/v2/ai/usage/7"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.period").value("month"))
            .andExpect(jsonPath("$.usage.summary.totalAnalyses").value(0));
    }

    @Test
    @DisplayName("GET /usage/{ownerId} rejects unknown periods")
    void should_ReturnBadRequest_When_PeriodUnknown() throws Exception {
        mockMvc.perform(get("/api/v2/ai/usage/7").param("period", "decade"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        verify(analysisService, never()).usageReport(anyLong(), eq(UsagePeriod.MONTH));
    }
}
