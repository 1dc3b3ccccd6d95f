package net.seanstash.controller;

import java.util.Map;
import net.seanstash.application.ai.CommandAnalysisService;
import net.seanstash.application.enhancement.PassSummary;
import net.seanstash.controller.support.ErrorResponseUtils;
import net.seanstash.domain.ai.AnalysisHealth;
import net.seanstash.domain.ai.AnalysisRecord;
import net.seanstash.domain.ai.UsagePeriod;
import net.seanstash.domain.ai.UsageReport;
import net.seanstash.scheduler.CommandEnhancementScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints for the command enhancement worker and its analysis ledger. */
@RestController
@RequestMapping("/api/v2/ai")
public class CommandEnhancementController {

    private static final Logger log = LoggerFactory.getLogger(CommandEnhancementController.class);

    private final CommandEnhancementScheduler scheduler;
    private final CommandAnalysisService analysisService;

    public CommandEnhancementController(CommandEnhancementScheduler scheduler, CommandAnalysisService analysisService) {
        this.scheduler = scheduler;
        this.analysisService = analysisService;
    }

    @GetMapping("/processor/status")
    public ResponseEntity<ProcessorStatusPayload> processorStatus() {
        return ResponseEntity.ok(new ProcessorStatusPayload(true, scheduler.getStatus()));
    }

    /**
     * Runs a pass immediately on the request thread.
     *
     * @return pass summary, or {@code 409} when a pass is already running here or elsewhere
     */
    @PostMapping("/processor/run")
    public ResponseEntity<?> runProcessor() {
        PassSummary summary = scheduler.triggerPass();
        if (summary.skipped()) {
            return ErrorResponseUtils.error(HttpStatus.CONFLICT, "Pass already running",
                "An enhancement pass is already in progress", "PASS_RUNNING");
        }
        log.info("Manual enhancement pass completed: created={} failedOwners={}",
            summary.snippetsCreated(), summary.ownersFailed());
        return ResponseEntity.ok(new PassPayload(true, summary));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthPayload> health() {
        return ResponseEntity.ok(new HealthPayload(true, analysisService.healthStatus()));
    }

    @GetMapping("/analysis/{analysisId}")
    public ResponseEntity<?> analysis(@PathVariable String analysisId, @RequestParam long ownerId) {
        return analysisService.findAnalysis(analysisId, ownerId)
            .<ResponseEntity<?>>map(record -> ResponseEntity.ok(new AnalysisPayload(true, record)))
            .orElseGet(() -> ErrorResponseUtils.error(HttpStatus.NOT_FOUND, "Analysis not found",
                "No analysis " + analysisId + " for owner " + ownerId, "ANALYSIS_NOT_FOUND"));
    }

    @GetMapping("/usage/{ownerId}")
    public ResponseEntity<UsagePayload> usage(@PathVariable long ownerId,
                                              @RequestParam(defaultValue = "month") String period) {
        UsageReport report = analysisService.usageReport(ownerId, UsagePeriod.fromLabel(period));
        return ResponseEntity.ok(new UsagePayload(true, report.period().label(), report));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException exception) {
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Invalid request", exception.getMessage(), "INVALID_REQUEST");
    }

    record ProcessorStatusPayload(boolean success, CommandEnhancementScheduler.ProcessorStatus processor) {
    }

    record PassPayload(boolean success, PassSummary summary) {
    }

    record HealthPayload(boolean success, AnalysisHealth ai) {
    }

    record AnalysisPayload(boolean success, AnalysisRecord analysis) {
    }

    record UsagePayload(boolean success, String period, UsageReport usage) {
    }
}
