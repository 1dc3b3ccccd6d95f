package net.seanstash.config;

import net.seanstash.application.ai.CommandAnalysisService;
import net.seanstash.domain.ai.AnalysisHealth;
import net.seanstash.scheduler.CommandEnhancementScheduler;
import org.springframework.boot.health.contributor.Health;
import org.springframework.boot.health.contributor.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports worker liveness and provider readiness under {@code /actuator/health}.
 *
 * <p>DOWN only when the worker is enabled but not scheduled. A missing API key is
 * reported as a detail, since raw commands simply wait until one is configured.</p>
 */
@Component("commandEnhancement")
public class CommandEnhancementHealthIndicator implements HealthIndicator {

    private final CommandEnhancementScheduler scheduler;
    private final CommandAnalysisService analysisService;

    public CommandEnhancementHealthIndicator(CommandEnhancementScheduler scheduler, CommandAnalysisService analysisService) {
        this.scheduler = scheduler;
        this.analysisService = analysisService;
    }

    @Override
    public Health health() {
        CommandEnhancementScheduler.ProcessorStatus status = scheduler.getStatus();
        AnalysisHealth ai = analysisService.healthStatus();
        Health.Builder builder;
        if (!status.enabled()) {
            builder = Health.up().withDetail("worker_status", "disabled_by_config");
        } else if (status.running()) {
            builder = Health.up().withDetail("worker_status", status.processing() ? "processing" : "idle");
        } else {
            builder = Health.down().withDetail("worker_status", "stopped");
        }
        builder.withDetail("interval_ms", status.intervalMillis())
            .withDetail("batch_size", status.batchSize())
            .withDetail("ai_status", ai.status())
            .withDetail("model", ai.model());
        if (status.lastPassFinishedAt() != null) {
            builder.withDetail("last_pass_finished_at", status.lastPassFinishedAt().toString());
        }
        return builder.build();
    }
}
