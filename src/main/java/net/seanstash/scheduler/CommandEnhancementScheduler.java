package net.seanstash.scheduler;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import net.seanstash.application.ai.AnalysisExtractionException;
import net.seanstash.application.ai.AnalysisOptions;
import net.seanstash.application.ai.AnalysisProviderException;
import net.seanstash.application.ai.CommandAnalysisService;
import net.seanstash.application.enhancement.CommandStore;
import net.seanstash.application.enhancement.EnhancedSnippetReconciler;
import net.seanstash.application.enhancement.EnhancementPassLock;
import net.seanstash.application.enhancement.PassSummary;
import net.seanstash.config.EnhancementProperties;
import net.seanstash.domain.ai.AnalysisResult;
import net.seanstash.domain.snippet.RawCommandRecord;
import net.seanstash.util.IdGenerator;
import net.seanstash.util.LoggingUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Periodic worker that turns captured terminal commands into enhanced snippets.
 *
 * <p>Each pass discovers unprocessed raw commands, groups them by owner and sends one
 * batch per owner through {@link CommandAnalysisService}. Passes never overlap: a tick
 * that arrives while a pass is running is skipped, and a lease row keeps other
 * instances out while this one works. One owner's failure never stops the pass.</p>
 */
@Component
@Slf4j
public class CommandEnhancementScheduler implements SmartLifecycle {

    private static final int DISCOVERY_MULTIPLIER = 5;

    private final TaskScheduler taskScheduler;
    private final CommandStore commandStore;
    private final CommandAnalysisService analysisService;
    private final EnhancedSnippetReconciler reconciler;
    private final EnhancementProperties properties;
    private final ObjectProvider<EnhancementPassLock> passLockProvider;
    private final MeterRegistry meterRegistry;
    private final String holderId = "enhancer-" + IdGenerator.uuidV7();

    private final AtomicBoolean processing = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledPass;
    private volatile Instant lastPassStartedAt;
    private volatile Instant lastPassFinishedAt;
    private volatile PassSummary lastPassSummary;

    public CommandEnhancementScheduler(TaskScheduler taskScheduler,
                                       CommandStore commandStore,
                                       CommandAnalysisService analysisService,
                                       EnhancedSnippetReconciler reconciler,
                                       EnhancementProperties properties,
                                       ObjectProvider<EnhancementPassLock> passLockProvider,
                                       MeterRegistry meterRegistry) {
        this.taskScheduler = taskScheduler;
        this.commandStore = commandStore;
        this.analysisService = analysisService;
        this.reconciler = reconciler;
        this.properties = properties;
        this.passLockProvider = passLockProvider;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Point-in-time view of the worker for status endpoints.
     */
    public record ProcessorStatus(
        boolean enabled,
        boolean running,
        boolean processing,
        long intervalMillis,
        int batchSize,
        Instant lastPassStartedAt,
        Instant lastPassFinishedAt,
        PassSummary lastPassSummary
    ) {
    }

    /**
     * Starts the fixed-rate schedule; the first pass runs immediately.
     */
    @Override
    public synchronized void start() {
        if (!properties.isEnabled()) {
            log.info("Command enhancement worker is disabled via configuration.");
            return;
        }
        if (isRunning()) {
            return;
        }
        scheduledPass = taskScheduler.scheduleAtFixedRate(this::runScheduledPass, properties.getInterval());
        log.info("Command enhancement worker started (interval={}ms, batchSize={}, cleanupRedundant={})",
            properties.getInterval().toMillis(), properties.getBatchSize(), properties.isCleanupRedundant());
    }

    @Override
    public synchronized void stop() {
        ScheduledFuture<?> current = scheduledPass;
        if (current != null) {
            current.cancel(false);
            scheduledPass = null;
            log.info("Command enhancement worker stopped.");
        }
    }

    @Override
    public boolean isRunning() {
        ScheduledFuture<?> current = scheduledPass;
        return current != null && !current.isCancelled();
    }

    public ProcessorStatus getStatus() {
        return new ProcessorStatus(
            properties.isEnabled(),
            isRunning(),
            processing.get(),
            properties.getInterval().toMillis(),
            properties.getBatchSize(),
            lastPassStartedAt,
            lastPassFinishedAt,
            lastPassSummary
        );
    }

    /**
     * Runs one pass on the calling thread under the same guard as scheduled passes.
     *
     * @return pass summary, flagged {@code skipped} when another pass is in progress
     */
    public PassSummary triggerPass() {
        return executePass();
    }

    void runScheduledPass() {
        try {
            executePass();
        } catch (RuntimeException exception) {
            LoggingUtils.error(log, exception, "Command enhancement pass failed unexpectedly");
            meterRegistry.counter("command.enhancement.passes", "outcome", "error").increment();
        }
    }

    private PassSummary executePass() {
        Instant startedAt = Instant.now();
        if (!processing.compareAndSet(false, true)) {
            log.debug("Command enhancement pass already running; skipping tick.");
            meterRegistry.counter("command.enhancement.passes", "outcome", "skipped").increment();
            return PassSummary.skipped(startedAt);
        }
        EnhancementPassLock passLock = passLockProvider.getIfAvailable();
        boolean leaseHeld = false;
        try {
            if (passLock != null) {
                leaseHeld = acquireLease(passLock);
                if (!leaseHeld) {
                    meterRegistry.counter("command.enhancement.passes", "outcome", "skipped").increment();
                    return PassSummary.skipped(startedAt);
                }
            }
            lastPassStartedAt = startedAt;
            PassSummary summary = processPass(startedAt);
            lastPassFinishedAt = summary.finishedAt();
            lastPassSummary = summary;
            meterRegistry.counter("command.enhancement.passes", "outcome",
                summary.ownersFailed() > 0 ? "partial" : "completed").increment();
            meterRegistry.counter("command.enhancement.snippets.created").increment(summary.snippetsCreated());
            return summary;
        } finally {
            if (leaseHeld) {
                releaseLease(passLock);
            }
            processing.set(false);
        }
    }

    private PassSummary processPass(Instant startedAt) {
        List<String> failures = new ArrayList<>();
        List<RawCommandRecord> discovered;
        try {
            discovered = commandStore.findUnprocessedRawCommands(properties.getBatchSize() * DISCOVERY_MULTIPLIER);
        } catch (DataAccessException exception) {
            LoggingUtils.error(log, exception, "Failed to discover unprocessed commands");
            failures.add("discovery: " + LoggingUtils.describe(exception));
            return new PassSummary(false, startedAt, Instant.now(), 0, 0, 0, 0, 0, 0, failures);
        }
        if (discovered.isEmpty()) {
            return new PassSummary(false, startedAt, Instant.now(), 0, 0, 0, 0, 0, 0, failures);
        }
        log.info("Found {} unprocessed terminal commands", discovered.size());

        Map<Long, Set<String>> commandsByOwner = new LinkedHashMap<>();
        for (RawCommandRecord record : discovered) {
            if (record.command() == null || record.command().isBlank()) {
                continue;
            }
            commandsByOwner.computeIfAbsent(record.ownerId(), owner -> new LinkedHashSet<>()).add(record.command());
        }

        int ownersProcessed = 0;
        int ownersFailed = 0;
        int created = 0;
        int duplicates = 0;
        int deleted = 0;
        boolean firstOwner = true;
        for (Map.Entry<Long, Set<String>> entry : commandsByOwner.entrySet()) {
            if (!firstOwner && !pauseBetweenOwners()) {
                break;
            }
            firstOwner = false;
            long ownerId = entry.getKey();
            List<String> batch = entry.getValue().stream().limit(properties.getBatchSize()).toList();
            try {
                OwnerOutcome outcome = processOwnerCommands(ownerId, batch);
                ownersProcessed++;
                created += outcome.created();
                duplicates += outcome.duplicates();
                deleted += outcome.deleted();
            } catch (RuntimeException exception) {
                ownersFailed++;
                failures.add("owner " + ownerId + ": " + LoggingUtils.describe(exception));
                meterRegistry.counter("command.enhancement.owner.failures", "reason", failureReason(exception)).increment();
                LoggingUtils.error(log, exception, "Command enhancement failed for owner {} ({} commands)",
                    ownerId, batch.size());
            }
        }

        PassSummary summary = new PassSummary(false, startedAt, Instant.now(), discovered.size(),
            ownersProcessed, ownersFailed, created, duplicates, deleted, failures);
        log.info("Command enhancement pass finished: owners={} failed={} created={} duplicates={} rawDeleted={}",
            ownersProcessed, ownersFailed, created, duplicates, deleted);
        return summary;
    }

    /**
     * Analyzes one owner's batch and reconciles the outcome with the store.
     *
     * <p>Provider failures propagate without marking so the batch is retried next pass.
     * Any received reply, usable or not, marks the whole batch processed.</p>
     */
    OwnerOutcome processOwnerCommands(long ownerId, List<String> commands) {
        AnalysisOptions options = new AnalysisOptions(properties.getMaxCandidates(), properties.isGroupSimilar());
        AnalysisResult result;
        try {
            result = analysisService.analyze(ownerId, commands, options);
        } catch (AnalysisExtractionException exception) {
            reconciler.markProcessed(ownerId, commands);
            throw exception;
        }

        if (!result.success()) {
            log.warn("Analysis {} produced no valid snippets for owner {}; marking {} commands processed",
                result.analysisId(), ownerId, commands.size());
            reconciler.markProcessed(ownerId, commands);
            return new OwnerOutcome(0, 0, 0);
        }

        EnhancedSnippetReconciler.PersistOutcome persisted =
            reconciler.persistCandidates(ownerId, result.validCandidates(), commands, result.analysisId());
        reconciler.markProcessed(ownerId, commands);

        int deleted = 0;
        if (properties.isCleanupRedundant() && persisted.created() + persisted.duplicates() > 0) {
            deleted = reconciler.removeRedundantRawCommands(ownerId, commands);
        }
        return new OwnerOutcome(persisted.created(), persisted.duplicates(), deleted);
    }

    record OwnerOutcome(int created, int duplicates, int deleted) {
    }

    private boolean pauseBetweenOwners() {
        Duration delay = properties.getOwnerDelay();
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            log.warn("Command enhancement pass interrupted between owners; ending pass early.");
            return false;
        }
    }

    private boolean acquireLease(EnhancementPassLock passLock) {
        try {
            boolean acquired = passLock.tryAcquire(holderId, properties.getLease().getDuration());
            if (!acquired) {
                log.debug("Another instance holds the enhancement pass lease; skipping pass.");
            }
            return acquired;
        } catch (DataAccessException exception) {
            LoggingUtils.warn(log, exception, "Failed to acquire enhancement pass lease; skipping pass");
            return false;
        }
    }

    private void releaseLease(EnhancementPassLock passLock) {
        try {
            passLock.release(holderId);
        } catch (DataAccessException exception) {
            LoggingUtils.warn(log, exception, "Failed to release enhancement pass lease {}; it will expire", holderId);
        }
    }

    private static String failureReason(RuntimeException exception) {
        if (exception instanceof AnalysisProviderException providerException) {
            return "provider_" + providerException.errorCode().name().toLowerCase(Locale.ROOT);
        }
        if (exception instanceof AnalysisExtractionException) {
            return "extraction";
        }
        return "unexpected";
    }
}
