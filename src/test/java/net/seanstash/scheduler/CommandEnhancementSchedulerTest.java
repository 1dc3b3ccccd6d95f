package net.seanstash.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import net.seanstash.application.ai.AnalysisExtractionException;
import net.seanstash.application.ai.AnalysisOptions;
import net.seanstash.application.ai.AnalysisProviderException;
import net.seanstash.application.ai.CommandAnalysisService;
import net.seanstash.application.enhancement.CommandStore;
import net.seanstash.application.enhancement.EnhancedSnippetReconciler;
import net.seanstash.application.enhancement.EnhancementPassLock;
import net.seanstash.application.enhancement.PassSummary;
import net.seanstash.config.EnhancementProperties;
import net.seanstash.domain.ai.AnalysisCandidate;
import net.seanstash.domain.ai.AnalysisResult;
import net.seanstash.domain.ai.CandidateFragment;
import net.seanstash.domain.snippet.RawCommandRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.TaskScheduler;

class CommandEnhancementSchedulerTest {

    private TaskScheduler taskScheduler;
    private CommandStore commandStore;
    private CommandAnalysisService analysisService;
    private EnhancedSnippetReconciler reconciler;
    private EnhancementProperties properties;
    private ObjectProvider<EnhancementPassLock> passLockProvider;
    private SimpleMeterRegistry meterRegistry;
    private CommandEnhancementScheduler scheduler;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        commandStore = mock(CommandStore.class);
        analysisService = mock(CommandAnalysisService.class);
        reconciler = mock(EnhancedSnippetReconciler.class);
        passLockProvider = mock(ObjectProvider.class);
        meterRegistry = new SimpleMeterRegistry();
        properties = new EnhancementProperties();
        properties.setOwnerDelay(Duration.ZERO);
        properties.setBatchSize(2);
        scheduler = new CommandEnhancementScheduler(taskScheduler, commandStore, analysisService, reconciler,
            properties, passLockProvider, meterRegistry);
    }

    private static RawCommandRecord raw(long id, long owner, String command) {
        return new RawCommandRecord(id, owner, "Terminal: " + command, command, Instant.EPOCH);
    }

    private static AnalysisResult successful(String analysisId) {
        AnalysisCandidate candidate = new AnalysisCandidate("Listing", "List files", List.of("shell"),
            List.of(new CandidateFragment("ls.sh", "ls -la", "bash", 0)), false, false);
        return new AnalysisResult(analysisId, true, false, List.of(candidate), List.of(),
            null, null, 5L, "model", "{}", Instant.EPOCH);
    }

    private static AnalysisResult empty(String analysisId) {
        return new AnalysisResult(analysisId, false, false, List.of(), List.of(),
            null, null, 5L, "model", "{}", Instant.EPOCH);
    }

    @Test
    void should_GroupByOwnerAndCapBatch_When_PassRuns() {
        when(commandStore.findUnprocessedRawCommands(10)).thenReturn(List.of(
            raw(1, 1L, "ls"), raw(2, 1L, "ls"), raw(3, 1L, "pwd"), raw(4, 1L, "whoami"), raw(5, 2L, "df -h")));
        when(analysisService.analyze(anyLong(), anyList(), any(AnalysisOptions.class))).thenReturn(successful("a"));
        when(reconciler.persistCandidates(anyLong(), anyList(), anyList(), anyString()))
            .thenReturn(new EnhancedSnippetReconciler.PersistOutcome(1, 0, 0));

        PassSummary summary = scheduler.triggerPass();

        verify(analysisService).analyze(eq(1L), eq(List.of("ls", "pwd")), any(AnalysisOptions.class));
        verify(analysisService).analyze(eq(2L), eq(List.of("df -h")), any(AnalysisOptions.class));
        assertThat(summary.skipped()).isFalse();
        assertThat(summary.commandsDiscovered()).isEqualTo(5);
        assertThat(summary.ownersProcessed()).isEqualTo(2);
        assertThat(summary.snippetsCreated()).isEqualTo(2);
        assertThat(meterRegistry.counter("command.enhancement.passes", "outcome", "completed").count()).isEqualTo(1.0);
    }

    @Test
    void should_SkipPass_When_PreviousPassStillRunning() {
        when(commandStore.findUnprocessedRawCommands(anyInt())).thenReturn(List.of(raw(1, 1L, "ls")));
        AtomicReference<PassSummary> nested = new AtomicReference<>();
        when(analysisService.analyze(anyLong(), anyList(), any(AnalysisOptions.class))).thenAnswer(invocation -> {
            nested.set(scheduler.triggerPass());
            return empty("a");
        });

        PassSummary outer = scheduler.triggerPass();

        assertThat(outer.skipped()).isFalse();
        assertThat(nested.get().skipped()).isTrue();
        assertThat(meterRegistry.counter("command.enhancement.passes", "outcome", "skipped").count()).isEqualTo(1.0);
        assertThat(scheduler.getStatus().processing()).isFalse();
    }

    @Test
    void should_ContinueWithNextOwner_When_OneOwnerFails() {
        when(commandStore.findUnprocessedRawCommands(anyInt())).thenReturn(List.of(raw(1, 1L, "ls"), raw(2, 2L, "pwd")));
        when(analysisService.analyze(eq(1L), anyList(), any(AnalysisOptions.class)))
            .thenThrow(new AnalysisProviderException(AnalysisProviderException.ErrorCode.RATE_LIMITED, "slow down"));
        when(analysisService.analyze(eq(2L), anyList(), any(AnalysisOptions.class))).thenReturn(successful("b"));
        when(reconciler.persistCandidates(anyLong(), anyList(), anyList(), anyString()))
            .thenReturn(new EnhancedSnippetReconciler.PersistOutcome(1, 0, 0));

        PassSummary summary = scheduler.triggerPass();

        assertThat(summary.ownersFailed()).isEqualTo(1);
        assertThat(summary.ownersProcessed()).isEqualTo(1);
        assertThat(summary.failures()).singleElement().asString().startsWith("owner 1:");
        assertThat(meterRegistry.counter("command.enhancement.owner.failures", "reason", "provider_rate_limited").count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.counter("command.enhancement.passes", "outcome", "partial").count()).isEqualTo(1.0);
    }

    @Test
    void should_LeaveCommandsUnmarked_When_ProviderFails() {
        when(analysisService.analyze(anyLong(), anyList(), any(AnalysisOptions.class)))
            .thenThrow(new AnalysisProviderException(AnalysisProviderException.ErrorCode.NETWORK, "unreachable"));

        assertThatThrownBy(() -> scheduler.processOwnerCommands(1L, List.of("ls")))
            .isInstanceOf(AnalysisProviderException.class);

        verify(reconciler, never()).markProcessed(anyLong(), anyList());
    }

    @Test
    void should_MarkCommands_When_ReplyCouldNotBeParsed() {
        when(analysisService.analyze(anyLong(), anyList(), any(AnalysisOptions.class)))
            .thenThrow(new AnalysisExtractionException("No valid JSON found in response"));

        assertThatThrownBy(() -> scheduler.processOwnerCommands(1L, List.of("ls")))
            .isInstanceOf(AnalysisExtractionException.class);

        verify(reconciler).markProcessed(1L, List.of("ls"));
    }

    @Test
    void should_MarkWithoutPersisting_When_NoCandidateIsValid() {
        when(analysisService.analyze(anyLong(), anyList(), any(AnalysisOptions.class))).thenReturn(empty("a"));

        CommandEnhancementScheduler.OwnerOutcome outcome = scheduler.processOwnerCommands(1L, List.of("ls"));

        assertThat(outcome.created()).isZero();
        verify(reconciler).markProcessed(1L, List.of("ls"));
        verify(reconciler, never()).persistCandidates(anyLong(), anyList(), anyList(), anyString());
    }

    @Test
    void should_RemoveRawRecords_When_SnippetsCoverCommands() {
        when(analysisService.analyze(anyLong(), anyList(), any(AnalysisOptions.class))).thenReturn(successful("a"));
        when(reconciler.persistCandidates(anyLong(), anyList(), anyList(), anyString()))
            .thenReturn(new EnhancedSnippetReconciler.PersistOutcome(0, 1, 0));
        when(reconciler.removeRedundantRawCommands(1L, List.of("ls"))).thenReturn(1);

        CommandEnhancementScheduler.OwnerOutcome outcome = scheduler.processOwnerCommands(1L, List.of("ls"));

        assertThat(outcome.duplicates()).isEqualTo(1);
        assertThat(outcome.deleted()).isEqualTo(1);
    }

    @Test
    void should_KeepRawRecords_When_CleanupDisabled() {
        properties.setCleanupRedundant(false);
        when(analysisService.analyze(anyLong(), anyList(), any(AnalysisOptions.class))).thenReturn(successful("a"));
        when(reconciler.persistCandidates(anyLong(), anyList(), anyList(), anyString()))
            .thenReturn(new EnhancedSnippetReconciler.PersistOutcome(1, 0, 0));

        scheduler.processOwnerCommands(1L, List.of("ls"));

        verify(reconciler, never()).removeRedundantRawCommands(anyLong(), anyList());
    }

    @Test
    void should_SkipPass_When_AnotherInstanceHoldsLease() {
        EnhancementPassLock lock = mock(EnhancementPassLock.class);
        when(passLockProvider.getIfAvailable()).thenReturn(lock);
        when(lock.tryAcquire(anyString(), any(Duration.class))).thenReturn(false);

        PassSummary summary = scheduler.triggerPass();

        assertThat(summary.skipped()).isTrue();
        verify(commandStore, never()).findUnprocessedRawCommands(anyInt());
        verify(lock, never()).release(anyString());
    }

    @Test
    void should_ReleaseLease_When_PassCompletes() {
        EnhancementPassLock lock = mock(EnhancementPassLock.class);
        when(passLockProvider.getIfAvailable()).thenReturn(lock);
        when(lock.tryAcquire(anyString(), any(Duration.class))).thenReturn(true);
        when(commandStore.findUnprocessedRawCommands(anyInt())).thenReturn(new ArrayList<>());

        PassSummary summary = scheduler.triggerPass();

        assertThat(summary.commandsDiscovered()).isZero();
        verify(lock).release(anyString());
        assertThat(scheduler.getStatus().lastPassSummary()).isEqualTo(summary);
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void should_ScheduleAtFixedRate_When_Started() {
        ScheduledFuture future = mock(ScheduledFuture.class);
        when(taskScheduler.scheduleAtFixedRate(any(Runnable.class), eq(properties.getInterval()))).thenReturn(future);

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();
        verify(future).cancel(false);
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void should_NotSchedule_When_Disabled() {
        properties.setEnabled(false);

        scheduler.start();

        assertThat(scheduler.isRunning()).isFalse();
        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }
}
