package net.seanstash.application.enhancement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import net.seanstash.domain.ai.AnalysisCandidate;
import net.seanstash.domain.ai.CandidateFragment;
import net.seanstash.domain.snippet.EnhancedSnippetRef;
import net.seanstash.domain.snippet.EnhancementAudit;
import net.seanstash.domain.snippet.RawCommandRecord;
import net.seanstash.domain.snippet.SnippetInsertResult;
import net.seanstash.support.retry.AdvisoryLockAcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class EnhancedSnippetReconcilerTest {

    private static final long OWNER = 7L;

    @Mock
    private CommandStore commandStore;

    private EnhancedSnippetReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new EnhancedSnippetReconciler(commandStore);
    }

    private static AnalysisCandidate candidate(String title) {
        return new AnalysisCandidate(title, "desc", List.of("shell"),
            List.of(new CandidateFragment("a.sh", "echo", "bash", 0)), false, false);
    }

    @Test
    void should_CreateSnippetWithAudit_When_TitleIsNew() {
        when(commandStore.findSnippetByTitle(OWNER, "ls")).thenReturn(Optional.empty());
        when(commandStore.insertEnhancedSnippet(eq(OWNER), any(), any())).thenReturn(SnippetInsertResult.created(11L));
        ArgumentCaptor<EnhancementAudit> audit = ArgumentCaptor.forClass(EnhancementAudit.class);

        EnhancedSnippetReconciler.PersistOutcome outcome =
            reconciler.persistCandidates(OWNER, List.of(candidate("ls")), List.of("ls -la"), "analysis-9");

        assertThat(outcome).isEqualTo(new EnhancedSnippetReconciler.PersistOutcome(1, 0, 0));
        verify(commandStore).insertEnhancedSnippet(eq(OWNER), eq(candidate("ls")), audit.capture());
        assertThat(audit.getValue().sourceCommands()).containsExactly("ls -la");
        assertThat(audit.getValue().analysisId()).isEqualTo("analysis-9");
    }

    @Test
    void should_SkipInsert_When_TitleAlreadyExistsForOwner() {
        when(commandStore.findSnippetByTitle(OWNER, "ls")).thenReturn(Optional.of(new EnhancedSnippetRef(3L, OWNER, "ls")));

        EnhancedSnippetReconciler.PersistOutcome outcome =
            reconciler.persistCandidates(OWNER, List.of(candidate("ls")), List.of("ls"), "a");

        assertThat(outcome.duplicates()).isEqualTo(1);
        verify(commandStore, never()).insertEnhancedSnippet(anyLong(), any(), any());
    }

    @Test
    void should_CountDuplicate_When_ConcurrentWriterWinsInsideLock() {
        when(commandStore.findSnippetByTitle(OWNER, "ls")).thenReturn(Optional.empty());
        when(commandStore.insertEnhancedSnippet(eq(OWNER), any(), any())).thenReturn(SnippetInsertResult.existing(5L));

        assertThat(reconciler.persistCandidates(OWNER, List.of(candidate("ls")), List.of("ls"), "a").duplicates())
            .isEqualTo(1);
    }

    @Test
    void should_RetryLockContention_When_AdvisoryLockBusy() {
        when(commandStore.findSnippetByTitle(OWNER, "ls")).thenReturn(Optional.empty());
        when(commandStore.insertEnhancedSnippet(eq(OWNER), any(), any()))
            .thenThrow(new AdvisoryLockAcquisitionException("title", 1L))
            .thenReturn(SnippetInsertResult.created(4L));

        assertThat(reconciler.persistCandidates(OWNER, List.of(candidate("ls")), List.of("ls"), "a").created())
            .isEqualTo(1);
        verify(commandStore, times(2)).insertEnhancedSnippet(eq(OWNER), any(), any());
    }

    @Test
    void should_KeepEarlierSnippets_When_LaterInsertFails() {
        when(commandStore.findSnippetByTitle(eq(OWNER), any())).thenReturn(Optional.empty());
        when(commandStore.insertEnhancedSnippet(eq(OWNER), eq(candidate("one")), any())).thenReturn(SnippetInsertResult.created(1L));
        when(commandStore.insertEnhancedSnippet(eq(OWNER), eq(candidate("two")), any()))
            .thenThrow(new DataAccessResourceFailureException("disk full"));

        EnhancedSnippetReconciler.PersistOutcome outcome = reconciler.persistCandidates(
            OWNER, List.of(candidate("one"), candidate("two")), List.of("x"), "a");

        assertThat(outcome).isEqualTo(new EnhancedSnippetReconciler.PersistOutcome(1, 0, 1));
    }

    @Test
    void should_ReturnFalse_When_MarkingFails() {
        doThrow(new DataAccessResourceFailureException("down")).when(commandStore).markCommandsProcessed(OWNER, List.of("ls"));

        assertThat(reconciler.markProcessed(OWNER, List.of("ls"))).isFalse();
    }

    @Test
    void should_DeleteEveryMatchingRawRecord_When_CleaningUp() {
        when(commandStore.findRawCommandsByText(OWNER, "ls")).thenReturn(List.of(
            new RawCommandRecord(20L, OWNER, "Terminal: ls", "ls", Instant.EPOCH),
            new RawCommandRecord(21L, OWNER, "Terminal: ls", "ls", Instant.EPOCH)));

        int deleted = reconciler.removeRedundantRawCommands(OWNER, List.of("ls", "ls"));

        assertThat(deleted).isEqualTo(2);
        verify(commandStore, times(1)).findRawCommandsByText(OWNER, "ls");
        verify(commandStore).deleteRawCommand(20L);
        verify(commandStore).deleteRawCommand(21L);
    }

    @Test
    void should_ContinueCleanup_When_OneDeleteFails() {
        when(commandStore.findRawCommandsByText(OWNER, "ls")).thenReturn(List.of(
            new RawCommandRecord(20L, OWNER, "Terminal: ls", "ls", Instant.EPOCH),
            new RawCommandRecord(21L, OWNER, "Terminal: ls", "ls", Instant.EPOCH)));
        doThrow(new DataAccessResourceFailureException("locked")).when(commandStore).deleteRawCommand(20L);

        assertThat(reconciler.removeRedundantRawCommands(OWNER, List.of("ls"))).isEqualTo(1);
    }

    @Test
    void should_CountFailureAndContinue_When_StoreRejectsTitle() {
        when(commandStore.findSnippetByTitle(eq(OWNER), any())).thenReturn(Optional.empty());
        when(commandStore.insertEnhancedSnippet(eq(OWNER), eq(candidate("Terminal: ls")), any()))
            .thenThrow(new IllegalArgumentException("raw command prefix"));
        when(commandStore.insertEnhancedSnippet(eq(OWNER), eq(candidate("ls")), any())).thenReturn(SnippetInsertResult.created(2L));

        EnhancedSnippetReconciler.PersistOutcome outcome = reconciler.persistCandidates(
            OWNER, List.of(candidate("Terminal: ls"), candidate("ls")), List.of("ls"), "a");

        assertThat(outcome).isEqualTo(new EnhancedSnippetReconciler.PersistOutcome(1, 0, 1));
    }
}
