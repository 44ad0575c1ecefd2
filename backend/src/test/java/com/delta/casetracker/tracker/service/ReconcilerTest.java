package com.delta.casetracker.tracker.service;

import com.delta.casetracker.tracker.history.CaseHistory;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.HistoryEntry;
import com.delta.casetracker.tracker.model.ReconcileResult;
import com.delta.casetracker.tracker.model.RunMode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.delta.casetracker.tracker.service.ChangeDetectorTest.historyOf;
import static com.delta.casetracker.tracker.service.ChangeDetectorTest.record;
import static com.delta.casetracker.tracker.service.ChangeDetectorTest.withDocuments;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconcilerTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-03-02T10:00:00Z");

    private final ChangeDetector detector = new ChangeDetector();
    private final Reconciler reconciler = new Reconciler();

    @Test
    void baselineRunStoresEveryRecordWithNowTimestamps() {
        List<CaseRecord> snapshot = List.of(record("A", 1), record("B", 2));

        ReconcileResult result = reconcile(snapshot, CaseHistory.empty(), T1);

        assertThat(result.runMode()).isEqualTo(RunMode.BASELINE);
        assertThat(result.history().size()).isEqualTo(2);
        HistoryEntry entry = result.history().get("A");
        assertThat(entry.firstSeenAt()).isEqualTo(T1);
        assertThat(entry.lastSeenAt()).isEqualTo(T1);
        assertThat(entry.lastUpdatedAt()).isEqualTo(T1);
    }

    @Test
    void incrementalRunUpdatesTimestampsByStatus() {
        CaseRecord unchanged = record("A", 1);
        CaseRecord updatedBefore = record("B", 1);
        CaseHistory history = historyOf(List.of(unchanged, updatedBefore));
        CaseRecord updated = withDocuments(updatedBefore, 5);

        ReconcileResult result = reconcile(List.of(unchanged, updated, record("C", 1)), history, T1);

        assertThat(result.runMode()).isEqualTo(RunMode.INCREMENTAL);
        HistoryEntry a = result.history().get("A");
        assertThat(a.firstSeenAt()).isEqualTo(T0);
        assertThat(a.lastUpdatedAt()).isEqualTo(T0);
        assertThat(a.lastSeenAt()).isEqualTo(T1);

        HistoryEntry b = result.history().get("B");
        assertThat(b.firstSeenAt()).isEqualTo(T0);
        assertThat(b.lastUpdatedAt()).isEqualTo(T1);
        assertThat(b.record().documentCount()).isEqualTo(5);
        assertThat(b.fingerprint()).isEqualTo(updated.fingerprint());

        assertThat(result.history().get("C").firstSeenAt()).isEqualTo(T1);
    }

    @Test
    void idsAbsentFromSnapshotAreCarriedOverUntouched() {
        CaseHistory history = historyOf(List.of(record("A", 1), record("GONE", 4)));

        ReconcileResult result = reconcile(List.of(record("A", 1)), history, T1);

        assertThat(result.history().get("GONE")).isEqualTo(history.get("GONE"));
    }

    @Test
    void clockSteppingBackDoesNotBreakTimestampOrder() {
        CaseHistory history = historyOf(List.of(record("A", 1)));
        CaseRecord updated = withDocuments(record("A", 1), 9);

        ReconcileResult result = reconcile(List.of(updated), history, T0.minusSeconds(3600));

        HistoryEntry entry = result.history().get("A");
        assertThat(entry.lastSeenAt()).isEqualTo(T0);
        assertThat(entry.lastUpdatedAt()).isEqualTo(T0);
    }

    @Test
    void unclassifiedSnapshotRecordIsRejected() {
        List<CaseRecord> snapshot = List.of(record("A", 1));

        assertThatThrownBy(() -> reconciler.reconcile(snapshot, List.<ClassifiedRecord>of(), CaseHistory.empty(), T1))
            .isInstanceOf(IllegalStateException.class);
    }

    private ReconcileResult reconcile(List<CaseRecord> snapshot, CaseHistory history, Instant now) {
        return reconciler.reconcile(snapshot, detector.classify(snapshot, history), history, now);
    }
}
