package com.delta.casetracker.tracker.service;

import com.delta.casetracker.tracker.history.CaseHistory;
import com.delta.casetracker.tracker.model.CaseCategory;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.model.ChangeStatus;
import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.HistoryEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangeDetectorTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final ChangeDetector detector = new ChangeDetector();

    @Test
    void baselineClassifiesEveryRecordAsNew() {
        List<CaseRecord> snapshot = records("P", 105);

        List<ClassifiedRecord> classified = detector.classify(snapshot, CaseHistory.empty());

        assertThat(classified).hasSize(105);
        assertThat(classified).allMatch(record -> record.status() == ChangeStatus.NEW);
    }

    @Test
    void incrementalRunSplitsNewUpdatedAndUnchanged() {
        List<CaseRecord> previous = records("P", 105);
        CaseHistory history = historyOf(previous);

        List<CaseRecord> snapshot = new ArrayList<>();
        for (int i = 0; i < 105; i++) {
            CaseRecord record = previous.get(i);
            if (i < 5) {
                snapshot.add(withDocuments(record, record.documentCount() + 1));
            } else if (i < 100) {
                snapshot.add(record);
            }
        }
        snapshot.add(record("N-1", 1));
        snapshot.add(record("N-2", 1));
        snapshot.add(record("N-3", 1));

        List<ClassifiedRecord> classified = detector.classify(snapshot, history);

        assertThat(classified).hasSize(103);
        assertThat(classified).filteredOn(r -> r.status() == ChangeStatus.NEW).hasSize(3);
        assertThat(classified).filteredOn(r -> r.status() == ChangeStatus.UPDATED).hasSize(5);
        assertThat(classified).filteredOn(r -> r.status() == ChangeStatus.UNCHANGED).hasSize(95);
        assertThat(classified).extracting(ClassifiedRecord::id).doesNotContain("P-0101", "P-0104");
    }

    @Test
    void outputIsSortedByIdRegardlessOfInputOrder() {
        List<CaseRecord> snapshot = List.of(record("C", 1), record("A", 1), record("B", 1));

        List<ClassifiedRecord> classified = detector.classify(snapshot, CaseHistory.empty());

        assertThat(classified).extracting(ClassifiedRecord::id).containsExactly("A", "B", "C");
    }

    @Test
    void reportsWhichMutableFieldsChanged() {
        CaseRecord stored = new CaseRecord("X", CaseCategory.INBOUND, "t", List.of("a"), 2, T0);
        CaseRecord current = new CaseRecord("X", CaseCategory.INBOUND, "t", List.of("a", "b"), 2, T0.plusSeconds(60));

        List<ClassifiedRecord> classified = detector.classify(List.of(current), historyOf(List.of(stored)));

        assertThat(classified.get(0).status()).isEqualTo(ChangeStatus.UPDATED);
        assertThat(classified.get(0).changedFields()).containsExactly("lastMovementAt", "tags");
    }

    @Test
    void titleAndTagOrderDoNotCountAsChanges() {
        CaseRecord stored = new CaseRecord("X", CaseCategory.INBOUND, "old title", List.of("b", "a"), 2, T0);
        CaseRecord current = new CaseRecord("X", CaseCategory.GENERATED, "new title", List.of(" a", "b", ""), 2, T0);

        List<ClassifiedRecord> classified = detector.classify(List.of(current), historyOf(List.of(stored)));

        assertThat(classified.get(0).status()).isEqualTo(ChangeStatus.UNCHANGED);
        assertThat(classified.get(0).changedFields()).isEmpty();
    }

    @Test
    void staleStoredFingerprintIsReportedAsFingerprintChange() {
        CaseRecord record = record("X", 3);
        HistoryEntry legacy = new HistoryEntry(record, "0000", T0, T0, T0);
        CaseHistory history = CaseHistory.of(Map.of("X", legacy));

        List<ClassifiedRecord> classified = detector.classify(List.of(record), history);

        assertThat(classified.get(0).status()).isEqualTo(ChangeStatus.UPDATED);
        assertThat(classified.get(0).changedFields()).containsExactly("fingerprint");
    }

    @Test
    void rejectsDuplicateIdsInSnapshot() {
        List<CaseRecord> snapshot = List.of(record("A", 1), record("A", 2));

        assertThatThrownBy(() -> detector.classify(snapshot, CaseHistory.empty()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("A");
    }

    @Test
    void classificationIsDeterministic() {
        List<CaseRecord> previous = records("P", 20);
        CaseHistory history = historyOf(previous.subList(0, 10));

        assertThat(detector.classify(previous, history)).isEqualTo(detector.classify(previous, history));
    }

    static List<CaseRecord> records(String prefix, int count) {
        List<CaseRecord> out = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            out.add(record(String.format("%s-%04d", prefix, i), i % 7));
        }
        return out;
    }

    static CaseRecord record(String id, int documentCount) {
        return new CaseRecord(id, CaseCategory.INBOUND, "Case " + id, List.of("urgent"), documentCount, T0);
    }

    static CaseRecord withDocuments(CaseRecord record, int documentCount) {
        return new CaseRecord(
            record.id(),
            record.category(),
            record.title(),
            record.tags(),
            documentCount,
            record.lastMovementAt()
        );
    }

    static CaseHistory historyOf(List<CaseRecord> records) {
        Map<String, HistoryEntry> entries = new TreeMap<>();
        for (CaseRecord record : records) {
            entries.put(record.id(), HistoryEntry.firstObservation(record, T0));
        }
        return CaseHistory.of(entries);
    }
}
