package com.delta.casetracker.tracker.service;

import com.delta.casetracker.tracker.history.CaseHistory;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.model.ChangeStatus;
import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.HistoryEntry;
import com.delta.casetracker.tracker.model.ReconcileResult;
import com.delta.casetracker.tracker.model.RunMode;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the replacement history for a run. Pure: persisting the result is the caller's job.
 */
@Service
public class Reconciler {

    public ReconcileResult reconcile(
        Collection<CaseRecord> snapshot,
        List<ClassifiedRecord> classified,
        CaseHistory history,
        Instant now
    ) {
        RunMode runMode = history.isEmpty() ? RunMode.BASELINE : RunMode.INCREMENTAL;
        Map<String, ChangeStatus> statusById = new HashMap<>();
        for (ClassifiedRecord record : classified) {
            statusById.put(record.id(), record.status());
        }

        TreeMap<String, HistoryEntry> next = new TreeMap<>(history.entries());
        for (CaseRecord record : ChangeDetector.indexById(snapshot).values()) {
            ChangeStatus status = statusById.get(record.id());
            if (status == null) {
                throw new IllegalStateException("Case " + record.id() + " was not classified in this run");
            }
            HistoryEntry previous = history.get(record.id());
            next.put(record.id(), nextEntry(previous, record, status, now));
        }
        return new ReconcileResult(CaseHistory.of(next), runMode);
    }

    private HistoryEntry nextEntry(HistoryEntry previous, CaseRecord record, ChangeStatus status, Instant now) {
        if (previous == null) {
            return HistoryEntry.firstObservation(record, now);
        }
        // never move timestamps backwards if the clock stepped back between runs
        Instant observedAt = now.isBefore(previous.lastSeenAt()) ? previous.lastSeenAt() : now;
        if (status == ChangeStatus.UNCHANGED) {
            return previous.seenAgain(record, observedAt);
        }
        return previous.updated(record, observedAt);
    }
}
