package com.delta.casetracker.tracker.service;

import com.delta.casetracker.tracker.history.CaseHistory;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.model.ChangeStatus;
import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.HistoryEntry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Classifies a snapshot against history. Output is sorted by id and depends only on the inputs.
 * Ids that are in history but missing from the snapshot are not reported; the registry is append-mostly.
 */
@Service
public class ChangeDetector {
    static final String FIELD_DOCUMENT_COUNT = "documentCount";
    static final String FIELD_LAST_MOVEMENT_AT = "lastMovementAt";
    static final String FIELD_TAGS = "tags";
    static final String FIELD_FINGERPRINT = "fingerprint";

    public List<ClassifiedRecord> classify(Collection<CaseRecord> snapshot, CaseHistory history) {
        SortedMap<String, CaseRecord> current = indexById(snapshot);
        List<ClassifiedRecord> out = new ArrayList<>(current.size());
        for (CaseRecord record : current.values()) {
            HistoryEntry previous = history.get(record.id());
            if (previous == null) {
                out.add(ClassifiedRecord.of(record, ChangeStatus.NEW, List.of()));
            } else if (previous.fingerprint().equals(record.fingerprint())) {
                out.add(ClassifiedRecord.of(record, ChangeStatus.UNCHANGED, List.of()));
            } else {
                out.add(ClassifiedRecord.of(record, ChangeStatus.UPDATED, changedFields(previous.record(), record)));
            }
        }
        return out;
    }

    static List<String> changedFields(CaseRecord previous, CaseRecord current) {
        List<String> fields = new ArrayList<>();
        if (previous.documentCount() != current.documentCount()) {
            fields.add(FIELD_DOCUMENT_COUNT);
        }
        if (!Objects.equals(previous.lastMovementAt(), current.lastMovementAt())) {
            fields.add(FIELD_LAST_MOVEMENT_AT);
        }
        if (!previous.normalizedTags().equals(current.normalizedTags())) {
            fields.add(FIELD_TAGS);
        }
        if (fields.isEmpty()) {
            // stored digest predates the current fingerprint layout
            fields.add(FIELD_FINGERPRINT);
        }
        return fields;
    }

    public static SortedMap<String, CaseRecord> indexById(Collection<CaseRecord> snapshot) {
        SortedMap<String, CaseRecord> byId = new TreeMap<>();
        if (snapshot == null) {
            return byId;
        }
        for (CaseRecord record : snapshot) {
            if (record == null) {
                continue;
            }
            CaseRecord existing = byId.putIfAbsent(record.id(), record);
            if (existing != null) {
                throw new IllegalArgumentException("Snapshot contains duplicate case id " + record.id());
            }
        }
        return byId;
    }
}
