package com.delta.casetracker.tracker.collect;

import com.delta.casetracker.tracker.model.CaseRecord;

import java.util.List;

/**
 * Source of the current registry snapshot. Implementations return each case id at most once.
 */
public interface SnapshotCollector {

    List<CaseRecord> collect();
}
