package com.delta.casetracker.tracker.model;

import com.delta.casetracker.tracker.history.CaseHistory;

public record ReconcileResult(CaseHistory history, RunMode runMode) {
}
