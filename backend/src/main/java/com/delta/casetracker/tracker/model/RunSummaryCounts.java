package com.delta.casetracker.tracker.model;

import java.util.List;

public record RunSummaryCounts(
    int total,
    int newCount,
    int updatedCount,
    int unchangedCount,
    int limitedCount,
    int fetchedCount,
    int skippedTooLargeCount,
    int fetchErrorCount
) {
    public static RunSummaryCounts from(List<ClassifiedRecord> records) {
        int newCount = 0;
        int updatedCount = 0;
        int unchangedCount = 0;
        int limitedCount = 0;
        int fetchedCount = 0;
        int skippedTooLargeCount = 0;
        int fetchErrorCount = 0;
        for (ClassifiedRecord record : records) {
            switch (record.status()) {
                case NEW -> newCount++;
                case UPDATED -> updatedCount++;
                case UNCHANGED -> unchangedCount++;
            }
            if (ClassifiedRecord.SKIP_NEW_RECORD_LIMIT.equals(record.skipReason())) {
                limitedCount++;
            }
            if (record.fetchOutcome() != null) {
                switch (record.fetchOutcome()) {
                    case FETCHED -> fetchedCount++;
                    case SKIPPED_TOO_LARGE -> skippedTooLargeCount++;
                    case FETCH_ERROR -> fetchErrorCount++;
                }
            }
        }
        return new RunSummaryCounts(
            records.size(),
            newCount,
            updatedCount,
            unchangedCount,
            limitedCount,
            fetchedCount,
            skippedTooLargeCount,
            fetchErrorCount
        );
    }
}
