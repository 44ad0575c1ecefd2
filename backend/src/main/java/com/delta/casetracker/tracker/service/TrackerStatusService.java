package com.delta.casetracker.tracker.service;

import com.delta.casetracker.tracker.history.CaseHistory;
import com.delta.casetracker.tracker.history.HistoryStoreException;
import com.delta.casetracker.tracker.history.JsonHistoryRepository;
import com.delta.casetracker.tracker.model.TrackerStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TrackerStatusService {
    private static final Logger log = LoggerFactory.getLogger(TrackerStatusService.class);

    private final JsonHistoryRepository historyRepository;
    private final TrackerRunService trackerRunService;

    public TrackerStatusService(JsonHistoryRepository historyRepository, TrackerRunService trackerRunService) {
        this.historyRepository = historyRepository;
        this.trackerRunService = trackerRunService;
    }

    public TrackerStatusResponse getStatus() {
        boolean present = historyRepository.exists();
        int entries = 0;
        if (present) {
            try {
                CaseHistory history = historyRepository.load();
                entries = history.size();
            } catch (HistoryStoreException e) {
                log.warn("History at {} could not be read for status", historyRepository.historyPath(), e);
                entries = -1;
            }
        }
        return new TrackerStatusResponse(
            historyRepository.historyPath().toString(),
            present,
            entries,
            trackerRunService.isRunInProgress(),
            trackerRunService.getLastStatus()
        );
    }
}
