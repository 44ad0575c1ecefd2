package com.delta.casetracker.tracker.api;

import com.delta.casetracker.tracker.collect.SnapshotCollector;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.model.TrackerRunReport;
import com.delta.casetracker.tracker.model.TrackerStatusResponse;
import com.delta.casetracker.tracker.service.TrackerRunService;
import com.delta.casetracker.tracker.service.TrackerStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/tracker")
public class TrackerController {
    private final TrackerRunService trackerRunService;
    private final TrackerStatusService trackerStatusService;
    private final SnapshotCollector snapshotCollector;

    public TrackerController(
        TrackerRunService trackerRunService,
        TrackerStatusService trackerStatusService,
        SnapshotCollector snapshotCollector
    ) {
        this.trackerRunService = trackerRunService;
        this.trackerStatusService = trackerStatusService;
        this.snapshotCollector = snapshotCollector;
    }

    /**
     * Runs the tracker over the posted snapshot, or over the configured collector when no body is sent.
     */
    @PostMapping("/runs")
    public TrackerRunReport run(@RequestBody(required = false) List<CaseRecord> snapshot) {
        List<CaseRecord> records = snapshot == null ? snapshotCollector.collect() : snapshot;
        return trackerRunService.run(records);
    }

    @PostMapping("/runs/cancel")
    public Map<String, Boolean> cancel() {
        return Map.of("cancelled", trackerRunService.cancel());
    }

    @GetMapping("/runs/latest")
    public TrackerRunReport latest() {
        TrackerRunReport report = trackerRunService.getLastReport();
        if (report == null) {
            throw new ResponseStatusException(NOT_FOUND, "No tracker run has been persisted yet");
        }
        return report;
    }

    @GetMapping("/status")
    public TrackerStatusResponse status() {
        return trackerStatusService.getStatus();
    }
}
