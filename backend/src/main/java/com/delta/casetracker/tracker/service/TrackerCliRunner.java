package com.delta.casetracker.tracker.service;

import com.delta.casetracker.config.TrackerProperties;
import com.delta.casetracker.tracker.collect.SnapshotCollector;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.RunSummaryCounts;
import com.delta.casetracker.tracker.model.TrackerRunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TrackerCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TrackerCliRunner.class);

    private final TrackerProperties properties;
    private final SnapshotCollector snapshotCollector;
    private final TrackerRunService trackerRunService;
    private final ConfigurableApplicationContext applicationContext;

    public TrackerCliRunner(
        TrackerProperties properties,
        SnapshotCollector snapshotCollector,
        TrackerRunService trackerRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.snapshotCollector = snapshotCollector;
        this.trackerRunService = trackerRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = 0;
        try {
            List<CaseRecord> snapshot = snapshotCollector.collect();
            TrackerRunReport report = trackerRunService.run(snapshot);
            logReport(report);
        } catch (RuntimeException e) {
            log.error("Tracker run failed; history left unchanged and the run can be retried", e);
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> finalExitCode));
        }
    }

    private void logReport(TrackerRunReport report) {
        RunSummaryCounts counts = report.counts();
        log.info(
            "Run {} ({}) finished: total={} new={} updated={} unchanged={} limited={} fetched={} tooLarge={} fetchErrors={}",
            report.runId(),
            report.runMode(),
            counts.total(),
            counts.newCount(),
            counts.updatedCount(),
            counts.unchangedCount(),
            counts.limitedCount(),
            counts.fetchedCount(),
            counts.skippedTooLargeCount(),
            counts.fetchErrorCount()
        );
        for (ClassifiedRecord record : report.skipped()) {
            log.info(
                "Not analysed {} status={} reason={} detail={}",
                record.id(),
                record.status(),
                record.skipReason(),
                record.fetchError()
            );
        }
    }
}
