package com.delta.casetracker.tracker.service;

import com.delta.casetracker.config.TrackerProperties;
import com.delta.casetracker.tracker.history.HistoryLock;
import com.delta.casetracker.tracker.history.JsonHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Removes temp files left by history writes that crashed before their rename. Skipped while another process holds
 * the history lock, since its temp file may still be in flight.
 */
@Component
@Order(0)
public class HistoryMaintenanceRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HistoryMaintenanceRunner.class);

    private final JsonHistoryRepository historyRepository;
    private final TrackerProperties properties;

    public HistoryMaintenanceRunner(JsonHistoryRepository historyRepository, TrackerProperties properties) {
        this.historyRepository = historyRepository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getHistory().isCleanupTempFilesOnStartup()) {
            return;
        }
        try (HistoryLock lock = historyRepository.acquireLock()) {
            int deleted = historyRepository.deleteOrphanTempFiles();
            if (deleted > 0) {
                log.info("Removed {} orphaned history temp file(s) next to {}", deleted, historyRepository.historyPath());
            }
        } catch (ActiveTrackerRunException e) {
            log.info("Skipping history temp cleanup: {}", e.getMessage());
        } catch (TrackerRunException e) {
            log.warn("Skipping history temp cleanup because the history location is not usable", e);
        }
    }
}
