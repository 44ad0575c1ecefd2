package com.delta.casetracker.tracker.service;

import com.delta.casetracker.config.TrackerProperties;
import com.delta.casetracker.tracker.fetch.ArtifactFetcher;
import com.delta.casetracker.tracker.history.CaseHistory;
import com.delta.casetracker.tracker.history.HistoryLock;
import com.delta.casetracker.tracker.history.JsonHistoryRepository;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.LimitPolicy;
import com.delta.casetracker.tracker.model.ReconcileResult;
import com.delta.casetracker.tracker.model.RunMode;
import com.delta.casetracker.tracker.model.RunStage;
import com.delta.casetracker.tracker.model.RunState;
import com.delta.casetracker.tracker.model.RunSummaryCounts;
import com.delta.casetracker.tracker.model.TrackerRunReport;
import com.delta.casetracker.tracker.model.TrackerRunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one tracker run: load, classify, limit, plan, reconcile, persist. The history lock is held for the
 * whole run and the durable store is only touched by the final atomic replace.
 */
@Service
public class TrackerRunService {
    private static final Logger log = LoggerFactory.getLogger(TrackerRunService.class);

    private final JsonHistoryRepository historyRepository;
    private final ChangeDetector changeDetector;
    private final LimitEnforcer limitEnforcer;
    private final FetchPlanner fetchPlanner;
    private final Reconciler reconciler;
    private final ArtifactFetcher artifactFetcher;
    private final TrackerProperties properties;
    private final Clock clock;

    private final AtomicReference<RunContext> activeRun = new AtomicReference<>();
    private final AtomicReference<TrackerRunStatus> lastStatus = new AtomicReference<>();
    private final AtomicReference<TrackerRunReport> lastReport = new AtomicReference<>();

    public TrackerRunService(
        JsonHistoryRepository historyRepository,
        ChangeDetector changeDetector,
        LimitEnforcer limitEnforcer,
        FetchPlanner fetchPlanner,
        Reconciler reconciler,
        ArtifactFetcher artifactFetcher,
        TrackerProperties properties,
        Clock clock
    ) {
        this.historyRepository = historyRepository;
        this.changeDetector = changeDetector;
        this.limitEnforcer = limitEnforcer;
        this.fetchPlanner = fetchPlanner;
        this.reconciler = reconciler;
        this.artifactFetcher = artifactFetcher;
        this.properties = properties;
        this.clock = clock;
    }

    public TrackerRunReport run(Collection<CaseRecord> snapshot) {
        LimitPolicy policy = properties.getLimits().toPolicy();
        HistoryLock lock = historyRepository.acquireLock();
        RunContext context = new RunContext(UUID.randomUUID().toString(), clock.instant());
        try (lock) {
            activeRun.set(context);
            lastStatus.set(context.status(RunState.RUNNING, null, null, null, "run started"));
            log.info(
                "Tracker run {} started: snapshot={} maxNewPerRun={} maxArtifactSizeBytes={}",
                context.runId,
                snapshot == null ? 0 : snapshot.size(),
                policy.maxNewPerRun(),
                policy.maxArtifactSizeBytes()
            );
            TrackerRunReport report = execute(context, snapshot, policy);
            lastReport.set(report);
            lastStatus.set(context.status(RunState.PERSISTED, report.finishedAt(), report.runMode(), report.counts(), "persisted"));
            return report;
        } catch (IllegalArgumentException e) {
            recordAborted(context, "invalid_snapshot: " + e.getMessage());
            throw e;
        } catch (TrackerRunException e) {
            recordAborted(context, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            String message = "Tracker run " + context.runId + " failed after stage " + context.stage
                + "; history left unchanged";
            recordAborted(context, "exception=" + e.getClass().getSimpleName());
            throw new TrackerRunException(message, e);
        } finally {
            activeRun.compareAndSet(context, null);
        }
    }

    private TrackerRunReport execute(RunContext context, Collection<CaseRecord> snapshot, LimitPolicy policy) {
        CaseHistory history = historyRepository.load();
        RunMode runMode = history.isEmpty() ? RunMode.BASELINE : RunMode.INCREMENTAL;
        context.advance(RunStage.LOADED);
        checkCancelled(context);

        List<ClassifiedRecord> classified = changeDetector.classify(snapshot, history);
        context.advance(RunStage.CLASSIFIED);
        checkCancelled(context);

        List<ClassifiedRecord> limited = limitEnforcer.enforce(classified, policy);
        context.advance(RunStage.LIMIT_APPLIED);
        checkCancelled(context);

        List<ClassifiedRecord> planned = fetchPlanner.plan(limited, artifactFetcher, policy, context::isCancelled);
        context.advance(RunStage.PLANNED);
        checkCancelled(context);

        Instant now = clock.instant();
        ReconcileResult reconciled = reconciler.reconcile(snapshot, planned, history, now);
        context.advance(RunStage.RECONCILED);
        checkCancelled(context);

        historyRepository.replace(reconciled.history());
        context.advance(RunStage.PERSISTED);

        RunSummaryCounts counts = RunSummaryCounts.from(planned);
        log.info(
            "Tracker run {} persisted: mode={} total={} new={} updated={} unchanged={} limited={} fetched={} tooLarge={} fetchErrors={}",
            context.runId,
            runMode,
            counts.total(),
            counts.newCount(),
            counts.updatedCount(),
            counts.unchangedCount(),
            counts.limitedCount(),
            counts.fetchedCount(),
            counts.skippedTooLargeCount(),
            counts.fetchErrorCount()
        );
        return new TrackerRunReport(
            context.runId,
            context.startedAt,
            clock.instant(),
            RunState.PERSISTED,
            runMode,
            counts,
            planned
        );
    }

    /**
     * Requests cancellation of the run in progress. Returns false when no run is active.
     */
    public boolean cancel() {
        RunContext context = activeRun.get();
        if (context == null) {
            return false;
        }
        context.cancelled = true;
        log.info("Cancellation requested for tracker run {} at stage {}", context.runId, context.stage);
        return true;
    }

    public boolean isRunInProgress() {
        return activeRun.get() != null;
    }

    public TrackerRunStatus getLastStatus() {
        return lastStatus.get();
    }

    public TrackerRunReport getLastReport() {
        return lastReport.get();
    }

    private void checkCancelled(RunContext context) {
        if (context.isCancelled()) {
            throw new RunAbortedException(
                "Tracker run " + context.runId + " cancelled after stage " + context.stage + "; nothing persisted"
            );
        }
    }

    private void recordAborted(RunContext context, String notes) {
        RunStage reached = context.stage;
        context.advance(RunStage.ABORTED);
        log.warn("Tracker run {} aborted after stage {}: {}", context.runId, reached, notes);
        lastStatus.set(new TrackerRunStatus(
            context.runId,
            context.startedAt,
            clock.instant(),
            RunState.ABORTED,
            reached,
            null,
            null,
            notes
        ));
    }

    private static final class RunContext {
        private final String runId;
        private final Instant startedAt;
        private volatile RunStage stage = RunStage.STARTED;
        private volatile boolean cancelled;

        private RunContext(String runId, Instant startedAt) {
            this.runId = runId;
            this.startedAt = startedAt;
        }

        private void advance(RunStage next) {
            this.stage = next;
        }

        private boolean isCancelled() {
            return cancelled || Thread.currentThread().isInterrupted();
        }

        private TrackerRunStatus status(
            RunState state,
            Instant finishedAt,
            RunMode runMode,
            RunSummaryCounts counts,
            String notes
        ) {
            return new TrackerRunStatus(runId, startedAt, finishedAt, state, stage, runMode, counts, notes);
        }
    }
}
