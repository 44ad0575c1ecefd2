package com.delta.casetracker.tracker.service;

import com.delta.casetracker.tracker.fetch.ArtifactFetchResult;
import com.delta.casetracker.tracker.fetch.ArtifactFetcher;
import com.delta.casetracker.tracker.fetch.ArtifactProbeResult;
import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.FetchOutcome;
import com.delta.casetracker.tracker.model.LimitPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Decides per admitted record whether its artifact is fetched. Records are planned independently on the fetch
 * pool; failures are recorded on the record and never fail the run.
 */
@Service
public class FetchPlanner {
    private static final Logger log = LoggerFactory.getLogger(FetchPlanner.class);
    private static final long CANCEL_POLL_MILLIS = 200;

    private final ExecutorService fetchExecutor;

    public FetchPlanner(@Qualifier("fetchExecutor") ExecutorService fetchExecutor) {
        this.fetchExecutor = fetchExecutor;
    }

    public List<ClassifiedRecord> plan(List<ClassifiedRecord> records, ArtifactFetcher fetcher, LimitPolicy policy) {
        return plan(records, fetcher, policy, () -> false);
    }

    /**
     * Returns the records in their input order with fetch outcomes filled in for admitted ones.
     *
     * @throws RunAbortedException when {@code cancelled} turns true before every outcome is collected
     */
    public List<ClassifiedRecord> plan(
        List<ClassifiedRecord> records,
        ArtifactFetcher fetcher,
        LimitPolicy policy,
        BooleanSupplier cancelled
    ) {
        AtomicBoolean aborted = new AtomicBoolean();
        BooleanSupplier stop = () -> aborted.get() || cancelled.getAsBoolean();
        List<PlanTask> tasks = new ArrayList<>(records.size());
        for (ClassifiedRecord record : records) {
            PlanTask task = new PlanTask(record);
            if (record.admitted()) {
                task.future = fetchExecutor.submit(() -> task.run(() -> planOne(record, fetcher, policy, stop)));
            }
            tasks.add(task);
        }

        List<ClassifiedRecord> planned = new ArrayList<>(records.size());
        try {
            for (PlanTask task : tasks) {
                planned.add(task.future == null ? task.record : await(task.future, cancelled));
            }
        } catch (RunAbortedException e) {
            aborted.set(true);
            for (PlanTask task : tasks) {
                if (task.future != null) {
                    task.future.cancel(true);
                }
            }
            awaitInFlight(tasks);
            throw e;
        }
        return planned;
    }

    ClassifiedRecord planOne(ClassifiedRecord record, ArtifactFetcher fetcher, LimitPolicy policy, BooleanSupplier stop) {
        String caseId = record.id();
        ArtifactProbeResult probe;
        try {
            probe = fetcher.probeSize(caseId);
        } catch (RuntimeException e) {
            probe = ArtifactProbeResult.failed(caseId, "probe_exception", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (probe == null || !probe.isSuccessful()) {
            String error = probe == null ? "probe_missing" : describe(probe.errorCode(), probe.errorMessage());
            log.warn("Artifact size probe failed for case {}: {}", caseId, error);
            return record.withFetch(FetchOutcome.FETCH_ERROR, null, ClassifiedRecord.SKIP_PROBE_FAILED, error);
        }

        long sizeBytes = probe.sizeBytes();
        if (sizeBytes > policy.maxArtifactSizeBytes()) {
            log.info(
                "Skipping artifact for case {}: size {} bytes exceeds limit {}",
                caseId,
                sizeBytes,
                policy.maxArtifactSizeBytes()
            );
            return record.withFetch(FetchOutcome.SKIPPED_TOO_LARGE, sizeBytes, ClassifiedRecord.SKIP_TOO_LARGE, null);
        }

        if (stop.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            log.info("Run cancelled before fetching artifact for case {}", caseId);
            return record;
        }

        ArtifactFetchResult fetched;
        try {
            fetched = fetcher.materialize(caseId);
        } catch (RuntimeException e) {
            log.warn("Artifact fetch threw for case {}", caseId, e);
            return record.withFetch(
                FetchOutcome.FETCH_ERROR,
                sizeBytes,
                ClassifiedRecord.SKIP_FETCH_FAILED,
                describe("fetch_exception", e.getClass().getSimpleName() + ": " + e.getMessage())
            );
        }
        if (fetched == null || !fetched.isSuccessful()) {
            String error = fetched == null ? "fetch_missing" : describe(fetched.errorCode(), fetched.errorMessage());
            log.warn("Artifact fetch failed for case {}: {}", caseId, error);
            return record.withFetch(FetchOutcome.FETCH_ERROR, sizeBytes, ClassifiedRecord.SKIP_FETCH_FAILED, error);
        }
        log.debug("Fetched artifact for case {} ({} bytes) to {}", caseId, fetched.bytesWritten(), fetched.location());
        return record.withFetch(FetchOutcome.FETCHED, sizeBytes, null, null);
    }

    /**
     * Blocks until every task that already started has returned, so nothing touches the fetcher after an abort.
     */
    private void awaitInFlight(List<PlanTask> tasks) {
        boolean interrupted = false;
        for (PlanTask task : tasks) {
            if (task.future == null || task.state.compareAndSet(PlanTask.PENDING, PlanTask.SKIPPED)) {
                continue;
            }
            while (true) {
                try {
                    task.done.await();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private ClassifiedRecord await(Future<ClassifiedRecord> future, BooleanSupplier cancelled) {
        while (true) {
            if (cancelled.getAsBoolean()) {
                throw new RunAbortedException("Run cancelled during fetch planning");
            }
            try {
                return future.get(CANCEL_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException stillRunning) {
                // loop to re-check cancellation
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunAbortedException("Interrupted during fetch planning");
            } catch (ExecutionException e) {
                throw new IllegalStateException("Fetch planning failed unexpectedly", e.getCause());
            }
        }
    }

    private static final class PlanTask {
        private static final int PENDING = 0;
        private static final int RUNNING = 1;
        private static final int SKIPPED = 2;

        private final ClassifiedRecord record;
        private final AtomicInteger state = new AtomicInteger(PENDING);
        private final CountDownLatch done = new CountDownLatch(1);
        private Future<ClassifiedRecord> future;

        private PlanTask(ClassifiedRecord record) {
            this.record = record;
        }

        private ClassifiedRecord run(Supplier<ClassifiedRecord> work) {
            if (!state.compareAndSet(PENDING, RUNNING)) {
                return record;
            }
            try {
                return work.get();
            } finally {
                done.countDown();
            }
        }
    }

    private String describe(String errorCode, String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            return errorCode;
        }
        return errorCode + ": " + errorMessage;
    }
}
