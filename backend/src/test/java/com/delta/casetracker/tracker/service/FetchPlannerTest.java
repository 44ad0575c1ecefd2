package com.delta.casetracker.tracker.service;

import com.delta.casetracker.tracker.fetch.ArtifactFetchResult;
import com.delta.casetracker.tracker.fetch.ArtifactFetcher;
import com.delta.casetracker.tracker.fetch.ArtifactProbeResult;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.model.ChangeStatus;
import com.delta.casetracker.tracker.model.ClassifiedRecord;
import com.delta.casetracker.tracker.model.FetchOutcome;
import com.delta.casetracker.tracker.model.LimitPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchPlannerTest {
    private static final long SIZE_LIMIT = 100_000_000L;
    private static final LimitPolicy POLICY = new LimitPolicy(10, SIZE_LIMIT);

    @Mock
    private ArtifactFetcher fetcher;

    private final ExecutorService executor = Executors.newFixedThreadPool(3);
    private final FetchPlanner planner = new FetchPlanner(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void oversizedArtifactIsSkippedWithoutMaterializing() {
        ClassifiedRecord record = admitted("BIG");
        when(fetcher.probeSize("BIG")).thenReturn(ArtifactProbeResult.ofSize("BIG", 150_000_000L));

        List<ClassifiedRecord> planned = planner.plan(List.of(record), fetcher, POLICY);

        ClassifiedRecord result = planned.get(0);
        assertThat(result.fetchOutcome()).isEqualTo(FetchOutcome.SKIPPED_TOO_LARGE);
        assertThat(result.skipReason()).isEqualTo(ClassifiedRecord.SKIP_TOO_LARGE);
        assertThat(result.probedSizeBytes()).isEqualTo(150_000_000L);
        verify(fetcher, never()).materialize(anyString());
    }

    @Test
    void artifactAtExactlyTheLimitIsFetched() {
        ClassifiedRecord record = admitted("EDGE");
        when(fetcher.probeSize("EDGE")).thenReturn(ArtifactProbeResult.ofSize("EDGE", SIZE_LIMIT));
        when(fetcher.materialize("EDGE")).thenReturn(stored("EDGE"));

        List<ClassifiedRecord> planned = planner.plan(List.of(record), fetcher, POLICY);

        assertThat(planned.get(0).fetchOutcome()).isEqualTo(FetchOutcome.FETCHED);
        assertThat(planned.get(0).skipReason()).isNull();
        verify(fetcher, times(1)).probeSize("EDGE");
        verify(fetcher, times(1)).materialize("EDGE");
    }

    @Test
    void probeFailureIsRecordedAndOtherRecordsContinue() {
        when(fetcher.probeSize("A")).thenReturn(ArtifactProbeResult.failed("A", "http_503", "unavailable"));
        when(fetcher.probeSize("B")).thenThrow(new IllegalStateException("boom"));
        when(fetcher.probeSize("C")).thenReturn(ArtifactProbeResult.ofSize("C", 10));
        when(fetcher.materialize("C")).thenReturn(stored("C"));

        List<ClassifiedRecord> planned = planner.plan(List.of(admitted("A"), admitted("B"), admitted("C")), fetcher, POLICY);

        assertThat(planned).extracting(ClassifiedRecord::fetchOutcome)
            .containsExactly(FetchOutcome.FETCH_ERROR, FetchOutcome.FETCH_ERROR, FetchOutcome.FETCHED);
        assertThat(planned.get(0).skipReason()).isEqualTo(ClassifiedRecord.SKIP_PROBE_FAILED);
        assertThat(planned.get(0).fetchError()).startsWith("http_503");
        assertThat(planned.get(1).fetchError()).contains("boom");
        verify(fetcher, never()).materialize("A");
        verify(fetcher, never()).materialize("B");
    }

    @Test
    void materializeFailureBecomesFetchError() {
        when(fetcher.probeSize("A")).thenReturn(ArtifactProbeResult.ofSize("A", 10));
        when(fetcher.materialize("A")).thenReturn(ArtifactFetchResult.failed("A", Instant.now(), "io_error", "reset"));
        when(fetcher.probeSize("B")).thenReturn(ArtifactProbeResult.ofSize("B", 10));
        when(fetcher.materialize("B")).thenThrow(new RuntimeException("disk full"));

        List<ClassifiedRecord> planned = planner.plan(List.of(admitted("A"), admitted("B")), fetcher, POLICY);

        assertThat(planned).allMatch(r -> r.fetchOutcome() == FetchOutcome.FETCH_ERROR);
        assertThat(planned).allMatch(r -> ClassifiedRecord.SKIP_FETCH_FAILED.equals(r.skipReason()));
        assertThat(planned.get(0).fetchError()).isEqualTo("io_error: reset");
        assertThat(planned.get(1).fetchError()).contains("disk full");
    }

    @Test
    void recordsThatAreNotAdmittedAreNeverProbed() {
        CaseRecord limited = ChangeDetectorTest.record("L", 1);
        CaseRecord unchanged = ChangeDetectorTest.record("U", 1);
        List<ClassifiedRecord> input = List.of(
            ClassifiedRecord.of(limited, ChangeStatus.NEW, List.of()).exclude(ClassifiedRecord.SKIP_NEW_RECORD_LIMIT),
            ClassifiedRecord.of(unchanged, ChangeStatus.UNCHANGED, List.of()).exclude(null)
        );

        List<ClassifiedRecord> planned = planner.plan(input, fetcher, POLICY);

        assertThat(planned).isEqualTo(input);
        verifyNoInteractions(fetcher);
    }

    @Test
    void resultOrderMatchesInputOrderWhenCompletionOrderDiffers() {
        ArtifactFetcher slowFirst = new ArtifactFetcher() {
            @Override
            public ArtifactProbeResult probeSize(String caseId) {
                if (caseId.equals("A")) {
                    sleep(150);
                }
                return ArtifactProbeResult.ofSize(caseId, 1);
            }

            @Override
            public ArtifactFetchResult materialize(String caseId) {
                return stored(caseId);
            }
        };
        List<ClassifiedRecord> input = new ArrayList<>();
        for (String id : List.of("A", "B", "C", "D")) {
            input.add(admitted(id));
        }

        List<ClassifiedRecord> planned = planner.plan(input, slowFirst, POLICY);

        assertThat(planned).extracting(ClassifiedRecord::id).containsExactly("A", "B", "C", "D");
        assertThat(planned).allMatch(r -> r.fetchOutcome() == FetchOutcome.FETCHED);
    }

    @Test
    void cancellationDuringPlanningInterruptsStartedWorkAndNeverMaterializes() {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger interrupted = new AtomicInteger();
        when(fetcher.probeSize(anyString())).thenAnswer(invocation -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                Thread.currentThread().interrupt();
            }
            return ArtifactProbeResult.ofSize(invocation.getArgument(0), 10);
        });

        try {
            assertThatThrownBy(() -> planner.plan(
                List.of(admitted("A"), admitted("B")),
                fetcher,
                POLICY,
                () -> started.getCount() == 0
            )).isInstanceOf(RunAbortedException.class);
        } finally {
            release.countDown();
        }

        assertThat(interrupted.get()).isGreaterThanOrEqualTo(1);
        verify(fetcher, never()).materialize(anyString());
    }

    @Test
    void cancellationAfterProbeSkipsMaterialize() {
        when(fetcher.probeSize("A")).thenReturn(ArtifactProbeResult.ofSize("A", 10));

        ClassifiedRecord result = planner.planOne(admitted("A"), fetcher, POLICY, () -> true);

        assertThat(result.fetchOutcome()).isNull();
        verify(fetcher, never()).materialize(anyString());
    }

    private static ClassifiedRecord admitted(String id) {
        return ClassifiedRecord.of(ChangeDetectorTest.record(id, 1), ChangeStatus.NEW, List.of()).admit();
    }

    private static ArtifactFetchResult stored(String id) {
        return ArtifactFetchResult.stored(id, Path.of("artifacts", id + ".pdf"), 10, Instant.now());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
