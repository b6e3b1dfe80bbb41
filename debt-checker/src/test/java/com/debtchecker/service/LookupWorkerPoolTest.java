package com.debtchecker.service;

import com.debtchecker.config.DebtCheckerProperties;
import com.debtchecker.model.ApiReply;
import com.debtchecker.model.ErrorKind;
import com.debtchecker.model.LookupOutcome;
import com.debtchecker.model.RunResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LookupWorkerPoolTest {

    private final RecordingCheckpointStore store = new RecordingCheckpointStore();
    private final MutableClock clock = new MutableClock();

    private LookupWorkerPool pool(DebtApi api, int workers, int maxConcurrent) {
        DebtCheckerProperties properties = TestSupport.properties(workers);
        properties.getCancellation().setGracePeriod(Duration.ofMillis(300));
        return new LookupWorkerPool(TestSupport.client(api, maxConcurrent, 5), store, properties, clock);
    }

    private static List<String> ids(int n) {
        return IntStream.rangeClosed(1, n).mapToObj(i -> "ip-" + i).collect(Collectors.toList());
    }

    @Test
    void completedRunHasOneOutcomePerIdentifier() {
        ScriptedDebtApi api = new ScriptedDebtApi().latency(1);
        List<String> identifiers = ids(60);

        RunResult result = pool(api, 8, 8).run(identifiers);

        assertThat(result.partial()).isFalse();
        assertThat(result.remaining()).isEmpty();
        assertThat(result.results().identifiers()).containsExactlyInAnyOrderElementsOf(identifiers);
        assertThat(result.progress().completed()).isEqualTo(60);
        assertThat(api.totalCalls()).isEqualTo(60);
        assertThat(store.last().partial()).isFalse();
        assertThat(store.last().remaining()).isEmpty();
    }

    @Test
    void resolvesFoundNotFoundAndRetriedIdentifiers() {
        ScriptedDebtApi api = new ScriptedDebtApi()
                .found("A", "100")
                .reply("C",
                        ApiReply.error(ErrorKind.SERVER_ERROR, "HTTP 500"),
                        ApiReply.error(ErrorKind.SERVER_ERROR, "HTTP 500"),
                        ApiReply.found(new BigDecimal("50")));

        RunResult result = pool(api, 3, 3).run(List.of("A", "B", "C"));

        assertThat(result.results().asMap()).containsOnly(
                Map.entry("A", LookupOutcome.found(new BigDecimal("100"), 1)),
                Map.entry("B", LookupOutcome.notFound(1)),
                Map.entry("C", LookupOutcome.found(new BigDecimal("50"), 3)));
        assertThat(result.partial()).isFalse();
    }

    @Test
    void oneFailureDoesNotAbortTheRun() {
        ScriptedDebtApi api = new ScriptedDebtApi()
                .reply("ip-2", ApiReply.error(ErrorKind.SERVER_ERROR, "HTTP 503"))
                .reply("ip-3", ApiReply.error(ErrorKind.MALFORMED_IDENTIFIER, "HTTP 400"));

        RunResult result = pool(api, 2, 2).run(ids(5));

        assertThat(result.partial()).isFalse();
        assertThat(result.results().size()).isEqualTo(5);
        assertThat(result.results().failedIdentifiers()).containsExactlyInAnyOrder("ip-2", "ip-3");
        assertThat(result.results().get("ip-2")).get()
                .extracting(LookupOutcome::attempts).isEqualTo(5);
    }

    @Test
    void cancellationAfterKCompletionsKeepsThemAndMarksPartial() {
        ScriptedDebtApi api = new ScriptedDebtApi().latency(5);
        List<String> identifiers = ids(40);
        CancellationController cancellation = new CancellationController();
        int k = 6;

        RunResult result = pool(api, 2, 2).run(identifiers, Map.of(), cancellation, progress -> {
            if (progress.completed() >= k && !cancellation.isCancelRequested()) {
                cancellation.requestCancel("test interrupt");
            }
        });

        assertThat(result.partial()).isTrue();
        assertThat(result.results().size()).isBetween(k, identifiers.size());
        assertThat(result.results().size()).isLessThan(identifiers.size());
        List<String> all = new ArrayList<>(result.results().identifiers());
        all.addAll(result.remaining());
        assertThat(all).containsExactlyInAnyOrderElementsOf(identifiers);
        assertThat(cancellation.state()).isEqualTo(CancellationController.State.STOPPED);

        assertThat(store.last().partial()).isTrue();
        assertThat(store.last().completed()).hasSize(result.results().size());
        assertThat(store.last().remaining()).isEqualTo(result.remaining());
    }

    @Test
    void cancelledRunDispatchesInInputOrder() {
        ScriptedDebtApi api = new ScriptedDebtApi();
        CancellationController cancellation = new CancellationController();

        RunResult result = pool(api, 1, 1).run(ids(10), Map.of(), cancellation, progress -> {
            if (progress.completed() == 3) {
                cancellation.requestCancel("test");
            }
        });

        assertThat(result.results().identifiers()).containsExactly("ip-1", "ip-2", "ip-3");
        assertThat(result.remaining()).containsExactly("ip-4", "ip-5", "ip-6", "ip-7", "ip-8", "ip-9", "ip-10");
    }

    @Test
    void fatalErrorAbortsRunAndKeepsCheckpoint() {
        ScriptedDebtApi api = new ScriptedDebtApi()
                .reply("ip-5", ApiReply.error(ErrorKind.AUTH_REJECTED, "token has no access"));

        assertThatThrownBy(() -> pool(api, 1, 1).run(ids(10)))
                .isInstanceOf(FatalRunException.class)
                .hasMessageContaining("authentication rejected");

        assertThat(store.last().partial()).isTrue();
        assertThat(store.last().completed()).containsOnlyKeys("ip-1", "ip-2", "ip-3", "ip-4");
        assertThat(store.last().remaining()).containsExactly(
                "ip-5", "ip-6", "ip-7", "ip-8", "ip-9", "ip-10");
        assertThat(api.calls("ip-6")).isZero();
    }

    @Test
    void inFlightCountNeverExceedsThrottleCap() {
        ScriptedDebtApi api = new ScriptedDebtApi().latency(3);

        RunResult result = pool(api, 10, 3).run(ids(50));

        assertThat(result.results().size()).isEqualTo(50);
        assertThat(api.maxInFlight()).isLessThanOrEqualTo(3);
    }

    @Test
    void seededOutcomesAreReturnedWithoutQuerying() {
        ScriptedDebtApi api = new ScriptedDebtApi();
        Map<String, LookupOutcome> seeded = Map.of("old", LookupOutcome.found(new BigDecimal("12.30"), 1));

        RunResult result = pool(api, 2, 2).run(List.of("new"), seeded,
                new CancellationController(), ProgressListener.NONE);

        assertThat(result.results().identifiers()).containsExactlyInAnyOrder("old", "new");
        assertThat(api.calls("old")).isZero();
        assertThat(result.progress().total()).isEqualTo(1);
    }

    @Test
    void duplicatesAreQueriedForEachOccurrence() {
        ScriptedDebtApi api = new ScriptedDebtApi().found("A", "1");

        RunResult result = pool(api, 2, 2).run(List.of("A", "B", "A"));

        assertThat(api.calls("A")).isEqualTo(2);
        assertThat(result.results().identifiers()).containsExactlyInAnyOrder("A", "B");
        assertThat(result.progress().completed()).isEqualTo(3);
    }

    @Test
    void rerunGivesSameAmounts() {
        ScriptedDebtApi api = new ScriptedDebtApi().found("A", "100").found("C", "50");
        LookupWorkerPool pool = pool(api, 3, 3);

        RunResult first = pool.run(List.of("A", "B", "C"));
        RunResult second = pool.run(List.of("A", "B", "C"));

        assertThat(second.results()).isEqualTo(first.results());
    }

    @Test
    void lookupsStillRunningAfterGracePeriodAreAbandoned() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(2);
        CountDownLatch never = new CountDownLatch(1);
        DebtApi blocking = identifier -> {
            entered.countDown();
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ApiReply.error(ErrorKind.NETWORK, "interrupted");
            }
            return ApiReply.notFound();
        };
        CancellationController cancellation = new CancellationController();
        Thread canceller = new Thread(() -> {
            try {
                if (entered.await(5, TimeUnit.SECONDS)) {
                    cancellation.requestCancel("test interrupt");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();

        long start = System.nanoTime();
        RunResult result = pool(blocking, 2, 2).run(ids(5), Map.of(), cancellation, ProgressListener.NONE);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        canceller.join();

        assertThat(result.partial()).isTrue();
        assertThat(result.results().size()).isZero();
        assertThat(result.remaining()).containsExactlyInAnyOrderElementsOf(ids(5));
        assertThat(cancellation.isStopRequested()).isTrue();
        assertThat(elapsedMillis).isLessThan(5_000);
    }
}
