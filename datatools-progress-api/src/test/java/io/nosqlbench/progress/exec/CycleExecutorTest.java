/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.nosqlbench.progress.exec;

import io.nosqlbench.progress.HiddenProgress;
import io.nosqlbench.progress.InactivePhaseException;
import io.nosqlbench.progress.Progress;
import io.nosqlbench.progress.ProgressCheck;
import io.nosqlbench.progress.ProgressContribution;
import io.nosqlbench.progress.ProgressTracker;
import io.nosqlbench.progress.ProgressTrackerConfig;
import io.nosqlbench.progress.SamplePhase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class CycleExecutorTest {

    private ExecutorService pool;
    private List<SamplePhase> requests;
    private ProgressTracker<SamplePhase> tracker;

    @BeforeEach
    public void setUp() {
        pool = Executors.newFixedThreadPool(4);
        requests = new ArrayList<>();
        tracker = new ProgressTracker<>(
            ProgressTrackerConfig.forPhase(SamplePhase.LOADING).continueTo(SamplePhase.RUNNING),
            target -> {
                requests.add(target);
                tracker.phaseExited(SamplePhase.LOADING);
            });
    }

    @AfterEach
    public void tearDown() {
        pool.shutdownNow();
    }

    @Test
    public void parallelTasksAreSummed() throws Exception {
        CycleExecutor<SamplePhase> cycles = new CycleExecutor<>(pool, tracker);
        for (int i = 0; i < 16; i++) {
            cycles.add(() -> new Progress(1, 2));
        }
        cycles.add(() -> HiddenProgress.of(0, 4));
        tracker.phaseEntered(SamplePhase.LOADING);

        ProgressCheck<SamplePhase> check = cycles.runCycle();
        assertEquals(1, check.cycle());
        assertEquals(new Progress(16, 32), check.visible());
        assertEquals(new Progress(16, 36), check.complete());
        assertFalse(check.ready());
        assertEquals(1, cycles.getStatistics().getCyclesRun());
        assertEquals(17, cycles.getStatistics().getTasksCompleted());
    }

    @Test
    public void runsUntilTheHostLeavesThePhase() throws Exception {
        AtomicInteger loaded = new AtomicInteger();
        CycleExecutor<SamplePhase> cycles = new CycleExecutor<>(pool, tracker)
            .add(ProgressTasks.named("assets", () -> new Progress(Math.min(loaded.incrementAndGet(), 5), 5)))
            .add(WaitTasks.waitCycles(2));
        tracker.phaseEntered(SamplePhase.LOADING);

        long run = cycles.runWhileActive(100);

        assertEquals(5, run);
        assertFalse(tracker.isActive());
        assertEquals(List.of(SamplePhase.RUNNING), requests);
        assertEquals(0, cycles.runWhileActive(100));
    }

    @Test
    public void maxCyclesBoundsTheLoop() throws Exception {
        CycleExecutor<SamplePhase> cycles = new CycleExecutor<>(pool, tracker)
            .add(() -> Progress.of(false));
        tracker.phaseEntered(SamplePhase.LOADING);

        assertEquals(3, cycles.runWhileActive(3));
        assertTrue(tracker.isActive());
        assertEquals(3, tracker.getCycle());
        assertTrue(requests.isEmpty());
    }

    @Test
    public void failedTaskSkipsTheDecision() throws Exception {
        CycleExecutor<SamplePhase> cycles = new CycleExecutor<>(pool, tracker)
            .add(() -> Progress.of(true))
            .add(ProgressTasks.named("broken", () -> {
                throw new IllegalStateException("asset missing");
            }));
        tracker.phaseEntered(SamplePhase.LOADING);

        ProgressCycleException e = assertThrows(ProgressCycleException.class, cycles::runCycle);
        assertEquals(1, e.getCycle());
        assertEquals(1, e.getFailedTasks());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("asset missing", e.getSuppressed()[0].getMessage());

        assertTrue(tracker.getLastCheck().isEmpty());
        assertTrue(requests.isEmpty());
        assertEquals(1, cycles.getStatistics().getCyclesFailed());
        assertEquals(1, cycles.getStatistics().getTasksFailed());
        assertEquals(0.5, cycles.getStatistics().getTaskFailureRate(), 1e-9);
    }

    @Test
    public void interruptedCycleLeavesNoStaleProgress() throws Exception {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        CycleExecutor<SamplePhase> cycles = new CycleExecutor<>(pool, tracker)
            .add(ProgressTasks.named("interruptible", () -> {
                started.countDown();
                release.await();
                return new Progress(5, 5);
            }))
            .add(ProgressTasks.named("stubborn", () -> {
                started.countDown();
                boolean released = false;
                while (!released) {
                    try {
                        released = release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        // keeps running like a task that ignores cancellation
                    }
                }
                return new Progress(5, 5);
            }));
        tracker.phaseEntered(SamplePhase.LOADING);

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread driver = new Thread(() -> {
            try {
                cycles.runCycle();
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        driver.start();
        assertTrue(started.await(10, TimeUnit.SECONDS));
        driver.interrupt();
        driver.join(10_000);
        assertInstanceOf(InterruptedException.class, thrown.get());

        assertEquals(2, tracker.beginCycle());
        release.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(Progress.NONE, tracker.getProgress());
        assertTrue(tracker.getLastCheck().isEmpty());
        assertTrue(requests.isEmpty());
    }

    @Test
    public void nullResultIsAFailure() throws Exception {
        CycleExecutor<SamplePhase> cycles = new CycleExecutor<>(pool, tracker).add(() -> null);
        tracker.phaseEntered(SamplePhase.LOADING);

        ProgressCycleException e = assertThrows(ProgressCycleException.class, cycles::runCycle);
        assertInstanceOf(NullPointerException.class, e.getSuppressed()[0]);
    }

    @Test
    public void cycleNeedsAnActivePhase() {
        CycleExecutor<SamplePhase> cycles = new CycleExecutor<>(pool, tracker).add(() -> Progress.of(true));
        assertThrows(InactivePhaseException.class, cycles::runCycle);
    }

    @Test
    public void trackedTaskAppliesItsResult() throws Exception {
        tracker.phaseEntered(SamplePhase.LOADING);
        tracker.beginCycle();
        Callable<ProgressContribution> callable = ProgressTasks.track(tracker,
            () -> ProgressContribution.both(new Progress(1, 2), HiddenProgress.of(true)));

        ProgressContribution result = callable.call();

        assertInstanceOf(ProgressContribution.class, result);
        assertEquals(new Progress(1, 2), tracker.getProgress());
        assertEquals(new Progress(2, 3), tracker.getCompleteProgress());
    }

    @Test
    public void tasksCanBeRemoved() {
        ProgressTask task = () -> Progress.NONE;
        CycleExecutor<SamplePhase> cycles = new CycleExecutor<>(pool, tracker).add(task);
        assertEquals(1, cycles.getTasks().size());
        assertTrue(cycles.remove(task));
        assertTrue(cycles.getTasks().isEmpty());
        assertSame(tracker, cycles.getTracker());
    }
}
