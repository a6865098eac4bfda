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

import io.nosqlbench.progress.ProgressCheck;
import io.nosqlbench.progress.ProgressContribution;
import io.nosqlbench.progress.ProgressTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs the tasks of a tracked phase, one cycle at a time, on an {@link ExecutorService}.
 *
 * <p>A cycle is:
 * <ol>
 *   <li>{@link ProgressTracker#beginCycle()} - running totals return to the persisted baseline</li>
 *   <li>every registered task is submitted; tasks run in parallel and record into the shared
 *       counter without locking</li>
 *   <li>the executor waits for every task's future, which makes all recording happen-before
 *       the next step</li>
 *   <li>{@link ProgressTracker#checkProgress()} - the transition decision</li>
 * </ol>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ExecutorService pool = Executors.newFixedThreadPool(4);
 * CycleExecutor<AppState> cycles = new CycleExecutor<>(pool, tracker)
 *     .add(() -> new Progress(assets.loaded(), assets.total()))
 *     .add(WaitTasks.waitCycles(10));
 *
 * tracker.phaseEntered(AppState.LOADING);
 * cycles.runWhileActive(1000);
 * }</pre>
 *
 * <p>If the driving thread is interrupted, or submission fails, the outstanding tasks of the
 * cycle are cancelled. A task that finishes after its cycle has ended does not record.
 *
 * <p>The executor service is owned by the caller and is not shut down here. Task registration
 * may happen from any thread; {@link #runCycle()} is meant to be driven by one host thread.
 *
 * @param <S> the phase type
 */
public final class CycleExecutor<S> {

    private static final Logger logger = LogManager.getLogger(CycleExecutor.class);

    private final ExecutorService executor;
    private final ProgressTracker<S> tracker;
    private final CopyOnWriteArrayList<ProgressTask> tasks = new CopyOnWriteArrayList<>();
    private final CycleStatistics statistics = new CycleStatistics();

    public CycleExecutor(ExecutorService executor, ProgressTracker<S> tracker) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
    }

    /**
     * Registers a task to run in every cycle.
     *
     * @return this executor
     */
    public CycleExecutor<S> add(ProgressTask task) {
        tasks.add(Objects.requireNonNull(task, "task"));
        return this;
    }

    public boolean remove(ProgressTask task) {
        return tasks.remove(task);
    }

    public List<ProgressTask> getTasks() {
        return new ArrayList<>(tasks);
    }

    public CycleStatistics getStatistics() {
        return statistics;
    }

    public ProgressTracker<S> getTracker() {
        return tracker;
    }

    /**
     * Runs one cycle of all registered tasks and then the transition decision.
     *
     * @return the decision for the cycle
     * @throws ProgressCycleException if any task failed; the decision is skipped
     * @throws io.nosqlbench.progress.InactivePhaseException if the tracked phase is not active
     * @throws InterruptedException if interrupted while waiting for tasks; tasks not yet
     *     finished are cancelled
     */
    public ProgressCheck<S> runCycle() throws InterruptedException {
        long cycle = tracker.beginCycle();
        List<ProgressTask> snapshot = new ArrayList<>(tasks);

        List<Future<ProgressContribution>> futures = new ArrayList<>(snapshot.size());
        List<Throwable> failures = new ArrayList<>();
        int collected = 0;
        try {
            for (ProgressTask task : snapshot) {
                futures.add(executor.submit(forCycle(task, cycle)));
            }
            for (; collected < futures.size(); collected++) {
                try {
                    futures.get(collected).get();
                    statistics.incrementTasksCompleted();
                } catch (ExecutionException e) {
                    statistics.incrementTasksFailed();
                    logger.warn("Progress task {} failed in cycle {} of phase '{}': {}",
                        snapshot.get(collected), cycle, tracker.getPhase(), e.getCause().getMessage());
                    failures.add(e.getCause());
                }
            }
        } finally {
            if (collected < futures.size()) {
                // abandoned cycle: stale tasks must not record into the next one
                logger.warn("Cycle {} of phase '{}' abandoned, cancelling {} outstanding tasks",
                    cycle, tracker.getPhase(), futures.size() - collected);
                for (int i = collected; i < futures.size(); i++) {
                    futures.get(i).cancel(true);
                }
            }
        }
        statistics.incrementCyclesRun();

        if (!failures.isEmpty()) {
            statistics.incrementCyclesFailed();
            ProgressCycleException failed = new ProgressCycleException(
                String.valueOf(tracker.getPhase()), cycle, failures.size(), snapshot.size());
            failures.forEach(failed::addSuppressed);
            throw failed;
        }

        return tracker.checkProgress();
    }

    private Callable<ProgressContribution> forCycle(ProgressTask task, long cycle) {
        return ProgressTasks.track(tracker, () -> {
            ProgressContribution contribution = task.run();
            if (tracker.getCycle() != cycle) {
                throw new CancellationException("task " + task + " outlived cycle " + cycle
                    + " of phase '" + tracker.getPhase() + "'");
            }
            return contribution;
        });
    }

    /**
     * Runs cycles until the tracked phase is no longer active or {@code maxCycles} have run.
     * The phase becomes inactive when the host acts on the transition request by exiting it.
     *
     * @param maxCycles upper bound on the number of cycles
     * @return the number of cycles run
     * @throws InterruptedException if interrupted while waiting for tasks
     */
    public long runWhileActive(long maxCycles) throws InterruptedException {
        long run = 0;
        while (run < maxCycles && tracker.isActive()) {
            runCycle();
            run++;
        }
        return run;
    }
}
