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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counts kept by a {@link CycleExecutor}: cycles run, cycles that failed, and task
 * runs that completed or failed.
 *
 * <pre>{@code
 * CycleStatistics stats = executor.getStatistics();
 * System.out.println("Cycles: " + stats.getCyclesRun() + ", task failures: " + stats.getTasksFailed());
 * }</pre>
 */
public final class CycleStatistics {
    private final AtomicLong cyclesRun = new AtomicLong(0);
    private final AtomicLong cyclesFailed = new AtomicLong(0);
    private final AtomicLong tasksCompleted = new AtomicLong(0);
    private final AtomicLong tasksFailed = new AtomicLong(0);

    public long getCyclesRun() {
        return cyclesRun.get();
    }

    public long getCyclesFailed() {
        return cyclesFailed.get();
    }

    public long getTasksCompleted() {
        return tasksCompleted.get();
    }

    public long getTasksFailed() {
        return tasksFailed.get();
    }

    /**
     * Returns the share of task runs that failed, between 0.0 and 1.0.
     * Returns 0.0 if no task has run yet.
     *
     * @return failure rate (0.0 to 1.0)
     */
    public double getTaskFailureRate() {
        long failed = tasksFailed.get();
        long total = tasksCompleted.get() + failed;
        return total > 0 ? (double) failed / total : 0.0;
    }

    // Package-private methods for updating statistics

    void incrementCyclesRun() {
        cyclesRun.incrementAndGet();
    }

    void incrementCyclesFailed() {
        cyclesFailed.incrementAndGet();
    }

    void incrementTasksCompleted() {
        tasksCompleted.incrementAndGet();
    }

    void incrementTasksFailed() {
        tasksFailed.incrementAndGet();
    }

    @Override
    public String toString() {
        return String.format(
            "CycleStatistics[cycles=%d, failedCycles=%d, tasksCompleted=%d, tasksFailed=%d]",
            cyclesRun.get(), cyclesFailed.get(), tasksCompleted.get(), tasksFailed.get()
        );
    }
}
